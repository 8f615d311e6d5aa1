package com.resonanceloop.common.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of a profile file. Unvalidated: convert with {@link ProfileValidator#validate}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfileDefinition(
    @JsonProperty("profileId") String profileId,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("description") String description,
    @JsonProperty("dimensionWeights") Map<String, Double> dimensionWeights,
    @JsonProperty("patternSets") Map<String, List<String>> patternSets,
    @JsonProperty("categoricalCodes") Map<String, String> categoricalCodes,
    @JsonProperty("framing") Framing framing
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Framing(
        @JsonProperty("directive") String directive,
        @JsonProperty("promptTemplate") String promptTemplate,
        @JsonProperty("identityStatement") String identityStatement,
        @JsonProperty("complianceDirective") String complianceDirective,
        @JsonProperty("amplifiers") Map<String, String> amplifiers
    ) {}
}

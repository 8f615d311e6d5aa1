package com.resonanceloop.common.mutation;

import com.resonanceloop.common.model.Request;
import com.resonanceloop.common.profile.ProfileFraming;
import com.resonanceloop.common.profile.TargetProfile;

/**
 * Builds the first request of a run from the profile's template.
 */
public final class PromptComposer {

    private PromptComposer() {}

    /**
     * Substitutes {@code scenario} literally for every {@code {scenario}} placeholder, so the
     * scenario text appears verbatim in the prompt.
     */
    public static Request initialRequest(TargetProfile profile, String scenario) {
        if (scenario == null || scenario.isBlank()) {
            throw new IllegalArgumentException("scenario must not be blank");
        }
        ProfileFraming framing = profile.framing();
        String prompt = framing.promptTemplate().replace(ProfileFraming.SCENARIO_PLACEHOLDER, scenario);
        return Request.initial(prompt, framing.directive());
    }
}

package com.resonanceloop.engine.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.exception.ProfileNotFoundException;
import com.resonanceloop.common.exception.ProfileValidationException;
import com.resonanceloop.common.profile.ProfileDefinition;
import com.resonanceloop.common.profile.ProfileStore;
import com.resonanceloop.common.profile.ProfileValidator;
import com.resonanceloop.common.profile.TargetProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ProfileStore} over JSON profile files found by a resource pattern.
 *
 * <p>Every file is read and validated once, in the constructor. An unreadable or invalid file,
 * a duplicate id, or an empty location stops startup.
 */
public class ClasspathProfileStore implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ClasspathProfileStore.class);

    private final Map<String, TargetProfile> profiles;

    public ClasspathProfileStore(ObjectMapper objectMapper, String locationPattern) {
        this.profiles = Collections.unmodifiableMap(load(objectMapper, locationPattern));
        log.info("[ProfileStore] Loaded profiles. location={} ids={}", locationPattern, profiles.keySet());
    }

    @Override
    public TargetProfile getProfile(String profileId) {
        TargetProfile profile = profileId == null ? null : profiles.get(normalize(profileId));
        if (profile == null) {
            throw new ProfileNotFoundException(profileId);
        }
        return profile;
    }

    @Override
    public List<TargetProfile> listProfiles() {
        return List.copyOf(profiles.values());
    }

    private static Map<String, TargetProfile> load(ObjectMapper objectMapper, String locationPattern) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(locationPattern);
        } catch (IOException e) {
            throw new ProfileValidationException("<store>", "cannot resolve " + locationPattern, e);
        }
        if (resources.length == 0) {
            throw new ProfileValidationException("<store>", List.of("no profile files at " + locationPattern));
        }

        List<Resource> sorted = new ArrayList<>(List.of(resources));
        sorted.sort((a, b) -> String.valueOf(a.getFilename()).compareTo(String.valueOf(b.getFilename())));

        Map<String, TargetProfile> loaded = new LinkedHashMap<>();
        for (Resource resource : sorted) {
            ProfileDefinition definition;
            try (InputStream in = resource.getInputStream()) {
                definition = objectMapper.readValue(in, ProfileDefinition.class);
            } catch (IOException e) {
                throw new ProfileValidationException(String.valueOf(resource.getFilename()),
                                                     "unreadable profile file", e);
            }
            TargetProfile profile = ProfileValidator.validate(definition);
            String key = normalize(profile.profileId());
            if (loaded.putIfAbsent(key, profile) != null) {
                throw new ProfileValidationException(profile.profileId(),
                    List.of("duplicate profile id in " + resource.getFilename()));
            }
        }
        return loaded;
    }

    private static String normalize(String profileId) {
        return profileId.trim().toLowerCase(Locale.ROOT);
    }
}

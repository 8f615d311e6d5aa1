package com.resonanceloop.common.profile;

import com.resonanceloop.common.exception.ProfileNotFoundException;

import java.util.List;

/**
 * Resolves profile identifiers to validated, immutable {@link TargetProfile}s.
 * Returned profiles are shared read-only across concurrent runs.
 */
public interface ProfileStore {

    /**
     * @param profileId profile identifier, case-insensitive
     * @return the validated profile
     * @throws ProfileNotFoundException when no profile has that identifier
     */
    TargetProfile getProfile(String profileId);

    List<TargetProfile> listProfiles();
}

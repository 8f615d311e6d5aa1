package com.resonanceloop.common.exception;

public class ProfileNotFoundException extends ConvergenceException {
    private final String profileId;

    public ProfileNotFoundException(String profileId) {
        super("ProfileStore", "profile '" + profileId + "' not found");
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}

package com.resonanceloop.common.exception;

import java.util.List;

/**
 * Raised when a profile definition is incomplete or inconsistent. Carries every
 * problem found, not only the first.
 */
public class ProfileValidationException extends ConvergenceException {
    private final String profileId;
    private final List<String> problems;

    public ProfileValidationException(String profileId, List<String> problems) {
        super("ProfileValidator", "profile '" + profileId + "' is invalid: " + String.join("; ", problems));
        this.profileId = profileId;
        this.problems = List.copyOf(problems);
    }

    public ProfileValidationException(String profileId, String problem, Throwable cause) {
        super("ProfileValidator", "profile '" + profileId + "' is invalid: " + problem, cause);
        this.profileId = profileId;
        this.problems = List.of(problem);
    }

    public String getProfileId() {
        return profileId;
    }

    public List<String> getProblems() {
        return problems;
    }
}

package com.resonanceloop.common.exception;

/**
 * Base for configuration and lookup faults raised outside the attempt loop.
 * Failures inside a run are reported as values, never as this exception.
 */
public class ConvergenceException extends RuntimeException {
    private final String component;

    public ConvergenceException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ConvergenceException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

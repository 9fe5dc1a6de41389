package com.gradeflow.grading;

/**
 * Configuration problem that prevents any submission of a job from starting
 */
public class FatalConfigurationException extends Exception {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.gradeflow.grading;

/**
 * Provider answered, but the answer does not match the expected score schema
 */
public class MalformedResponseException extends Exception {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

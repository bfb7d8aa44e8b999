package com.z254.sentinel.rules;

/**
 * A detection rule specification was rejected.
 */
public class RuleValidationException extends RuntimeException {

    public RuleValidationException(String message) {
        super(message);
    }
}

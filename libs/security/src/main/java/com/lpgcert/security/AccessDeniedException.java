package com.lpgcert.security;

/**
 * Thrown when an identified user lacks the role an operation requires.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}

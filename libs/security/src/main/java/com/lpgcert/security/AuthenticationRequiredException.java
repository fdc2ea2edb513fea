package com.lpgcert.security;

/**
 * Thrown when a request carries no resolvable user identity.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}

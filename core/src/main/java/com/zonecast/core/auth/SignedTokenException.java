package com.zonecast.core.auth;

/**
 * Thrown when a {@link SignedToken} is malformed, tampered with or expired.
 */
public class SignedTokenException extends RuntimeException {

    public SignedTokenException(String message) {
        super(message);
    }

    public SignedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.rolegate.security;

/**
 * Carries an {@link AuthError} through exception-based channels: exceptional completion of
 * an {@link Authenticator} future, or failure of a {@link ProtectedOperation}.
 * <p>
 * Unchecked, like the rest of the library's domain exceptions. The message is the error's
 * client-safe description unless an authenticator supplies its own diagnostic detail;
 * {@link #unauthorized()} never carries detail about the requirement.
 */
public class AuthException extends RuntimeException {

    private final AuthError error;

    public AuthException(AuthError error) {
        this(error, error.description(), null);
    }

    public AuthException(AuthError error, String message) {
        this(error, message, null);
    }

    public AuthException(AuthError error, String message, Throwable cause) {
        super(message, cause);
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        this.error = error;
    }

    public static AuthException invalidToken(String message) {
        return new AuthException(AuthError.INVALID_TOKEN, message);
    }

    public static AuthException expiredToken(String message) {
        return new AuthException(AuthError.EXPIRED_TOKEN, message);
    }

    public static AuthException providerUnavailable(String message, Throwable cause) {
        return new AuthException(AuthError.PROVIDER_UNAVAILABLE, message, cause);
    }

    public static AuthException unauthorized() {
        return new AuthException(AuthError.UNAUTHORIZED);
    }

    public AuthError error() {
        return error;
    }
}

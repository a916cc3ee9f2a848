package com.rolegate.security;

/**
 * Terminal result of {@link Authorizer#authorize(String, Requirement)}.
 * <p>
 * {@link Denied} is a singleton without fields: a denial never says which requirement
 * failed or what the principal held.
 */
public sealed interface AuthorizationOutcome
        permits AuthorizationOutcome.Allowed, AuthorizationOutcome.Denied, AuthorizationOutcome.AuthFailed {

    AuthorizationState state();

    default boolean isAllowed() {
        return state() == AuthorizationState.ALLOWED;
    }

    static AuthorizationOutcome allowed(Principal principal) {
        return new Allowed(principal);
    }

    static AuthorizationOutcome denied() {
        return Denied.INSTANCE;
    }

    static AuthorizationOutcome authFailed(AuthError error) {
        return new AuthFailed(error);
    }

    /**
     * Converts a non-allowed outcome into the error a caller should report:
     * the authentication error for {@link AuthFailed}, {@link AuthError#UNAUTHORIZED}
     * for {@link Denied}.
     *
     * @throws IllegalStateException if the outcome is {@link Allowed}
     */
    default AuthError error() {
        if (this instanceof AuthFailed failed) {
            return failed.reason();
        }
        if (this instanceof Denied) {
            return AuthError.UNAUTHORIZED;
        }
        throw new IllegalStateException("an allowed outcome has no error");
    }

    /** The principal was authenticated and meets the requirement. */
    record Allowed(Principal principal) implements AuthorizationOutcome {

        public Allowed {
            if (principal == null) {
                throw new IllegalArgumentException("principal must not be null");
            }
        }

        @Override
        public AuthorizationState state() {
            return AuthorizationState.ALLOWED;
        }
    }

    /** The principal was authenticated but does not meet the requirement. */
    final class Denied implements AuthorizationOutcome {

        private static final Denied INSTANCE = new Denied();

        private Denied() {
        }

        @Override
        public AuthorizationState state() {
            return AuthorizationState.DENIED;
        }

        @Override
        public String toString() {
            return "Denied";
        }
    }

    /** The token could not be resolved to a principal. */
    record AuthFailed(AuthError reason) implements AuthorizationOutcome {

        public AuthFailed {
            if (reason == null || reason == AuthError.UNAUTHORIZED) {
                throw new IllegalArgumentException("reason must be an authentication error");
            }
        }

        @Override
        public AuthorizationState state() {
            return AuthorizationState.AUTH_FAILED;
        }
    }
}

package com.rolegate.security;

/**
 * Closed set of reasons an authorization attempt can fail.
 * <p>
 * The first three originate from the {@link Authenticator} and are passed to the caller
 * unchanged. {@link #UNAUTHORIZED} originates only from the decision step.
 */
public enum AuthError {

    /** The token is syntactically or cryptographically invalid. */
    INVALID_TOKEN("Invalid token"),

    /** The token was valid once but has lapsed. */
    EXPIRED_TOKEN("Expired token"),

    /** The backing store (database, cache, identity provider) could not be reached. */
    PROVIDER_UNAVAILABLE("Authentication provider unavailable"),

    /** The principal was authenticated but does not meet the requirement. */
    UNAUTHORIZED("Unauthorized");

    private final String description;

    AuthError(String description) {
        this.description = description;
    }

    /** Short, detail-free description safe to return to clients. */
    public String description() {
        return description;
    }

    /**
     * Whether a caller may reasonably retry later. Only provider outages are transient;
     * retry policy itself belongs to the caller.
     */
    public boolean isTransient() {
        return this == PROVIDER_UNAVAILABLE;
    }

    /** Whether this error was produced while resolving the token. */
    public boolean isAuthenticationFailure() {
        return this != UNAUTHORIZED;
    }
}

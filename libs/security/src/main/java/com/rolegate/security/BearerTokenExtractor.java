package com.rolegate.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 */
public final class BearerTokenExtractor {

    /** Authentication scheme, matched case-insensitively. */
    public static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from a header of the form {@code "Bearer <token>"}.
     * <p>
     * The scheme is case-insensitive and must be followed by whitespace; surrounding
     * whitespace around the token is dropped.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals("bearer")
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}

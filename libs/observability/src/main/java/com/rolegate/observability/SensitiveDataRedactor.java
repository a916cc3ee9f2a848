package com.rolegate.observability;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps bearer tokens and other credentials out of log output.
 * <p>
 * Two modes: {@link #redact(Map)} replaces the values of sensitive fields in a structured
 * log map, and {@link #maskToken(String)} turns a token into a short hash fingerprint that is
 * still useful for correlating log lines. No character of the token itself is kept. Field matching is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Number of hex digits of the SHA-256 digest kept by {@link #maskToken(String)}. */
    public static final int FINGERPRINT_LENGTH = 12;

    /** Tokens this short are redacted instead of fingerprinted. */
    static final int MIN_FINGERPRINT_TOKEN_LENGTH = 8;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive field values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     *
     * @param data the log data map
     * @return a new map with sensitive values redacted, in the input's iteration order
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            result.put(key, isSensitive(key) ? REDACTED : entry.getValue());
        }
        return result;
    }

    /**
     * Masks a bearer token for logging as {@code sha256:} followed by the first
     * {@value #FINGERPRINT_LENGTH} hex digits of its SHA-256 digest. The same token always
     * yields the same fingerprint. Tokens of {@value #MIN_FINGERPRINT_TOKEN_LENGTH} characters
     * or fewer are fully redacted.
     *
     * @param token the raw token (may be null)
     * @return the fingerprint, never the raw value or part of it
     */
    public String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "<none>";
        }
        if (token.length() <= MIN_FINGERPRINT_TOKEN_LENGTH) {
            return REDACTED;
        }
        byte[] digest = sha256().digest(token.getBytes(StandardCharsets.UTF_8));
        return "sha256:" + HexFormat.of().formatHex(digest).substring(0, FINGERPRINT_LENGTH);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}

package com.rolegate.security;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves an opaque bearer token to a {@link Principal}.
 * <p>
 * Implementations own all token verification and any I/O it needs (database, cache,
 * signature checks), and may complete the future on another thread. On failure the future
 * completes exceptionally with an {@link AuthException} carrying:
 * <ul>
 *   <li>{@link AuthError#INVALID_TOKEN} when the token is malformed, unknown or forged,</li>
 *   <li>{@link AuthError#EXPIRED_TOKEN} when the token was valid once but has lapsed,</li>
 *   <li>{@link AuthError#PROVIDER_UNAVAILABLE} when the backing store cannot be reached.</li>
 * </ul>
 * On success the principal must be fully populated, roles and direct permissions included.
 * <p>
 * Callers may cancel the returned future when the surrounding call is abandoned.
 * Implementations should then drop pending I/O, and must not leave shared state half
 * written if the result is discarded.
 * <p>
 * Example:
 * <pre>{@code
 * Authenticator authenticator = token -> sessionStore.lookup(token)
 *         .thenApply(session -> Principal.of(session.userId(), session.name())
 *                 .withRoles(session.roles()));
 * }</pre>
 */
@FunctionalInterface
public interface Authenticator {

    /**
     * Authenticates the token.
     *
     * @param token the bearer token, never null
     * @return a future that completes with the principal, or exceptionally with {@link AuthException}
     */
    CompletableFuture<Principal> authenticateToken(String token);
}

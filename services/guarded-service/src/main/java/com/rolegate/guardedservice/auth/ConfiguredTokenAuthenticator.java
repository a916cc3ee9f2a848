package com.rolegate.guardedservice.auth;

import com.rolegate.guardedservice.config.RoleGateProperties.TokenProperties;
import com.rolegate.security.AuthException;
import com.rolegate.security.Authenticator;
import com.rolegate.security.Principal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Authenticator backed by the static token table in {@code rolegate.service.tokens}.
 *
 * <p>Stands in for a real identity store during development: each configured token resolves to
 * a freshly built {@link Principal}. Unknown tokens are rejected as invalid, tokens flagged
 * {@code expired} as expired. A configured {@code latency} delays the answer on a timer thread,
 * which is how the guard timeout can be exercised locally.
 */
public class ConfiguredTokenAuthenticator implements Authenticator {

    private final Map<String, TokenProperties> tokens;

    public ConfiguredTokenAuthenticator(Map<String, TokenProperties> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens must not be null");
        }
        this.tokens = Map.copyOf(tokens);
    }

    @Override
    public CompletableFuture<Principal> authenticateToken(String token) {
        TokenProperties entry = tokens.get(token);
        if (entry == null) {
            return CompletableFuture.failedFuture(AuthException.invalidToken("Unknown token"));
        }
        if (entry.expired()) {
            return CompletableFuture.failedFuture(AuthException.expiredToken("Token has expired"));
        }
        if (entry.latency().isZero()) {
            return CompletableFuture.completedFuture(toPrincipal(entry));
        }
        // completing an already cancelled future is a no-op
        Executor delayed = CompletableFuture.delayedExecutor(entry.latency().toMillis(), TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> toPrincipal(entry), delayed);
    }

    public int size() {
        return tokens.size();
    }

    private static Principal toPrincipal(TokenProperties entry) {
        return new Principal(
                entry.id(),
                entry.displayName(),
                new LinkedHashSet<>(entry.roles()),
                new LinkedHashSet<>(entry.permissions()));
    }
}

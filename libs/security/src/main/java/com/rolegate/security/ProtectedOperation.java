package com.rolegate.security;

import java.util.concurrent.CompletableFuture;

/**
 * An operation that only runs for callers meeting its {@link Requirement}.
 * Produced by {@link Guard#protect(java.util.function.Function)}.
 *
 * @param <T> result type of the wrapped operation
 */
@FunctionalInterface
public interface ProtectedOperation<T> {

    /**
     * Authorizes the token and, if allowed, runs the operation with the principal.
     *
     * @param token bearer token presented by the caller
     * @return the operation's result, or a future failed with {@link AuthException}
     */
    CompletableFuture<T> invoke(String token);
}

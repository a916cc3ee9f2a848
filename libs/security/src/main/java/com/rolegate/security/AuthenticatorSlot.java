package com.rolegate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the one {@link Authenticator} active in the application.
 * <p>
 * {@link #install(Authenticator)} swaps the reference atomically. Each authentication
 * reads the reference once, so calls already in flight complete against the instance
 * they started with, and every call started after the swap sees the new one.
 */
public final class AuthenticatorSlot implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatorSlot.class);

    private final AtomicReference<Authenticator> active = new AtomicReference<>();

    public AuthenticatorSlot() {
    }

    public AuthenticatorSlot(Authenticator initial) {
        install(initial);
    }

    /**
     * Makes the given authenticator the active one.
     *
     * @return the previously active authenticator, if any
     */
    public Optional<Authenticator> install(Authenticator authenticator) {
        if (authenticator == null) {
            throw new IllegalArgumentException("authenticator must not be null");
        }
        if (authenticator == this) {
            throw new IllegalArgumentException("a slot cannot delegate to itself");
        }
        Authenticator previous = active.getAndSet(authenticator);
        log.info("Installed authenticator {} (replacing {})",
                authenticator.getClass().getSimpleName(),
                previous == null ? "none" : previous.getClass().getSimpleName());
        return Optional.ofNullable(previous);
    }

    public Optional<Authenticator> current() {
        return Optional.ofNullable(active.get());
    }

    public boolean isInstalled() {
        return active.get() != null;
    }

    /**
     * Delegates to the active authenticator. With none installed the result fails with
     * {@link AuthError#PROVIDER_UNAVAILABLE}. An authenticator that throws instead of
     * returning a failed future is treated the same way as one that fails the future.
     */
    @Override
    public CompletableFuture<Principal> authenticateToken(String token) {
        Authenticator authenticator = active.get();
        if (authenticator == null) {
            return CompletableFuture.failedFuture(
                    AuthException.providerUnavailable("No authenticator installed", null));
        }
        try {
            CompletableFuture<Principal> result = authenticator.authenticateToken(token);
            if (result == null) {
                return CompletableFuture.failedFuture(AuthException.providerUnavailable(
                        authenticator.getClass().getSimpleName() + " returned no result", null));
            }
            return result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}

package com.rolegate.security;

import com.rolegate.observability.SensitiveDataRedactor;
import com.rolegate.observability.SpanHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs the full authorization state machine for one call: authenticate the token, then
 * check the requirement.
 * <p>
 * <ul>
 *   <li>Authentication failures end in {@link AuthorizationOutcome.AuthFailed} with the
 *       authenticator's error, unchanged. They are never reported as a denial.</li>
 *   <li>A failed check ends in {@link AuthorizationOutcome.Denied}, with no detail.</li>
 *   <li>There are no retries.</li>
 * </ul>
 * Cancelling the returned future cancels the pending authentication.
 * <p>
 * The decision may run on the thread that completes the authentication, so this class
 * touches no thread-local state; binding the principal to the log context is left to the
 * caller.
 */
public final class Authorizer {

    private static final Logger log = LoggerFactory.getLogger(Authorizer.class);

    static final String AUTHENTICATE_SPAN = "rolegate.authenticate";

    private final Authenticator authenticator;
    private final DecisionEngine decisions;
    private final AuthorizationMetrics metrics;
    private final SpanHelper spans;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public Authorizer(Authenticator authenticator, DecisionEngine decisions) {
        this(authenticator, decisions, AuthorizationMetrics.standalone(), SpanHelper.noop());
    }

    public Authorizer(Authenticator authenticator, DecisionEngine decisions,
                      AuthorizationMetrics metrics, SpanHelper spans) {
        if (authenticator == null) {
            throw new IllegalArgumentException("authenticator must not be null");
        }
        if (decisions == null) {
            throw new IllegalArgumentException("decisions must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (spans == null) {
            throw new IllegalArgumentException("spans must not be null");
        }
        this.authenticator = authenticator;
        this.decisions = decisions;
        this.metrics = metrics;
        this.spans = spans;
    }

    /**
     * Resolves the token without checking any requirement.
     *
     * @return the authenticator's future; a missing token fails with {@link AuthError#INVALID_TOKEN},
     *         and an authenticator that throws a non-{@link AuthException} or returns no future
     *         fails it with {@link AuthError#PROVIDER_UNAVAILABLE}
     */
    public CompletableFuture<Principal> authenticateToken(String token) {
        if (token == null || token.isBlank()) {
            return CompletableFuture.failedFuture(AuthException.invalidToken("Missing bearer token"));
        }
        long start = System.nanoTime();
        CompletableFuture<Principal> pending = spans.traceAsync(AUTHENTICATE_SPAN,
                Map.of("token.fingerprint", redactor.maskToken(token)),
                () -> invokeAuthenticator(token));
        pending.whenComplete((principal, error) -> metrics.recordAuthentication(start));
        return pending;
    }

    /**
     * Authenticates the token and checks the requirement.
     *
     * @param token       bearer token (null or blank fails with {@link AuthError#INVALID_TOKEN})
     * @param requirement the single role or permission the operation demands
     * @return future outcome; it only completes exceptionally if cancelled
     */
    public CompletableFuture<AuthorizationOutcome> authorize(String token, Requirement requirement) {
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        CompletableFuture<Principal> pending;
        try {
            pending = authenticateToken(token);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Principal> authentication = pending;
        CompletableFuture<AuthorizationOutcome> outcome = new CompletableFuture<>();
        authentication.whenComplete((principal, error) -> {
            if (outcome.isDone()) {
                // cancelled by the caller
                return;
            }
            try {
                outcome.complete(error == null ? decide(principal, requirement) : failed(error, token));
            } catch (RuntimeException e) {
                log.error("Authorization for {} failed while deciding", requirement, e);
                outcome.complete(AuthorizationOutcome.authFailed(AuthError.PROVIDER_UNAVAILABLE));
            }
        });
        outcome.whenComplete((result, error) -> {
            if (outcome.isCancelled()) {
                authentication.cancel(true);
                log.debug("Authorization cancelled for {}", requirement);
            } else if (result != null) {
                metrics.recordOutcome(result);
            }
        });
        return outcome;
    }

    /**
     * The decision engine this authorizer consults.
     */
    public DecisionEngine decisions() {
        return decisions;
    }

    private AuthorizationOutcome decide(Principal principal, Requirement requirement) {
        if (principal == null) {
            log.error("Authenticator completed without a principal");
            return AuthorizationOutcome.authFailed(AuthError.PROVIDER_UNAVAILABLE);
        }
        if (decisions.satisfies(principal, requirement)) {
            log.debug("Allowed principal '{}' for {}", principal.id(), requirement);
            return AuthorizationOutcome.allowed(principal);
        }
        log.debug("Denied principal '{}' for {}", principal.id(), requirement);
        return AuthorizationOutcome.denied();
    }

    private AuthorizationOutcome failed(Throwable error, String token) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            log.error("Authenticator cancelled its own authentication for token {}", redactor.maskToken(token));
            return AuthorizationOutcome.authFailed(AuthError.PROVIDER_UNAVAILABLE);
        }
        if (cause instanceof AuthException authException) {
            AuthError reason = authException.error();
            if (reason == AuthError.UNAUTHORIZED) {
                log.error("Authenticator reported UNAUTHORIZED for token {}; treating as invalid token",
                        redactor.maskToken(token));
                return AuthorizationOutcome.authFailed(AuthError.INVALID_TOKEN);
            }
            if (reason == AuthError.PROVIDER_UNAVAILABLE) {
                log.warn("Authentication provider unavailable: {}", authException.getMessage());
            } else {
                log.info("Authentication failed ({}) for token {}", reason, redactor.maskToken(token));
            }
            return AuthorizationOutcome.authFailed(reason);
        }
        log.error("Authenticator failed without an AuthError for token {}", redactor.maskToken(token), cause);
        return AuthorizationOutcome.authFailed(AuthError.PROVIDER_UNAVAILABLE);
    }

    private CompletableFuture<Principal> invokeAuthenticator(String token) {
        CompletableFuture<Principal> result;
        try {
            result = authenticator.authenticateToken(token);
        } catch (AuthException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(AuthException.providerUnavailable(
                    authenticator.getClass().getSimpleName() + " threw " + e.getClass().getSimpleName(), e));
        }
        if (result == null) {
            return CompletableFuture.failedFuture(AuthException.providerUnavailable(
                    authenticator.getClass().getSimpleName() + " returned no result", null));
        }
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

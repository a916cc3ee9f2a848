package com.rolegate.guardedservice.infrastructure.web;

import com.rolegate.observability.CorrelationContextHolder;
import com.rolegate.observability.SensitiveDataRedactor;
import com.rolegate.security.AuthError;
import com.rolegate.security.AuthorizationOutcome;
import com.rolegate.security.Authorizer;
import com.rolegate.security.BearerTokenExtractor;
import com.rolegate.security.Principal;
import com.rolegate.security.Requirement;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.function.HandlerFilterFunction;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Functional-route filter that enforces one {@link Requirement} before the handler runs.
 *
 * <p>The bearer token is taken from the {@code Authorization} header and handed to the {@link
 * Authorizer}. The servlet thread waits at most the configured guard timeout; on timeout the
 * pending authorization is cancelled, which cancels the authentication behind it, and the caller
 * gets 503. On an allow verdict the principal is stored under {@link #PRINCIPAL_ATTRIBUTE} and
 * bound to the log context before the handler is invoked.
 */
public class GuardFilterFunction implements HandlerFilterFunction<ServerResponse, ServerResponse> {

    private static final Logger log = LoggerFactory.getLogger(GuardFilterFunction.class);

    /** Request attribute holding the authenticated {@link Principal}. */
    public static final String PRINCIPAL_ATTRIBUTE = "rolegate.principal";

    private final Authorizer authorizer;
    private final Requirement requirement;
    private final Duration timeout;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public GuardFilterFunction(Authorizer authorizer, Requirement requirement, Duration timeout) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer must not be null");
        }
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.authorizer = authorizer;
        this.requirement = requirement;
        this.timeout = timeout;
    }

    @Override
    public ServerResponse filter(ServerRequest request, HandlerFunction<ServerResponse> next)
            throws Exception {
        Optional<String> token =
                BearerTokenExtractor.extract(request.headers().firstHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            log.debug("Rejected {} {}: no bearer token", request.method(), request.path());
            return AuthProblems.serverResponse(AuthError.INVALID_TOKEN);
        }

        CompletableFuture<AuthorizationOutcome> pending = authorizer.authorize(token.get(), requirement);
        AuthorizationOutcome outcome;
        try {
            outcome = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("Authorization for {} timed out after {} ms (token {})",
                    requirement, timeout.toMillis(), redactor.maskToken(token.get()));
            return AuthProblems.serverResponse(AuthError.PROVIDER_UNAVAILABLE);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return AuthProblems.serverResponse(AuthError.PROVIDER_UNAVAILABLE);
        } catch (ExecutionException e) {
            log.error("Authorization for {} failed unexpectedly", requirement, e.getCause());
            return AuthProblems.serverResponse(AuthError.PROVIDER_UNAVAILABLE);
        }

        if (outcome instanceof AuthorizationOutcome.Allowed allowed) {
            Principal principal = allowed.principal();
            request.attributes().put(PRINCIPAL_ATTRIBUTE, principal);
            CorrelationContextHolder.bindPrincipal(principal.id());
            return next.handle(request);
        }
        log.debug("{} {} answered with {}", request.method(), request.path(), outcome.error());
        return AuthProblems.serverResponse(outcome.error());
    }

    public Requirement requirement() {
        return requirement;
    }

    /**
     * Reads the principal stored by a guard earlier in the chain.
     *
     * @throws IllegalStateException if the route is not guarded
     */
    public static Principal principal(ServerRequest request) {
        return request.attribute(PRINCIPAL_ATTRIBUTE)
                .map(Principal.class::cast)
                .orElseThrow(() -> new IllegalStateException("request was not authorized by a guard"));
    }
}

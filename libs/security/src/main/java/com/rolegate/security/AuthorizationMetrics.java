package com.rolegate.security;

import com.rolegate.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for authorization attempts.
 * <ul>
 *   <li>{@value #OUTCOMES}: counter tagged {@code outcome} (allowed, denied, auth_failed)
 *       and {@code error} (the {@link AuthError}, or {@code none})</li>
 *   <li>{@value #AUTHENTICATION_DURATION}: time spent waiting on the authenticator</li>
 * </ul>
 * Requirement names are never used as tags.
 */
public final class AuthorizationMetrics {

    public static final String OUTCOMES = "rolegate.authorization.outcomes";
    public static final String AUTHENTICATION_DURATION = "rolegate.authentication.duration";

    private final MetricFactory metrics;
    private final Timer authenticationTimer;

    public AuthorizationMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
        this.authenticationTimer = metrics.timer(AUTHENTICATION_DURATION,
                "Time spent resolving a token to a principal");
    }

    /**
     * Metrics kept in a private registry, for embedders that do not export them.
     */
    public static AuthorizationMetrics standalone() {
        return new AuthorizationMetrics(MetricFactory.standalone("rolegate"));
    }

    void recordOutcome(AuthorizationOutcome outcome) {
        String error = outcome.isAllowed() ? "none" : tagValue(outcome.error().name());
        metrics.counter(OUTCOMES, "Authorization attempts by terminal state",
                "outcome", tagValue(outcome.state().name()),
                "error", error).increment();
    }

    void recordAuthentication(long startNanos) {
        authenticationTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private static String tagValue(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}

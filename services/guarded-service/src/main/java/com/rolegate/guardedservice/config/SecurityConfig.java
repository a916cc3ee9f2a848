package com.rolegate.guardedservice.config;

import com.rolegate.guardedservice.auth.ConfiguredTokenAuthenticator;
import com.rolegate.observability.MetricFactory;
import com.rolegate.observability.SpanHelper;
import com.rolegate.security.AuthenticatorSlot;
import com.rolegate.security.AuthorizationMetrics;
import com.rolegate.security.Authorizer;
import com.rolegate.security.DecisionEngine;
import com.rolegate.security.RoleDeclarationValidator;
import com.rolegate.security.RoleDeclarations;
import com.rolegate.security.RoleRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the authorization engine as explicit application objects.
 *
 * <p>The registry and the authenticator slot are ordinary beans rather than process globals, so
 * tests can build their own. The registry is loaded and validated before the web layer starts;
 * a bad declaration stops the application.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public RoleRegistry roleRegistry(RoleGateProperties properties) {
        RoleDeclarations declarations = RoleDeclarations.fromClasspath(properties.roleDeclarations());
        RoleDeclarationValidator.validate(declarations).orThrow("role declarations");
        return RoleRegistry.of(declarations);
    }

    @Bean
    public AuthenticatorSlot authenticatorSlot(RoleGateProperties properties) {
        var authenticator = new ConfiguredTokenAuthenticator(properties.tokens());
        log.info("Serving {} configured token(s)", authenticator.size());
        return new AuthenticatorSlot(authenticator);
    }

    @Bean
    public DecisionEngine decisionEngine(RoleRegistry roleRegistry) {
        return new DecisionEngine(roleRegistry);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, RoleGateProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(SpanHelper.INSTRUMENTATION_NAME));
    }

    @Bean
    public Authorizer authorizer(
            AuthenticatorSlot authenticatorSlot,
            DecisionEngine decisionEngine,
            MetricFactory metricFactory,
            SpanHelper spanHelper) {
        return new Authorizer(
                authenticatorSlot, decisionEngine, new AuthorizationMetrics(metricFactory), spanHelper);
    }
}

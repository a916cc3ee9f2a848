package com.rolegate.guardedservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the guarded service, bound from {@code rolegate.service.*}.
 *
 * <pre>
 * rolegate:
 *   service:
 *     name: guarded-service
 *     environment: production
 *     role-declarations: roles.json
 *     guard-timeout: 5s
 *     tokens:
 *       admin-token:
 *         id: "1"
 *         display-name: admin
 *         roles: [admin]
 * </pre>
 *
 * @param name service name used for logging and metrics. Required.
 * @param environment deployment environment (development, staging, production).
 * @param roleDeclarations classpath resource holding the role declaration JSON.
 * @param guardTimeout how long a guard waits for the authenticator before answering 503.
 * @param tokens demo token table served by the configured authenticator, keyed by token.
 */
@ConfigurationProperties(prefix = "rolegate.service")
@Validated
public record RoleGateProperties(
        @NotBlank String name,
        String environment,
        String roleDeclarations,
        Duration guardTimeout,
        Map<String, @Valid TokenProperties> tokens) {

    public static final String DEFAULT_ROLE_DECLARATIONS = "roles.json";
    public static final Duration DEFAULT_GUARD_TIMEOUT = Duration.ofSeconds(5);

    /** Applies defaults before Bean Validation runs. */
    public RoleGateProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (roleDeclarations == null || roleDeclarations.isBlank()) {
            roleDeclarations = DEFAULT_ROLE_DECLARATIONS;
        }
        if (guardTimeout == null || guardTimeout.isZero() || guardTimeout.isNegative()) {
            guardTimeout = DEFAULT_GUARD_TIMEOUT;
        }
        tokens = tokens == null ? Map.of() : Map.copyOf(tokens);
    }

    /**
     * One entry of the demo token table.
     *
     * @param id principal id. Required.
     * @param displayName principal display name.
     * @param roles roles attached to the principal.
     * @param permissions direct permissions attached to the principal.
     * @param expired when true the token is rejected as expired.
     * @param latency artificial delay before the authenticator answers.
     */
    public record TokenProperties(
            @NotBlank String id,
            String displayName,
            List<String> roles,
            List<String> permissions,
            boolean expired,
            Duration latency) {

        public TokenProperties {
            roles = roles == null ? List.of() : List.copyOf(roles);
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
            if (latency == null || latency.isNegative()) {
                latency = Duration.ZERO;
            }
        }
    }
}

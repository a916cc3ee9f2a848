package com.rolegate.guardedservice;

import com.rolegate.guardedservice.config.RoleGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Reference service that puts HTTP routes behind the RoleGate engine.
 *
 * <p>The service is the guard adapter: it pulls the bearer token out of each request, asks the
 * {@link com.rolegate.security.Authorizer} for a verdict, and turns the verdict into an HTTP
 * response. Roles are loaded from {@code roles.json} at startup; the active authenticator is the
 * token table in {@code rolegate.service.tokens}.
 *
 * <ul>
 *   <li>Functional routes guarded by {@code GuardFilterFunction}
 *   <li>Annotated controller guarded with {@link com.rolegate.security.Guard}
 *   <li>RFC 7807 problem responses for every authorization failure
 *   <li>Correlation ID propagation, Actuator health and Prometheus metrics
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(RoleGateProperties.class)
public class GuardedServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(GuardedServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GuardedServiceApplication.class, args);
        log.info("RoleGate guarded service started");
    }
}

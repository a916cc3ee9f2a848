package com.rolegate.guardedservice.api;

import com.rolegate.guardedservice.config.RoleGateProperties;
import com.rolegate.guardedservice.infrastructure.web.RouteGuards;
import com.rolegate.security.AuthException;
import com.rolegate.security.BearerTokenExtractor;
import com.rolegate.security.ProtectedOperation;
import com.rolegate.security.Requirement;
import com.rolegate.security.RoleDefinition;
import com.rolegate.security.RoleRegistry;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registry contents for administrators, guarded with a {@link com.rolegate.security.Guard}
 * rather than a route filter. Rejections surface as {@link AuthException} and are mapped by
 * {@link com.rolegate.guardedservice.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/roles")
public class RoleController {

    private final ProtectedOperation<Map<String, Object>> listRoles;
    private final Duration timeout;

    public RoleController(RouteGuards guards, RoleRegistry roleRegistry, RoleGateProperties properties) {
        this.listRoles = guards.guard(Requirement.role("admin"))
                .protect(principal -> describe(roleRegistry));
        this.timeout = properties.guardTimeout();
    }

    @GetMapping
    public Map<String, Object> roles(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String token = BearerTokenExtractor.extract(authorization).orElse(null);
        return await(listRoles.invoke(token));
    }

    private <T> T await(CompletableFuture<T> pending) {
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw AuthException.providerUnavailable("Authorization timed out", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw AuthException.providerUnavailable("Interrupted while authorizing", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Guarded operation failed", e.getCause());
        }
    }

    private static Map<String, Object> describe(RoleRegistry registry) {
        Map<String, Set<String>> roles = new LinkedHashMap<>();
        for (RoleDefinition definition : registry.snapshot().values()) {
            roles.put(definition.name(), definition.permissions());
        }
        return Map.of("count", roles.size(), "roles", roles);
    }
}

package com.rolegate.guardedservice.infrastructure.web;

import com.rolegate.guardedservice.config.RoleGateProperties;
import com.rolegate.security.Authorizer;
import com.rolegate.security.Guard;
import com.rolegate.security.Requirement;
import com.rolegate.security.RoleDeclarationValidator;
import com.rolegate.security.RoleRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Hands out guards for routes and controllers and remembers every requirement it was asked for.
 *
 * <p>Once all singletons exist, the recorded role requirements are checked against the
 * {@link RoleRegistry}. A route that demands an undeclared role would deny every caller, so it
 * fails startup instead.
 */
@Component
public class RouteGuards implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(RouteGuards.class);

    private final Authorizer authorizer;
    private final RoleRegistry roleRegistry;
    private final RoleGateProperties properties;
    private final Set<Requirement> requirements = new LinkedHashSet<>();

    public RouteGuards(Authorizer authorizer, RoleRegistry roleRegistry, RoleGateProperties properties) {
        this.authorizer = authorizer;
        this.roleRegistry = roleRegistry;
        this.properties = properties;
    }

    public GuardFilterFunction requireRole(String roleName) {
        return filter(Requirement.role(roleName));
    }

    public GuardFilterFunction requirePermission(String permissionName) {
        return filter(Requirement.permission(permissionName));
    }

    /** Guard for annotated controllers. */
    public Guard guard(Requirement requirement) {
        record(requirement);
        return new Guard(authorizer, requirement);
    }

    public synchronized List<Requirement> requirements() {
        return List.copyOf(requirements);
    }

    @Override
    public void afterSingletonsInstantiated() {
        RoleDeclarationValidator.validateRequirements(roleRegistry, requirements())
                .orThrow("route requirements");
        log.info("Guarding {} requirement(s) with timeout {}", requirements().size(), properties.guardTimeout());
    }

    private GuardFilterFunction filter(Requirement requirement) {
        record(requirement);
        return new GuardFilterFunction(authorizer, requirement, properties.guardTimeout());
    }

    private synchronized void record(Requirement requirement) {
        requirements.add(requirement);
    }
}

package com.rolegate.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Answers role and permission questions about an authenticated {@link Principal}.
 * <p>
 * Every method is pure: no I/O, no blocking, no state of its own. Permissions are
 * expanded through the {@link RoleRegistry} on each call, so a role redefinition is
 * seen by the next decision.
 */
public final class DecisionEngine {

    private final RoleRegistry registry;

    public DecisionEngine(RoleRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * True iff the principal holds the role. The role's permissions are not consulted,
     * nor is whether the role is defined in the registry.
     */
    public boolean hasRole(Principal principal, String roleName) {
        requirePrincipal(principal);
        return roleName != null && principal.roles().contains(roleName);
    }

    /**
     * True iff the permission is granted directly, or by at least one role the principal
     * holds. Direct permissions are checked first, then roles in the principal's order;
     * the first match wins.
     */
    public boolean hasPermission(Principal principal, String permissionName) {
        requirePrincipal(principal);
        if (permissionName == null) {
            return false;
        }
        if (principal.directPermissions().contains(permissionName)) {
            return true;
        }
        for (String role : principal.roles()) {
            if (registry.permissionsOf(role).contains(permissionName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates a single requirement.
     */
    public boolean satisfies(Principal principal, Requirement requirement) {
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        if (requirement instanceof Requirement.RoleRequirement role) {
            return hasRole(principal, role.name());
        }
        return hasPermission(principal, requirement.name());
    }

    /**
     * The principal's effective permission set: direct permissions followed by the
     * permissions of each held role, in order, without duplicates. Undefined roles
     * contribute nothing.
     */
    public Set<String> effectivePermissions(Principal principal) {
        requirePrincipal(principal);
        Set<String> all = new LinkedHashSet<>(principal.directPermissions());
        for (String role : principal.roles()) {
            all.addAll(registry.permissionsOf(role));
        }
        return Collections.unmodifiableSet(all);
    }

    public RoleRegistry registry() {
        return registry;
    }

    private static void requirePrincipal(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
    }
}

package com.rolegate.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The resolved identity of one authenticated caller, with the roles and permissions
 * attached to it.
 * <p>
 * A value, built fresh by the {@link Authenticator} for each authentication and never
 * persisted by this library. Role names are resolved against the {@link RoleRegistry} only
 * when a decision is made, so the principal holds no reference into registry storage.
 * Direct permissions are granted independently of any role.
 * <p>
 * Both sets keep the order in which entries were attached; the decision engine walks roles
 * in that order, which makes its short-circuit deterministic for a given principal.
 *
 * @param id                opaque, application-defined user id
 * @param displayName       human-readable name (defaults to the id)
 * @param roles             role names held by the principal
 * @param directPermissions permissions granted outside any role
 */
public record Principal(
        String id,
        String displayName,
        Set<String> roles,
        Set<String> directPermissions
) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
        roles = copyNames(roles, "role");
        directPermissions = copyNames(directPermissions, "permission");
    }

    /**
     * Creates a principal with no roles and no direct permissions.
     */
    public static Principal of(String id, String displayName) {
        return new Principal(id, displayName, Set.of(), Set.of());
    }

    public Principal withRole(String role) {
        return withRoles(Collections.singleton(role));
    }

    public Principal withRoles(String... roles) {
        return withRoles(Arrays.asList(roles));
    }

    public Principal withRoles(Collection<String> additional) {
        Set<String> next = new LinkedHashSet<>(roles);
        next.addAll(additional);
        return new Principal(id, displayName, next, directPermissions);
    }

    public Principal withPermission(String permission) {
        return withPermissions(Collections.singleton(permission));
    }

    public Principal withPermissions(String... permissions) {
        return withPermissions(Arrays.asList(permissions));
    }

    public Principal withPermissions(Collection<String> additional) {
        Set<String> next = new LinkedHashSet<>(directPermissions);
        next.addAll(additional);
        return new Principal(id, displayName, roles, next);
    }

    private static Set<String> copyNames(Collection<String> names, String kind) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(kind + " names must not be null or blank");
            }
            copy.add(name);
        }
        return Collections.unmodifiableSet(copy);
    }
}

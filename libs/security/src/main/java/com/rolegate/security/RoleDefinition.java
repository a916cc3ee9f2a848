package com.rolegate.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named bundle of permissions.
 * <p>
 * Immutable: the permission set is copied on construction and exposed read-only, so a
 * definition handed out by {@link RoleRegistry} can never change underneath a reader.
 * Iteration order of {@link #permissions()} is declaration order.
 *
 * @param name        case-sensitive role name
 * @param permissions permission names granted by the role
 */
public record RoleDefinition(String name, Set<String> permissions) {

    public RoleDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name must not be null or blank");
        }
        if (permissions == null) {
            throw new IllegalArgumentException("permissions must not be null");
        }
        for (String permission : permissions) {
            if (permission == null || permission.isBlank()) {
                throw new IllegalArgumentException(
                        "role '%s' has a null or blank permission".formatted(name));
            }
        }
        permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    public static RoleDefinition of(String name, String... permissions) {
        return new RoleDefinition(name, new LinkedHashSet<>(Arrays.asList(permissions)));
    }

    public static RoleDefinition of(String name, Collection<String> permissions) {
        if (permissions == null) {
            throw new IllegalArgumentException("permissions must not be null");
        }
        return new RoleDefinition(name, new LinkedHashSet<>(permissions));
    }

    public boolean grants(String permission) {
        return permissions.contains(permission);
    }
}

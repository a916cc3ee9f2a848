package com.rolegate.security;

/**
 * What a protected operation demands of its caller: exactly one role name or exactly one
 * permission name. Requirements do not combine.
 */
public sealed interface Requirement permits Requirement.RoleRequirement, Requirement.PermissionRequirement {

    /** The role or permission name. */
    String name();

    static Requirement role(String roleName) {
        return new RoleRequirement(roleName);
    }

    static Requirement permission(String permissionName) {
        return new PermissionRequirement(permissionName);
    }

    /**
     * Satisfied when the principal holds the role itself.
     */
    record RoleRequirement(String name) implements Requirement {

        public RoleRequirement {
            requireName(name, "role");
        }

        @Override
        public String toString() {
            return "role:" + name;
        }
    }

    /**
     * Satisfied when the permission is in the principal's effective permission set.
     */
    record PermissionRequirement(String name) implements Requirement {

        public PermissionRequirement {
            requireName(name, "permission");
        }

        @Override
        public String toString() {
            return "permission:" + name;
        }
    }

    private static void requireName(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("required " + kind + " must not be null or blank");
        }
    }
}

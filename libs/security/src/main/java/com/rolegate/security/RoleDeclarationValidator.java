package com.rolegate.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Configuration-time checks for role declarations and guard requirements.
 * <p>
 * Unknown roles grant nothing at decision time rather than failing the call, so typos in
 * role names are caught here, before traffic starts. All errors are collected.
 */
public final class RoleDeclarationValidator {

    private RoleDeclarationValidator() {
        // utility class
    }

    /**
     * Checks that the declarations define at least one role and that no name carries
     * leading or trailing whitespace (names are matched exactly).
     */
    public static ValidationResult validate(RoleDeclarations declarations) {
        if (declarations == null) {
            return ValidationResult.fail(List.of("declarations must not be null"));
        }
        var errors = new ArrayList<String>();
        if (declarations.isEmpty()) {
            errors.add("declarations must define at least one role");
        }
        for (RoleDefinition role : declarations.roles()) {
            if (!role.name().equals(role.name().strip())) {
                errors.add("role '%s' has leading or trailing whitespace".formatted(role.name()));
            }
            for (String permission : role.permissions()) {
                if (!permission.equals(permission.strip())) {
                    errors.add("role '%s' permission '%s' has leading or trailing whitespace"
                            .formatted(role.name(), permission));
                }
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Checks that every role requirement names a role defined in the registry. Permission
     * requirements are not checked: a permission may be granted directly to principals.
     */
    public static ValidationResult validateRequirements(RoleRegistry registry,
                                                        Collection<Requirement> requirements) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (requirements == null) {
            return ValidationResult.fail(List.of("requirements must not be null"));
        }
        var errors = new ArrayList<String>();
        for (Requirement requirement : requirements) {
            if (requirement instanceof Requirement.RoleRequirement role && !registry.contains(role.name())) {
                errors.add("required role '%s' is not defined".formatted(role.name()));
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}

package com.rolegate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table of role name to granted permissions, shared by every decision in the process.
 * <p>
 * The table is an immutable snapshot behind an {@link AtomicReference}. Readers take the
 * current snapshot without locking; writers build a new snapshot and publish it in one
 * swap. A reader therefore observes either the old or the new permission set of a role,
 * never a partially updated one, and a bulk {@link #defineAll(RoleDeclarations)} becomes
 * visible all at once.
 * <p>
 * Roles are usually loaded once at startup. Redefinition at runtime is supported but
 * replaces a role's permission set rather than merging into it.
 */
public final class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final AtomicReference<Map<String, RoleDefinition>> table =
            new AtomicReference<>(Map.of());

    public RoleRegistry() {
    }

    /**
     * Creates a registry pre-loaded with the given declarations.
     */
    public static RoleRegistry of(RoleDeclarations declarations) {
        RoleRegistry registry = new RoleRegistry();
        registry.defineAll(declarations);
        return registry;
    }

    /**
     * Registers the role, or replaces the permission set of an existing role. A replaced
     * role keeps its registration position.
     *
     * @param roleName    case-sensitive role name
     * @param permissions permissions granted by the role (copied)
     * @throws IllegalArgumentException if the name or any permission is null or blank
     */
    public void define(String roleName, Set<String> permissions) {
        define(new RoleDefinition(roleName, permissions));
    }

    /**
     * Registers or replaces a role.
     */
    public void define(RoleDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        Map<String, RoleDefinition> previous = table.getAndUpdate(current -> {
            Map<String, RoleDefinition> next = new LinkedHashMap<>(current);
            next.put(definition.name(), definition);
            return Collections.unmodifiableMap(next);
        });
        if (previous.containsKey(definition.name())) {
            log.info("Role '{}' redefined with {} permission(s)",
                    definition.name(), definition.permissions().size());
        } else {
            log.debug("Role '{}' defined with {} permission(s)",
                    definition.name(), definition.permissions().size());
        }
    }

    /**
     * Registers every declared role in a single swap.
     *
     * @param declarations the roles to define
     */
    public void defineAll(RoleDeclarations declarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("declarations must not be null");
        }
        table.updateAndGet(current -> {
            Map<String, RoleDefinition> next = new LinkedHashMap<>(current);
            for (RoleDefinition definition : declarations.roles()) {
                next.put(definition.name(), definition);
            }
            return Collections.unmodifiableMap(next);
        });
        log.info("Loaded {} role(s): {}", declarations.size(),
                declarations.roles().stream().map(RoleDefinition::name).toList());
    }

    /**
     * Returns the permissions granted by a role. An undefined role grants nothing: the
     * result is an empty set, not an error.
     *
     * @param roleName role to look up (null yields an empty set)
     * @return unmodifiable permission set
     */
    public Set<String> permissionsOf(String roleName) {
        if (roleName == null) {
            return Set.of();
        }
        RoleDefinition definition = table.get().get(roleName);
        return definition == null ? Set.of() : definition.permissions();
    }

    /**
     * Looks up the full definition of a role.
     */
    public Optional<RoleDefinition> find(String roleName) {
        if (roleName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get().get(roleName));
    }

    /**
     * Returns the names of all defined roles in registration order.
     */
    public List<String> allRoleNames() {
        return List.copyOf(table.get().keySet());
    }

    public boolean contains(String roleName) {
        return roleName != null && table.get().containsKey(roleName);
    }

    public int size() {
        return table.get().size();
    }

    /**
     * Returns the current table as an immutable, registration-ordered snapshot.
     */
    public Map<String, RoleDefinition> snapshot() {
        return table.get();
    }
}

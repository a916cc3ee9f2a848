package com.rolegate.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static declaration of roles and the permissions they grant, loaded into a
 * {@link RoleRegistry} in one step at startup.
 * <p>
 * Built in code:
 * <pre>{@code
 * RoleDeclarations roles = RoleDeclarations.builder()
 *         .role("admin", "create_user", "delete_user", "view_admin_panel")
 *         .role("user", "view_profile", "edit_profile")
 *         .build();
 * }</pre>
 * or read from JSON shaped as {@code {"admin": ["create_user", ...], "user": [...]}}.
 * <p>
 * Declaration order is preserved. Declaring the same role twice keeps the position of the
 * first declaration and the permissions of the last one.
 */
public final class RoleDeclarations {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, List<String>>> DECLARATION_TYPE =
            new TypeReference<>() { };

    private final List<RoleDefinition> roles;

    private RoleDeclarations(Collection<RoleDefinition> roles) {
        this.roles = List.copyOf(roles);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a JSON declaration.
     *
     * @throws RoleDeclarationException if the JSON is malformed or declares blank names
     */
    public static RoleDeclarations fromJson(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        try {
            return fromMap(MAPPER.readValue(json, DECLARATION_TYPE));
        } catch (JsonProcessingException e) {
            throw new RoleDeclarationException("Malformed role declaration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON declaration from a stream. The stream is not closed.
     *
     * @throws RoleDeclarationException if the stream cannot be read or the JSON is malformed
     */
    public static RoleDeclarations fromJson(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("input stream must not be null");
        }
        try {
            return fromMap(MAPPER.readValue(in, DECLARATION_TYPE));
        } catch (IOException e) {
            throw new RoleDeclarationException("Unable to read role declaration", e);
        }
    }

    /**
     * Reads a JSON declaration from the classpath.
     *
     * @param resource classpath location, e.g. {@code "roles.json"}
     * @throws RoleDeclarationException if the resource does not exist or cannot be parsed
     */
    public static RoleDeclarations fromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RoleDeclarations.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new RoleDeclarationException("Role declaration not found on classpath: " + resource);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new RoleDeclarationException("Unable to read role declaration: " + resource, e);
        }
    }

    /**
     * Builds declarations from an ordered map of role name to permission names.
     *
     * @throws RoleDeclarationException if a name is blank or a permission list is missing
     */
    public static RoleDeclarations fromMap(Map<String, ? extends Collection<String>> declaration) {
        if (declaration == null) {
            throw new RoleDeclarationException("Role declaration must not be null");
        }
        Builder builder = builder();
        for (Map.Entry<String, ? extends Collection<String>> entry : declaration.entrySet()) {
            if (entry.getValue() == null) {
                throw new RoleDeclarationException(
                        "Role '%s' must declare a permission list".formatted(entry.getKey()));
            }
            try {
                builder.role(entry.getKey(), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new RoleDeclarationException(e.getMessage(), e);
            }
        }
        return builder.build();
    }

    /** Declared roles in declaration order. */
    public List<RoleDefinition> roles() {
        return roles;
    }

    public boolean isEmpty() {
        return roles.isEmpty();
    }

    public int size() {
        return roles.size();
    }

    /**
     * Fluent builder, the code form of a role declaration.
     */
    public static final class Builder {

        private final Map<String, RoleDefinition> roles = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder role(String name, String... permissions) {
            return role(RoleDefinition.of(name, permissions));
        }

        public Builder role(String name, Collection<String> permissions) {
            return role(RoleDefinition.of(name, permissions));
        }

        public Builder role(RoleDefinition definition) {
            if (definition == null) {
                throw new IllegalArgumentException("definition must not be null");
            }
            roles.put(definition.name(), definition);
            return this;
        }

        public RoleDeclarations build() {
            return new RoleDeclarations(new ArrayList<>(roles.values()));
        }
    }
}

package com.rolegate.security;

import com.rolegate.security.testing.TestPrincipalFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoleRegistry")
class RoleRegistryTest {

    @Nested
    @DisplayName("define()")
    class Define {

        @Test
        @DisplayName("registers a role and its permissions")
        void registersRole() {
            var registry = new RoleRegistry();

            registry.define("moderator", Set.of("delete_post", "pin_post"));

            assertThat(registry.permissionsOf("moderator")).containsExactlyInAnyOrder("delete_post", "pin_post");
            assertThat(registry.contains("moderator")).isTrue();
        }

        @Test
        @DisplayName("redefinition replaces the permission set, it does not merge")
        void redefinitionReplaces() {
            var registry = new RoleRegistry();
            var engine = new DecisionEngine(registry);
            var principal = Principal.of("1", "admin").withRole("admin");

            registry.define("admin", Set.of("x"));
            registry.define("admin", Set.of("y"));

            assertThat(engine.hasPermission(principal, "y")).isTrue();
            assertThat(engine.hasPermission(principal, "x")).isFalse();
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("role names are case-sensitive")
        void caseSensitive() {
            var registry = new RoleRegistry();
            registry.define("Admin", Set.of("a"));
            registry.define("admin", Set.of("b"));

            assertThat(registry.allRoleNames()).containsExactly("Admin", "admin");
            assertThat(registry.permissionsOf("ADMIN")).isEmpty();
        }

        @Test
        @DisplayName("rejects blank role names and blank permissions")
        void rejectsBlankNames() {
            var registry = new RoleRegistry();

            assertThatThrownBy(() -> registry.define(" ", Set.of("a")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.define("r", Set.of("")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'r'");
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("copies the caller's set")
        void copiesPermissions() {
            var registry = new RoleRegistry();
            var permissions = new java.util.HashSet<>(Set.of("a"));

            registry.define("r", permissions);
            permissions.add("b");

            assertThat(registry.permissionsOf("r")).containsExactly("a");
            assertThatThrownBy(() -> registry.permissionsOf("r").add("c"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("unknown role grants an empty set, not an error")
        void unknownRoleIsEmpty() {
            var registry = RoleRegistry.of(TestPrincipalFactory.referenceRoles());

            assertThat(registry.permissionsOf("nonexistent")).isEmpty();
            assertThat(registry.permissionsOf(null)).isEmpty();
            assertThat(registry.find("nonexistent")).isEmpty();
        }

        @Test
        @DisplayName("allRoleNames follows registration order, redefinition keeps position")
        void registrationOrder() {
            var registry = new RoleRegistry();
            registry.define("zeta", Set.of());
            registry.define("alpha", Set.of());
            registry.define("mid", Set.of());
            registry.define("zeta", Set.of("z"));

            assertThat(registry.allRoleNames()).containsExactly("zeta", "alpha", "mid");
        }

        @Test
        @DisplayName("snapshot is immutable")
        void snapshotImmutable() {
            var registry = RoleRegistry.of(TestPrincipalFactory.referenceRoles());

            assertThatThrownBy(() -> registry.snapshot().remove("admin"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(registry.find("admin")).get()
                    .extracting(RoleDefinition::permissions)
                    .isEqualTo(Set.of("delete_user"));
        }
    }

    @Nested
    @DisplayName("defineAll()")
    class DefineAll {

        @Test
        @DisplayName("bulk-loads declarations in declaration order")
        void bulkLoads() {
            var registry = new RoleRegistry();

            registry.defineAll(RoleDeclarations.builder()
                    .role("admin", "create_user", "delete_user", "view_admin_panel")
                    .role("user", "view_profile", "edit_profile")
                    .role("moderator", "delete_post", "edit_post", "pin_post")
                    .build());

            assertThat(registry.allRoleNames()).containsExactly("admin", "user", "moderator");
            assertThat(registry.permissionsOf("user")).containsExactly("view_profile", "edit_profile");
        }

        @Test
        @DisplayName("replaces existing roles and keeps the others")
        void replacesExisting() {
            var registry = new RoleRegistry();
            registry.define("admin", Set.of("old"));
            registry.define("guest", Set.of("browse"));

            registry.defineAll(RoleDeclarations.builder().role("admin", "new").build());

            assertThat(registry.permissionsOf("admin")).containsExactly("new");
            assertThat(registry.permissionsOf("guest")).containsExactly("browse");
        }

        @Test
        @DisplayName("rejects null declarations")
        void rejectsNull() {
            assertThatThrownBy(() -> new RoleRegistry().defineAll(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

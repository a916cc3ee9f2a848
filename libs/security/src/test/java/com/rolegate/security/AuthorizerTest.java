package com.rolegate.security;

import com.rolegate.observability.MetricFactory;
import com.rolegate.observability.SpanHelper;
import com.rolegate.security.testing.StubAuthenticator;
import com.rolegate.security.testing.TestPrincipalFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Authorizer")
class AuthorizerTest {

    private StubAuthenticator authenticator;
    private SimpleMeterRegistry meters;
    private Authorizer authorizer;

    @BeforeEach
    void setUp() {
        authenticator = new StubAuthenticator()
                .accept("user-token", TestPrincipalFactory.referencePrincipal())
                .accept("admin-token", Principal.of("1", "admin").withRole("admin"))
                .reject("stale", AuthError.EXPIRED_TOKEN)
                .reject("forged", AuthError.INVALID_TOKEN)
                .reject("db-down", AuthError.PROVIDER_UNAVAILABLE);
        meters = new SimpleMeterRegistry();
        authorizer = new Authorizer(authenticator,
                new DecisionEngine(RoleRegistry.of(TestPrincipalFactory.referenceRoles())),
                new AuthorizationMetrics(new MetricFactory(meters, "test")),
                SpanHelper.noop());
    }

    @Nested
    @DisplayName("allow and deny")
    class Verdicts {

        @Test
        @DisplayName("allowed outcome carries the principal")
        void allowed() {
            var outcome = authorizer.authorize("user-token", Requirement.permission("view_profile")).join();

            assertThat(outcome).isInstanceOf(AuthorizationOutcome.Allowed.class);
            assertThat(((AuthorizationOutcome.Allowed) outcome).principal().id()).isEqualTo("123");
            assertThat(outcome.state()).isEqualTo(AuthorizationState.ALLOWED);
        }

        @Test
        @DisplayName("missing role is denied")
        void deniedRole() {
            var outcome = authorizer.authorize("user-token", Requirement.role("admin")).join();

            assertThat(outcome).isSameAs(AuthorizationOutcome.denied());
            assertThat(outcome.error()).isEqualTo(AuthError.UNAUTHORIZED);
        }

        @Test
        @DisplayName("denial reveals nothing about the requirement")
        void denialHasNoDetail() {
            var outcome = authorizer.authorize("user-token", Requirement.permission("delete_user")).join();

            assertThat(outcome.toString()).doesNotContain("delete_user").doesNotContain("view_profile");
        }

        @Test
        @DisplayName("role requirement is met through role membership")
        void roleAllowed() {
            assertThat(authorizer.authorize("admin-token", Requirement.role("admin")).join().isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("authentication failures")
    class Failures {

        @Test
        @DisplayName("expired token is AuthFailed(EXPIRED_TOKEN), never Denied")
        void expiredToken() {
            var outcome = authorizer.authorize("stale", Requirement.role("admin")).join();

            assertThat(outcome).isEqualTo(AuthorizationOutcome.authFailed(AuthError.EXPIRED_TOKEN));
            assertThat(outcome.state()).isEqualTo(AuthorizationState.AUTH_FAILED);
        }

        @Test
        @DisplayName("invalid and unavailable errors propagate unchanged")
        void propagatesUnchanged() {
            assertThat(authorizer.authorize("forged", Requirement.permission("x")).join().error())
                    .isEqualTo(AuthError.INVALID_TOKEN);
            assertThat(authorizer.authorize("db-down", Requirement.permission("x")).join().error())
                    .isEqualTo(AuthError.PROVIDER_UNAVAILABLE);
        }

        @Test
        @DisplayName("missing token fails without calling the authenticator")
        void missingToken() {
            assertThat(authorizer.authorize(null, Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.INVALID_TOKEN);
            assertThat(authorizer.authorize("  ", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.INVALID_TOKEN);
            assertThat(authenticator.calls()).isZero();
        }

        @Test
        @DisplayName("unexpected authenticator exceptions map to PROVIDER_UNAVAILABLE")
        void unexpectedException() {
            var broken = new Authorizer(
                    token -> CompletableFuture.failedFuture(new IllegalStateException("pool exhausted")),
                    authorizer.decisions());

            assertThat(broken.authorize("t", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.PROVIDER_UNAVAILABLE);
        }

        @Test
        @DisplayName("synchronously thrown AuthException is still reported")
        void synchronousThrow() {
            var throwing = new Authorizer(
                    token -> {
                        throw AuthException.expiredToken("lapsed");
                    },
                    authorizer.decisions());

            assertThat(throwing.authorize("t", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.EXPIRED_TOKEN);
        }

        @Test
        @DisplayName("an authenticator reporting UNAUTHORIZED is treated as an invalid token")
        void authenticatorUnauthorized() {
            var confused = new Authorizer(
                    token -> CompletableFuture.failedFuture(AuthException.unauthorized()),
                    authorizer.decisions());

            assertThat(confused.authorize("t", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.INVALID_TOKEN);
        }

        @Test
        @DisplayName("an authenticator cancelling its own future yields AuthFailed(PROVIDER_UNAVAILABLE)")
        void authenticatorCancelsItself() {
            var cancelling = new Authorizer(token -> {
                CompletableFuture<Principal> future = new CompletableFuture<>();
                future.cancel(true);
                return future;
            }, authorizer.decisions());

            CompletableFuture<AuthorizationOutcome> outcome = cancelling.authorize("t", Requirement.role("admin"));

            assertThat(outcome).isDone().isNotCancelled();
            assertThat(outcome).isNotCompletedExceptionally();
            assertThat(outcome.join()).isEqualTo(AuthorizationOutcome.authFailed(AuthError.PROVIDER_UNAVAILABLE));
        }

        @Test
        @DisplayName("authenticateToken reports an authenticator returning no future as PROVIDER_UNAVAILABLE")
        void authenticateTokenWithNullFuture() {
            var silent = new Authorizer(token -> null, authorizer.decisions());

            CompletableFuture<Principal> principal = silent.authenticateToken("t");

            assertThatThrownBy(principal::join)
                    .isInstanceOf(CompletionException.class)
                    .cause()
                    .isInstanceOfSatisfying(AuthException.class,
                            e -> assertThat(e.error()).isEqualTo(AuthError.PROVIDER_UNAVAILABLE));
            assertThat(silent.authorize("t", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.PROVIDER_UNAVAILABLE);
        }

        @Test
        @DisplayName("authenticateToken wraps a thrown non-auth exception as PROVIDER_UNAVAILABLE")
        void authenticateTokenWithThrow() {
            var throwing = new Authorizer(token -> {
                throw new IllegalStateException("pool exhausted");
            }, authorizer.decisions());

            assertThatThrownBy(() -> throwing.authenticateToken("t").join())
                    .cause()
                    .isInstanceOfSatisfying(AuthException.class,
                            e -> assertThat(e.error()).isEqualTo(AuthError.PROVIDER_UNAVAILABLE))
                    .hasRootCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("a null principal maps to PROVIDER_UNAVAILABLE")
        void nullPrincipal() {
            var empty = new Authorizer(token -> CompletableFuture.completedFuture(null), authorizer.decisions());

            assertThat(empty.authorize("t", Requirement.role("admin")).join().error())
                    .isEqualTo(AuthError.PROVIDER_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("asynchronous authentication")
    class Async {

        @Test
        @DisplayName("decides once the authenticator completes")
        void decidesOnCompletion() {
            CompletableFuture<Principal> pending = authenticator.pending("slow");

            var outcome = authorizer.authorize("slow", Requirement.permission("view_profile"));
            assertThat(outcome).isNotDone();

            pending.complete(TestPrincipalFactory.referencePrincipal());
            assertThat(outcome.join().isAllowed()).isTrue();
        }

        @Test
        @DisplayName("cancelling the outcome cancels the pending authentication")
        void cancellationPropagates() {
            CompletableFuture<Principal> pending = authenticator.pending("slow");

            var outcome = authorizer.authorize("slow", Requirement.permission("view_profile"));
            outcome.cancel(true);

            assertThat(pending).isCancelled();
        }

        @Test
        @DisplayName("a late completion after cancellation changes nothing")
        void lateCompletionIgnored() {
            CompletableFuture<Principal> pending = new CompletableFuture<>();
            var outcome = new Authorizer(token -> pending, authorizer.decisions())
                    .authorize("slow", Requirement.role("admin"));

            outcome.cancel(true);
            pending.complete(Principal.of("1", "x").withRole("admin"));

            assertThat(outcome).isCancelled();
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("counts outcomes by state and error")
        void countsOutcomes() {
            authorizer.authorize("user-token", Requirement.permission("view_profile")).join();
            authorizer.authorize("user-token", Requirement.role("admin")).join();
            authorizer.authorize("stale", Requirement.role("admin")).join();

            assertThat(meters.get(AuthorizationMetrics.OUTCOMES).tag("outcome", "allowed").counter().count())
                    .isEqualTo(1.0);
            assertThat(meters.get(AuthorizationMetrics.OUTCOMES).tag("outcome", "denied")
                    .tag("error", "unauthorized").counter().count()).isEqualTo(1.0);
            assertThat(meters.get(AuthorizationMetrics.OUTCOMES).tag("outcome", "auth_failed")
                    .tag("error", "expired_token").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("times authentication calls")
        void timesAuthentication() {
            authorizer.authorize("user-token", Requirement.permission("view_profile")).join();

            assertThat(meters.get(AuthorizationMetrics.AUTHENTICATION_DURATION).timer().count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("rejects a null requirement")
    void rejectsNullRequirement() {
        assertThatThrownBy(() -> authorizer.authorize("user-token", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.rolegate.security;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Attaches one requirement to an operation by plain function composition.
 * <pre>{@code
 * ProtectedOperation<Report> deleteUser = Guard.requirePermission(authorizer, "delete_user")
 *         .protect(principal -> users.delete(principal, userId));
 *
 * deleteUser.invoke(token).join();
 * }</pre>
 * Failures surface as {@link AuthException}: the authenticator's error when the token is
 * rejected, {@link AuthError#UNAUTHORIZED} when the principal does not qualify. The wrapped
 * operation only runs after an allow verdict. Cancelling the invocation's future cancels the
 * authorization still in progress.
 */
public final class Guard {

    private final Authorizer authorizer;
    private final Requirement requirement;

    public Guard(Authorizer authorizer, Requirement requirement) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer must not be null");
        }
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        this.authorizer = authorizer;
        this.requirement = requirement;
    }

    public static Guard requireRole(Authorizer authorizer, String roleName) {
        return new Guard(authorizer, Requirement.role(roleName));
    }

    public static Guard requirePermission(Authorizer authorizer, String permissionName) {
        return new Guard(authorizer, Requirement.permission(permissionName));
    }

    /**
     * Wraps a synchronous operation.
     */
    public <T> ProtectedOperation<T> protect(Function<Principal, T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        return protectAsync(principal -> CompletableFuture.completedFuture(operation.apply(principal)));
    }

    /**
     * Wraps an operation that itself completes asynchronously.
     */
    public <T> ProtectedOperation<T> protectAsync(Function<Principal, CompletableFuture<T>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        return token -> {
            CompletableFuture<AuthorizationOutcome> outcome = authorizer.authorize(token, requirement);
            CompletableFuture<T> result = outcome.thenCompose(verdict -> {
                if (verdict instanceof AuthorizationOutcome.Allowed allowed) {
                    return operation.apply(allowed.principal());
                }
                return CompletableFuture.failedFuture(new AuthException(verdict.error()));
            });
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    outcome.cancel(true);
                }
            });
            return result;
        };
    }

    public Requirement requirement() {
        return requirement;
    }
}

package com.rolegate.security;

/**
 * Thrown when a static role declaration cannot be read or parsed.
 * <p>
 * Raised at startup, before any request traffic; the application should fail to start.
 */
public class RoleDeclarationException extends RuntimeException {

    public RoleDeclarationException(String message) {
        super(message);
    }

    public RoleDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}

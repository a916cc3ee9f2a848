package com.rolegate.security;

/**
 * States of one authorization attempt. {@link AuthorizationOutcome#state()} reports one of
 * the three terminal states.
 * <pre>
 * RECEIVED → AUTHENTICATING → AUTHENTICATED → DECIDING → ALLOWED | DENIED
 *                           ↘ AUTH_FAILED
 * </pre>
 */
public enum AuthorizationState {
    RECEIVED,
    AUTHENTICATING,
    AUTHENTICATED,
    DECIDING,
    ALLOWED,
    DENIED,
    AUTH_FAILED
}

package com.questrail.poolheat.api;

import java.util.Objects;

/**
 * The cloud refused the account credential.
 *
 * <p>Not retryable without user action. Hosts should surface it as a setup or
 * re-authentication failure.</p>
 */
public final class AuthenticationException extends HeatPumpException
{
    private final String reason;

    public AuthenticationException(String reason) {
        super("authentication failed: " + reason);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AuthenticationException(String reason, Throwable cause) {
        super("authentication failed: " + reason, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String reason() {
        return reason;
    }
}

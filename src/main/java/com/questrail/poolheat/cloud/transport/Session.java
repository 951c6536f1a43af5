package com.questrail.poolheat.cloud.transport;

import java.util.Objects;
import java.util.Optional;

/**
 * An authenticated session with the vendor cloud.
 *
 * <p>{@code expiresAtNanos} is on the engine's monotonic clock. Tokens never
 * appear in {@link #toString()}.</p>
 */
public record Session(String accessToken, Optional<String> refreshToken, long expiresAtNanos)
{
    public Session {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
        if (accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be blank");
        }
    }

    /**
     * True when the session expires within {@code marginNanos} of {@code nowNanos}.
     */
    public boolean expiresWithin(long nowNanos, long marginNanos) {
        return expiresAtNanos - nowNanos <= marginNanos;
    }

    @Override
    public String toString() {
        return "Session[token=***, refreshable=" + refreshToken.isPresent() + "]";
    }
}

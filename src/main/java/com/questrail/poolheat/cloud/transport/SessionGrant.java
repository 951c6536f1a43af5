package com.questrail.poolheat.cloud.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a login or refresh call. {@code validity} is empty when the cloud
 * does not say how long the token lasts.
 */
public record SessionGrant(String accessToken, Optional<String> refreshToken, Optional<Duration> validity)
{
    public SessionGrant {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
        Objects.requireNonNull(validity, "validity");
    }

    public static SessionGrant of(String accessToken) {
        return new SessionGrant(accessToken, Optional.empty(), Optional.empty());
    }

    @Override
    public String toString() {
        return "SessionGrant[token=***, refreshable=" + refreshToken.isPresent() + ", validity=" + validity + "]";
    }
}

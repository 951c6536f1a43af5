package com.questrail.poolheat.cloud.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SyncTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing of the synchronization engine.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>pollInterval</b>: spacing of regular poll cycles.</li>
 *   <li><b>discoveryInterval</b>: how often a poll cycle also re-lists the
 *       account's devices to pick up additions. The first cycle always lists.</li>
 *   <li><b>commandTimeout</b>: how long a command may stay pending, measured
 *       from issue, before it expires. Should be a small multiple of
 *       {@code pollInterval}.</li>
 *   <li><b>confirmationPollDelay</b>: delay between the cloud accepting a
 *       command and the expedited poll that looks for corroboration.</li>
 *   <li><b>sessionSafetyMargin</b>: a cached session closer than this to its
 *       expiry is renewed before use.</li>
 *   <li><b>sessionLifetime</b>: assumed lifetime of a session when the cloud
 *       does not state one.</li>
 *   <li><b>authWaitTimeout</b>: upper bound a caller waits for a login or
 *       refresh performed by another thread.</li>
 * </ul>
 */
public record SyncTimingPolicy(
        Duration pollInterval,
        Duration discoveryInterval,
        Duration commandTimeout,
        Duration confirmationPollDelay,
        Duration sessionSafetyMargin,
        Duration sessionLifetime,
        Duration authWaitTimeout
) {
    public SyncTimingPolicy {
        requirePositive(pollInterval, "pollInterval");
        requirePositive(discoveryInterval, "discoveryInterval");
        requirePositive(commandTimeout, "commandTimeout");
        requireNonNegative(confirmationPollDelay, "confirmationPollDelay");
        requireNonNegative(sessionSafetyMargin, "sessionSafetyMargin");
        requirePositive(sessionLifetime, "sessionLifetime");
        requirePositive(authWaitTimeout, "authWaitTimeout");

        if (sessionSafetyMargin.compareTo(sessionLifetime) >= 0) {
            throw new IllegalArgumentException("sessionSafetyMargin must be shorter than sessionLifetime");
        }
    }

    /**
     * Defaults for the Fairland cloud:
     * <ul>
     *   <li>pollInterval: 30s</li>
     *   <li>discoveryInterval: 10min</li>
     *   <li>commandTimeout: 90s (three poll intervals)</li>
     *   <li>confirmationPollDelay: 5s</li>
     *   <li>sessionSafetyMargin: 60s</li>
     *   <li>sessionLifetime: 12h</li>
     *   <li>authWaitTimeout: 30s</li>
     * </ul>
     */
    public static SyncTimingPolicy defaults() {
        return withPollInterval(Duration.ofSeconds(30));
    }

    /**
     * Defaults scaled to a given poll interval; the command timeout follows at
     * three intervals.
     */
    public static SyncTimingPolicy withPollInterval(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        return new SyncTimingPolicy(
                pollInterval,
                Duration.ofMinutes(10),
                pollInterval.multipliedBy(3),
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                Duration.ofHours(12),
                Duration.ofSeconds(30)
        );
    }

    public SyncTimingPolicy withCommandTimeout(Duration timeout) {
        return new SyncTimingPolicy(pollInterval, discoveryInterval, timeout, confirmationPollDelay,
                sessionSafetyMargin, sessionLifetime, authWaitTimeout);
    }

    public SyncTimingPolicy withConfirmationPollDelay(Duration delay) {
        return new SyncTimingPolicy(pollInterval, discoveryInterval, commandTimeout, delay,
                sessionSafetyMargin, sessionLifetime, authWaitTimeout);
    }

    public SyncTimingPolicy withDiscoveryInterval(Duration interval) {
        return new SyncTimingPolicy(pollInterval, interval, commandTimeout, confirmationPollDelay,
                sessionSafetyMargin, sessionLifetime, authWaitTimeout);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}

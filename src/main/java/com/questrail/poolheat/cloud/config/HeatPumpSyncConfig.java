package com.questrail.poolheat.cloud.config;

import java.util.Objects;

/**
 * Aggregated configuration of the synchronization engine, as supplied by the
 * host's configuration layer.
 */
public record HeatPumpSyncConfig(
        Credential credential,
        SyncTimingPolicy timingPolicy,
        CommandRetryPolicy retryPolicy,
        int unavailableAfterFailedCycles
) {
    public HeatPumpSyncConfig {
        Objects.requireNonNull(credential, "credential");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (unavailableAfterFailedCycles < 1) {
            throw new IllegalArgumentException("unavailableAfterFailedCycles must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Credential credential;
        private SyncTimingPolicy timingPolicy = SyncTimingPolicy.defaults();
        private CommandRetryPolicy retryPolicy = CommandRetryPolicy.defaults();
        private int unavailableAfterFailedCycles = 3;

        public Builder withCredential(Credential credential) {
            this.credential = credential;
            return this;
        }

        public Builder withCredential(String account, String secret) {
            return withCredential(new Credential(account, secret));
        }

        public Builder withTimingPolicy(SyncTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withRetryPolicy(CommandRetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withUnavailableAfterFailedCycles(int cycles) {
            this.unavailableAfterFailedCycles = cycles;
            return this;
        }

        public HeatPumpSyncConfig build() {
            return new HeatPumpSyncConfig(credential, timingPolicy, retryPolicy, unavailableAfterFailedCycles);
        }
    }
}

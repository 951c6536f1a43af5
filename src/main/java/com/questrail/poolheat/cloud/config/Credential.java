package com.questrail.poolheat.cloud.config;

import java.util.Objects;

/**
 * Account credential supplied once at setup. The secret never appears in
 * {@link #toString()}.
 */
public record Credential(String account, String secret)
{
    public Credential {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(secret, "secret");
        if (account.isBlank()) {
            throw new IllegalArgumentException("account must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Credential[account=" + account + ", secret=***]";
    }
}

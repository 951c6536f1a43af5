package com.questrail.poolheat.api;

/**
 * Why a command ended without confirmed success.
 */
public enum FailureReason
{
    /** Retryable transport failures outlasted the retry budget. */
    TRANSPORT_EXHAUSTED,

    /** The cloud rejected the request in a way retries cannot fix. */
    FATAL_TRANSPORT,

    /** Credentials were refused while sending. */
    AUTHENTICATION,

    /** The cloud accepted the command but polling never showed the value. */
    TIMEOUT,

    /** A later command for the same field replaced this one. */
    SUPERSEDED,

    /** The controller shut down while the command was pending. */
    SHUTDOWN
}

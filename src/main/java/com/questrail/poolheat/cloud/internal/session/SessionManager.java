package com.questrail.poolheat.cloud.internal.session;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.Credential;
import com.questrail.poolheat.cloud.config.SyncTimingPolicy;
import com.questrail.poolheat.cloud.internal.time.MonotonicClock;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.SessionEvent;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;
import com.questrail.poolheat.cloud.transport.CloudTransport;
import com.questrail.poolheat.cloud.transport.Session;
import com.questrail.poolheat.cloud.transport.SessionGrant;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SessionManager
 * -----------------------------------------------------------------------------
 * Holds the single cloud session shared by polling and command dispatch.
 *
 * <h2>Single flight</h2>
 * At most one login or refresh is in progress at any time. The first caller
 * that finds the session missing or about to expire performs the network call
 * outside the lock; every concurrent caller waits, bounded by
 * {@code authWaitTimeout}, for the same result.
 *
 * <h2>Expiry</h2>
 * Expiry is tracked on the monotonic clock. A session within
 * {@code sessionSafetyMargin} of expiry is renewed before use. When the cloud
 * states no lifetime, {@code sessionLifetime} is assumed.
 *
 * <h2>Failure</h2>
 * An {@link AuthenticationException} clears the session and is rethrown to
 * every waiter. Each distinct failure reason is reported to the sink once.
 */
public final class SessionManager
{
    private final CloudTransport transport;
    private final Credential credential;
    private final SyncTimingPolicy timing;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    private final Object lock = new Object();

    // guarded by lock
    private Session current;
    private CompletableFuture<Session> inFlight;
    private String lastReportedFailure;

    private volatile boolean authFailed;

    public SessionManager(CloudTransport transport,
                          Credential credential,
                          SyncTimingPolicy timing,
                          MonotonicClock clock,
                          WallClock wallClock,
                          SyncObservabilitySink sink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.credential = Objects.requireNonNull(credential, "credential");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Returns a session valid for at least the safety margin, logging in or
     * refreshing if necessary.
     *
     * @throws AuthenticationException if the cloud rejects the credential
     * @throws TransportException      if the login call fails or the wait times out
     */
    public Session currentSession() {
        CompletableFuture<Session> flight;
        Session stale;
        boolean leader = false;

        synchronized (lock) {
            if (current != null && !current.expiresWithin(clock.nowNanos(), timing.sessionSafetyMargin().toNanos())) {
                return current;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            flight = inFlight;
            stale = current;
        }

        if (leader) {
            renew(flight, stale);
        }
        return awaitSession(flight);
    }

    /**
     * Drops the cached session unconditionally.
     */
    public void invalidate() {
        synchronized (lock) {
            current = null;
        }
        sink.onAuthEvent(new SessionEvent(wallClock.now(), SessionEvent.Kind.INVALIDATED, "session dropped"));
    }

    /**
     * Drops the cached session only if it is still {@code rejected}. A caller
     * holding an old session must not discard one another thread just obtained.
     */
    public void invalidate(Session rejected) {
        Objects.requireNonNull(rejected, "rejected");
        boolean dropped;
        synchronized (lock) {
            dropped = current == rejected;
            if (dropped) {
                current = null;
            }
        }
        if (dropped) {
            sink.onAuthEvent(new SessionEvent(wallClock.now(), SessionEvent.Kind.INVALIDATED, "session rejected by cloud"));
        }
    }

    /**
     * True after the most recent login attempt was rejected, until one succeeds.
     */
    public boolean isAuthFailed() {
        return authFailed;
    }

    /**
     * Callers currently blocked on an in-flight login or refresh.
     */
    int awaitingCallers() {
        synchronized (lock) {
            return inFlight == null ? 0 : inFlight.getNumberOfDependents();
        }
    }

    private void renew(CompletableFuture<Session> flight, Session stale) {
        try {
            boolean refreshing = stale != null && stale.refreshToken().isPresent();
            SessionGrant grant = refreshing ? refreshOrLogin(stale) : transport.login(credential);
            Session session = toSession(grant);

            synchronized (lock) {
                current = session;
                inFlight = null;
                lastReportedFailure = null;
            }
            authFailed = false;
            sink.onAuthEvent(new SessionEvent(wallClock.now(),
                    refreshing ? SessionEvent.Kind.REFRESHED : SessionEvent.Kind.LOGGED_IN,
                    "account " + credential.account()));
            flight.complete(session);
        } catch (AuthenticationException e) {
            boolean report;
            synchronized (lock) {
                current = null;
                inFlight = null;
                report = !e.reason().equals(lastReportedFailure);
                lastReportedFailure = e.reason();
            }
            authFailed = true;
            if (report) {
                sink.onAuthEvent(new SessionEvent(wallClock.now(), SessionEvent.Kind.AUTH_FAILED, e.reason()));
            }
            flight.completeExceptionally(e);
        } catch (RuntimeException e) {
            synchronized (lock) {
                inFlight = null;
            }
            flight.completeExceptionally(e);
        }
    }

    private SessionGrant refreshOrLogin(Session stale) {
        try {
            return transport.refresh(stale);
        } catch (AuthenticationException e) {
            return transport.login(credential);
        }
    }

    private Session toSession(SessionGrant grant) {
        long lifetime = grant.validity().orElse(timing.sessionLifetime()).toNanos();
        return new Session(grant.accessToken(), grant.refreshToken(), clock.nowNanos() + lifetime);
    }

    private Session awaitSession(CompletableFuture<Session> flight) {
        try {
            return flight.get(timing.authWaitTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw TransportException.retryable("timed out waiting for cloud session", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.retryable("interrupted waiting for cloud session", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw TransportException.fatal("session acquisition failed", cause);
        }
    }
}

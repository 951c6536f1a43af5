/**
 * Background work of the engine: the {@link com.questrail.poolheat.cloud.internal.exec.Poller}
 * and the {@link com.questrail.poolheat.cloud.internal.exec.CommandDispatcher}.
 *
 * <p>Both run network calls on executors handed in by the runtime and use the
 * {@link com.questrail.poolheat.cloud.internal.time.MonotonicScheduler} only
 * for timers. Neither holds a lock across a network call.</p>
 */
package com.questrail.poolheat.cloud.internal.exec;

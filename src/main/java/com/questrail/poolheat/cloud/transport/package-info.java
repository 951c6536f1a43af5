/**
 * Cloud Transport Port
 * =============================================================================
 *
 * Defines the <em>vendor-agnostic boundary</em> between the synchronization
 * engine and a concrete cloud API (the Fairland binding, a simulator, or a test
 * double).
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>{@link com.questrail.poolheat.cloud.transport.Session} values, never raw credentials on the wire</li>
 *   <li>{@link com.questrail.poolheat.api.Device} and
 *       {@link com.questrail.poolheat.cloud.transport.DeviceSnapshot} values</li>
 *   <li>The error taxonomy: authentication, session rejection, retryable and
 *       fatal transport failures</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of {@link com.questrail.poolheat.cloud.transport.CloudTransport} MUST:
 * <ul>
 *   <li>Perform one request/response per call</li>
 *   <li>Hold no session or device state</li>
 *   <li>Not retry, poll, or schedule anything</li>
 * </ul>
 *
 * <p>Session renewal, retries and polling live in the engine.</p>
 */
package com.questrail.poolheat.cloud.transport;

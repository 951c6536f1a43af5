/**
 * Fairland IoT Cloud Binding
 * =============================================================================
 *
 * <p>Implements the cloud transport port against the Fairland REST API
 * ({@code https://api-eu.fairlandiot.com}): JSON over HTTPS POST, a
 * {@code {code, msg, data}} envelope, and data points addressed by numeric id.</p>
 *
 * <pre>
 *   CloudTransport call
 *        → FairlandCloudTransport   (endpoint choice, headers, batching)
 *            → FairlandJsonCodec    (request bodies, envelope, data points)
 *                → HttpExchange     (one HTTP POST; Netty in production)
 * </pre>
 *
 * <p>Netty types stay inside the {@code netty} sub-package.</p>
 */
package com.questrail.poolheat.cloud.transport.fairland;

package com.questrail.poolheat.cloud.transport.fairland;

import com.questrail.poolheat.api.TransportException;

import java.net.URI;
import java.util.Map;

/**
 * HttpExchange
 * =============================================================================
 * Blocking HTTP port used by {@link FairlandCloudTransport}.
 *
 * <p>Implementations perform exactly one request per call and never retry.
 * Connection failures and timeouts are raised as retryable
 * {@link TransportException}s; any response, whatever its status, is returned
 * as an {@link HttpReply}.</p>
 */
public interface HttpExchange extends AutoCloseable
{
    HttpReply post(URI uri, Map<String, String> headers, byte[] body);

    @Override
    void close();
}

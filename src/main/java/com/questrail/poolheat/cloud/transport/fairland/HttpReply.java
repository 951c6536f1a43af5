package com.questrail.poolheat.cloud.transport.fairland;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Status and body of one HTTP response.
 */
public record HttpReply(int status, byte[] body)
{
    public HttpReply {
        Objects.requireNonNull(body, "body");
    }

    public static HttpReply ok(String json) {
        return new HttpReply(200, json.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}

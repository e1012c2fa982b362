package com.questrail.traitstream.transport;

import com.questrail.traitstream.observe.ObserveRequest;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One streaming POST: endpoint, headers in send order, and body.
 */
public record StreamRequest(URI endpoint, Map<String, String> headers, byte[] body)
{
    public static final String PROTOBUF_CONTENT_TYPE = "application/x-protobuf";
    public static final String DEFAULT_USER_AGENT = "traitstream/0.1 (Java)";

    public StreamRequest {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(body, "body");
        String scheme = endpoint.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("endpoint must be http or https: " + endpoint);
        }
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /**
     * The observe request with the header set the stream endpoint expects.
     */
    public static StreamRequest observe(URI endpoint, String accessToken, ObserveRequest observe) {
        return observe(endpoint, accessToken, observe, DEFAULT_USER_AGENT);
    }

    public static StreamRequest observe(URI endpoint, String accessToken, ObserveRequest observe, String userAgent) {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(observe, "observe");
        Objects.requireNonNull(userAgent, "userAgent");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Basic " + accessToken);
        headers.put("Content-Type", PROTOBUF_CONTENT_TYPE);
        headers.put("Accept", PROTOBUF_CONTENT_TYPE);
        headers.put("User-Agent", userAgent);
        headers.put("X-Accept-Response-Streaming", "true");
        headers.put("X-Accept-Content-Transfer-Encoding", "binary");
        return new StreamRequest(endpoint, headers, observe.toByteArray());
    }

    @Override
    public String toString() {
        // Headers are left out: they carry the access token.
        return "StreamRequest[endpoint=" + endpoint + ", bodyLength=" + body.length + ']';
    }
}

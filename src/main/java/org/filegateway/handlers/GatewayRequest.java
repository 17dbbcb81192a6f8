package org.filegateway.handlers;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Immutable view of one aggregated HTTP request. The body is copied so the
 * view outlives the Netty buffer.
 */
public class GatewayRequest {

    private static final String BEARER_PREFIX = "Bearer ";

    private final HttpMethod method;
    private final String path;
    private final Map<String, List<String>> parameters;
    private final HttpHeaders headers;
    private final byte[] body;

    public GatewayRequest(HttpMethod method, String uri, HttpHeaders headers, byte[] body) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        this.method = method;
        this.path = decoder.path();
        this.parameters = decoder.parameters();
        this.headers = headers;
        this.body = body != null ? body : new byte[0];
    }

    public static GatewayRequest from(FullHttpRequest req) {
        return new GatewayRequest(req.method(), req.uri(), req.headers().copy(), ByteBufUtil.getBytes(req.content()));
    }

    public HttpMethod method() {
        return method;
    }

    /**
     * Decoded path without the query string
     */
    public String path() {
        return path;
    }

    /**
     * First value of a query parameter, or null
     */
    public String param(String name) {
        List<String> values = parameters.getOrDefault(name, Collections.emptyList());
        return values.isEmpty() ? null : values.get(0);
    }

    public String param(String name, String defaultValue) {
        String value = param(name);
        return value != null ? value : defaultValue;
    }

    public String contentType() {
        return headers.get(HttpHeaderNames.CONTENT_TYPE);
    }

    /**
     * Token from an {@code Authorization: Bearer} header, or null
     */
    public String bearerToken() {
        String authHeader = headers.get(HttpHeaderNames.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    public byte[] body() {
        return body;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}

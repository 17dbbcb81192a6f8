package org.filegateway.handlers;

import static io.netty.handler.codec.http.HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS;
import static io.netty.handler.codec.http.HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS;
import static io.netty.handler.codec.http.HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_DISPOSITION;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpHeaderNames.WWW_AUTHENTICATE;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpChunkedInput;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.stream.ChunkedFile;
import io.netty.util.CharsetUtil;
import org.filegateway.managers.SessionStore;
import org.filegateway.utils.GatewayLogger;
import org.filegateway.utils.MimeTypes;
import org.json.JSONObject;

/**
 * Routes aggregated HTTP requests to the gateway operations.
 *
 * <p>Order per request: decoder failure check, CORS preflight, exact route
 * lookup, bearer token check for protected routes, method check, then the
 * operation. Whatever escapes an operation becomes a 500 JSON answer; the
 * connection and the listener carry on.
 */
public class FileGatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final String TAG = "HTTP";
    private static final int CHUNK_SIZE = 8192;

    private final RouteTable routes;
    private final SessionStore sessions;

    public FileGatewayHandler(RouteTable routes, SessionStore sessions) {
        this.routes = routes;
        this.sessions = sessions;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        if (req.decoderResult().isFailure()) {
            GatewayLogger.warn(TAG, "Malformed request from " + ctx.channel().remoteAddress() + ": "
                + req.decoderResult().cause());
            sendResult(ctx, req, null, OperationResult.badRequest("Bad request"));
            return;
        }

        if (HttpMethod.OPTIONS.equals(req.method())) {
            handlePreflight(ctx, req);
            return;
        }

        GatewayRequest request = GatewayRequest.from(req);
        Route route = Route.lookup(request.path());
        OperationResult result;

        if (route == null) {
            result = OperationResult.notFound("Not found");
        } else if (route.requiresAuth() && sessions.validate(request.bearerToken()) == null) {
            result = OperationResult.unauthorized();
        } else if (!route.method().equals(request.method())) {
            result = OperationResult.failure(Outcome.METHOD_NOT_ALLOWED, "Only " + route.method() + " allowed");
        } else {
            result = dispatch(route, request);
        }

        sendResult(ctx, req, route, result);
    }

    private OperationResult dispatch(Route route, GatewayRequest request) {
        try {
            return routes.handlerFor(route).handle(request);
        } catch (RuntimeException e) {
            GatewayLogger.error(TAG, "Error on " + route.path() + " (path=" + request.param("path") + "): " + e);
            return OperationResult.internal("Internal server error");
        }
    }

    private void handlePreflight(ChannelHandlerContext ctx, FullHttpRequest req) {
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        resp.headers().set(ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        resp.headers().set(ACCESS_CONTROL_ALLOW_METHODS, "POST, GET, OPTIONS, DELETE");
        resp.headers().set(ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization");
        resp.headers().setInt(CONTENT_LENGTH, 0);
        sendHttpResponse(ctx, req, resp);
    }

    private void sendResult(ChannelHandlerContext ctx, FullHttpRequest req, Route route, OperationResult result) {
        HttpResponseStatus status = statusOf(result.getOutcome());

        if (result.getFile() != null) {
            sendFile(ctx, req, result.getFile());
            return;
        }

        FullHttpResponse resp;
        if (result.getHtml() != null) {
            resp = textResponse(status, result.getHtml(), "text/html; charset=UTF-8");
        } else {
            resp = jsonResponse(status, result.getJson());
        }
        if (status == HttpResponseStatus.UNAUTHORIZED && route != null && route.requiresAuth()) {
            resp.headers().set(WWW_AUTHENTICATE, "Bearer");
        }
        sendHttpResponse(ctx, req, resp);
    }

    private void sendFile(ChannelHandlerContext ctx, FullHttpRequest req, Path file) {
        RandomAccessFile raf = null;
        ChunkedFile chunks;
        long length;
        try {
            raf = new RandomAccessFile(file.toFile(), "r");
            length = raf.length();
            chunks = chunkedFile(raf, length);
        } catch (IOException e) {
            closeQuietly(raf);
            GatewayLogger.error(TAG, "Download error for " + file + ": " + e.getMessage());
            sendHttpResponse(ctx, req, jsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                OperationResult.internal(e.getMessage()).getJson()));
            return;
        }

        String fileName = file.getFileName().toString();
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        resp.headers().set(CONTENT_TYPE, MimeTypes.forFileName(fileName));
        resp.headers().set(CONTENT_DISPOSITION, "attachment; filename=\"" + fileName.replace("\"", "") + "\"");
        resp.headers().set(ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        resp.headers().set(CONTENT_LENGTH, length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(resp, keepAlive);
        ctx.write(resp);
        ChannelFuture f = ctx.writeAndFlush(new HttpChunkedInput(chunks));
        if (!keepAlive) {
            f.addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * Wraps the open file for streaming. The file is closed if it cannot
     * be wrapped.
     */
    static ChunkedFile chunkedFile(RandomAccessFile raf, long length) throws IOException {
        try {
            return new ChunkedFile(raf, 0, length, CHUNK_SIZE);
        } catch (IOException | IllegalArgumentException e) {
            closeQuietly(raf);
            throw e;
        }
    }

    private static void closeQuietly(RandomAccessFile raf) {
        if (raf == null) {
            return;
        }
        try {
            raf.close();
        } catch (IOException e) {
            GatewayLogger.warn(TAG, "Failed to close download file: " + e.getMessage());
        }
    }

    static HttpResponseStatus statusOf(Outcome outcome) {
        switch (outcome) {
            case OK:
                return HttpResponseStatus.OK;
            case BAD_REQUEST:
                return HttpResponseStatus.BAD_REQUEST;
            case UNAUTHORIZED:
                return HttpResponseStatus.UNAUTHORIZED;
            case NOT_FOUND:
                return HttpResponseStatus.NOT_FOUND;
            case METHOD_NOT_ALLOWED:
                return HttpResponseStatus.METHOD_NOT_ALLOWED;
            case CONFLICT:
                return HttpResponseStatus.CONFLICT;
            case PAYLOAD_TOO_LARGE:
                return HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE;
            default:
                return HttpResponseStatus.INTERNAL_SERVER_ERROR;
        }
    }

    static FullHttpResponse jsonResponse(HttpResponseStatus status, JSONObject json) {
        return textResponse(status, json.toString(), "application/json; charset=UTF-8");
    }

    private static FullHttpResponse textResponse(HttpResponseStatus status, String text, String contentType) {
        ByteBuf content = Unpooled.copiedBuffer(text, CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        resp.headers().set(CONTENT_TYPE, contentType);
        resp.headers().setInt(CONTENT_LENGTH, content.readableBytes());
        resp.headers().set(ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        return resp;
    }

    private void sendHttpResponse(ChannelHandlerContext ctx, FullHttpRequest req, FullHttpResponse res) {
        boolean keepAlive = HttpUtil.isKeepAlive(req) && res.status().code() == 200;
        HttpUtil.setKeepAlive(res, keepAlive);
        ChannelFuture f = ctx.writeAndFlush(res);
        if (!keepAlive) {
            f.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        GatewayLogger.error(TAG, "Connection error from " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
        ctx.close();
    }
}

package org.filegateway.handlers;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMessage;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpUtil;
import org.filegateway.utils.GatewayLogger;

/**
 * Aggregates request bodies up to the upload limit. A larger request is
 * answered with a 413 JSON body carrying the CORS header, and the
 * connection is closed.
 */
public class GatewayObjectAggregator extends HttpObjectAggregator {

    public GatewayObjectAggregator(int maxContentLength) {
        super(maxContentLength);
    }

    @Override
    protected void handleOversizedMessage(ChannelHandlerContext ctx, HttpMessage oversized) {
        GatewayLogger.warn("HTTP", "Request from " + ctx.channel().remoteAddress() + " exceeds "
            + maxContentLength() + " bytes");

        OperationResult result = OperationResult.failure(Outcome.PAYLOAD_TOO_LARGE, "File too large");
        FullHttpResponse resp = FileGatewayHandler.jsonResponse(
            FileGatewayHandler.statusOf(result.getOutcome()), result.getJson());
        HttpUtil.setKeepAlive(resp, false);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}

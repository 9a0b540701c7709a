package org.muma.respkv.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.respkv.command.CommandRouter;
import org.muma.respkv.command.RequestException;
import org.muma.respkv.protocol.ErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个连接的处理器：读 -> 路由 -> 写回 -> 继续读，直到对端关闭。
 * <p>
 * 每次读到的字节切片原样交给路由，不跨读缓冲：没有以完整 CRLF 结尾的切片被当作非法请求，
 * 而不是等待后续数据补齐。请求非法时直接关闭连接，不做重新同步。
 */
public class RedisConnectionHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(RedisConnectionHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandRouter router;
    private final boolean errorReplies;

    public RedisConnectionHandler(CommandRouter router, boolean errorReplies) {
        this.router = router;
        this.errorReplies = errorReplies;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        byte[] response;
        try {
            response = router.handleRequest(msg);
        } catch (RequestException e) {
            rejectRequest(ctx, e);
            return;
        }
        if (response.length > 0) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(response));
        }
    }

    private void rejectRequest(ChannelHandlerContext ctx, RequestException e) {
        log.warn("Malformed request from {} ({}): {}", ctx.channel().remoteAddress(), e.getError(), e.getMessage());
        if (errorReplies) {
            ctx.writeAndFlush(new ErrorMessage("ERR " + toSingleLine(e.getMessage()))).addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.close();
        }
    }

    // 错误信息可能带有客户端发来的原始字节，Simple Error 里不能出现 CR/LF
    static String toSingleLine(String message) {
        if (message == null) {
            return "";
        }
        return message.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            log.warn("I/O error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}

package org.muma.respkv.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 接入控制，挂在 ServerChannel 的 pipeline 上 (ServerBootstrapAcceptor 之前)。
 * <p>
 * 每个新接入的子 Channel 必须先拿到一个名额才会被注册到 worker 线程池；
 * 拿不到 (超时或名额池已关闭) 就直接丢弃这个 socket，不给客户端任何回复。
 * 名额在子 Channel 关闭时归还。
 * <p>
 * 等待名额会阻塞 accept 线程：名额耗尽时新连接在 backlog 里短暂排队。
 */
@ChannelHandler.Sharable
public class AdmissionController extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final ConnectionPermits permits;
    private final long permitTimeoutMillis;

    public AdmissionController(ConnectionPermits permits, long permitTimeoutMillis) {
        this.permits = permits;
        this.permitTimeoutMillis = permitTimeoutMillis;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        Channel child = (Channel) msg;
        try {
            permits.acquire(permitTimeoutMillis);
        } catch (AdmissionException e) {
            log.warn("Dropping connection from {}: {}", child.remoteAddress(), e.getMessage());
            child.unsafe().closeForcibly();
            return;
        }

        child.closeFuture().addListener(future -> {
            permits.release();
            log.debug("Connection permit released, {} available", permits.available());
        });
        ctx.fireChannelRead(child);
    }
}

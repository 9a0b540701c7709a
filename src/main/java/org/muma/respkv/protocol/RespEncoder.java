package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * RESP 编码器
 * <p>
 * 作为 Netty Handler 时负责把直接写出的 {@link RedisMessage} (例如错误回复) 编码；
 * 静态方法供路由层把多条回复拼接到同一个缓冲区。
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        writeTo(out, msg);
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer();
        try {
            writeTo(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    // 递归写入，数组元素按相同规则编码
    public static void writeTo(ByteBuf out, RedisMessage msg) {
        // 类型标识字节
        out.writeByte(msg.type().tag());
        if (msg instanceof SimpleString s) {
            out.writeBytes(s.toBytes(s.content()));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeBytes(e.toBytes(e.content()));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeBytes(String.valueOf(i.value()).getBytes(StandardCharsets.US_ASCII));
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                out.writeBytes(String.valueOf(b.content().length).getBytes(StandardCharsets.US_ASCII));
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            if (a.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                out.writeBytes(String.valueOf(a.elements().length).getBytes(StandardCharsets.US_ASCII));
                out.writeBytes(CRLF);
                for (RedisMessage element : a.elements()) {
                    writeTo(out, element);
                }
            }
        }
    }
}

package org.muma.respkv.command;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.respkv.command.impl.EchoCommand;
import org.muma.respkv.command.impl.GetCommand;
import org.muma.respkv.command.impl.PingCommand;
import org.muma.respkv.command.impl.SetCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.protocol.RespException;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令路由
 * <p>
 * 一次读到的字节切片 = 一个请求。请求是 BulkString 组成的数组，可以把多条命令直接拼在同一个数组里
 * (流水线)，路由按位置从左到右识别命令，依次执行，回复按命令顺序拼接到同一个输出缓冲区。
 * 不认识的单词直接跳过，不产生回复。
 */
public class CommandRouter {

    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final long SLOW_REQUEST_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final RespDecoder decoder = new RespDecoder();
    private final RedisContext context;

    public CommandRouter(StorageEngine storage) {
        this(storage, Clock.systemUTC());
    }

    public CommandRouter(StorageEngine storage, Clock clock) {
        this.context = new RedisContext(storage, clock);
        this.initCommandRegistry();
    }

    private void initCommandRegistry() {
        register(new PingCommand());
        register(new EchoCommand());
        register(new GetCommand());
        register(new SetCommand());

        log.info("CommandRouter initialized. Total commands registered: {}", commandMap.size());
    }

    private void register(RedisCommand command) {
        commandMap.put(command.name(), command);
    }

    /**
     * 命令名大小写不敏感
     */
    public boolean isCommand(String word) {
        return commandMap.containsKey(word.toUpperCase(Locale.ROOT));
    }

    public byte[] handleRequest(byte[] request) {
        return handleRequest(Unpooled.wrappedBuffer(request));
    }

    /**
     * 处理一次读到的完整请求，返回拼接后的全部回复。
     * 不修改 request 的读写下标，也不释放它。
     *
     * @throws RequestException 请求格式或参数不合法，调用方应中止该连接
     */
    public byte[] handleRequest(ByteBuf request) {
        long startTime = System.nanoTime();
        validateFrame(request);

        ByteBuf out = Unpooled.buffer();
        try {
            int offset = request.readerIndex();
            int commands = 0;
            // 一次读可能带来多个背靠背的顶层数组，逐个解码直到切片用完
            while (offset < request.writerIndex()) {
                RespDecoder.Decoded decoded = decode(request, offset);
                offset += decoded.consumed();
                commands += dispatch(toWords(decoded.message().data()), out);
            }

            long duration = (System.nanoTime() - startTime) / 1_000_000; // ms
            if (duration > SLOW_REQUEST_MILLIS) {
                log.warn("Slow request detected: {} commands cost {}ms", commands, duration);
            }
            return ByteBufUtil.getBytes(out);
        } finally {
            out.release();
        }
    }

    // 解码前的廉价检查：长度至少 2，且以 CRLF 结尾
    private void validateFrame(ByteBuf request) {
        int length = request.readableBytes();
        if (length < 2) {
            throw new RequestException(RequestError.INPUT_TOO_SHORT, "Input too short: " + length + " bytes");
        }
        int end = request.writerIndex();
        if (request.getByte(end - 2) != CR || request.getByte(end - 1) != LF) {
            throw new RequestException(RequestError.CRLF_NOT_AT_END, "CRLF (\\r\\n) characters not present at end");
        }
    }

    private RespDecoder.Decoded decode(ByteBuf request, int offset) {
        try {
            return decoder.decode(request, offset);
        } catch (RespException e) {
            throw new RequestException(RequestError.PROTOCOL, e.getMessage(), e);
        }
    }

    // 请求必须是非空数组，且每个元素都是非 null 的 BulkString
    private String[] toWords(RedisMessage message) {
        if (!(message instanceof RedisArray array)) {
            throw new RequestException(RequestError.NOT_ARRAY, "Command is not Array: " + message.type());
        }
        if (array.isNull()) {
            throw new RequestException(RequestError.NULL_ARRAY, "Null Array");
        }
        RedisMessage[] elements = array.elements();
        if (elements.length == 0) {
            throw new RequestException(RequestError.EMPTY_ARRAY, "Empty Array");
        }

        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String[] words = new String[elements.length];
        for (int i = 0; i < elements.length; i++) {
            if (!(elements[i] instanceof BulkString bulk) || bulk.isNull()) {
                throw new RequestException(RequestError.NOT_ALL_BULK, "Not all words are Bulk Strings");
            }
            try {
                words[i] = utf8.decode(ByteBuffer.wrap(bulk.content())).toString();
            } catch (CharacterCodingException e) {
                throw new RequestException(RequestError.INVALID_UTF8, "Word " + i + " is not valid UTF-8", e);
            }
        }
        return words;
    }

    /**
     * 核心分发逻辑
     *
     * @return 执行的命令条数
     */
    private int dispatch(String[] words, ByteBuf out) {
        RequestCursor cursor = new RequestCursor(words, this::isCommand);
        int executed = 0;
        while (cursor.hasNext()) {
            String word = cursor.next();
            RedisCommand command = commandMap.get(word.toUpperCase(Locale.ROOT));
            if (command == null) {
                log.debug("Skipping unrecognized word: {}", word);
                continue;
            }
            if (log.isDebugEnabled()) {
                log.debug("Execute Command: {} at word {}", command.name(), cursor.position() - 1);
            }
            RespEncoder.writeTo(out, command.execute(cursor, context));
            executed++;
        }
        return executed;
    }
}

package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 无状态：对一段完整的字节切片做一次性解析，不跨读缓冲。
 * 所有读取都基于绝对下标并做边界检查，不会移动 ByteBuf 的 readerIndex。
 * 解析结果附带消耗的字节数，数组元素依次累加偏移量递归解析。
 */
public class RespDecoder {

    private static final byte MINUS_BYTE = '-';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // "$-1\r\n" / "*-1\r\n"
    private static final int NULL_FRAME_LENGTH = 5;
    private static final long NULL_LENGTH = -1;

    // 防止 "*2000000000\r\n" 这种声明直接撑爆内存
    private static final int MAX_PREALLOCATED_ELEMENTS = 1024;

    // 数组嵌套层数上限，递归解析不能把栈打爆
    public static final int MAX_NESTING_DEPTH = 512;

    /**
     * 解码结果
     *
     * @param message  解出的消息
     * @param consumed 消耗的字节数 (含类型字节与结尾 CRLF)
     */
    public record Decoded(Message message, int consumed) {
    }

    // 长度前缀的解析结果，length 为 -1 表示 null
    private record Length(long length, int consumed) {
        boolean isNull() {
            return length == NULL_LENGTH;
        }
    }

    private record Parsed(RedisMessage value, int consumed) {
    }

    public Decoded decode(ByteBuf in) {
        return decode(in, in.readerIndex());
    }

    public Decoded decode(ByteBuf in, int offset) {
        Parsed parsed = readNextObject(in, offset, 0);
        return new Decoded(new Message(parsed.value().type(), parsed.value()), parsed.consumed());
    }

    // 1. 读取类型标识字节  2. 根据类型分发处理
    private Parsed readNextObject(ByteBuf in, int offset, int depth) {
        if (offset >= in.writerIndex()) {
            throw new RespException(RespError.UNEXPECTED_END, "Unexpected end of input at offset " + offset);
        }
        return switch (RespType.fromTag(in.getByte(offset))) {
            case SIMPLE_STRING -> decodeSimpleString(in, offset);
            case ERROR -> decodeError(in, offset);
            case INTEGER -> decodeInteger(in, offset);
            case BULK_STRING -> decodeBulkString(in, offset);
            case ARRAY -> decodeArray(in, offset, depth);
        };
    }

    // 简单字符串: +<content>\r\n，内容不允许出现 CR 或 LF
    private Parsed decodeSimpleString(ByteBuf in, int offset) {
        int end = readLineEnd(in, offset);
        String content = in.toString(offset + 1, end - offset - 1, StandardCharsets.UTF_8);
        return new Parsed(new SimpleString(content), end + 2 - offset);
    }

    private Parsed decodeError(ByteBuf in, int offset) {
        int end = readLineEnd(in, offset);
        String content = in.toString(offset + 1, end - offset - 1, StandardCharsets.UTF_8);
        return new Parsed(new ErrorMessage(content), end + 2 - offset);
    }

    // 整数: :[+-]<digits>\r\n，符号只影响结果，不参与数字解析
    private Parsed decodeInteger(ByteBuf in, int offset) {
        int limit = in.writerIndex();
        int i = offset + 1;
        boolean negative = false;
        if (i < limit && (in.getByte(i) == '+' || in.getByte(i) == '-')) {
            negative = in.getByte(i) == '-';
            i++;
        }
        int digitsStart = i;
        long value = 0;
        while (true) {
            if (i >= limit) {
                throw new RespException(RespError.CR_MISSING, "Missing the CR (\\r) character");
            }
            byte b = in.getByte(i);
            if (b == CR) {
                break;
            }
            if (b < '0' || b > '9') {
                throw integerParseError(in, digitsStart, i + 1);
            }
            try {
                value = Math.addExact(Math.multiplyExact(value, 10), b - '0');
            } catch (ArithmeticException e) {
                throw integerParseError(in, digitsStart, i + 1);
            }
            i++;
        }
        if (i == digitsStart) {
            throw integerParseError(in, digitsStart, i);
        }
        expectLf(in, i + 1);
        return new Parsed(new RedisInteger(negative ? -value : value), i + 2 - offset);
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private Parsed decodeBulkString(ByteBuf in, int offset) {
        Length length = parseLength(in, offset);
        if (length.isNull()) {
            return new Parsed(BulkString.NULL, length.consumed()); // Null Bulk String
        }

        int start = offset + length.consumed();
        long crIndex = start + length.length();
        // 内容可以包含任意字节，只校验声明长度之后的 CRLF
        if (crIndex >= in.writerIndex() || in.getByte((int) crIndex) != CR) {
            throw new RespException(RespError.CR_MISSING, "Missing the CR (\\r) character");
        }
        expectLf(in, (int) crIndex + 1);

        byte[] content = new byte[(int) length.length()];
        in.getBytes(start, content);
        return new Parsed(new BulkString(content), (int) crIndex + 2 - offset);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private Parsed decodeArray(ByteBuf in, int offset, int depth) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespException(RespError.NESTING_TOO_DEEP, "Array nesting deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        Length count = parseLength(in, offset);
        if (count.isNull()) {
            return new Parsed(RedisArray.NULL, count.consumed()); // Null Array
        }

        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count.length(), MAX_PREALLOCATED_ELEMENTS));
        int cursor = offset + count.consumed();
        for (long n = 0; n < count.length(); n++) {
            Parsed element = readNextObject(in, cursor, depth + 1);
            elements.add(element.value());
            cursor += element.consumed();
        }
        return new Parsed(new RedisArray(elements.toArray(new RedisMessage[0])), cursor - offset);
    }

    /**
     * 解析 BulkString 与 Array 共用的长度前缀
     * <p>
     * 跳过类型字节后逐个扫描 ASCII 数字直到 CR；"-1\r\n" 为 null 标记，其它负数一律拒绝。
     * 返回的字节数包含类型字节和结尾 CRLF。
     */
    private Length parseLength(ByteBuf in, int offset) {
        int limit = in.writerIndex();
        int i = offset + 1;

        if (i < limit && in.getByte(i) == MINUS_BYTE) {
            if (i + 2 < limit && in.getByte(i + 1) == '1' && in.getByte(i + 2) == CR) {
                if (i + 3 < limit && in.getByte(i + 3) == LF) {
                    return new Length(NULL_LENGTH, NULL_FRAME_LENGTH);
                }
                throw new RespException(RespError.LF_MISSING, "Missing the LF (\\n) character");
            }
            throw new RespException(RespError.NEGATIVE_LENGTH, "Received negative length");
        }

        int digitsStart = i;
        long length = 0;
        while (true) {
            if (i >= limit) {
                throw new RespException(RespError.CR_MISSING, "Missing the CR (\\r) character");
            }
            byte b = in.getByte(i);
            if (b == CR) {
                break;
            }
            if (b < '0' || b > '9') {
                throw integerParseError(in, digitsStart, i + 1);
            }
            length = length * 10 + (b - '0');
            if (length > Integer.MAX_VALUE) {
                throw integerParseError(in, digitsStart, i + 1);
            }
            i++;
        }
        if (i == digitsStart) {
            throw integerParseError(in, digitsStart, i);
        }
        expectLf(in, i + 1);
        return new Length(length, i + 2 - offset);
    }

    // 找到行尾 CR 的下标，要求紧跟 LF；CR 之前出现 LF 视为帧错误
    private int readLineEnd(ByteBuf in, int offset) {
        int limit = in.writerIndex();
        for (int i = offset + 1; i < limit; i++) {
            byte b = in.getByte(i);
            if (b == CR) {
                if (i + 1 >= limit) {
                    throw new RespException(RespError.LF_MISSING, "Missing the LF (\\n) character");
                }
                if (in.getByte(i + 1) != LF) {
                    throw new RespException(RespError.CRLF_MISPLACED, "CR (\\r) not immediately followed by LF (\\n)");
                }
                return i;
            }
            if (b == LF) {
                throw new RespException(RespError.CRLF_MISPLACED, "LF (\\n) found before CR (\\r)");
            }
        }
        throw new RespException(RespError.CR_MISSING, "Missing the CR (\\r) character");
    }

    private void expectLf(ByteBuf in, int index) {
        if (index >= in.writerIndex() || in.getByte(index) != LF) {
            throw new RespException(RespError.LF_MISSING, "Missing the LF (\\n) character");
        }
    }

    private RespException integerParseError(ByteBuf in, int from, int to) {
        String text = in.toString(from, to - from, StandardCharsets.UTF_8);
        return new RespException(RespError.INTEGER_PARSE, "Couldn't parse '" + text + "' to integer");
    }
}

package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 累积缓冲区由 ByteToMessageDecoder 维护。每次 decode 只尝试取出一个完整的帧：
 * 数据不够时把 readerIndex 复位，等待下一次读；格式非法时抛出 {@link RespProtocolException}，
 * 之后收到的所有字节都直接丢弃，由上层关闭连接。
 * <p>
 * COMMAND 模式只接受客户端请求格式 (*N 后跟 N 个 $len 批量字符串)；
 * REPLY 模式接受任意响应帧，用于从节点读取 Master 的回复。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    public enum Mode {
        COMMAND, REPLY
    }

    /**
     * 连接关闭时缓冲区里还留着半个帧
     */
    public enum DecoderEvent {
        TRUNCATED_FRAME
    }

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 与 Redis 的 PROTO_INLINE_MAX_SIZE 一致
    static final int MAX_LINE_LENGTH = 64 * 1024;
    static final int MAX_MULTIBULK_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    // 批量内容读入 byte[]，上限受数组长度限制 (再留出结尾的 CRLF)
    public static final long MAX_ALLOWED_BULK_LENGTH = Integer.MAX_VALUE - 2;

    private final Mode mode;
    private final long maxBulkLength;

    // 出现协议错误后进入丢弃状态
    private boolean discarding;

    public RespDecoder(Mode mode) {
        this(mode, DEFAULT_MAX_BULK_LENGTH);
    }

    public RespDecoder(Mode mode, long maxBulkLength) {
        if (maxBulkLength < 1 || maxBulkLength > MAX_ALLOWED_BULK_LENGTH) {
            throw new IllegalArgumentException("maxBulkLength out of range [1, " + MAX_ALLOWED_BULK_LENGTH + "]: " + maxBulkLength);
        }
        this.mode = mode;
        this.maxBulkLength = maxBulkLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (discarding) {
            in.skipBytes(in.readableBytes());
            return;
        }

        int start = in.readerIndex();
        RedisMessage msg;
        try {
            msg = mode == Mode.COMMAND ? readCommand(in) : readMessage(in);
        } catch (RespProtocolException e) {
            discarding = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }

        if (msg == null) {
            // 半包：什么都不消费
            in.readerIndex(start);
            return;
        }

        // *0\r\n 只消费不产出，和 Redis 行为一致
        if (msg instanceof RedisArray array && array.size() == 0 && mode == Mode.COMMAND) {
            return;
        }
        out.add(msg);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        // 完整的帧在 channelInputClosed 里已经解完了，这里还剩字节说明是被截断的帧
        if (in.isReadable() && !discarding) {
            log.debug("Connection {} closed with {} bytes of a partial frame buffered",
                    ctx.channel().remoteAddress(), in.readableBytes());
            in.skipBytes(in.readableBytes());
            ctx.fireUserEventTriggered(DecoderEvent.TRUNCATED_FRAME);
        }
    }

    // 解析请求: *<count>\r\n 后跟 count 个 $<len>\r\n<data>\r\n
    private RedisArray readCommand(ByteBuf in) {
        if (!in.isReadable()) return null;

        byte type = in.readByte();
        if (type != ASTERISK_BYTE) {
            throw new RespProtocolException("expected '*', got '" + printable(type) + "'");
        }

        String line = readLine(in);
        if (line == null) return null;

        long count = parseLength(line, "multibulk");
        if (count < 0 || count > MAX_MULTIBULK_LENGTH) {
            throw new RespProtocolException("invalid multibulk length: " + line);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            if (!in.isReadable()) return null;

            byte elementType = in.readByte();
            if (elementType != DOLLAR_BYTE) {
                throw new RespProtocolException("expected '$', got '" + printable(elementType) + "'");
            }

            String lengthLine = readLine(in);
            if (lengthLine == null) return null;

            long length = parseLength(lengthLine, "bulk");
            if (length < 0) {
                throw new RespProtocolException("invalid bulk length: " + lengthLine);
            }

            BulkString bulk = readBulkContent(in, length);
            if (bulk == null) return null;
            elements[i] = bulk;
        }
        return new RedisArray(elements);
    }

    // 解析任意响应帧，数组递归处理
    private RedisMessage readMessage(ByteBuf in) {
        if (!in.isReadable()) return null;

        byte type = in.readByte();
        String line = readLine(in);
        if (line == null) return null;

        return switch (type) {
            case PLUS_BYTE -> new SimpleString(line);
            case MINUS_BYTE -> new ErrorMessage(line);
            case COLON_BYTE -> new RedisInteger(parseLength(line, "integer"));
            case DOLLAR_BYTE -> {
                long length = parseLength(line, "bulk");
                if (length == -1) {
                    yield BulkString.NULL;
                }
                if (length < 0) {
                    throw new RespProtocolException("invalid bulk length: " + line);
                }
                yield readBulkContent(in, length);
            }
            case ASTERISK_BYTE -> readArrayElements(in, line);
            default -> throw new RespProtocolException("unknown RESP type byte: '" + printable(type) + "'");
        };
    }

    private RedisArray readArrayElements(ByteBuf in, String countLine) {
        long count = parseLength(countLine, "multibulk");
        if (count == -1) {
            return new RedisArray(null);
        }
        if (count < 0 || count > MAX_MULTIBULK_LENGTH) {
            throw new RespProtocolException("invalid multibulk length: " + countLine);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            RedisMessage element = readMessage(in);
            if (element == null) return null;
            elements[i] = element;
        }
        return new RedisArray(elements);
    }

    // 读取 <len bytes>\r\n
    private BulkString readBulkContent(ByteBuf in, long length) {
        if (length > maxBulkLength) {
            throw new RespProtocolException("bulk length " + length + " exceeds limit " + maxBulkLength);
        }
        if (in.readableBytes() < length + 2) {
            return null;
        }

        byte[] content = new byte[(int) length];
        in.readBytes(content);

        if (in.readByte() != CR || in.readByte() != LF) {
            throw new RespProtocolException("expected CRLF after bulk payload");
        }
        return new BulkString(content);
    }

    // 读取到 \r\n 为止的一行，不够一行返回 null
    private String readLine(ByteBuf in) {
        int from = in.readerIndex();
        int lf = in.indexOf(from, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new RespProtocolException("header line too long");
            }
            return null;
        }
        if (lf - from > MAX_LINE_LENGTH) {
            throw new RespProtocolException("header line too long");
        }
        if (lf == from || in.getByte(lf - 1) != CR) {
            throw new RespProtocolException("expected CRLF line terminator");
        }

        String line = in.toString(from, lf - 1 - from, StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);
        return line;
    }

    private long parseLength(String line, String what) {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid " + what + " value: '" + line + "'");
        }
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b);
    }
}

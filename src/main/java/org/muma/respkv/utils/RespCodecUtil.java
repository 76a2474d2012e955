package org.muma.respkv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编码工具类
 * RespEncoder 和从节点握手都走这里，保证只有一份编码逻辑。
 */
public final class RespCodecUtil {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    private RespCodecUtil() {
    }

    /**
     * 把一个 RESP 消息按规范写入 ByteBuf，数组元素递归写入
     */
    public static void writeTo(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeCharSequence(s.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeCharSequence(e.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, a.elements().length);
                for (RedisMessage element : a.elements()) {
                    writeTo(out, element);
                }
            }
        }
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            writeTo(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 由字符串参数构造请求命令，例如 command("REPLCONF", "capa", "psync2")
     */
    public static RedisArray command(String... args) {
        RedisMessage[] elements = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            elements[i] = new BulkString(args[i]);
        }
        return new RedisArray(elements);
    }

    // <n>\r\n
    private static void writeNumber(ByteBuf out, long n) {
        out.writeCharSequence(Long.toString(n), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}

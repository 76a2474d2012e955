package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static List<String> args(RedisArray array) {
        List<String> list = new ArrayList<>();
        for (RedisMessage m : array.elements()) {
            list.add(((BulkString) m).asString());
        }
        return list;
    }

    private EmbeddedChannel commandChannel() {
        return new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.COMMAND));
    }

    @Test
    void testDecodeSingleCommand() {
        EmbeddedChannel ch = commandChannel();
        assertTrue(ch.writeInbound(buf("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n")));

        RedisArray cmd = ch.readInbound();
        assertEquals(List.of("SET", "foo", "bar"), args(cmd));
        assertNull(ch.readInbound());
        assertFalse(ch.finish());
    }

    @Test
    void testFrameSplitAcrossReads() {
        EmbeddedChannel ch = commandChannel();

        // 半包：只拿到一部分 bulk 内容
        assertFalse(ch.writeInbound(buf("*2\r\n$4\r\nECHO\r\n$5\r\nhel")));
        assertNull(ch.readInbound());

        assertFalse(ch.writeInbound(buf("lo")));
        assertNull(ch.readInbound());

        assertTrue(ch.writeInbound(buf("\r\n")));
        RedisArray cmd = ch.readInbound();
        assertEquals(List.of("ECHO", "hello"), args(cmd));
    }

    @Test
    void testSplitInsideHeaderLine() {
        EmbeddedChannel ch = commandChannel();
        assertFalse(ch.writeInbound(buf("*1\r")));
        assertFalse(ch.writeInbound(buf("\n$4\r\nPI")));
        assertTrue(ch.writeInbound(buf("NG\r\n")));

        RedisArray cmd = ch.readInbound();
        assertEquals(List.of("PING"), args(cmd));
    }

    @Test
    void testPipelinedCommandsInOneRead() {
        EmbeddedChannel ch = commandChannel();
        ch.writeInbound(buf("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n"));

        assertEquals(List.of("PING"), args(ch.readInbound()));
        assertEquals(List.of("ECHO", "hello"), args(ch.readInbound()));
        assertEquals(List.of("GET", "missing"), args(ch.readInbound()));
        assertNull(ch.readInbound());
    }

    @Test
    void testBulkIsBinarySafe() {
        EmbeddedChannel ch = commandChannel();
        // value 中包含 CRLF，按长度读取而不是按行切分
        ch.writeInbound(buf("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$6\r\na\r\nb\r\n\r\n"));

        RedisArray cmd = ch.readInbound();
        assertArrayEquals("a\r\nb\r\n".getBytes(StandardCharsets.UTF_8), cmd.argBytes(2));
    }

    @Test
    void testEmptyMultibulkIsIgnored() {
        EmbeddedChannel ch = commandChannel();
        ch.writeInbound(buf("*0\r\n*1\r\n$4\r\nPING\r\n"));

        assertEquals(List.of("PING"), args(ch.readInbound()));
        assertNull(ch.readInbound());
    }

    @Test
    void testWrongSigilIsProtocolError() {
        EmbeddedChannel ch = commandChannel();
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("PING\r\n")));
    }

    @Test
    void testNegativeBulkLengthIsProtocolError() {
        EmbeddedChannel ch = commandChannel();
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("*1\r\n$-1\r\n")));
    }

    @Test
    void testNonNumericLengthIsProtocolError() {
        EmbeddedChannel ch = commandChannel();
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("*x\r\n")));
    }

    @Test
    void testOversizedBulkIsProtocolError() {
        EmbeddedChannel ch = new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.COMMAND, 16));
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("*1\r\n$17\r\n")));
    }

    @Test
    void testBulkLimitMustFitInByteArray() {
        assertThrows(IllegalArgumentException.class,
                () -> new RespDecoder(RespDecoder.Mode.COMMAND, 4L * 1024 * 1024 * 1024));
        assertThrows(IllegalArgumentException.class, () -> new RespDecoder(RespDecoder.Mode.COMMAND, 0));
        assertDoesNotThrow(() -> new RespDecoder(RespDecoder.Mode.COMMAND, RespDecoder.MAX_ALLOWED_BULK_LENGTH));
    }

    @Test
    void testMissingCrlfAfterBulkIsProtocolError() {
        EmbeddedChannel ch = commandChannel();
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("*1\r\n$4\r\nPINGxx")));
    }

    @Test
    void testBytesAfterProtocolErrorAreDiscarded() {
        EmbeddedChannel ch = commandChannel();
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("?oops\r\n")));

        // 出错后不再尝试重新同步
        assertFalse(ch.writeInbound(buf("*1\r\n$4\r\nPING\r\n")));
        assertNull(ch.readInbound());
    }

    @Test
    void testTruncatedFrameAtEofFiresEvent() {
        List<Object> events = new ArrayList<>();
        EmbeddedChannel ch = new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.COMMAND),
                new ChannelInboundHandlerAdapter() {
                    @Override
                    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
                        events.add(evt);
                    }
                });

        ch.writeInbound(buf("*1\r\n$5\r\nhel"));
        ch.finish();

        assertEquals(List.of(RespDecoder.DecoderEvent.TRUNCATED_FRAME), events);
    }

    @Test
    void testReplyModeDecodesAllTypes() {
        EmbeddedChannel ch = new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.REPLY));
        ch.writeInbound(buf("+FULLRESYNC abc 0\r\n-ERR boom\r\n:42\r\n$-1\r\n*2\r\n$1\r\na\r\n:7\r\n*-1\r\n"));

        assertEquals(new SimpleString("FULLRESYNC abc 0"), ch.readInbound());
        assertEquals(new ErrorMessage("ERR boom"), ch.readInbound());
        assertEquals(new RedisInteger(42), ch.readInbound());
        assertTrue(((BulkString) ch.readInbound()).isNull());

        RedisArray nested = ch.readInbound();
        assertEquals(2, nested.size());
        assertEquals("a", nested.argString(0));
        assertEquals(new RedisInteger(7), nested.elements()[1]);

        RedisArray nullArray = ch.readInbound();
        assertNull(nullArray.elements());
    }

    @Test
    void testReplyModeWaitsForFullLine() {
        EmbeddedChannel ch = new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.REPLY));
        assertFalse(ch.writeInbound(buf("+PO")));
        assertTrue(ch.writeInbound(buf("NG\r\n")));
        assertEquals(new SimpleString("PONG"), ch.readInbound());
    }

    @Test
    void testReplyModeUnknownTypeIsProtocolError() {
        EmbeddedChannel ch = new EmbeddedChannel(new RespDecoder(RespDecoder.Mode.REPLY));
        assertThrows(RespProtocolException.class, () -> ch.writeInbound(buf("!weird\r\n")));
    }
}

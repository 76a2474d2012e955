package org.muma.respkv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.*;
import static org.muma.respkv.utils.RespCodecUtil.command;

class CommandDispatcherTest {

    private StorageEngine storage;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        dispatcher = new CommandDispatcher(storage);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static RedisArray binaryCommand(byte[]... parts) {
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    private static String asString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof ErrorMessage e) return e.content();
        return null;
    }

    @Test
    void testPing() {
        assertEquals(new SimpleString("PONG"), dispatcher.dispatch(command("PING")));
    }

    @Test
    void testVerbIsCaseInsensitive() {
        assertEquals(new SimpleString("PONG"), dispatcher.dispatch(command("pInG")));
        assertEquals("hi", asString(dispatcher.dispatch(command("echo", "hi"))));
    }

    @Test
    void testPingWithArgumentIsArityError() {
        RedisMessage res = dispatcher.dispatch(command("PING", "extra"));
        assertEquals(new ErrorMessage("ERR wrong number of arguments"), res);
    }

    @Test
    void testEcho() {
        RedisMessage res = dispatcher.dispatch(command("ECHO", "hello"));
        assertInstanceOf(BulkString.class, res);
        assertEquals("hello", asString(res));

        assertEquals(new ErrorMessage("ERR wrong number of arguments"), dispatcher.dispatch(command("ECHO")));
    }

    @Test
    void testSetThenGet() {
        assertEquals(new SimpleString("OK"), dispatcher.dispatch(command("SET", "name", "root")));
        assertEquals("root", asString(dispatcher.dispatch(command("GET", "name"))));

        // 覆盖写
        dispatcher.dispatch(command("SET", "name", "admin"));
        assertEquals("admin", asString(dispatcher.dispatch(command("GET", "name"))));
    }

    @Test
    void testGetMissingKeyReturnsNil() {
        RedisMessage res = dispatcher.dispatch(command("GET", "missing"));
        assertTrue(((BulkString) res).isNull());
    }

    @Test
    void testSetWithOneArgumentLeavesStoreUnchanged() {
        RedisMessage res = dispatcher.dispatch(command("SET", "onlykey"));

        assertEquals(new ErrorMessage("ERR wrong number of arguments"), res);
        assertEquals(0, storage.size());
        assertNull(storage.get(bytes("onlykey")));
    }

    @Test
    void testSetWithTooManyArguments() {
        RedisMessage res = dispatcher.dispatch(command("SET", "k", "v", "EX"));
        assertEquals(new ErrorMessage("ERR wrong number of arguments"), res);
        assertEquals(0, storage.size());
    }

    @Test
    void testGetArity() {
        assertEquals(new ErrorMessage("ERR wrong number of arguments"), dispatcher.dispatch(command("GET")));
        assertEquals(new ErrorMessage("ERR wrong number of arguments"), dispatcher.dispatch(command("GET", "a", "b")));
    }

    @Test
    void testUnknownCommand() {
        assertEquals(new ErrorMessage("ERR unknown command"), dispatcher.dispatch(command("FLUSHALL")));
    }

    @Test
    void testBinaryKeysDoNotCollide() {
        byte[] keyFF = {(byte) 0xff};
        byte[] keyFE = {(byte) 0xfe};

        dispatcher.dispatch(binaryCommand(bytes("SET"), keyFF, bytes("a")));
        RedisMessage res = dispatcher.dispatch(binaryCommand(bytes("GET"), keyFE));
        assertTrue(((BulkString) res).isNull());

        dispatcher.dispatch(binaryCommand(bytes("SET"), keyFE, bytes("b")));
        assertEquals("a", asString(dispatcher.dispatch(binaryCommand(bytes("GET"), keyFF))));
        assertEquals("b", asString(dispatcher.dispatch(binaryCommand(bytes("GET"), keyFE))));
        assertEquals(2, storage.size());
    }

    @Test
    void testMalformedCommandArrayIsUnknownCommand() {
        ErrorMessage unknown = new ErrorMessage("ERR unknown command");
        assertEquals(unknown, dispatcher.dispatch(new RedisArray(new RedisMessage[0])));
        assertEquals(unknown, dispatcher.dispatch(new RedisArray(null)));
        assertEquals(unknown, dispatcher.dispatch(new RedisArray(new RedisMessage[]{new RedisInteger(1)})));
        assertEquals(unknown, dispatcher.dispatch(new RedisArray(new RedisMessage[]{BulkString.NULL})));
    }

    @Test
    void testClientErrorFromStorageBecomesErrReply() {
        StorageEngine failing = mock(StorageEngine.class);
        when(failing.get(any())).thenThrow(new IllegalStateException("storage is read-only"));

        RedisMessage res = new CommandDispatcher(failing).dispatch(command("GET", "k"));
        assertEquals(new ErrorMessage("ERR storage is read-only"), res);
    }

    @Test
    void testUnexpectedFailureNeverEscapesDispatch() {
        StorageEngine failing = mock(StorageEngine.class);
        doThrow(new RuntimeException("disk on fire")).when(failing).set(any(), any());

        RedisMessage res = new CommandDispatcher(failing).dispatch(command("SET", "k", "v"));
        assertEquals(new ErrorMessage("ERR internal server error"), res);
        verify(failing).set(aryEq(bytes("k")), any());
    }
}

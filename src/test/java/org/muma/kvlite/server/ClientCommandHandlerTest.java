package org.muma.kvlite.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.kvlite.command.CommandDispatcher;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.protocol.RespDecoder;
import org.muma.kvlite.protocol.RespEncoder;
import org.muma.kvlite.store.impl.ExpiringMemoryStore;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ClientCommandHandlerTest {

    private ExpiringMemoryStore store;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        store = new ExpiringMemoryStore();
        CommandDispatcher dispatcher = new CommandDispatcher(store,
                new KvLiteConfig(6379, "/data", "dump.rdb"));
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new ClientCommandHandler(dispatcher));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void send(String raw) {
        channel.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.UTF_8));
        channel.runPendingTasks();
    }

    private String reply() {
        ByteBuf out = channel.readOutbound();
        if (out == null) return null;
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    void testPing() {
        send("*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply());
    }

    @Test
    void testEcho() {
        send("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n");
        assertEquals("$2\r\nhi\r\n", reply());
    }

    @Test
    void testSetGetOnSameConnection() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n");
        assertEquals("+OK\r\n", reply());

        send("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("$1\r\nv\r\n", reply());

        send("*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n");
        assertEquals("$-1\r\n", reply());
    }

    @Test
    void testConfigGetDir() {
        send("*3\r\n$6\r\nCONFIG\r\n$3\r\nGET\r\n$3\r\ndir\r\n");
        assertEquals("*2\r\n$3\r\ndir\r\n$5\r\n/data\r\n", reply());
    }

    @Test
    void testKeysOnEmptyStore() {
        send("*2\r\n$4\r\nKEYS\r\n$1\r\n*\r\n");
        assertEquals("*-1\r\n", reply());
    }

    @Test
    void testValidationFailureSendsNothingAndKeepsConnection() {
        send("*2\r\n$3\r\nSET\r\n$1\r\nk\r\n");
        assertNull(reply());
        assertTrue(channel.isOpen());

        send("*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply());
    }

    @Test
    void testUnknownCommandSendsNothing() {
        send("*1\r\n$8\r\nFLUSHALL\r\n");
        assertNull(reply());
        assertTrue(channel.isOpen());
    }

    @Test
    void testQuitRepliesThenCloses() {
        send("*1\r\n$4\r\nQUIT\r\n");
        assertEquals("+OK\r\n", reply());
        assertFalse(channel.isOpen());
    }

    @Test
    void testCommandsPipelinedAfterQuitAreNotExecuted() {
        send("*1\r\n$4\r\nQUIT\r\n"
                + "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n"
                + "*1\r\n$4\r\nPING\r\n");

        assertEquals("+OK\r\n", reply());
        assertNull(reply());
        assertFalse(channel.isOpen());
        assertNull(store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    void testMalformedFrameClosesConnection() {
        send("*1\r\n$x\r\n");
        assertNull(reply());
        assertFalse(channel.isOpen());
    }

    @Test
    void testNonArrayFrameClosesConnection() {
        send("+PING\r\n");
        assertNull(reply());
        assertFalse(channel.isOpen());
    }

    @Test
    void testArrayWithNonBulkElementClosesConnection() {
        send("*2\r\n$3\r\nGET\r\n:1\r\n");
        assertFalse(channel.isOpen());
    }

    @Test
    void testEmptyArrayClosesConnection() {
        send("*0\r\n");
        assertFalse(channel.isOpen());
    }
}

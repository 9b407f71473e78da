package org.muma.kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static String encode(RedisMessage msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(msg));
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
            channel.finishAndReleaseAll();
        }
    }

    // --- Decoder ---

    @Test
    void testDecodeMultiBulkCommand() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(buf("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n"));

        RedisArray array = channel.readInbound();
        assertEquals(2, array.size());
        assertEquals("ECHO", ((BulkString) array.elements()[0]).asString());
        assertEquals("hi", ((BulkString) array.elements()[1]).asString());
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeFrameSplitAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(buf("*3\r\n$3\r\nSET\r\n$1\r"));
        assertNull(channel.readInbound());

        channel.writeInbound(buf("\nk\r\n$5\r\nhel"));
        assertNull(channel.readInbound());

        channel.writeInbound(buf("lo\r\n"));
        RedisArray array = channel.readInbound();
        assertEquals("hello", ((BulkString) array.elements()[2]).asString());
    }

    @Test
    void testDecodeBinarySafeBulkString() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        // 内容里带 \r\n，按长度读取
        channel.writeInbound(buf("*1\r\n$4\r\na\r\nb\r\n"));

        RedisArray array = channel.readInbound();
        assertEquals("a\r\nb", ((BulkString) array.elements()[0]).asString());
    }

    @Test
    void testDecodeTwoFramesInOneRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(buf("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n"));

        assertNotNull(channel.readInbound());
        assertNotNull(channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeReplyTypes() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(buf("+OK\r\n-ERR boom\r\n:42\r\n$-1\r\n*-1\r\n"));

        assertEquals(new SimpleString("OK"), channel.readInbound());
        assertEquals(new ErrorMessage("ERR boom"), channel.readInbound());
        assertEquals(new RedisInteger(42), channel.readInbound());
        assertTrue(((BulkString) channel.readInbound()).isNull());
        assertTrue(((RedisArray) channel.readInbound()).isNull());
    }

    @Test
    void testDecodeUnknownTypeByteFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        assertThrows(DecoderException.class, () -> channel.writeInbound(buf("PING\r\n")));
    }

    @Test
    void testDecodeMissingCrlfFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        assertThrows(DecoderException.class, () -> channel.writeInbound(buf("*1\r\n$2\r\nhiXX")));
    }

    @Test
    void testDecodeBadLengthFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        assertThrows(DecoderException.class, () -> channel.writeInbound(buf("*1\r\n$abc\r\n")));
    }

    @Test
    void testLargeBulkHeaderWaitsForPayload() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        // 声明接近上限的长度，但只陆续到达少量字节
        channel.writeInbound(buf("*1\r\n$536870000\r\n"));
        for (int i = 0; i < 64; i++) {
            channel.writeInbound(buf("x"));
        }

        assertNull(channel.readInbound());
        assertTrue(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    void testBulkPayloadArrivingInChunks() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        String payload = "v".repeat(70_000);
        channel.writeInbound(buf("*2\r\n$3\r\nSET\r\n$70000\r\n"));
        for (int i = 0; i < payload.length(); i += 7_000) {
            channel.writeInbound(buf(payload.substring(i, i + 7_000)));
            assertNull(channel.readInbound());
        }
        channel.writeInbound(buf("\r\n"));

        RedisArray array = channel.readInbound();
        assertEquals(payload, ((BulkString) array.elements()[1]).asString());
    }

    @Test
    void testDecodeLineWithoutCrFails() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        assertThrows(DecoderException.class, () -> channel.writeInbound(buf("*1\n")));
    }

    // --- Encoder ---

    @Test
    void testEncodeSimpleString() {
        assertEquals("+PONG\r\n", encode(SimpleString.PONG));
    }

    @Test
    void testEncodeBulkString() {
        assertEquals("$2\r\nhi\r\n", encode(new BulkString("hi")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
    }

    @Test
    void testEncodeNulls() {
        assertEquals("$-1\r\n", encode(new BulkString((byte[]) null)));
        assertEquals("*-1\r\n", encode(new RedisArray(null)));
    }

    @Test
    void testEncodeArray() {
        RedisArray array = new RedisArray(new RedisMessage[]{new BulkString("dir"), new BulkString("/tmp")});
        assertEquals("*2\r\n$3\r\ndir\r\n$4\r\n/tmp\r\n", encode(array));
    }

    @Test
    void testEncodeNestedArrayAndMixedTypes() {
        RedisArray array = new RedisArray(new RedisMessage[]{
                new RedisInteger(-7),
                new RedisArray(new RedisMessage[]{new BulkString((byte[]) null), new SimpleString("OK")}),
                new ErrorMessage("ERR x")
        });
        assertEquals("*3\r\n:-7\r\n*2\r\n$-1\r\n+OK\r\n-ERR x\r\n", encode(array));
    }
}

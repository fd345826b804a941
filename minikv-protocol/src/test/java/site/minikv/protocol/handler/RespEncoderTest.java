package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespInteger;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RespEncoderTest {

    private static String readAll(final EmbeddedChannel channel) {
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    public void testEncodeReplies() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        assertTrue(channel.writeOutbound(BulkString.fromString("v")));
        assertEquals("$1\r\nv\r\n", readAll(channel));

        assertTrue(channel.writeOutbound(RespInteger.valueOf(42)));
        assertEquals(":42\r\n", readAll(channel));

        assertTrue(channel.writeOutbound(new Errors("WRONGTYPE Operation against a key holding the wrong kind of value")));
        assertEquals("-WRONGTYPE Operation against a key holding the wrong kind of value\r\n", readAll(channel));

        assertTrue(channel.writeOutbound(RespArray.EMPTY));
        assertEquals("*0\r\n", readAll(channel));

        channel.finish();
    }
}

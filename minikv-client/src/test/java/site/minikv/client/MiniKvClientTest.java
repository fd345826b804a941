package site.minikv.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespInteger;
import site.minikv.server.MiniKvServer;
import site.minikv.server.config.ServerConfig;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MiniKvClient测试")
class MiniKvClientTest {

    private MiniKvServer server;
    private MiniKvClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MiniKvServer(ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .workerThreadCount(1)
                .commandExecutorThreadCount(2)
                .shutdownTimeoutMillis(2_000)
                .build());
        server.start();
        client = new MiniKvClient("127.0.0.1", server.getBoundPort());
        client.setReadTimeout(5_000);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.stop();
    }

    @Test
    void testStringCommands() throws IOException {
        assertEquals("OK", client.execute("SET", "greeting", "hello").toString());
        assertEquals("hello", client.execute("GET", "greeting").toString());
        assertTrue(((BulkString) client.execute("GET", "missing")).isNull());
        assertEquals(1, ((RespInteger) client.execute("DEL", "greeting", "missing")).getContent());
    }

    @Test
    @DisplayName("二进制值原样往返")
    void testBinaryValue() throws IOException {
        final byte[] binary = {0, 1, '\r', '\n', (byte) 0xFE};
        client.execute("SET", List.of(KvBytes.fromString("bin"), new KvBytes(binary)));

        final BulkString reply = (BulkString) client.execute("GET", List.of(KvBytes.fromString("bin")));
        assertArrayEquals(binary, reply.getContent().getBytes());
    }

    @Test
    void testSortedSetCommands() throws IOException {
        client.execute("ZADD", "scores", "3", "c");
        client.execute("ZADD", "scores", "1", "a");
        client.execute("ZADD", "scores", "2", "b");

        final RespArray range = (RespArray) client.execute("ZRANGE", "scores", "0", "-1");
        assertEquals(3, range.getContent().length);
        assertEquals("a", range.getContent()[0].toString());
        assertEquals("c", range.getContent()[2].toString());
    }

    @Test
    @DisplayName("命令错误以Errors返回，连接可继续使用")
    void testErrorReplyKeepsConnectionUsable() throws IOException {
        final Resp reply = client.execute("NOPE");
        assertTrue(reply instanceof Errors);
        assertEquals("ERR unknown command 'NOPE'", ((Errors) reply).getContent());

        assertEquals("PONG", client.execute("PING").toString());
    }

    @Test
    @DisplayName("服务器停止后execute抛出IOException")
    void testServerGoneRaisesIOException() {
        server.stop();
        assertThrows(IOException.class, () -> client.execute("PING"));
    }

    @Test
    @DisplayName("无法连接时构造函数抛出IOException")
    void testConnectFailure() throws IOException {
        final int unusedPort;
        try (ServerSocket probe = new ServerSocket(0)) {
            unusedPort = probe.getLocalPort();
        }
        assertThrows(IOException.class, () -> new MiniKvClient("127.0.0.1", unusedPort));
    }
}

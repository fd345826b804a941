package site.minikv.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigLoader单元测试")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("端口写成字符串也能解析")
    void testLoadWithStringPort() throws IOException {
        Path file = write("{\"server_host\":\"0.0.0.0\",\"server_port\":\"7000\",\"log_level\":\"debug\"}");

        KvConfig config = ConfigLoader.load(file);

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals("debug", config.getLogLevel());
    }

    @Test
    @DisplayName("缺失字段使用默认值，未知字段被忽略")
    void testMissingAndUnknownFields() throws IOException {
        Path file = write("{\"server_port\":6400,\"something_else\":true}");

        KvConfig config = ConfigLoader.load(file);

        assertEquals(KvConfig.DEFAULT_HOST, config.getHost());
        assertEquals(6400, config.getPort());
        assertEquals(KvConfig.DEFAULT_LOG_LEVEL, config.getLogLevel());
    }

    @Test
    @DisplayName("文件不存在或内容非法时严格加载抛出异常")
    void testStrictLoadFailures() throws IOException {
        assertThrows(ConfigLoadException.class, () -> ConfigLoader.load(tempDir.resolve("missing.json")));
        assertThrows(ConfigLoadException.class, () -> ConfigLoader.load(write("not json")));
        assertThrows(ConfigLoadException.class, () -> ConfigLoader.load(write("{\"server_port\":\"abc\"}")));
        assertThrows(ConfigLoadException.class, () -> ConfigLoader.load(write("{\"server_port\":70000}")));
    }

    @Test
    @DisplayName("加载失败回退到默认配置")
    void testFallbackToDefaults() {
        KvConfig config = ConfigLoader.loadOrDefault(tempDir.resolve("missing.json"));

        assertEquals("localhost", config.getHost());
        assertEquals(6379, config.getPort());
        assertEquals("info", config.getLogLevel());
    }
}

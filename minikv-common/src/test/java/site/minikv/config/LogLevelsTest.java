package site.minikv.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("日志配置测试")
class LogLevelsTest {

    private static Logger root() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }

    @AfterEach
    void restoreLevel() {
        root().setLevel(Level.INFO);
    }

    @Test
    @DisplayName("级别名大小写不敏感，无法识别时为INFO")
    void testParse() {
        assertEquals(Level.DEBUG, LogLevels.parse("debug"));
        assertEquals(Level.WARN, LogLevels.parse("Warning"));
        assertEquals(Level.ERROR, LogLevels.parse(" ERROR "));
        assertEquals(Level.INFO, LogLevels.parse("verbose"));
        assertEquals(Level.INFO, LogLevels.parse(null));
    }

    @Test
    @DisplayName("apply修改根日志器级别")
    void testApply() {
        assertEquals(Level.WARN, LogLevels.apply("warn"));
        assertEquals(Level.WARN, root().getLevel());
    }

    @Test
    @DisplayName("INFO与ERROR日志同时写入app.log")
    void testFileAppenderWritesAppLog() throws IOException {
        final Appender<ILoggingEvent> appender = root().getAppender("FILE");
        assertThat(appender).isInstanceOf(FileAppender.class);
        final String file = ((FileAppender<ILoggingEvent>) appender).getFile();
        assertThat(file).endsWith("app.log");

        final String marker = UUID.randomUUID().toString();
        final org.slf4j.Logger logger = LoggerFactory.getLogger(LogLevelsTest.class);
        logger.info("info {}", marker);
        logger.error("error {}", marker);

        final String content = new String(Files.readAllBytes(Path.of(file)), StandardCharsets.UTF_8);
        assertThat(content).contains("INFO  site.minikv.config.LogLevelsTest - info " + marker);
        assertThat(content).contains("ERROR site.minikv.config.LogLevelsTest - error " + marker);
    }
}

package site.minikv.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 把配置中的日志级别应用到Logback根日志器
 */
@Slf4j
public final class LogLevels {

    private LogLevels() {
    }

    /**
     * 解析级别名，大小写不敏感；无法识别时返回INFO
     *
     * @param name 级别名，例如 info、debug
     * @return Logback级别
     */
    public static Level parse(final String name) {
        if (name == null) {
            return Level.INFO;
        }
        final String normalized = name.trim().toUpperCase(Locale.ROOT);
        // warning 与 Go/JUL 风格的写法兼容
        if ("WARNING".equals(normalized)) {
            return Level.WARN;
        }
        return Level.toLevel(normalized, Level.INFO);
    }

    /**
     * 设置根日志器级别
     *
     * @param name 级别名
     * @return 实际生效的级别
     */
    public static Level apply(final String name) {
        final Level level = parse(name);
        final org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger) {
            ((Logger) root).setLevel(level);
        } else {
            log.warn("根日志器不是Logback实现，忽略日志级别 '{}'", name);
        }
        return level;
    }
}

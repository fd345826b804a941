package site.minikv.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON配置加载器
 *
 * <p>服务端与客户端共用。{@link #load(Path)} 在失败时抛出异常，
 * {@link #loadOrDefault(Path)} 记录错误后回退到 {@link KvConfig#defaults()}，
 * 启动流程永远不会因为配置文件而中止。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public final class ConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {
    }

    /**
     * 严格加载
     *
     * @param path 配置文件路径
     * @return 解析结果
     * @throws ConfigLoadException 文件不存在、无法读取或不是合法JSON
     */
    public static KvConfig load(final Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigLoadException("配置文件不存在: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            final KvConfig config = MAPPER.readValue(in, KvConfig.class);
            if (config == null) {
                throw new ConfigLoadException("配置文件为空: " + path);
            }
            fillMissing(config);
            validate(config);
            return config;
        } catch (IOException e) {
            throw new ConfigLoadException("配置文件解析失败: " + path, e);
        }
    }

    /**
     * 加载失败时使用默认配置
     *
     * @param path 配置文件路径
     * @return 解析结果或默认配置
     */
    public static KvConfig loadOrDefault(final Path path) {
        try {
            final KvConfig config = load(path);
            log.info("已加载配置文件: {}", path);
            return config;
        } catch (ConfigLoadException e) {
            log.error("加载配置失败: {}", e.getMessage());
            log.info("使用默认配置");
            return KvConfig.defaults();
        }
    }

    private static void fillMissing(final KvConfig config) {
        if (config.getHost() == null || config.getHost().isBlank()) {
            config.setHost(KvConfig.DEFAULT_HOST);
        }
        if (config.getLogLevel() == null || config.getLogLevel().isBlank()) {
            config.setLogLevel(KvConfig.DEFAULT_LOG_LEVEL);
        }
    }

    private static void validate(final KvConfig config) {
        // 0 表示由操作系统分配端口
        if (config.getPort() < 0 || config.getPort() > 65535) {
            throw new ConfigLoadException("端口号必须在0-65535范围内: " + config.getPort());
        }
    }
}

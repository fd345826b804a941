package site.minikv.server.config;

import lombok.Builder;
import lombok.Data;
import site.minikv.config.KvConfig;

/**
 * 服务器运行参数
 *
 * @author minikv
 * @since 1.0.0
 */
@Data
@Builder
public class ServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = KvConfig.DEFAULT_HOST;

    /** 0 表示由系统分配临时端口 */
    @Builder.Default
    private int port = KvConfig.DEFAULT_PORT;

    @Builder.Default
    private int backlogSize = 1024;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /** 命令执行线程数，存储自身有读写锁，多个线程可以并行执行读命令 */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /** 停止时等待命令执行器清空队列的最长时间 */
    @Builder.Default
    private long shutdownTimeoutMillis = 15_000L;

    // ========== 日志配置 ==========

    @Builder.Default
    private String logLevel = KvConfig.DEFAULT_LOG_LEVEL;

    public static ServerConfig defaultConfig() {
        return ServerConfig.builder().build();
    }

    /**
     * 由配置文件内容构建
     */
    public static ServerConfig fromKvConfig(final KvConfig kvConfig) {
        return ServerConfig.builder()
                .host(kvConfig.getHost())
                .port(kvConfig.getPort())
                .logLevel(kvConfig.getLogLevel())
                .build();
    }
}

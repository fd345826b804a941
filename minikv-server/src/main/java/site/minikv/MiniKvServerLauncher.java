package site.minikv;

import lombok.extern.slf4j.Slf4j;
import site.minikv.config.CommandLineOptions;
import site.minikv.config.ConfigLoader;
import site.minikv.config.KvConfig;
import site.minikv.config.LogLevels;
import site.minikv.server.KvServer;
import site.minikv.server.MiniKvServer;
import site.minikv.server.ServerStartException;
import site.minikv.server.config.ServerConfig;

/**
 * 服务器入口
 *
 * <p>用法：{@code MiniKvServerLauncher [--config <path>]}，默认读取 ./config.json。
 * 配置文件缺失或无效时使用 localhost:6379。端口绑定失败时以状态码1退出。
 */
@Slf4j
public class MiniKvServerLauncher {

    public static void main(String[] args) throws Exception {
        final CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("用法: MiniKvServerLauncher [--config <path>]");
            System.exit(1);
            return;
        }

        final KvConfig kvConfig = ConfigLoader.loadOrDefault(options.getConfigPath());
        LogLevels.apply(kvConfig.getLogLevel());

        final KvServer server = new MiniKvServer(ServerConfig.fromKvConfig(kvConfig));
        try {
            server.start();
        } catch (ServerStartException e) {
            log.error("服务器启动失败: {}", e.getMessage(), e.getCause());
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "minikv-shutdown"));

        server.awaitTermination();
    }
}

package site.minikv.config;

import lombok.Getter;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 服务端与客户端共用的命令行参数
 *
 * <p>目前只有 {@code --config <path>}（也接受 {@code --config=<path>}），
 * 未指定时使用当前目录下的 {@code config.json}。
 */
@Getter
public final class CommandLineOptions {

    public static final String DEFAULT_CONFIG_PATH = "./config.json";

    private static final String CONFIG_FLAG = "--config";

    private final Path configPath;

    private CommandLineOptions(final Path configPath) {
        this.configPath = configPath;
    }

    /**
     * 解析参数
     *
     * @param args main方法的参数
     * @return 解析结果
     * @throws IllegalArgumentException 出现未知参数或 --config 缺少取值
     */
    public static CommandLineOptions parse(final String[] args) {
        String config = DEFAULT_CONFIG_PATH;
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (CONFIG_FLAG.equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config 需要一个文件路径");
                }
                config = args[++i];
            } else if (arg.startsWith(CONFIG_FLAG + "=")) {
                config = arg.substring(CONFIG_FLAG.length() + 1);
            } else {
                throw new IllegalArgumentException("未知参数: " + arg);
            }
        }
        return new CommandLineOptions(Paths.get(config));
    }
}

package site.minikv.config;

/**
 * 配置文件无法读取或内容不合法
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(final String message) {
        super(message);
    }

    public ConfigLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

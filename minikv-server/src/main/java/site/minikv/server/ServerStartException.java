package site.minikv.server;

/**
 * 服务器启动失败，通常是端口绑定失败
 *
 * @author minikv
 * @since 1.0.0
 */
public class ServerStartException extends RuntimeException {

    public ServerStartException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

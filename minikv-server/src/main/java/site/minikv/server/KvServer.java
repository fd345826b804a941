package site.minikv.server;

/**
 * 服务器生命周期接口
 *
 * <p>状态转换：STOPPED → LISTENING → DRAINING → STOPPED。
 *
 * @author minikv
 * @since 1.0.0
 */
public interface KvServer {

    /**
     * 服务器状态
     */
    enum State {
        /** 未监听 */
        STOPPED,
        /** 正在接受连接 */
        LISTENING,
        /** 已停止接受连接，正在关闭已有连接并等待命令执行完毕 */
        DRAINING
    }

    /**
     * 绑定端口并开始接受连接
     *
     * @throws ServerStartException 绑定失败，服务器保持STOPPED
     * @throws IllegalStateException 服务器不处于STOPPED状态
     */
    void start();

    /**
     * 停止服务器
     *
     * <p>停止接受新连接，关闭所有已有连接，等待正在执行的命令完成后返回。
     * 重复调用无副作用。
     */
    void stop();

    /**
     * 阻塞直到服务器停止
     */
    void awaitTermination() throws InterruptedException;

    /**
     * 实际监听的端口，未监听时返回-1
     */
    int getBoundPort();

    State getState();
}

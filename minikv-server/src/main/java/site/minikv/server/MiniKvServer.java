package site.minikv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.CommandDispatcher;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.config.ServerConfig;
import site.minikv.server.handler.RespCommandHandler;
import site.minikv.store.InMemoryKvStore;
import site.minikv.store.KvStore;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于Netty的服务器实现
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接</li>
 *   <li>worker线程组负责编解码和读写</li>
 *   <li>命令执行线程组运行 {@link RespCommandHandler}，等待存储锁不会阻塞I/O线程</li>
 * </ul>
 * 根据操作系统选择Epoll、KQueue或NIO传输。
 *
 * <p>所有已接受的连接记录在 {@link ChannelGroup} 中，停止时统一关闭。
 * 状态保存在 {@link AtomicReference} 中，作为停止信号：进入DRAINING后新接受的连接会被立即关闭。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class MiniKvServer implements KvServer {

    @Getter
    private final ServerConfig config;

    @Getter
    private final KvStore store;

    private final CommandDispatcher dispatcher;

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    /** 已接受的连接，关闭后自动移除 */
    private final ChannelGroup channels = new DefaultChannelGroup("minikv-clients", GlobalEventExecutor.INSTANCE);

    private volatile CountDownLatch terminationLatch = new CountDownLatch(0);

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private EventExecutorGroup commandExecutor;

    private volatile Channel serverChannel;

    public MiniKvServer(final ServerConfig config) {
        this(config, new InMemoryKvStore());
    }

    public MiniKvServer(final ServerConfig config, final KvStore store) {
        this.config = config;
        this.store = store;
        this.dispatcher = new CommandDispatcher(store);
    }

    @Override
    public synchronized void start() {
        if (state.get() != State.STOPPED) {
            throw new IllegalStateException("服务器已在运行: " + state.get());
        }
        initializeEventLoopGroups();
        initializeCommandExecutor();

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        if (state.get() == State.DRAINING) {
                            ch.close();
                            return;
                        }
                        channels.add(ch);
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });

        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseResources();
            throw new ServerStartException("启动被中断", e);
        } catch (Exception e) {
            log.error("无法绑定 {}:{} - {}", config.getHost(), config.getPort(), e.getMessage());
            releaseResources();
            throw new ServerStartException("无法绑定 " + config.getHost() + ":" + config.getPort(), e);
        }

        terminationLatch = new CountDownLatch(1);
        state.set(State.LISTENING);
        log.info("minikv服务器已启动: {}:{}", config.getHost(), getBoundPort());
    }

    /**
     * 优雅停止
     *
     * <p>按以下顺序关闭各个组件：
     * <ul>
     *   <li>关闭监听Channel，不再接受新连接</li>
     *   <li>关闭所有已接受的连接</li>
     *   <li>关闭worker和boss线程组，I/O线程不再向命令执行器投递事件</li>
     *   <li>关闭命令执行器，已提交的命令执行完毕</li>
     * </ul>
     * 返回时不会再有命令访问存储。
     */
    @Override
    public void stop() {
        if (!state.compareAndSet(State.LISTENING, State.DRAINING)) {
            log.debug("服务器未在监听 ({})，忽略停止请求", state.get());
            return;
        }
        log.info("minikv服务器正在停止，当前连接数: {}", channels.size());
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
            }
            channels.close().awaitUninterruptibly();
        } finally {
            releaseResources();
            serverChannel = null;
            state.set(State.STOPPED);
            terminationLatch.countDown();
            log.info("minikv服务器已停止");
        }
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminationLatch.await();
    }

    @Override
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public State getState() {
        return state.get();
    }

    private void releaseResources() {
        final long timeout = config.getShutdownTimeoutMillis();
        // 命令执行器最后关闭，否则worker仍会向已终止的执行器投递事件
        shutdown(bossGroup, timeout);
        shutdown(workerGroup, timeout);
        shutdown(commandExecutor, timeout);
        commandExecutor = null;
        workerGroup = null;
        bossGroup = null;
    }

    private static void shutdown(final EventExecutorGroup group, final long timeoutMillis) {
        if (group == null) {
            return;
        }
        final Future<?> future = group.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS);
        if (!future.awaitUninterruptibly(timeoutMillis + 1_000L)) {
            log.warn("线程组在 {} ms 内未能终止", timeoutMillis);
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.debug("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.debug("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.debug("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("minikv-cmd"));
    }
}

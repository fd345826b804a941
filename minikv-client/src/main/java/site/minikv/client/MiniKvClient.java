package site.minikv.client;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespCodec;
import site.minikv.protocol.RespStreamReader;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;

/**
 * 阻塞式客户端
 *
 * <p>一次发送一条请求并等待对应的回复。方法加锁，多个线程共用一个实例时请求会串行化。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class MiniKvClient implements Closeable {

    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    @Getter
    private final String host;

    @Getter
    private final int port;

    private final Socket socket;

    private final OutputStream out;

    private final RespStreamReader reader;

    /**
     * 连接服务器
     *
     * @throws IOException 无法建立连接
     */
    public MiniKvClient(final String host, final int port) throws IOException {
        this.host = host;
        this.port = port;
        this.socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MILLIS);
            socket.setTcpNoDelay(true);
            this.out = socket.getOutputStream();
            this.reader = new RespStreamReader(socket.getInputStream());
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        log.debug("已连接到 {}:{}", host, port);
    }

    /**
     * 执行一条命令
     *
     * @param command 命令名
     * @param args    参数
     * @return 服务器回复，命令级错误以 {@link site.minikv.protocol.Errors} 返回
     * @throws IOException 连接中断
     */
    public Resp execute(final String command, final String... args) throws IOException {
        final List<KvBytes> list = new ArrayList<>(args.length);
        for (final String arg : args) {
            list.add(KvBytes.fromString(arg));
        }
        return execute(command, list);
    }

    public synchronized Resp execute(final String command, final List<KvBytes> args) throws IOException {
        out.write(RespCodec.encodeRequest(command, args));
        out.flush();
        return reader.readReply();
    }

    /**
     * 设置读取回复的超时时间，0表示不超时
     */
    public void setReadTimeout(final int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    @Override
    public void close() throws IOException {
        reader.close();
        socket.close();
    }
}

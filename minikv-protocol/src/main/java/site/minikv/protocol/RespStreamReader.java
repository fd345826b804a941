package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * 阻塞式RESP读取器
 *
 * <p>包装一个输入流，按需读入字节直到解码出一个完整帧。
 * 多余的字节留在内部缓冲区供下一次读取使用。非线程安全。
 *
 * @author minikv
 * @since 1.0.0
 */
public class RespStreamReader implements Closeable {

    private static final int READ_CHUNK = 8192;

    private final InputStream in;

    private final ByteBuf buffer = Unpooled.buffer(READ_CHUNK);

    public RespStreamReader(final InputStream in) {
        this.in = in;
    }

    /**
     * 读取一条回复
     *
     * @throws EOFException 帧完整之前流已结束
     */
    public Resp readReply() throws IOException {
        while (true) {
            final Resp reply = RespCodec.decodeReply(buffer);
            if (reply != null) {
                buffer.discardReadBytes();
                return reply;
            }
            fill();
        }
    }

    /**
     * 读取一条请求
     *
     * @throws EOFException 帧完整之前流已结束
     */
    public RespRequest readRequest() throws IOException {
        while (true) {
            final RespRequest request = RespCodec.decodeRequest(buffer);
            if (request != null) {
                buffer.discardReadBytes();
                return request;
            }
            fill();
        }
    }

    private void fill() throws IOException {
        final int read = buffer.writeBytes(in, READ_CHUNK);
        if (read < 0) {
            throw new EOFException("connection closed before a complete frame was received");
        }
    }

    @Override
    public void close() throws IOException {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
        in.close();
    }
}

package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import site.minikv.datastructure.KvBytes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 请求与回复的编解码入口
 *
 * <p>请求固定为批量字符串数组；回复可以是任意RESP类型，委托给 {@link Resp#decode(ByteBuf)}。
 * 解码方法在数据不完整时返回null且不移动读索引，可以在收到更多字节后重试。
 *
 * @author minikv
 * @since 1.0.0
 */
public final class RespCodec {

    private RespCodec() {
    }

    /**
     * 把命令和参数编码为请求帧
     *
     * @param command 命令名
     * @param args    参数
     * @return 完整的线上字节
     */
    public static byte[] encodeRequest(final String command, final List<KvBytes> args) {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encodeRequest(buf, command, args);
            final byte[] out = new byte[buf.readableBytes()];
            buf.readBytes(out);
            return out;
        } finally {
            buf.release();
        }
    }

    public static void encodeRequest(final ByteBuf out, final String command, final List<KvBytes> args) {
        out.writeByte('*');
        Resp.writeNumber(out, 1L + args.size());
        out.writeBytes(Resp.CRLF);
        writeBulk(out, command.getBytes(StandardCharsets.UTF_8));
        for (final KvBytes arg : args) {
            writeBulk(out, arg.getBytesUnsafe());
        }
    }

    private static void writeBulk(final ByteBuf out, final byte[] bytes) {
        out.writeByte('$');
        Resp.writeNumber(out, bytes.length);
        out.writeBytes(Resp.CRLF);
        out.writeBytes(bytes);
        out.writeBytes(Resp.CRLF);
    }

    /**
     * 解码一条请求
     *
     * @param buffer 输入缓冲区
     * @return 请求，数据不完整时返回null
     * @throws ProtocolException 不是批量字符串数组或格式错误
     */
    public static RespRequest decodeRequest(final ByteBuf buffer) {
        final int initialIndex = buffer.readerIndex();
        final RespRequest request = readRequest(buffer);
        if (request == null) {
            buffer.readerIndex(initialIndex);
        }
        return request;
    }

    private static RespRequest readRequest(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            return null;
        }
        if (buffer.readByte() != '*') {
            throw new ProtocolException("expected array");
        }
        final String header = Resp.readLine(buffer);
        if (header == null) {
            return null;
        }
        final int count = Resp.parseArrayLength(header);
        if (count <= 0) {
            return new RespRequest(KvBytes.EMPTY, List.of());
        }

        final List<KvBytes> parts = new ArrayList<>(Math.min(count, 16));
        for (int i = 0; i < count; i++) {
            if (!buffer.isReadable()) {
                return null;
            }
            final byte sigil = buffer.readByte();
            if (sigil != '$') {
                throw new ProtocolException("expected '$', got '" + (char) sigil + "'");
            }
            final String lengthLine = Resp.readLine(buffer);
            if (lengthLine == null) {
                return null;
            }
            final BulkString bulk = Resp.readBulkBody(buffer, Resp.parseBulkLength(lengthLine));
            if (bulk == null) {
                return null;
            }
            parts.add(bulk.isNull() ? KvBytes.EMPTY : bulk.getContent());
        }
        return new RespRequest(parts.get(0), parts.subList(1, parts.size()));
    }

    /**
     * 解码一条回复，恰好消费一个元素
     *
     * @param buffer 输入缓冲区
     * @return 回复，数据不完整时返回null
     */
    public static Resp decodeReply(final ByteBuf buffer) {
        return Resp.decode(buffer);
    }
}

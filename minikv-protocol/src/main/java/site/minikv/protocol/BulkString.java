package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.minikv.datastructure.KvBytes;

import java.nio.charset.StandardCharsets;

/**
 * 批量字符串，格式为 "$长度\r\n内容\r\n"
 *
 * <p>二进制安全，内容可以包含任意字节。长度为-1表示null，
 * 对应键不存在或条件写入未执行。
 *
 * <p>创建方式：
 * <ul>
 *     <li>{@link #wrapTrusted(byte[])} - 零拷贝，仅用于解码器等可信路径</li>
 *     <li>{@link #valueOf(KvBytes)} - 包装已有的不可变字节序列</li>
 *     <li>{@link #fromString(String)} - 按UTF-8编码字符串</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {

    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** null批量字符串 */
    public static final BulkString NULL = new BulkString(null);

    /** 内容，null表示空回复 */
    private final KvBytes content;

    public BulkString(final KvBytes content) {
        this.content = content;
    }

    public static BulkString valueOf(final KvBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return valueOf(KvBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        return valueOf(KvBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = content.getBytesUnsafe();
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeNumber(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String render() {
        if (content == null) {
            return "(nil)";
        }
        return "\"" + content.getString() + "\"";
    }

    /**
     * 内容的字符串形式，null回复返回null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}

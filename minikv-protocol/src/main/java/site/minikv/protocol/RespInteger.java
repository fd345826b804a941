package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * 整数回复，格式为 ":数字\r\n"
 *
 * <p>-1 到 10 之间的常用值使用缓存实例。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public class RespInteger extends Resp {

    private static final int CACHE_LOW = -2;

    private static final RespInteger[] CACHE = new RespInteger[13];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = valueOf(0);

    public static final RespInteger ONE = valueOf(1);

    private final long content;

    public RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法，小整数返回缓存实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value < CACHE_LOW + CACHE.length) {
            return CACHE[(int) (value - CACHE_LOW)];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeNumber(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String render() {
        return "(integer) " + content;
    }

    @Override
    public String toString() {
        return Long.toString(content);
    }
}

package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串，格式为 "+内容\r\n"
 *
 * <p>内容中不允许出现CR或LF，仅用于状态类回复。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {

    public static final SimpleString OK = new SimpleString("OK");

    public static final SimpleString PONG = new SimpleString("PONG");

    private final String content;

    public SimpleString(final String content) {
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("简单字符串不能包含换行: " + content);
        }
        this.content = content;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String render() {
        return content;
    }

    @Override
    public String toString() {
        return content;
    }
}

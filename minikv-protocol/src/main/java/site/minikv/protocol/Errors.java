package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误回复，格式为 "-内容\r\n"
 *
 * <p>内容以错误类别开头，如 {@code ERR}、{@code WRONGTYPE}。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {

    private final String content;

    public Errors(final String content) {
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String render() {
        return "(error) " + content;
    }

    @Override
    public String toString() {
        return content;
    }
}

package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 数组，格式为 "*数量\r\n" 后接各元素
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {

    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    public static final RespArray NULL = new RespArray((Resp[]) null);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public static RespArray valueOf(final List<? extends Resp> content) {
        return valueOf(content.toArray(new Resp[0]));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        byteBuf.writeByte('*');
        writeNumber(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    /**
     * 逐行编号输出，嵌套数组的后续行按编号宽度缩进
     */
    @Override
    public String render() {
        if (content == null) {
            return "(nil)";
        }
        if (content.length == 0) {
            return "(empty array)";
        }
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < content.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            final String prefix = (i + 1) + ") ";
            final String[] lines = content[i].render().split("\n", -1);
            sb.append(prefix).append(lines[0]);
            for (int j = 1; j < lines.length; j++) {
                sb.append('\n').append(" ".repeat(prefix.length())).append(lines[j]);
            }
        }
        return sb.toString();
    }
}

package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议基础类
 *
 * <p>所有回复类型的父类，负责按首字节分派解码，并约定编码与可读化两个抽象方法。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头，长度-1表示null</li>
 *     <li>数组 - 以"*"开头，元素递归解码</li>
 * </ul>
 *
 * <p>解码约定：数据不完整时返回null并把读索引恢复到调用前的位置，
 * 格式错误时抛出 {@link ProtocolException}。成功时恰好消费一个完整元素，
 * 因此同一连接上的多个回复可以依次解码。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {

    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 批量字符串最大长度 512MB */
    static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;

    /** 数组最大元素数量 */
    static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 单行（帧头、状态、错误）最大长度 */
    static final int PROTO_MAX_LINE_LEN = 64 * 1024;

    /**
     * 解码一个回复元素
     *
     * @param buffer 输入缓冲区
     * @return 解码结果，数据不完整时返回null
     * @throws ProtocolException 数据不符合RESP格式
     */
    public static Resp decode(final ByteBuf buffer) {
        final int initialIndex = buffer.readerIndex();
        final Resp resp = decodeElement(buffer);
        if (resp == null) {
            buffer.readerIndex(initialIndex);
        }
        return resp;
    }

    private static Resp decodeElement(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            return null;
        }
        final byte typeIndicator = buffer.readByte();
        final String line = readLine(buffer);
        if (line == null) {
            return null;
        }
        switch (typeIndicator) {
            case '+':
                return new SimpleString(line);
            case '-':
                return new Errors(line);
            case ':':
                return RespInteger.valueOf(parseNumber(line, "integer"));
            case '$':
                return readBulkBody(buffer, parseBulkLength(line));
            case '*': {
                final int count = parseArrayLength(line);
                if (count < 0) {
                    return RespArray.NULL;
                }
                if (count == 0) {
                    return RespArray.EMPTY;
                }
                final Resp[] elements = new Resp[count];
                for (int i = 0; i < count; i++) {
                    final Resp element = decodeElement(buffer);
                    if (element == null) {
                        return null;
                    }
                    elements[i] = element;
                }
                return new RespArray(elements);
            }
            default:
                log.warn("无法识别的RESP类型标识: 0x{}", Integer.toHexString(typeIndicator & 0xFF));
                throw new ProtocolException("unknown reply type '" + (char) typeIndicator + "'");
        }
    }

    /**
     * 读取到CRLF为止的一行，不包含CRLF
     *
     * @return 行内容，CRLF尚未到达时返回null（读索引已被推进，由调用方统一回滚）
     */
    static String readLine(final ByteBuf buffer) {
        final int start = buffer.readerIndex();
        final int searchEnd = Math.min(buffer.writerIndex(), start + PROTO_MAX_LINE_LEN + 1);
        final int cr = buffer.indexOf(start, searchEnd, (byte) '\r');
        if (cr < 0) {
            if (buffer.writerIndex() - start > PROTO_MAX_LINE_LEN) {
                throw new ProtocolException("line too long");
            }
            return null;
        }
        if (cr + 1 >= buffer.writerIndex()) {
            return null;
        }
        if (buffer.getByte(cr + 1) != '\n') {
            throw new ProtocolException("expected CRLF");
        }
        final String line = buffer.toString(start, cr - start, StandardCharsets.UTF_8);
        buffer.readerIndex(cr + 2);
        return line;
    }

    static long parseNumber(final String text, final String what) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid " + what + ": '" + text + "'", e);
        }
    }

    static int parseBulkLength(final String text) {
        final long length = parseNumber(text, "bulk length");
        if (length < -1 || length > PROTO_MAX_BULK_LEN) {
            throw new ProtocolException("invalid bulk length: " + length);
        }
        return (int) length;
    }

    static int parseArrayLength(final String text) {
        final long length = parseNumber(text, "multibulk length");
        if (length < -1 || length > PROTO_MAX_ARRAY_LEN) {
            throw new ProtocolException("invalid multibulk length: " + length);
        }
        return (int) length;
    }

    /**
     * 读取批量字符串的内容与结尾CRLF
     *
     * @param length 已解析的长度
     * @return 批量字符串，内容不完整时返回null
     */
    static BulkString readBulkBody(final ByteBuf buffer, final int length) {
        if (length == -1) {
            return BulkString.NULL;
        }
        if (buffer.readableBytes() < length + 2) {
            return null;
        }
        final byte[] content = new byte[length];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    /**
     * 写入线上格式
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 转换为便于人阅读的文本，供命令行客户端展示
     */
    public abstract String render();

    static void writeNumber(final ByteBuf byteBuf, final long value) {
        byteBuf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
    }
}

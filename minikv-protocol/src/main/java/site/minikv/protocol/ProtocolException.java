package site.minikv.protocol;

/**
 * 协议格式错误
 *
 * <p>帧头非法、长度不是数字、类型标识不符或缺少CRLF时抛出。
 * 出现该异常后连接上的字节流已经无法重新对齐，调用方应关闭连接。
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(final String message) {
        super(message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package site.minikv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 二进制安全的不可变字节序列
 *
 * <p>键、值、有序集合成员以及命令参数统一使用该类型表示，保证任意字节
 * （包括\r\n和非UTF-8序列）都能原样存储和比较。
 *
 * <p>设计要点：
 * <ul>
 *     <li>值语义 - equals/hashCode基于字节内容，可直接作为HashMap的键</li>
 *     <li>预计算哈希 - 构造时一次性计算，避免重复开销</li>
 *     <li>无符号字节序 - compareTo按无符号字节逐位比较，用于有序集合的同分排序</li>
 *     <li>受信任包装 - 协议层解码出的数组已归自己所有，可零拷贝包装</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
public final class KvBytes implements Comparable<KvBytes> {

    /** 默认字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节序列 */
    public static final KvBytes EMPTY = new KvBytes(new byte[0], true);

    /** 底层字节数组，构造后不再修改 */
    private final byte[] bytes;

    /** 预计算的哈希值 */
    private final int hashCode;

    /** 延迟计算的字符串形式 */
    private volatile String stringValue;

    /**
     * 安全构造：对传入数组做防御性拷贝
     *
     * @param bytes 字节数组，不能为null
     */
    public KvBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private KvBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝包装调用方不再修改的数组
     *
     * @param trustedBytes 受信任的字节数组
     * @return 包装后的实例，入参为null时返回null
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        if (trustedBytes.length == 0) {
            return EMPTY;
        }
        return new KvBytes(trustedBytes, true);
    }

    /**
     * 由UTF-8字符串创建
     *
     * @param str 字符串
     * @return 对应实例，入参为null时返回null
     */
    public static KvBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes result = new KvBytes(str.getBytes(CHARSET), true);
        result.stringValue = str;
        return result;
    }

    /**
     * 返回内容副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 直接返回底层数组，调用方不得修改
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 以UTF-8解码的字符串形式
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * ASCII大小写不敏感比较，用于命令名匹配
     *
     * @param other 另一个字节序列
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final KvBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    private static byte toLower(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 按无符号字节的字典序比较，前缀相同时较短者在前
     */
    @Override
    public int compareTo(final KvBytes other) {
        if (this == other) {
            return 0;
        }
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return getString();
    }
}

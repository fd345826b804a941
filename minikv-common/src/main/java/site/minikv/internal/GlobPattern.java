package site.minikv.internal;

import site.minikv.datastructure.KvBytes;

/**
 * KEYS命令使用的通配符匹配器
 *
 * <p>只支持两种通配符：
 * <ul>
 *     <li>{@code *} - 匹配任意长度（含空）的字节序列</li>
 *     <li>{@code ?} - 恰好匹配一个字节</li>
 * </ul>
 * 其余字节（包括 {@code [ ] ( ) . + ^ $ \} 等）都按字面量匹配，匹配总是锚定整个键。
 *
 * <p>模式在构造时编译为指令数组：0~255 表示字面字节，{@link #ANY_ONE} 与
 * {@link #ANY_RUN} 表示通配符，连续的 {@code *} 合并为一条。编译不会失败。
 * 实例不可变，可在线程间共享。
 *
 * @author minikv
 * @since 1.0.0
 */
public final class GlobPattern {

    private static final int ANY_ONE = -1;

    private static final int ANY_RUN = -2;

    private final int[] program;

    private final String source;

    private GlobPattern(final int[] program, final String source) {
        this.program = program;
        this.source = source;
    }

    /**
     * 编译模式
     *
     * @param pattern 模式字节
     * @return 编译结果
     */
    public static GlobPattern compile(final KvBytes pattern) {
        final byte[] raw = pattern.getBytesUnsafe();
        final int[] ops = new int[raw.length];
        int n = 0;
        for (final byte b : raw) {
            if (b == '*') {
                if (n > 0 && ops[n - 1] == ANY_RUN) {
                    continue;
                }
                ops[n++] = ANY_RUN;
            } else if (b == '?') {
                ops[n++] = ANY_ONE;
            } else {
                ops[n++] = b & 0xFF;
            }
        }
        final int[] program = new int[n];
        System.arraycopy(ops, 0, program, 0, n);
        return new GlobPattern(program, pattern.getString());
    }

    public static GlobPattern compile(final String pattern) {
        return compile(KvBytes.fromString(pattern));
    }

    /**
     * 整体匹配
     *
     * @param key 待匹配的键
     * @return 整个键都被模式覆盖时返回true
     */
    public boolean matches(final KvBytes key) {
        final byte[] text = key.getBytesUnsafe();
        int p = 0;
        int t = 0;
        // 最近一次 * 的位置以及它当前吞掉的文本末尾，用于回溯
        int starOp = -1;
        int starText = 0;

        while (t < text.length) {
            if (p < program.length && program[p] == ANY_RUN) {
                starOp = p++;
                starText = t;
            } else if (p < program.length
                    && (program[p] == ANY_ONE || program[p] == (text[t] & 0xFF))) {
                p++;
                t++;
            } else if (starOp >= 0) {
                p = starOp + 1;
                t = ++starText;
            } else {
                return false;
            }
        }
        while (p < program.length && program[p] == ANY_RUN) {
            p++;
        }
        return p == program.length;
    }

    /**
     * 模式不含任何通配符
     */
    public boolean isLiteral() {
        for (final int op : program) {
            if (op < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return source;
    }
}

package site.minikv.command;

import site.minikv.datastructure.KvBytes;

import java.util.Locale;

/**
 * 命令参数的数值转换
 *
 * @author minikv
 * @since 1.0.0
 */
public final class CommandArgs {

    private CommandArgs() {
    }

    /**
     * 解析64位有符号整数
     *
     * @throws CommandArgumentException 不是合法的十进制整数或超出范围
     */
    public static long parseLong(final KvBytes arg) {
        final String text = arg.getString();
        if (text.isEmpty() || text.charAt(0) == '+') {
            throw new CommandArgumentException(CommandArgumentException.NOT_AN_INTEGER);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new CommandArgumentException(CommandArgumentException.NOT_AN_INTEGER);
        }
    }

    /**
     * 解析分数，接受 inf/+inf/-inf，拒绝NaN
     *
     * @throws CommandArgumentException 不是合法的浮点数
     */
    public static double parseDouble(final KvBytes arg) {
        final String text = arg.getString();
        switch (text.toLowerCase(Locale.ROOT)) {
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (text.isEmpty() || !isPlainNumber(text)) {
            throw new CommandArgumentException(CommandArgumentException.NOT_A_FLOAT);
        }
        try {
            final double value = Double.parseDouble(text);
            if (Double.isNaN(value)) {
                throw new CommandArgumentException(CommandArgumentException.NOT_A_FLOAT);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new CommandArgumentException(CommandArgumentException.NOT_A_FLOAT);
        }
    }

    /**
     * 只允许数字、符号、小数点和指数，排除 Double.parseDouble 额外接受的
     * "NaN"、"Infinity"、十六进制以及 d/f 后缀
     */
    private static boolean isPlainNumber(final String text) {
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (!(c >= '0' && c <= '9') && c != '-' && c != '+' && c != '.' && c != 'e' && c != 'E') {
                return false;
            }
        }
        return true;
    }
}

package site.minikv.command;

/**
 * 命令参数校验失败，回复为 {@code -ERR <message>}
 *
 * @author minikv
 * @since 1.0.0
 */
public class CommandArgumentException extends RuntimeException {

    public static final String NOT_AN_INTEGER = "value is not an integer or out of range";

    public static final String NOT_A_FLOAT = "value is not a valid float";

    public static final String SYNTAX_ERROR = "syntax error";

    public CommandArgumentException(final String message) {
        super(message);
    }
}

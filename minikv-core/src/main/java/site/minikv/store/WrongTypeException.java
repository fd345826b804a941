package site.minikv.store;

/**
 * 对持有其他类型值的键执行了不匹配的操作
 *
 * @author minikv
 * @since 1.0.0
 */
public class WrongTypeException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}

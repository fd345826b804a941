package site.minikv.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.command.CommandArgumentException;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;
import site.minikv.protocol.SimpleString;
import site.minikv.store.KvStore;
import site.minikv.store.SetOptions;

import java.util.Locale;

/**
 * SET key value [NX|XX] [EX seconds]
 *
 * <p>选项大小写不敏感，顺序任意。NX与XX互斥；EX的秒数必须为正整数。
 * 条件不满足时回复null批量字符串。
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class Set implements Command {

    private final KvStore store;

    private KvBytes key;

    private KvBytes value;

    private SetOptions options;

    public Set(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
        value = request.arg(1);

        SetOptions.Condition condition = SetOptions.Condition.NONE;
        Long expireSeconds = null;
        for (int i = 2; i < request.argCount(); i++) {
            final String option = request.arg(i).getString().toUpperCase(Locale.ROOT);
            switch (option) {
                case "NX":
                case "XX": {
                    final SetOptions.Condition requested = SetOptions.Condition.valueOf(option);
                    if (condition != SetOptions.Condition.NONE && condition != requested) {
                        throw new CommandArgumentException(CommandArgumentException.SYNTAX_ERROR);
                    }
                    condition = requested;
                    break;
                }
                case "EX": {
                    if (expireSeconds != null || i + 1 >= request.argCount()) {
                        throw new CommandArgumentException(CommandArgumentException.SYNTAX_ERROR);
                    }
                    final long seconds = CommandArgs.parseLong(request.arg(++i));
                    if (seconds <= 0) {
                        throw new CommandArgumentException("invalid expire time in 'set' command");
                    }
                    expireSeconds = seconds;
                    break;
                }
                default:
                    throw new CommandArgumentException(CommandArgumentException.SYNTAX_ERROR);
            }
        }
        options = SetOptions.builder().condition(condition).expireSeconds(expireSeconds).build();
    }

    @Override
    public Resp handle() {
        if (store.set(key, value, options)) {
            return SimpleString.OK;
        }
        log.debug("SET {} 未执行: {}", key, options);
        return BulkString.NULL;
    }
}

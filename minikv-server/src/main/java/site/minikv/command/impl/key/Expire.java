package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

/**
 * EXPIRE key seconds
 *
 * <p>键存在回复1，否则回复0。秒数小于等于0时键立即过期。
 */
public class Expire implements Command {

    private final KvStore store;

    private KvBytes key;

    private long seconds;

    public Expire(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
        seconds = CommandArgs.parseLong(request.arg(1));
    }

    @Override
    public Resp handle() {
        return store.expire(key, seconds) ? RespInteger.ONE : RespInteger.ZERO;
    }
}

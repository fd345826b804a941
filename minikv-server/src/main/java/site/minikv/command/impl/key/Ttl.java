package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

/**
 * TTL key
 *
 * <p>回复 -2 表示键不存在，-1 表示未设置过期，否则为剩余秒数。
 */
public class Ttl implements Command {

    private final KvStore store;

    private KvBytes key;

    public Ttl(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(store.ttl(key));
    }
}

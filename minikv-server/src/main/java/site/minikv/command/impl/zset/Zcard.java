package site.minikv.command.impl.zset;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

public class Zcard implements Command {

    private final KvStore store;

    private KvBytes key;

    public Zcard(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(store.zcard(key));
    }
}

package site.minikv.command.impl.server;

import site.minikv.command.Command;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

/**
 * DBSIZE，回复未过期键的数量
 */
public class Dbsize implements Command {

    private final KvStore store;

    public Dbsize(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        // 无参数
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(store.dbsize());
    }
}

package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

public class Get implements Command {

    private final KvStore store;

    private KvBytes key;

    public Get(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
    }

    @Override
    public Resp handle() {
        return BulkString.valueOf(store.get(key));
    }
}

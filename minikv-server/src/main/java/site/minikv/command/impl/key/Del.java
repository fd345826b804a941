package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

import java.util.List;

/**
 * DEL key [key ...]，回复实际删除的键数量
 */
public class Del implements Command {

    private final KvStore store;

    private List<KvBytes> keys;

    public Del(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        keys = request.getArgs();
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(store.del(keys));
    }
}

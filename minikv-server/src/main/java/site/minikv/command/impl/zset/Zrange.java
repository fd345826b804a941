package site.minikv.command.impl.zset;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

import java.util.List;

/**
 * ZRANGE key start stop
 *
 * <p>下标从0开始，两端包含，负数从末尾倒数。
 */
public class Zrange implements Command {

    private final KvStore store;

    private KvBytes key;

    private long start;

    private long stop;

    public Zrange(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
        start = CommandArgs.parseLong(request.arg(1));
        stop = CommandArgs.parseLong(request.arg(2));
    }

    @Override
    public Resp handle() {
        final List<KvBytes> members = store.zrange(key, start, stop);
        final Resp[] content = new Resp[members.size()];
        for (int i = 0; i < content.length; i++) {
            content[i] = BulkString.valueOf(members.get(i));
        }
        return RespArray.valueOf(content);
    }
}

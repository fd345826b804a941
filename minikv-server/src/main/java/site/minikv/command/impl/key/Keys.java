package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

import java.util.List;

/**
 * KEYS pattern
 *
 * <p>模式只识别 {@code *} 和 {@code ?}，其余字符按字面匹配。
 */
public class Keys implements Command {

    private final KvStore store;

    private KvBytes pattern;

    public Keys(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        pattern = request.arg(0);
    }

    @Override
    public Resp handle() {
        final List<KvBytes> keys = store.keys(pattern);
        final Resp[] content = new Resp[keys.size()];
        for (int i = 0; i < content.length; i++) {
            content[i] = BulkString.valueOf(keys.get(i));
        }
        return RespArray.valueOf(content);
    }
}

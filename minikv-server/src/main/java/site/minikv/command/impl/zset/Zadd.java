package site.minikv.command.impl.zset;

import site.minikv.command.Command;
import site.minikv.command.CommandArgs;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;
import site.minikv.protocol.RespRequest;
import site.minikv.store.KvStore;

/**
 * ZADD key score member
 *
 * <p>新增成员回复1，更新已有成员的分数回复0。
 */
public class Zadd implements Command {

    private final KvStore store;

    private KvBytes key;

    private double score;

    private KvBytes member;

    public Zadd(final KvStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final RespRequest request) {
        key = request.arg(0);
        score = CommandArgs.parseDouble(request.arg(1));
        member = request.arg(2);
    }

    @Override
    public Resp handle() {
        return store.zadd(key, score, member) ? RespInteger.ONE : RespInteger.ZERO;
    }
}

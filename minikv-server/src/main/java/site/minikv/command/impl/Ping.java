package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespRequest;
import site.minikv.protocol.SimpleString;

/**
 * PING [message]
 *
 * <p>无参数时回复PONG，带参数时原样回显。
 */
public class Ping implements Command {

    private KvBytes message;

    @Override
    public void setContext(final RespRequest request) {
        message = request.argCount() == 1 ? request.arg(0) : null;
    }

    @Override
    public Resp handle() {
        if (message == null) {
            return SimpleString.PONG;
        }
        return BulkString.valueOf(message);
    }
}

package site.minikv.protocol;

import lombok.Getter;
import site.minikv.datastructure.KvBytes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 一条解码后的客户端请求
 *
 * <p>数组的第0个元素是命令名，其余为参数，全部保持原始字节。
 * 空数组解码为命令名为空、无参数的请求。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public final class RespRequest {

    private final KvBytes command;

    private final List<KvBytes> args;

    public RespRequest(final KvBytes command, final List<KvBytes> args) {
        this.command = command;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static RespRequest of(final String command, final String... args) {
        final List<KvBytes> list = new ArrayList<>(args.length);
        for (final String arg : args) {
            list.add(KvBytes.fromString(arg));
        }
        return new RespRequest(KvBytes.fromString(command), list);
    }

    /**
     * 大写形式的命令名，用于命令查找与错误消息
     */
    public String getCommandName() {
        return command.getString().toUpperCase(Locale.ROOT);
    }

    public int argCount() {
        return args.size();
    }

    public KvBytes arg(final int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return "RespRequest{" + command + " " + args + "}";
    }
}

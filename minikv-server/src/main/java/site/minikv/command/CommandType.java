package site.minikv.command;

import lombok.Getter;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.key.Del;
import site.minikv.command.impl.key.Expire;
import site.minikv.command.impl.key.Keys;
import site.minikv.command.impl.key.Ttl;
import site.minikv.command.impl.server.Dbsize;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.command.impl.zset.Zadd;
import site.minikv.command.impl.zset.Zcard;
import site.minikv.command.impl.zset.Zrange;
import site.minikv.datastructure.KvBytes;
import site.minikv.store.KvStore;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令类型枚举，定义了系统支持的所有命令及其参数个数规则
 *
 * <p>参数个数不包含命令名本身，{@code maxArgs} 为 -1 表示不限。
 * 命令名匹配大小写不敏感。
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    /** PING [message] */
    PING("PING", 0, 1),

    // ========== 字符串命令 ==========
    /** SET key value [NX|XX] [EX seconds] */
    SET("SET", 2, -1),
    /** GET key */
    GET("GET", 1, 1),

    // ========== 键命令 ==========
    /** DEL key [key ...] */
    DEL("DEL", 1, -1),
    /** KEYS pattern */
    KEYS("KEYS", 1, 1),
    /** EXPIRE key seconds */
    EXPIRE("EXPIRE", 2, 2),
    /** TTL key */
    TTL("TTL", 1, 1),

    // ========== 有序集合命令 ==========
    /** ZADD key score member */
    ZADD("ZADD", 3, 3),
    /** ZRANGE key start stop */
    ZRANGE("ZRANGE", 3, 3),
    /** ZCARD key */
    ZCARD("ZCARD", 1, 1),

    // ========== 服务器命令 ==========
    /** DBSIZE */
    DBSIZE("DBSIZE", 0, 0);

    /** 命令查找缓存，键为大写命令名 */
    private static final Map<KvBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    /** 命令名 */
    private final KvBytes commandBytes;

    private final int minArgs;

    private final int maxArgs;

    CommandType(final String commandName, final int minArgs, final int maxArgs) {
        this.commandBytes = KvBytes.fromString(commandName);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * 根据命令名查找命令类型
     *
     * @param commandBytes 命令名，大小写不敏感
     * @return 对应的CommandType，不存在时返回null
     */
    public static CommandType findByBytes(final KvBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        for (final CommandType type : values()) {
            if (type.commandBytes.equalsIgnoreCase(commandBytes)) {
                return type;
            }
        }
        return null;
    }

    /**
     * 检查参数个数
     *
     * @param argCount 不含命令名的参数个数
     */
    public boolean acceptsArgCount(final int argCount) {
        return argCount >= minArgs && (maxArgs < 0 || argCount <= maxArgs);
    }

    /**
     * 错误消息中使用的小写命令名
     */
    public String displayName() {
        return commandBytes.getString().toLowerCase(Locale.ROOT);
    }

    /**
     * 创建命令实例
     *
     * @param store 命令操作的存储
     * @return 新的命令实例
     */
    public Command createCommand(final KvStore store) {
        switch (this) {
            case PING:
                return new Ping();
            case SET:
                return new Set(store);
            case GET:
                return new Get(store);
            case DEL:
                return new Del(store);
            case KEYS:
                return new Keys(store);
            case EXPIRE:
                return new Expire(store);
            case TTL:
                return new Ttl(store);
            case ZADD:
                return new Zadd(store);
            case ZRANGE:
                return new Zrange(store);
            case ZCARD:
                return new Zcard(store);
            case DBSIZE:
                return new Dbsize(store);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}

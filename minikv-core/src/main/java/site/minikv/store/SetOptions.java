package site.minikv.store;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * SET命令的附加选项
 *
 * @author minikv
 * @since 1.0.0
 */
@Getter
@Builder
@ToString
public class SetOptions {

    /** 不带任何选项 */
    public static final SetOptions NONE = SetOptions.builder().build();

    /**
     * 写入条件
     */
    public enum Condition {
        /** 无条件写入 */
        NONE,
        /** 仅当键不存在时写入 */
        NX,
        /** 仅当键已存在时写入 */
        XX
    }

    @Builder.Default
    private final Condition condition = Condition.NONE;

    /** 过期秒数，null表示不设置过期（同时清除旧的过期时间） */
    private final Long expireSeconds;

    public boolean hasExpire() {
        return expireSeconds != null;
    }
}

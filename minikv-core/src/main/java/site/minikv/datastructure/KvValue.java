package site.minikv.datastructure;

/**
 * 键空间中的值
 *
 * <p>过期时间保存在值自身上，键被删除或覆盖时过期信息随之消失。
 * 实现类不是线程安全的，由存储层的读写锁保护。
 *
 * @author minikv
 * @since 1.0.0
 */
public interface KvValue {

    /** 永不过期 */
    long NO_EXPIRE = -1L;

    /**
     * 过期时间
     *
     * @return 过期时间戳（毫秒），-1表示永不过期
     */
    long expireAt();

    /**
     * 设置过期时间
     *
     * @param expireAt 过期时间戳（毫秒），-1表示永不过期
     */
    void setExpireAt(long expireAt);

    /**
     * 在给定时刻是否已过期，到达过期时间的那一毫秒即视为过期
     *
     * @param now 当前时间戳（毫秒）
     */
    default boolean isExpiredAt(final long now) {
        final long expireAt = expireAt();
        return expireAt != NO_EXPIRE && now >= expireAt;
    }

    /**
     * 类型名，用于日志
     */
    String typeName();
}

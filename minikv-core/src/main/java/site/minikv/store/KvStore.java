package site.minikv.store;

import site.minikv.datastructure.KvBytes;

import java.util.Collection;
import java.util.List;

/**
 * 键值存储操作接口
 *
 * <p>所有方法都是线程安全的。每个操作相对其他操作是原子的：
 * 读操作看到的要么是某个写操作之前的状态，要么是之后的状态。
 * 过期采用惰性策略，访问时发现已过期的键视为不存在并被删除。
 *
 * <p>对持有其他类型值的键执行类型不匹配的读写会抛出 {@link WrongTypeException}。
 *
 * @author minikv
 * @since 1.0.0
 */
public interface KvStore {

    /**
     * 写入字符串值
     *
     * @param key     键
     * @param value   值
     * @param options 写入条件与过期设置
     * @return 实际写入返回true，NX/XX条件不满足时返回false
     */
    boolean set(KvBytes key, KvBytes value, SetOptions options);

    /**
     * 读取字符串值
     *
     * @param key 键
     * @return 值，键不存在或已过期时返回null
     */
    KvBytes get(KvBytes key);

    /**
     * 删除键
     *
     * @param keys 待删除的键，重复的键只计一次
     * @return 实际删除的键数量
     */
    long del(Collection<KvBytes> keys);

    /**
     * 按通配符列出键
     *
     * @param pattern 支持 {@code *} 与 {@code ?} 的模式
     * @return 匹配的未过期键，顺序不保证
     */
    List<KvBytes> keys(KvBytes pattern);

    /**
     * 设置过期时间
     *
     * @param key     键
     * @param seconds 秒数，小于等于0时键立即过期
     * @return 键存在返回true
     */
    boolean expire(KvBytes key, long seconds);

    /**
     * 剩余生存时间
     *
     * @param key 键
     * @return -2 键不存在，-1 未设置过期，否则为四舍五入后的剩余秒数
     */
    long ttl(KvBytes key);

    /**
     * 向有序集合添加成员或更新分数
     *
     * @return 新增成员返回true
     */
    boolean zadd(KvBytes key, double score, KvBytes member);

    /**
     * 按排名区间读取有序集合成员，两端包含，支持负数下标
     *
     * @return 成员列表，键不存在时为空
     */
    List<KvBytes> zrange(KvBytes key, long start, long stop);

    /**
     * 有序集合的成员数量，键不存在时为0
     */
    long zcard(KvBytes key);

    /**
     * 未过期键的数量
     */
    long dbsize();
}

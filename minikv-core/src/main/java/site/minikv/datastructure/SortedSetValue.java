package site.minikv.datastructure;

import site.minikv.internal.SkipList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 有序集合值
 *
 * <p>使用双重数据结构实现O(1)的成员查找和O(log N)的排名查询：
 * <ul>
 *     <li>memberScores: 成员到分数的映射，保证成员唯一</li>
 *     <li>skipList: 按 (分数, 成员字节序) 排序的跳表</li>
 * </ul>
 * 两者始终包含相同的成员集合。
 *
 * @author minikv
 * @since 1.0.0
 */
public class SortedSetValue implements KvValue {

    private final Map<KvBytes, Double> memberScores = new HashMap<>();

    private final SkipList<KvBytes> skipList = new SkipList<>();

    private long expireAt = NO_EXPIRE;

    /**
     * 添加成员或更新已有成员的分数
     *
     * @param member 成员
     * @param score  分数，调用方保证不是NaN
     * @return 新增成员返回true，更新已有成员返回false
     */
    public boolean add(final KvBytes member, final double score) {
        final Double previous = memberScores.put(member, score);
        if (previous != null) {
            if (Double.compare(previous, score) == 0) {
                return false;
            }
            // 分数变化需要在跳表中重新定位
            skipList.delete(previous, member);
            skipList.insert(score, member);
            return false;
        }
        skipList.insert(score, member);
        return true;
    }

    /**
     * 成员的分数
     *
     * @return 分数，成员不存在时返回null
     */
    public Double score(final KvBytes member) {
        return memberScores.get(member);
    }

    public int size() {
        return memberScores.size();
    }

    /**
     * 按排名区间取成员，两端都包含
     *
     * <p>负数下标从末尾倒数，-1为最后一个。换算后截断到 [0, size-1]，
     * 起点大于终点时返回空列表。
     *
     * @param start 起始下标
     * @param stop  结束下标
     * @return 按 (分数, 成员) 升序排列的成员
     */
    public List<KvBytes> range(long start, long stop) {
        final int size = size();
        if (size == 0) {
            return Collections.emptyList();
        }
        if (start < 0) {
            start += size;
        }
        if (stop < 0) {
            stop += size;
        }
        if (start < 0) {
            start = 0;
        }
        if (stop >= size) {
            stop = size - 1L;
        }
        if (start > stop || start >= size) {
            return Collections.emptyList();
        }

        final List<SkipList.Node<KvBytes>> nodes = skipList.rangeByRank(start, stop);
        final List<KvBytes> members = new ArrayList<>(nodes.size());
        for (final SkipList.Node<KvBytes> node : nodes) {
            members.add(node.getMember());
        }
        return members;
    }

    @Override
    public long expireAt() {
        return expireAt;
    }

    @Override
    public void setExpireAt(final long expireAt) {
        this.expireAt = expireAt;
    }

    @Override
    public String typeName() {
        return "zset";
    }
}

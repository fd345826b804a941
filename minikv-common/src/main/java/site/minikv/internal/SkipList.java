package site.minikv.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 带跨度的跳表，有序集合的排序索引
 *
 * <p>节点按 (score, member) 排序：分数使用 {@link Double#compare} 做数值比较，
 * 分数相同时按成员自身的 {@link Comparable} 顺序比较。每层指针记录跨度，
 * 因此可以在 O(log n) 内定位任意排名。
 *
 * <p>非线程安全，由上层的存储锁保护。
 *
 * @param <T> 成员类型
 * @author minikv
 * @since 1.0.0
 */
public class SkipList<T extends Comparable<T>> {

    /** 最大层数 */
    private static final int MAX_LEVEL = 32;

    /** 层数增长概率 */
    private static final double P = 0.25;

    /** 头节点，不携带数据 */
    private final Node<T> head;

    /** 当前最高层数 */
    private int level;

    /** 节点数量 */
    private int size;

    /**
     * 跳表节点
     *
     * @param <T> 成员类型
     */
    public static final class Node<T> {
        private final double score;
        private final T member;
        private final Node<T>[] forward;
        private final long[] span;

        @SuppressWarnings("unchecked")
        private Node(final int level, final double score, final T member) {
            this.score = score;
            this.member = member;
            this.forward = new Node[level];
            this.span = new long[level];
        }

        public T getMember() {
            return member;
        }
    }

    public SkipList() {
        this.head = new Node<>(MAX_LEVEL, Double.NEGATIVE_INFINITY, null);
        this.level = 1;
        this.size = 0;
    }

    public int size() {
        return size;
    }

    /**
     * 判断节点是否排在 (score, member) 之前
     */
    private boolean precedes(final Node<T> node, final double score, final T member) {
        final int byScore = Double.compare(node.score, score);
        if (byScore != 0) {
            return byScore < 0;
        }
        return node.member.compareTo(member) < 0;
    }

    /**
     * 插入节点，调用方保证同一成员不会重复插入
     *
     * @param score  分数
     * @param member 成员
     */
    @SuppressWarnings("unchecked")
    public void insert(final double score, final T member) {
        final Node<T>[] update = new Node[MAX_LEVEL];
        final long[] rank = new long[MAX_LEVEL];

        // 1. 自顶向下查找每层的前驱，同时累计排名
        Node<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            rank[i] = i == level - 1 ? 0 : rank[i + 1];
            while (x.forward[i] != null && precedes(x.forward[i], score, member)) {
                rank[i] += x.span[i];
                x = x.forward[i];
            }
            update[i] = x;
        }

        // 2. 新层的前驱为头节点，跨度覆盖整个跳表
        final int newLevel = randomLevel();
        if (newLevel > level) {
            for (int i = level; i < newLevel; i++) {
                rank[i] = 0;
                update[i] = head;
                head.span[i] = size;
            }
            level = newLevel;
        }

        // 3. 接入新节点并修正跨度
        final Node<T> node = new Node<>(newLevel, score, member);
        for (int i = 0; i < newLevel; i++) {
            node.forward[i] = update[i].forward[i];
            update[i].forward[i] = node;
            node.span[i] = update[i].span[i] - (rank[0] - rank[i]);
            update[i].span[i] = rank[0] - rank[i] + 1;
        }
        for (int i = newLevel; i < level; i++) {
            update[i].span[i]++;
        }
        size++;
    }

    /**
     * 删除指定节点
     *
     * @param score  节点当前分数
     * @param member 成员
     * @return 找到并删除返回true
     */
    @SuppressWarnings("unchecked")
    public boolean delete(final double score, final T member) {
        final Node<T>[] update = new Node[MAX_LEVEL];
        Node<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            while (x.forward[i] != null && precedes(x.forward[i], score, member)) {
                x = x.forward[i];
            }
            update[i] = x;
        }

        x = x.forward[0];
        if (x == null || Double.compare(x.score, score) != 0 || !x.member.equals(member)) {
            return false;
        }

        for (int i = 0; i < level; i++) {
            if (update[i].forward[i] == x) {
                update[i].span[i] += x.span[i] - 1;
                update[i].forward[i] = x.forward[i];
            } else {
                update[i].span[i]--;
            }
        }
        while (level > 1 && head.forward[level - 1] == null) {
            level--;
        }
        size--;
        return true;
    }

    /**
     * 按排名区间取节点，排名从0开始，两端都包含
     *
     * <p>调用方负责把负数下标换算并截断到 [0, size-1]；越界部分被忽略。
     *
     * @param start 起始排名
     * @param stop  结束排名
     * @return 按顺序排列的节点
     */
    public List<Node<T>> rangeByRank(final long start, final long stop) {
        final List<Node<T>> result = new ArrayList<>();
        if (start < 0 || start > stop || start >= size) {
            return result;
        }

        // 利用跨度跳到第 start 个节点之前
        long traversed = 0;
        Node<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            while (x.forward[i] != null && traversed + x.span[i] <= start) {
                traversed += x.span[i];
                x = x.forward[i];
            }
        }

        x = x.forward[0];
        long rank = start;
        while (x != null && rank <= stop) {
            result.add(x);
            x = x.forward[0];
            rank++;
        }
        return result;
    }

    private int randomLevel() {
        int newLevel = 1;
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        while (random.nextDouble() < P && newLevel < MAX_LEVEL) {
            newLevel++;
        }
        return newLevel;
    }
}

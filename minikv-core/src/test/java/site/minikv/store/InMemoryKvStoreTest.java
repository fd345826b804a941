package site.minikv.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.datastructure.KvBytes;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryKvStore单元测试")
class InMemoryKvStoreTest {

    private ManualClock clock;
    private InMemoryKvStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000_000L);
        store = new InMemoryKvStore(clock);
    }

    private static KvBytes b(final String s) {
        return KvBytes.fromString(s);
    }

    private static List<String> strings(final List<KvBytes> list) {
        return list.stream().map(KvBytes::getString).collect(Collectors.toList());
    }

    private static SetOptions ex(final long seconds) {
        return SetOptions.builder().expireSeconds(seconds).build();
    }

    @Test
    @DisplayName("SET后GET返回原值，覆盖后返回新值")
    void testSetGet() {
        assertThat(store.set(b("k"), b("v1"), SetOptions.NONE)).isTrue();
        assertThat(store.get(b("k"))).isEqualTo(b("v1"));

        store.set(b("k"), b("v2"), SetOptions.NONE);
        assertThat(store.get(b("k"))).isEqualTo(b("v2"));
        assertThat(store.get(b("missing"))).isNull();
    }

    @Test
    @DisplayName("二进制值与空值原样保存")
    void testBinaryAndEmptyValues() {
        final byte[] binary = {0, '\r', '\n', (byte) 0xFF};
        store.set(b("bin"), new KvBytes(binary), SetOptions.NONE);
        store.set(b("empty"), KvBytes.EMPTY, SetOptions.NONE);

        assertThat(store.get(b("bin")).getBytes()).containsExactly(binary);
        assertThat(store.get(b("empty"))).isEqualTo(KvBytes.EMPTY);
        assertThat(store.ttl(b("empty"))).isEqualTo(-1);
    }

    @Test
    @DisplayName("NX只在键不存在时写入，XX只在键存在时写入")
    void testSetConditions() {
        final SetOptions nx = SetOptions.builder().condition(SetOptions.Condition.NX).build();
        final SetOptions xx = SetOptions.builder().condition(SetOptions.Condition.XX).build();

        assertThat(store.set(b("k"), b("a"), xx)).isFalse();
        assertThat(store.get(b("k"))).isNull();

        assertThat(store.set(b("k"), b("a"), nx)).isTrue();
        assertThat(store.set(b("k"), b("b"), nx)).isFalse();
        assertThat(store.get(b("k"))).isEqualTo(b("a"));

        assertThat(store.set(b("k"), b("c"), xx)).isTrue();
        assertThat(store.get(b("k"))).isEqualTo(b("c"));
    }

    @Test
    @DisplayName("NX把已过期的键视为不存在")
    void testNxOnExpiredKey() {
        store.set(b("k"), b("old"), ex(1));
        clock.advanceSeconds(1);

        final SetOptions nx = SetOptions.builder().condition(SetOptions.Condition.NX).build();
        assertThat(store.set(b("k"), b("new"), nx)).isTrue();
        assertThat(store.get(b("k"))).isEqualTo(b("new"));
    }

    @Test
    @DisplayName("SET EX设置过期，到期那一刻起键不可见")
    void testSetWithExpire() {
        store.set(b("k"), b("v"), ex(10));
        assertThat(store.ttl(b("k"))).isEqualTo(10);

        clock.advanceMillis(9_999);
        assertThat(store.get(b("k"))).isEqualTo(b("v"));

        clock.advanceMillis(1);
        assertThat(store.get(b("k"))).isNull();
        assertThat(store.ttl(b("k"))).isEqualTo(-2);
        assertThat(store.dbsize()).isZero();
    }

    @Test
    @DisplayName("不带EX的SET清除旧的过期时间")
    void testPlainSetClearsTtl() {
        store.set(b("k"), b("v"), ex(5));
        store.set(b("k"), b("v2"), SetOptions.NONE);

        assertThat(store.ttl(b("k"))).isEqualTo(-1);
        clock.advanceSeconds(10);
        assertThat(store.get(b("k"))).isEqualTo(b("v2"));
    }

    @Test
    @DisplayName("DEL返回实际删除数量，重复键只计一次")
    void testDel() {
        store.set(b("a"), b("1"), SetOptions.NONE);
        store.set(b("b"), b("2"), SetOptions.NONE);

        assertThat(store.del(List.of(b("a"), b("b"), b("c"), b("a")))).isEqualTo(2);
        assertThat(store.get(b("a"))).isNull();
        assertThat(store.del(List.of(b("a")))).isZero();
    }

    @Test
    @DisplayName("DEL不计入已过期的键，并清除其过期信息")
    void testDelExpiredKeyAndTtlCleared() {
        store.set(b("gone"), b("1"), ex(1));
        clock.advanceSeconds(2);
        assertThat(store.del(List.of(b("gone")))).isZero();

        store.set(b("k"), b("v"), ex(100));
        store.del(List.of(b("k")));
        store.set(b("k"), b("v"), SetOptions.NONE);
        assertThat(store.ttl(b("k"))).isEqualTo(-1);
    }

    @Test
    @DisplayName("KEYS支持*和?，其他字符按字面匹配")
    void testKeys() {
        for (final String key : new String[]{"user:1", "user:2", "user:10", "order:1", "a.b", "axb"}) {
            store.set(b(key), b("x"), SetOptions.NONE);
        }

        assertThat(strings(store.keys(b("user:*")))).containsExactlyInAnyOrder("user:1", "user:2", "user:10");
        assertThat(strings(store.keys(b("user:?")))).containsExactlyInAnyOrder("user:1", "user:2");
        assertThat(strings(store.keys(b("*")))).hasSize(6);
        assertThat(strings(store.keys(b("a.b")))).containsExactly("a.b");
        assertThat(strings(store.keys(b("nothing")))).isEmpty();
    }

    @Test
    @DisplayName("KEYS跳过已过期的键")
    void testKeysSkipsExpired() {
        store.set(b("live"), b("1"), SetOptions.NONE);
        store.set(b("dying"), b("2"), ex(1));
        store.zadd(b("zdying"), 1, b("m"));
        store.expire(b("zdying"), 1);

        clock.advanceSeconds(1);

        assertThat(strings(store.keys(b("*")))).containsExactly("live");
        assertThat(store.keys(b("dying"))).isEmpty();
        assertThat(store.dbsize()).isEqualTo(1);
    }

    @Test
    @DisplayName("EXPIRE对不存在的键返回false，非正秒数立即过期")
    void testExpire() {
        assertThat(store.expire(b("missing"), 10)).isFalse();

        store.set(b("k"), b("v"), SetOptions.NONE);
        assertThat(store.expire(b("k"), 10)).isTrue();
        assertThat(store.ttl(b("k"))).isEqualTo(10);

        assertThat(store.expire(b("k"), 20)).isTrue();
        assertThat(store.ttl(b("k"))).isEqualTo(20);

        assertThat(store.expire(b("k"), 0)).isTrue();
        assertThat(store.get(b("k"))).isNull();
        assertThat(store.ttl(b("k"))).isEqualTo(-2);
        assertThat(store.expire(b("k"), 10)).isFalse();
    }

    @Test
    @DisplayName("TTL按四舍五入返回剩余秒数")
    void testTtlRounding() {
        store.set(b("k"), b("v"), ex(10));
        clock.advanceMillis(1_400);
        assertThat(store.ttl(b("k"))).isEqualTo(9);
        clock.advanceMillis(200);
        assertThat(store.ttl(b("k"))).isEqualTo(8);
        assertThat(store.ttl(b("missing"))).isEqualTo(-2);
    }

    @Test
    @DisplayName("ZADD新增与更新，ZRANGE按分数排序")
    void testZaddZrange() {
        assertThat(store.zadd(b("z"), 2, b("b"))).isTrue();
        assertThat(store.zadd(b("z"), 1, b("a"))).isTrue();
        assertThat(store.zadd(b("z"), 3, b("c"))).isTrue();
        assertThat(store.zadd(b("z"), 0, b("c"))).isFalse();

        assertThat(store.zcard(b("z"))).isEqualTo(3);
        assertThat(strings(store.zrange(b("z"), 0, -1))).containsExactly("c", "a", "b");
        assertThat(strings(store.zrange(b("z"), -2, -1))).containsExactly("a", "b");
        assertThat(store.zrange(b("z"), 2, 1)).isEmpty();
        assertThat(store.zrange(b("missing"), 0, -1)).isEmpty();
        assertThat(store.zcard(b("missing"))).isZero();
    }

    @Test
    @DisplayName("有序集合可以设置过期")
    void testSortedSetExpire() {
        store.zadd(b("z"), 1, b("a"));
        assertThat(store.ttl(b("z"))).isEqualTo(-1);
        assertThat(store.expire(b("z"), 5)).isTrue();

        clock.advanceSeconds(5);
        assertThat(store.zrange(b("z"), 0, -1)).isEmpty();
        assertThat(store.zcard(b("z"))).isZero();

        assertThat(store.zadd(b("z"), 1, b("fresh"))).isTrue();
        assertThat(store.ttl(b("z"))).isEqualTo(-1);
    }

    @Test
    @DisplayName("类型不匹配时抛出WrongTypeException，SET可以覆盖任意类型")
    void testWrongType() {
        store.set(b("s"), b("v"), SetOptions.NONE);
        store.zadd(b("z"), 1, b("m"));

        assertThatThrownBy(() -> store.zadd(b("s"), 1, b("m")))
                .isInstanceOf(WrongTypeException.class)
                .hasMessage(WrongTypeException.MESSAGE);
        assertThatThrownBy(() -> store.zrange(b("s"), 0, -1)).isInstanceOf(WrongTypeException.class);
        assertThatThrownBy(() -> store.zcard(b("s"))).isInstanceOf(WrongTypeException.class);
        assertThatThrownBy(() -> store.get(b("z"))).isInstanceOf(WrongTypeException.class);

        assertThat(store.get(b("s"))).isEqualTo(b("v"));

        assertThat(store.set(b("z"), b("now-a-string"), SetOptions.NONE)).isTrue();
        assertThat(store.get(b("z"))).isEqualTo(b("now-a-string"));
    }

    @Test
    @DisplayName("DBSIZE统计字符串和有序集合")
    void testDbsize() {
        assertThat(store.dbsize()).isZero();
        store.set(b("a"), b("1"), SetOptions.NONE);
        store.zadd(b("z"), 1, b("m"));
        store.zadd(b("z"), 2, b("n"));
        assertThat(store.dbsize()).isEqualTo(2);
    }
}

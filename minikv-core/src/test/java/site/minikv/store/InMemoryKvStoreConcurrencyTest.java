package site.minikv.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.datastructure.KvBytes;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryKvStore并发测试")
class InMemoryKvStoreConcurrencyTest {

    private static final int THREADS = 8;
    private static final int OPERATIONS_PER_THREAD = 500;

    @Test
    @DisplayName("多线程写入互不相交的键，结果与串行执行一致")
    void testDisjointWriters() throws Exception {
        final InMemoryKvStore store = new InMemoryKvStore();
        final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < THREADS; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    final KvBytes zkey = KvBytes.fromString("z-" + thread);
                    for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
                        final KvBytes key = KvBytes.fromString("k-" + thread + "-" + i);
                        store.set(key, KvBytes.fromString(Integer.toString(i)), SetOptions.NONE);
                        store.zadd(zkey, i, key);
                        // 读操作与其他线程的写操作交错
                        assertThat(store.get(key)).isEqualTo(KvBytes.fromString(Integer.toString(i)));
                        store.keys(KvBytes.fromString("k-" + thread + "-1?"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (final Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.dbsize()).isEqualTo((long) THREADS * OPERATIONS_PER_THREAD + THREADS);
        for (int t = 0; t < THREADS; t++) {
            final KvBytes zkey = KvBytes.fromString("z-" + t);
            assertThat(store.zcard(zkey)).isEqualTo(OPERATIONS_PER_THREAD);
            final List<KvBytes> ordered = store.zrange(zkey, 0, -1);
            assertThat(ordered.get(0).getString()).isEqualTo("k-" + t + "-0");
            assertThat(ordered.get(ordered.size() - 1).getString())
                    .isEqualTo("k-" + t + "-" + (OPERATIONS_PER_THREAD - 1));
        }
    }

    @Test
    @DisplayName("并发ZADD同一成员不会重复计数")
    void testConcurrentUpsertSameMember() throws Exception {
        final InMemoryKvStore store = new InMemoryKvStore();
        final KvBytes key = KvBytes.fromString("board");
        final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        final List<Future<Integer>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < THREADS; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    int added = 0;
                    for (int i = 0; i < 100; i++) {
                        if (store.zadd(key, thread * 100 + i, KvBytes.fromString("m" + i))) {
                            added++;
                        }
                    }
                    return added;
                }));
            }
            int totalAdded = 0;
            for (final Future<Integer> future : futures) {
                totalAdded += future.get(30, TimeUnit.SECONDS);
            }
            assertThat(totalAdded).isEqualTo(100);
        } finally {
            executor.shutdownNow();
        }
        assertThat(store.zcard(key)).isEqualTo(100);
    }
}

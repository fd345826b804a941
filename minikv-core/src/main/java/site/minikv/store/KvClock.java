package site.minikv.store;

/**
 * 时间来源，测试中可替换为手动推进的时钟
 *
 * @author minikv
 * @since 1.0.0
 */
@FunctionalInterface
public interface KvClock {

    KvClock SYSTEM = System::currentTimeMillis;

    /**
     * @return 当前时间戳（毫秒）
     */
    long currentTimeMillis();
}

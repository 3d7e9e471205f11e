package jwksclient.core.port.out;

/**
 * Port for recording key set cache metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface JwksMetrics {

    /**
     * Record a lookup answered from a fresh cached key set.
     */
    void recordCacheHit();

    /**
     * Record a fetch against the key source.
     *
     * @param success    whether the fetch produced a key set
     * @param durationMs time spent fetching in milliseconds
     */
    void recordFetch(boolean success, long durationMs);

    /**
     * Record a refresh request that joined a fetch already in flight or found the entry already replaced.
     */
    void recordCoalescedRefresh();

    /**
     * Record a lookup answered with an expired key because refreshing did not yield a usable one.
     */
    void recordStaleKeyServed();

    /**
     * Metrics sink that discards everything.
     */
    static JwksMetrics noop() {
        return NoopJwksMetrics.INSTANCE;
    }

    /**
     * No-op implementation used when metrics are not configured.
     */
    final class NoopJwksMetrics implements JwksMetrics {

        private static final NoopJwksMetrics INSTANCE = new NoopJwksMetrics();

        private NoopJwksMetrics() {}

        @Override
        public void recordCacheHit() {}

        @Override
        public void recordFetch(boolean success, long durationMs) {}

        @Override
        public void recordCoalescedRefresh() {}

        @Override
        public void recordStaleKeyServed() {}
    }
}

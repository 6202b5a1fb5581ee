package storie.runtime.interpreter.cache;

/**
 * 缓存统计快照
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long evictionCount;
    private final double hitRate;
    private final long size;
    private final long maximumSize;

    public CacheStats(long hitCount, long missCount, long loadSuccessCount, long loadFailureCount,
                      long evictionCount, double hitRate, long size, long maximumSize) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.evictionCount = evictionCount;
        this.hitRate = hitRate;
        this.size = size;
        this.maximumSize = maximumSize;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getRequestCount() { return hitCount + missCount; }

    /** 成功编译并放入缓存的次数 */
    public long getLoadSuccessCount() { return loadSuccessCount; }

    /** 编译失败（未缓存）的次数 */
    public long getLoadFailureCount() { return loadFailureCount; }

    public long getEvictionCount() { return evictionCount; }
    public double getHitRate() { return hitRate; }
    public long getSize() { return size; }
    public long getMaximumSize() { return maximumSize; }

    @Override
    public String toString() {
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, failures=%d, evictions=%d, size=%d/%d",
                hitCount, missCount, hitRate * 100, loadFailureCount, evictionCount, size, maximumSize);
    }
}

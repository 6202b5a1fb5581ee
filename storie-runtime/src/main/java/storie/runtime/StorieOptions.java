package storie.runtime;

/**
 * 运行时选项
 *
 * <p>控制解释器的资源限制与编译缓存。实例不可变，通过 {@link Builder} 构建。</p>
 *
 * <pre>
 * StorieRuntime rt = StorieRuntime.init(StorieOptions.sandboxed());
 *
 * StorieOptions opts = StorieOptions.builder()
 *     .maxRecursionDepth(64)
 *     .programCacheSize(0)
 *     .build();
 * </pre>
 */
public final class StorieOptions {

    public static final int DEFAULT_PROGRAM_CACHE_SIZE = 256;

    private final int maxRecursionDepth;     // 0=无限制
    private final long maxLoopIterations;    // 0=无限制
    private final int programCacheSize;      // 0=禁用

    private StorieOptions(Builder builder) {
        this.maxRecursionDepth = builder.maxRecursionDepth;
        this.maxLoopIterations = builder.maxLoopIterations;
        this.programCacheSize = builder.programCacheSize;
    }

    // ============ 预定义工厂方法 ============

    /** 默认：无资源限制，启用编译缓存 */
    public static StorieOptions defaults() {
        return builder().build();
    }

    /** 沙箱：限制递归深度与单个循环的迭代次数 */
    public static StorieOptions sandboxed() {
        return builder()
                .maxRecursionDepth(256)
                .maxLoopIterations(1_000_000)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============ 查询方法 ============

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public long getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public int getProgramCacheSize() {
        return programCacheSize;
    }

    public boolean isProgramCacheEnabled() {
        return programCacheSize > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRecursionDepth(maxRecursionDepth)
                .maxLoopIterations(maxLoopIterations)
                .programCacheSize(programCacheSize);
    }

    @Override
    public String toString() {
        return "StorieOptions{maxRecursionDepth=" + maxRecursionDepth
                + ", maxLoopIterations=" + maxLoopIterations
                + ", programCacheSize=" + programCacheSize + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private int maxRecursionDepth = 0;
        private long maxLoopIterations = 0;
        private int programCacheSize = DEFAULT_PROGRAM_CACHE_SIZE;

        private Builder() {
        }

        public Builder maxRecursionDepth(int depth) {
            if (depth < 0) {
                throw new IllegalArgumentException("maxRecursionDepth must not be negative");
            }
            this.maxRecursionDepth = depth;
            return this;
        }

        public Builder maxLoopIterations(long maxIter) {
            if (maxIter < 0) {
                throw new IllegalArgumentException("maxLoopIterations must not be negative");
            }
            this.maxLoopIterations = maxIter;
            return this;
        }

        public Builder programCacheSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("programCacheSize must not be negative");
            }
            this.programCacheSize = size;
            return this;
        }

        public StorieOptions build() {
            return new StorieOptions(this);
        }
    }
}

package storie.runtime;

/**
 * Storie 整数值（64 位）
 */
public final class StorieInt extends StorieValue {

    // 小整数缓存（循环变量、坐标等常见范围）
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final StorieInt[] CACHE = new StorieInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new StorieInt(CACHE_LOW + i);
        }
    }

    /** 获取 StorieInt 实例，优先从缓存取 */
    public static StorieInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new StorieInt(value);
    }

    private final long value;

    private StorieInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value != 0;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

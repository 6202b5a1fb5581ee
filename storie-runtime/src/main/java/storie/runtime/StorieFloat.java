package storie.runtime;

/**
 * Storie 浮点值（64 位）
 *
 * <p>所有二元算术运算的结果都是浮点值。</p>
 */
public final class StorieFloat extends StorieValue {

    private static final StorieFloat ZERO = new StorieFloat(0.0);
    private static final StorieFloat ONE = new StorieFloat(1.0);

    /** 获取 StorieFloat 实例，常见值从缓存取 */
    public static StorieFloat of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) return ZERO;
        if (value == 1.0) return ONE;
        return new StorieFloat(value);
    }

    private final double value;

    private StorieFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Float";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public long asLong() {
        return (long) value;
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

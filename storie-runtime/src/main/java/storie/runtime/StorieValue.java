package storie.runtime;

/**
 * Storie 运行时值的基类
 *
 * <p>取值种类：nil、整数、浮点数、布尔、字符串、函数（原生或用户定义）。</p>
 */
public abstract class StorieValue {

    /**
     * 将 Java 值转换为 StorieValue
     *
     * <p>支持 null、StorieValue、整数类（Integer/Long/Short/Byte）、浮点类（Double/Float）、Boolean、CharSequence。</p>
     */
    public static StorieValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return StorieNull.NIL;
        }
        if (javaValue instanceof StorieValue) {
            return (StorieValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return StorieInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return StorieFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return StorieBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence) {
            return StorieString.of(javaValue.toString());
        }
        throw new StorieException("Cannot convert Java object to StorieValue: " + javaValue.getClass().getName());
    }

    /**
     * 获取值的类型名称
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 条件判断用的真值：nil、false、0、0.0、空字符串为假，其余为真
     */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNil() {
        return false;
    }

    /**
     * 是否为数值类型（整数或浮点数）
     */
    public boolean isNumber() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    /**
     * 是否为可调用对象
     */
    public boolean isCallable() {
        return false;
    }

    /**
     * 转换为 long（浮点数截断）
     */
    public long asLong() {
        throw new StorieException("Expected numeric value, got " + getTypeName());
    }

    /**
     * 转换为 double
     */
    public double asDouble() {
        throw new StorieException("Expected numeric value, got " + getTypeName());
    }

    /**
     * 转换为字符串
     */
    public String asString() {
        return toString();
    }

    /**
     * 转换为布尔值
     */
    public boolean asBoolean() {
        return isTruthy();
    }

    @Override
    public int hashCode() {
        Object val = toJavaValue();
        return val != null ? val.hashCode() : 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof StorieValue)) return false;
        StorieValue other = (StorieValue) obj;
        if (!getTypeName().equals(other.getTypeName())) return false;
        Object thisVal = toJavaValue();
        Object otherVal = other.toJavaValue();
        if (thisVal == null) return otherVal == null;
        return thisVal.equals(otherVal);
    }
}

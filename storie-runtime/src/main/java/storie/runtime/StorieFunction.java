package storie.runtime;

/**
 * 函数值基类：原生（宿主提供）或用户定义（proc）
 */
public abstract class StorieFunction extends StorieValue {

    private final String name;

    protected StorieFunction(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 是否为宿主提供的原生函数
     */
    public abstract boolean isNative();

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "<function>";
    }
}

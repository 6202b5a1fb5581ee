package storie.runtime;

/**
 * Storie nil 值
 */
public final class StorieNull extends StorieValue {

    /** 唯一的 nil 实例 */
    public static final StorieNull NIL = new StorieNull();

    private StorieNull() {
    }

    @Override
    public String getTypeName() {
        return "Nil";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNil() {
        return true;
    }

    @Override
    public String toString() {
        return "nil";
    }
}

package storie.runtime;

/**
 * Storie 字符串值
 */
public final class StorieString extends StorieValue {

    public static final StorieString EMPTY = new StorieString("");

    private final String value;

    private StorieString(String value) {
        this.value = value;
    }

    public static StorieString of(String value) {
        if (value == null || value.isEmpty()) return EMPTY;
        return new StorieString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

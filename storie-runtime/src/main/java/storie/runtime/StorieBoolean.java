package storie.runtime;

/**
 * Storie 布尔值
 */
public final class StorieBoolean extends StorieValue {

    public static final StorieBoolean TRUE = new StorieBoolean(true);

    public static final StorieBoolean FALSE = new StorieBoolean(false);

    private final boolean value;

    private StorieBoolean(boolean value) {
        this.value = value;
    }

    public static StorieBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Bool";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    public StorieBoolean not() {
        return of(!value);
    }
}

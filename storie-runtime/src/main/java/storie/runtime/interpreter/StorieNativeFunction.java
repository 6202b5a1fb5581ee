package storie.runtime.interpreter;

import storie.runtime.StorieFunction;
import storie.runtime.StorieNull;
import storie.runtime.StorieValue;
import storie.runtime.types.Environment;

import java.util.List;

/**
 * 原生（宿主提供的 Java）函数
 */
public final class StorieNativeFunction extends StorieFunction {

    /**
     * 原生函数接口：接收调用方环境与按位置排列的参数，返回一个值（null 视为 nil）
     */
    @FunctionalInterface
    public interface NativeFunc {
        StorieValue apply(Environment caller, List<StorieValue> args);
    }

    private final NativeFunc function;

    public StorieNativeFunction(String name, NativeFunc function) {
        super(name);
        this.function = function;
    }

    @Override
    public boolean isNative() {
        return true;
    }

    @Override
    public String getTypeName() {
        return "NativeFunction";
    }

    @Override
    public String toString() {
        return "<native fun " + getName() + ">";
    }

    public StorieValue call(Environment caller, List<StorieValue> args) {
        StorieValue result = function.apply(caller, args);
        return result != null ? result : StorieNull.NIL;
    }
}

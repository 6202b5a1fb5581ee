package storie.runtime.interpreter;

import storie.runtime.StorieBoolean;
import storie.runtime.StorieFloat;
import storie.runtime.StorieInt;
import storie.runtime.StorieNull;
import storie.runtime.StorieString;
import storie.runtime.StorieValue;

import java.util.List;

/**
 * 原生函数参数读取辅助
 *
 * <p>按位置读取并转换参数，失败时抛出 {@link StorieRuntimeException}：</p>
 * <ul>
 *   <li>int 接受浮点数（截断）</li>
 *   <li>float 接受整数</li>
 *   <li>bool 接受任意值（按真值）</li>
 * </ul>
 */
public final class NativeArgs {

    private final String functionName;
    private final List<StorieValue> args;

    private NativeArgs(String functionName, List<StorieValue> args) {
        this.functionName = functionName;
        this.args = args;
    }

    public static NativeArgs of(String functionName, List<StorieValue> args) {
        return new NativeArgs(functionName, args);
    }

    public int size() {
        return args.size();
    }

    public boolean has(int index) {
        return index >= 0 && index < args.size();
    }

    /** 越界时返回 nil */
    public StorieValue get(int index) {
        return has(index) ? args.get(index) : StorieNull.NIL;
    }

    public long expectInt(int index) {
        StorieValue v = require(index, "int");
        if (v instanceof StorieInt) {
            return ((StorieInt) v).getValue();
        }
        if (v instanceof StorieFloat) {
            return (long) ((StorieFloat) v).getValue();
        }
        throw mismatch("int", v);
    }

    public double expectFloat(int index) {
        StorieValue v = require(index, "float");
        if (v instanceof StorieFloat) {
            return ((StorieFloat) v).getValue();
        }
        if (v instanceof StorieInt) {
            return ((StorieInt) v).getValue();
        }
        throw mismatch("float", v);
    }

    public String expectString(int index) {
        StorieValue v = require(index, "string");
        if (v instanceof StorieString) {
            return ((StorieString) v).getValue();
        }
        throw mismatch("string", v);
    }

    public boolean expectBool(int index) {
        StorieValue v = require(index, "bool");
        if (v instanceof StorieBoolean) {
            return ((StorieBoolean) v).getValue();
        }
        return v.isTruthy();
    }

    // ============ 可选参数 ============

    /** 参数缺失或为 nil 时返回默认值 */
    public StorieValue optional(int index, StorieValue defaultValue) {
        if (!has(index) || args.get(index).isNil()) {
            return defaultValue;
        }
        return args.get(index);
    }

    public long optionalInt(int index, long defaultValue) {
        return isAbsent(index) ? defaultValue : expectInt(index);
    }

    public double optionalFloat(int index, double defaultValue) {
        return isAbsent(index) ? defaultValue : expectFloat(index);
    }

    public String optionalString(int index, String defaultValue) {
        return isAbsent(index) ? defaultValue : expectString(index);
    }

    private boolean isAbsent(int index) {
        return !has(index) || args.get(index).isNil();
    }

    private StorieValue require(int index, String kind) {
        if (!has(index)) {
            throw new StorieRuntimeException(prefix() + "Missing " + kind + " argument at index " + index);
        }
        return args.get(index);
    }

    private StorieRuntimeException mismatch(String kind, StorieValue actual) {
        return new StorieRuntimeException(prefix() + "Expected " + kind + ", got " + actual.getTypeName());
    }

    private String prefix() {
        return functionName != null ? functionName + ": " : "";
    }
}

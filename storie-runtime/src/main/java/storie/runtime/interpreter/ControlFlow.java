package storie.runtime.interpreter;

import storie.runtime.StorieNull;
import storie.runtime.StorieValue;

/**
 * 控制流异常
 *
 * <p>用于实现 return：从语句序列、代码块和循环中向外传播，直到最近的调用帧。
 * 不是真正的错误，不会传到宿主。</p>
 */
public final class ControlFlow extends RuntimeException {

    private final StorieValue value;

    private ControlFlow(StorieValue value) {
        super(null, null, false, false);  // 禁用堆栈跟踪以提高性能
        this.value = value;
    }

    public StorieValue getValue() {
        return value;
    }

    // ============ 工厂方法 ============

    public static ControlFlow returnValue(StorieValue value) {
        return new ControlFlow(value != null ? value : StorieNull.NIL);
    }
}

package storie.runtime;

/**
 * Storie 基础运行时异常（无源位置信息）。
 *
 * <p>解释器中的 {@code StorieRuntimeException} 继承此类，
 * 并添加 SourceLocation 等诊断信息。</p>
 */
public class StorieException extends RuntimeException {

    public StorieException(String message) {
        super(message);
    }

    public StorieException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.storielang.compiler;

/**
 * 编译期（词法/语法）错误基类
 *
 * <p>一旦抛出即中止整个编译，不做错误恢复。</p>
 */
public abstract class CompileException extends RuntimeException {
    private final String fileName;

    protected CompileException(String message, String fileName) {
        super(message);
        this.fileName = fileName;
    }

    public abstract ErrorKind getKind();

    public String getFileName() {
        return fileName;
    }

    public abstract int getLine();

    public abstract int getColumn();

    /** 出错位置的源码长度（用于下划线指示），未知时为 1 */
    public int getLength() {
        return 1;
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }
}

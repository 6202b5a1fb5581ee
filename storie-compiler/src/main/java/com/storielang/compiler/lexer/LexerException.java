package com.storielang.compiler.lexer;

import com.storielang.compiler.CompileException;
import com.storielang.compiler.ErrorKind;

/**
 * 词法错误
 */
public class LexerException extends CompileException {
    private final int line;
    private final int column;

    public LexerException(String message, String fileName, int line, int column) {
        super(message, fileName);
        this.line = line;
        this.column = column;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.LEXICAL;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return String.format("[%s:%d:%d] Lexer error: %s",
                getFileName(), line, column, getRawMessage());
    }
}

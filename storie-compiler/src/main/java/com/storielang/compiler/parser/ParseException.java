package com.storielang.compiler.parser;

import com.storielang.compiler.CompileException;
import com.storielang.compiler.ErrorKind;
import com.storielang.compiler.lexer.Token;

/**
 * 解析异常
 */
public class ParseException extends CompileException {
    private final Token token;
    private final String expected;

    public ParseException(String message, String fileName, Token token) {
        this(message, fileName, token, null);
    }

    public ParseException(String message, String fileName, Token token, String expected) {
        super(message, fileName);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SYNTAX;
    }

    @Override
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    @Override
    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public int getLength() {
        return token != null ? Math.max(1, token.getLexeme().length()) : 1;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(describe(token)).append(")");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }

    private static String describe(Token token) {
        switch (token.getType()) {
            case NEWLINE: return "end of line";
            case INDENT:  return "indent";
            case DEDENT:  return "dedent";
            case EOF:     return "end of input";
            default:      return "'" + token.getLexeme() + "'";
        }
    }
}

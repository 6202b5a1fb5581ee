package com.storielang.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 字面量值：INT_LITERAL 为 Long，FLOAT_LITERAL 为 Double，STRING_LITERAL 为去引号后的 String */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /**
     * 是否为指定文本的标识符（关键词判断）
     */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && lexeme.equals(word);
    }

    /**
     * 是否为指定文本的运算符
     */
    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && lexeme.equals(op);
    }

    /** 词素在源码中覆盖的字符数，合成 token 为 0 */
    public int length() {
        return lexeme.length();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (!type.isLayout() && type != TokenType.EOF) {
            sb.append(" '").append(lexeme).append('\'');
        }
        if (literal != null && type != TokenType.STRING_LITERAL) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}

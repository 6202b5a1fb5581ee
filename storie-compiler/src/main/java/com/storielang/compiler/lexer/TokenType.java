package com.storielang.compiler.lexer;

/**
 * Storie DSL 词法单元类型
 *
 * <p>关键词（var、if、proc 等）不单独分类，统一作为 {@link #IDENTIFIER}，由语法分析器按文本区分。</p>
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,

    // === 标识符（含关键词） ===
    IDENTIFIER,

    // === 运算符 + - * / % = == != < <= > >= ===
    OPERATOR,

    // === 标点 ===
    LPAREN,     // (
    RPAREN,     // )
    COMMA,      // ,
    COLON,      // :

    // === 布局 ===
    NEWLINE,
    INDENT,
    DEDENT,

    EOF;

    /**
     * 是否为缩进布局产生的合成 token
     */
    public boolean isLayout() {
        switch (this) {
            case NEWLINE:
            case INDENT:
            case DEDENT:
                return true;
            default:
                return false;
        }
    }
}

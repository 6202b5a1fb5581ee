package com.storielang.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Storie DSL 词法分析器
 *
 * <p>除普通 token 外，还根据每个逻辑行的行首缩进宽度合成 INDENT / DEDENT：</p>
 * <ul>
 *   <li>宽度大于栈顶：压栈，产生一个 INDENT</li>
 *   <li>宽度小于栈顶：逐层出栈，每层产生一个 DEDENT；最终必须恰好落在某个栈内宽度上</li>
 *   <li>空行和纯注释行不参与缩进计算，也不产生 NEWLINE</li>
 * </ul>
 * <p>括号内的换行不具有语法意义（参数列表可跨行）。遇到任何错误立即抛出 {@link LexerException}。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    // 缩进宽度栈，栈底恒为 0
    private final List<Integer> indentStack = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private int parenDepth = 0;
    private boolean atLineStart = true;
    private boolean lineHasTokens = false;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        indentStack.clear();
        indentStack.add(0);

        while (!isAtEnd()) {
            if (atLineStart && parenDepth == 0) {
                scanLineStart();
                continue;
            }
            start = current;
            scanToken();
        }

        if (parenDepth > 0) {
            throw error("Unterminated parenthesis", line, column);
        }

        // 最后一行没有换行符时补一个 NEWLINE，再关闭所有未闭合的块
        if (lineHasTokens) {
            addSynthetic(TokenType.NEWLINE, "");
        }
        while (indentStack.size() > 1) {
            indentStack.remove(indentStack.size() - 1);
            addSynthetic(TokenType.DEDENT, "");
        }
        addSynthetic(TokenType.EOF, "");
        return tokens;
    }

    // === 行首缩进 ===

    private void scanLineStart() {
        int lineBegin = current;
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            advance();
            width++;
        }
        if (isAtEnd()) {
            atLineStart = false;
            return;
        }

        char c = peek();
        if (c == '\n' || c == '\r' || c == '#') {
            // 空行或纯注释行：整行跳过
            while (!isAtEnd() && peek() != '\n') advance();
            if (!isAtEnd()) {
                advance();
                newLine();
            }
            return;
        }

        atLineStart = false;
        applyIndentation(width, source.substring(lineBegin, current));
    }

    private void applyIndentation(int width, String whitespace) {
        int top = indentStack.get(indentStack.size() - 1);
        if (width > top) {
            indentStack.add(width);
            addSynthetic(TokenType.INDENT, whitespace);
            return;
        }
        while (width < indentStack.get(indentStack.size() - 1)) {
            indentStack.remove(indentStack.size() - 1);
            addSynthetic(TokenType.DEDENT, "");
        }
        if (width != indentStack.get(indentStack.size() - 1)) {
            throw error("Inconsistent indentation: width " + width
                    + " does not match any enclosing block", line, column);
        }
    }

    // === 普通 Token ===

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(':
                parenDepth++;
                addToken(TokenType.LPAREN);
                break;
            case ')':
                if (parenDepth == 0) {
                    throw error("Unmatched ')'", line, column - 1);
                }
                parenDepth--;
                addToken(TokenType.RPAREN);
                break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;

            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
                addToken(TokenType.OPERATOR);
                break;

            case '=':
            case '<':
            case '>':
                match('=');
                addToken(TokenType.OPERATOR);
                break;

            case '!':
                if (!match('=')) {
                    throw error("Unexpected character '!'. Did you mean '!=' or 'not'?", line, column - 1);
                }
                addToken(TokenType.OPERATOR);
                break;

            case '#':
                // 行尾注释
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            // 行内空白
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                if (parenDepth == 0) {
                    addToken(TokenType.NEWLINE);
                    atLineStart = true;
                    lineHasTokens = false;
                }
                newLine();
                break;

            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: " + c, line, column - 1);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
        if (type != TokenType.NEWLINE) {
            lineHasTokens = true;
        }
    }

    private void addSynthetic(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, null, line, column, current));
    }

    // === 复杂 Token 扫描 ===

    private void string(char quote) {
        int startLine = line;
        int startColumn = column - 1;
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                throw error("Unterminated string", startLine, startColumn);
            }
            advance();
        }
        if (isAtEnd()) {
            throw error("Unterminated string", startLine, startColumn);
        }

        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, source.substring(start + 1, current - 1));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Invalid integer literal: " + text, line, column - text.length());
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private LexerException error(String message, int errLine, int errColumn) {
        return new LexerException(message, fileName, errLine, errColumn);
    }
}

package com.storielang.compiler.parser;

import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.decl.Program;
import com.storielang.compiler.ast.stmt.Statement;
import com.storielang.compiler.lexer.Lexer;
import com.storielang.compiler.lexer.Token;
import com.storielang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.storielang.compiler.lexer.TokenType.*;

/**
 * Storie DSL 语法分析器（语句递归下降 + 表达式优先级爬升）
 *
 * <p>遇到第一个结构错误即抛出 {@link ParseException}，不做恢复。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int pos = 0;

    // === Helper 实例 ===
    final ExprParser exprParser = new ExprParser(this);
    final StmtParser stmtParser = new StmtParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
    }

    public Parser(Lexer lexer) {
        this(lexer.scanTokens(), lexer.getFileName());
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(pos);
    }

    Token previous() {
        return pos > 0 ? tokens.get(pos - 1) : null;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(pos + 1, tokens.size() - 1));
    }

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        Token t = tokens.get(pos);
        if (t.getType() != EOF) {
            pos++;
        }
        return t;
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    /**
     * 当前 token 是否为指定关键词
     */
    boolean checkWord(String word) {
        return current().isWord(word);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, type.name());
    }

    /**
     * 期望指定文本的关键词
     */
    Token expectWord(String word, String message) {
        if (checkWord(word)) {
            return advance();
        }
        throw error(message, "'" + word + "'");
    }

    /**
     * 期望指定运算符
     */
    Token expectOperator(String op, String message) {
        if (current().isOperator(op)) {
            return advance();
        }
        throw error(message, "'" + op + "'");
    }

    ParseException error(String message) {
        return new ParseException(message, fileName, current());
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, fileName, current(), expected);
    }

    /**
     * 由 token 创建源码位置
     */
    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    SourceLocation location() {
        return locationOf(current());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个程序
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) {
                continue;
            }
            statements.add(stmtParser.parseStatement());
            stmtParser.endStatement();
        }
        return new Program(loc, fileName, statements);
    }
}

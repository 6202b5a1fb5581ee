package com.storielang.compiler;

import com.storielang.compiler.ast.decl.Program;
import com.storielang.compiler.lexer.Lexer;
import com.storielang.compiler.lexer.Token;
import com.storielang.compiler.parser.Parser;

import java.util.List;

/**
 * 源码到 {@link Program} 的编译入口（词法 + 语法分析）。
 *
 * <p>失败时抛出 {@link CompileException} 的子类：
 * {@link com.storielang.compiler.lexer.LexerException} 或
 * {@link com.storielang.compiler.parser.ParseException}。</p>
 */
public final class StorieCompiler {

    private StorieCompiler() {}

    public static List<Token> tokenize(String source, String fileName) {
        return new Lexer(source, fileName).scanTokens();
    }

    public static Program compile(String source, String fileName) {
        return new Parser(tokenize(source, fileName), fileName).parse();
    }

    public static Program compile(String source) {
        return compile(source, "<input>");
    }
}

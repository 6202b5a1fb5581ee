package com.storielang.compiler.lexer;

import com.storielang.compiler.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 只保留 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 非布局 token 的词素 */
    private List<String> lexemes(String source) {
        return scan(source).stream()
                .filter(t -> !t.getType().isLayout() && t.getType() != TokenType.EOF)
                .map(Token::getLexeme)
                .collect(Collectors.toList());
    }

    private LexerException lexError(String source) {
        return assertThrows(LexerException.class, () -> scan(source));
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点数")
        void testNumbers() {
            List<Token> toks = scan("42 3.5");
            assertEquals(TokenType.INT_LITERAL, toks.get(0).getType());
            assertEquals(42L, toks.get(0).getLiteral());
            assertEquals(TokenType.FLOAT_LITERAL, toks.get(1).getType());
            assertEquals(3.5, toks.get(1).getLiteral());
        }

        @Test
        @DisplayName("数字后没有小数位时点号是非法字符")
        void testTrailingDot() {
            LexerException e = lexError("1.");
            assertEquals("Unexpected character: .", e.getRawMessage());
            assertEquals(2, e.getColumn());
        }

        @Test
        @DisplayName("单双引号字符串，字面量不含引号")
        void testStrings() {
            List<Token> toks = scan("\"Hello\" 'yellow'");
            assertEquals(TokenType.STRING_LITERAL, toks.get(0).getType());
            assertEquals("Hello", toks.get(0).getLiteral());
            assertEquals("\"Hello\"", toks.get(0).getLexeme());
            assertEquals("yellow", toks.get(1).getLiteral());
        }

        @Test
        @DisplayName("字符串内的 # 不是注释")
        void testHashInString() {
            assertEquals(List.of("\"#fff\""), lexemes("\"#fff\""));
        }

        @Test
        @DisplayName("超出 long 范围的整数")
        void testIntegerOverflow() {
            LexerException e = lexError("99999999999999999999");
            assertTrue(e.getRawMessage().startsWith("Invalid integer literal"));
        }
    }

    // ================================================================
    // 运算符与标识符
    // ================================================================

    @Nested
    @DisplayName("运算符与标识符")
    class OperatorTests {

        @Test
        @DisplayName("双字符运算符优先匹配")
        void testTwoCharOperators() {
            assertEquals(List.of("==", "!=", "<=", ">=", "<", ">", "="), lexemes("== != <= >= < > ="));
            assertTrue(scan("<=").get(0).isOperator("<="));
        }

        @Test
        @DisplayName("算术运算符与标点")
        void testArithmeticAndPunctuation() {
            assertEquals(List.of(TokenType.OPERATOR, TokenType.OPERATOR, TokenType.OPERATOR,
                    TokenType.OPERATOR, TokenType.OPERATOR, TokenType.LPAREN, TokenType.RPAREN,
                    TokenType.COMMA, TokenType.COLON, TokenType.NEWLINE, TokenType.EOF),
                    types("+ - * / % ( ) , :"));
        }

        @Test
        @DisplayName("关键词以标识符形式出现")
        void testKeywordsAreIdentifiers() {
            List<Token> toks = scan("proc var_1 and");
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertTrue(toks.get(0).isWord("proc"));
            assertEquals("var_1", toks.get(1).getLexeme());
            assertTrue(toks.get(2).isWord("and"));
        }

        @Test
        @DisplayName("单独的 ! 报错")
        void testBangAlone() {
            LexerException e = lexError("!x");
            assertTrue(e.getRawMessage().contains("Did you mean"));
        }

        @Test
        @DisplayName("无法识别的字符")
        void testUnknownCharacter() {
            LexerException e = lexError("x = 1 @ 2");
            assertEquals(ErrorKind.LEXICAL, e.getKind());
            assertEquals(1, e.getLine());
            assertEquals(7, e.getColumn());
            assertEquals("Unexpected character: @", e.getRawMessage());
        }

        @Test
        @DisplayName("位置信息从 1 开始")
        void testPositions() {
            List<Token> toks = scan("var x = 40\nx = 1");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(5, toks.get(1).getColumn());
            Token second = toks.get(5);
            assertEquals("x", second.getLexeme());
            assertEquals(2, second.getLine());
            assertEquals(1, second.getColumn());
        }
    }

    // ================================================================
    // 换行、注释与缩进
    // ================================================================

    @Nested
    @DisplayName("布局")
    class LayoutTests {

        @Test
        @DisplayName("末行没有换行符时补 NEWLINE")
        void testTrailingNewline() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF), types("x"));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF), types("x\n"));
        }

        @Test
        @DisplayName("空输入只有 EOF")
        void testEmpty() {
            assertEquals(List.of(TokenType.EOF), types(""));
            assertEquals(List.of(TokenType.EOF), types("\n\n  \n# comment only\n"));
        }

        @Test
        @DisplayName("注释延伸到行尾")
        void testComment() {
            assertEquals(List.of("x", "=", "1", "y"), lexemes("x = 1 # set x\ny"));
        }

        @Test
        @DisplayName("缩进与回退")
        void testIndentDedent() {
            String src = "if x:\n  y = 1\n  if z:\n    w = 2\nv = 3\n";
            assertEquals(List.of(
                    TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT,
                    TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT,
                    TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.DEDENT, TokenType.DEDENT,
                    TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.EOF), types(src));
        }

        @Test
        @DisplayName("文件末尾关闭所有未闭合的块")
        void testDedentAtEof() {
            List<TokenType> t = types("if x:\n  if y:\n    z = 1");
            assertEquals(List.of(TokenType.NEWLINE, TokenType.DEDENT, TokenType.DEDENT, TokenType.EOF),
                    t.subList(t.size() - 4, t.size()));
        }

        @Test
        @DisplayName("空行和注释行不影响缩进")
        void testBlankLinesInsideBlock() {
            List<TokenType> t = types("if x:\n  a = 1\n\n# note\n  b = 2\n");
            assertEquals(1, t.stream().filter(k -> k == TokenType.INDENT).count());
            assertEquals(1, t.stream().filter(k -> k == TokenType.DEDENT).count());
        }

        @Test
        @DisplayName("回退到不存在的缩进宽度报错")
        void testInconsistentIndentation() {
            LexerException e = lexError("if x:\n    a = 1\n  b = 2\n");
            assertEquals(3, e.getLine());
            assertTrue(e.getRawMessage().startsWith("Inconsistent indentation"));
        }

        @Test
        @DisplayName("括号内的换行被忽略")
        void testNewlineInsideParens() {
            List<TokenType> t = types("drawText(\"Hi\",\n    10,\n    20)\n");
            assertEquals(1, t.stream().filter(k -> k == TokenType.NEWLINE).count());
            assertFalse(t.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("括号不匹配")
        void testUnbalancedParens() {
            assertEquals("Unmatched ')'", lexError("x)").getRawMessage());
            assertEquals("Unterminated parenthesis", lexError("f(1, 2").getRawMessage());
        }

        @Test
        @DisplayName("未闭合的字符串")
        void testUnterminatedString() {
            LexerException e = lexError("x = \"abc\ny = 1");
            assertEquals("Unterminated string", e.getRawMessage());
            assertEquals(1, e.getLine());
            assertEquals(5, e.getColumn());
            assertTrue(e.getMessage().contains("<test>:1:5"));
        }
    }
}

package com.storielang.compiler.parser;

import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.expr.*;
import com.storielang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.storielang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类（优先级爬升）
 *
 * <p>优先级由低到高：or(1) &lt; and(2) &lt; 比较(3) &lt; 加减(4) &lt; 乘除模(5)，均为左结合。
 * 前缀 - 与 not 以 {@link #UNARY_PRECEDENCE} 解析操作数，结合紧于所有二元运算符。</p>
 */
class ExprParser {

    static final int UNARY_PRECEDENCE = 100;

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseExpression(0);
    }

    /**
     * 解析优先级严格高于 minPrecedence 的二元表达式
     */
    Expression parseExpression(int minPrecedence) {
        Expression left = parsePrefix();

        while (true) {
            BinaryExpr.BinaryOp op = currentBinaryOp();
            if (op == null || op.getPrecedence() <= minPrecedence) {
                break;
            }
            Token opToken = parser.advance();
            Expression right = parseExpression(op.getPrecedence());
            left = new BinaryExpr(parser.locationOf(opToken), left, op, right);
        }

        return left;
    }

    /**
     * 当前 token 对应的二元运算符；and / or 是标识符形式的运算符
     */
    private BinaryExpr.BinaryOp currentBinaryOp() {
        Token t = parser.current();
        if (t.is(OPERATOR)) {
            return BinaryExpr.BinaryOp.fromSource(t.getLexeme());  // '=' 返回 null
        }
        if (t.isWord("and")) return BinaryExpr.BinaryOp.AND;
        if (t.isWord("or")) return BinaryExpr.BinaryOp.OR;
        return null;
    }

    // 前缀：字面量、标识符、调用、一元运算、括号
    private Expression parsePrefix() {
        Token t = parser.current();
        SourceLocation loc = parser.locationOf(t);

        switch (t.getType()) {
            case INT_LITERAL:
                parser.advance();
                return Literal.ofInt(loc, (Long) t.getLiteral());

            case FLOAT_LITERAL:
                parser.advance();
                return Literal.ofFloat(loc, (Double) t.getLiteral());

            case STRING_LITERAL:
                parser.advance();
                return Literal.ofString(loc, (String) t.getLiteral());

            case IDENTIFIER:
                return parseIdentifierPrefix(t, loc);

            case OPERATOR:
                if (t.isOperator("-")) {
                    parser.advance();
                    Expression operand = parseExpression(UNARY_PRECEDENCE);
                    return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, operand);
                }
                throw parser.error("Unexpected prefix operator '" + t.getLexeme() + "'");

            case LPAREN:
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')' after expression");
                return inner;

            default:
                throw parser.error("Unexpected token in expression", "expression");
        }
    }

    private Expression parseIdentifierPrefix(Token t, SourceLocation loc) {
        switch (t.getLexeme()) {
            case "true":
                parser.advance();
                return Literal.ofBoolean(loc, true);
            case "false":
                parser.advance();
                return Literal.ofBoolean(loc, false);
            case "not": {
                parser.advance();
                Expression operand = parseExpression(UNARY_PRECEDENCE);
                return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, operand);
            }
            default:
                break;
        }

        parser.advance();
        if (parser.match(LPAREN)) {
            return new CallExpr(loc, t.getLexeme(), parseArguments());
        }
        return new Identifier(loc, t.getLexeme());
    }

    // 参数列表（'(' 已消费）
    private List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            args.add(parseExpression());
            while (parser.match(COMMA)) {
                args.add(parseExpression());
            }
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }
}

package com.storielang.compiler.parser;

import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.decl.Parameter;
import com.storielang.compiler.ast.expr.Expression;
import com.storielang.compiler.ast.stmt.*;
import com.storielang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.storielang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 *
 * <p>按首个标识符的文本分派：var、let、if、for、proc、return；
 * 否则向前看一个 token，'=' 为赋值，其余为表达式语句。</p>
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        Token t = parser.current();
        if (t.is(IDENTIFIER)) {
            switch (t.getLexeme()) {
                case "var":    return parseVarStmt(VarStmt.DeclKind.VAR);
                case "let":    return parseVarStmt(VarStmt.DeclKind.LET);
                case "if":     return parseIfStmt();
                case "for":    return parseForStmt();
                case "proc":   return parseProcStmt();
                case "return": return parseReturnStmt();
                case "elif":
                case "else":
                    throw parser.error("'" + t.getLexeme() + "' without matching 'if'");
                default:
                    if (parser.peek().isOperator("=")) {
                        return parseAssignStmt();
                    }
                    break;
            }
        }
        Expression expr = parser.exprParser.parseExpression();
        return new ExpressionStmt(parser.locationOf(t), expr);
    }

    /**
     * 语句结束：消费 NEWLINE；块语句以 DEDENT 结束，块末尾和文件末尾无需换行
     */
    void endStatement() {
        if (parser.match(NEWLINE)) {
            return;
        }
        Token prev = parser.previous();
        if (parser.check(DEDENT) || parser.isAtEnd() || (prev != null && prev.is(DEDENT))) {
            return;
        }
        throw parser.error("Expected end of line after statement", "NEWLINE");
    }

    // var x = expr / let x = expr
    private Statement parseVarStmt(VarStmt.DeclKind kind) {
        Token kw = parser.advance();
        Token name = parser.expect(IDENTIFIER, "Expected identifier after '" + kind.getKeyword() + "'");
        parser.expectOperator("=", "Expected '=' in " + kind.getKeyword() + " declaration");
        Expression value = parser.exprParser.parseExpression();
        return new VarStmt(parser.locationOf(kw), kind, name.getLexeme(), value);
    }

    // name = expr
    private Statement parseAssignStmt() {
        Token name = parser.advance();
        parser.expectOperator("=", "Expected '='");
        Expression value = parser.exprParser.parseExpression();
        return new AssignStmt(parser.locationOf(name), name.getLexeme(), value);
    }

    // if cond: block (elif cond: block)* (else: block)?
    private Statement parseIfStmt() {
        Token kw = parser.advance();
        Expression condition = parser.exprParser.parseExpression();
        IfBranch primary = new IfBranch(condition, parseBlock());

        List<IfBranch> elifs = new ArrayList<>();
        while (parser.checkWord("elif")) {
            parser.advance();
            Expression c = parser.exprParser.parseExpression();
            elifs.add(new IfBranch(c, parseBlock()));
        }

        Block elseBlock = null;
        if (parser.checkWord("else")) {
            parser.advance();
            elseBlock = parseBlock();
        }

        return new IfStmt(parser.locationOf(kw), primary, elifs, elseBlock);
    }

    // for i in range(start, end): block
    private Statement parseForStmt() {
        Token kw = parser.advance();
        Token var = parser.expect(IDENTIFIER, "Expected loop variable name");
        parser.expectWord("in", "Expected 'in' after for variable");
        parser.expectWord("range", "Expected 'range' after 'in'");
        parser.expect(LPAREN, "Expected '(' after 'range'");
        Expression start = parser.exprParser.parseExpression();
        parser.expect(COMMA, "Expected ',' in range(start, end)");
        Expression end = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after range arguments");
        Block body = parseBlock();
        return new ForStmt(parser.locationOf(kw), var.getLexeme(), start, end, body);
    }

    // proc name(p: type, ...): block
    private Statement parseProcStmt() {
        Token kw = parser.advance();
        Token name = parser.expect(IDENTIFIER, "Expected proc name");
        parser.expect(LPAREN, "Expected '(' after proc name");

        List<Parameter> params = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            do {
                Token pname = parser.expect(IDENTIFIER, "Expected parameter name");
                parser.expect(COLON, "Expected ':' after parameter name");
                Token ptype = parser.expect(IDENTIFIER, "Expected parameter type");
                params.add(new Parameter(parser.locationOf(pname), pname.getLexeme(), ptype.getLexeme()));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        Block body = parseBlock();
        return new ProcStmt(parser.locationOf(kw), name.getLexeme(), params, body);
    }

    // return expr
    private Statement parseReturnStmt() {
        Token kw = parser.advance();
        Expression value = parser.exprParser.parseExpression();
        return new ReturnStmt(parser.locationOf(kw), value);
    }

    /**
     * 解析 ':' NEWLINE INDENT stmt* DEDENT
     */
    Block parseBlock() {
        parser.expect(COLON, "Expected ':' before block");
        parser.expect(NEWLINE, "Expected newline after ':'");
        SourceLocation loc = parser.location();
        parser.expect(INDENT, "Expected indented block");

        List<Statement> statements = new ArrayList<>();
        while (!parser.isAtEnd()) {
            if (parser.match(DEDENT)) {
                return new Block(loc, statements);
            }
            if (parser.match(NEWLINE)) {
                continue;
            }
            statements.add(parseStatement());
            endStatement();
        }
        throw parser.error("Unterminated block", "DEDENT");
    }
}

package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.expr.Expression;

/**
 * For 语句：for name in range(start, end)，区间左闭右开
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Expression start;
    private final Expression end;
    private final Block body;

    public ForStmt(SourceLocation location, String variable, Expression start, Expression end, Block body) {
        super(location);
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}

package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.expr.Expression;

/**
 * 赋值语句 name = value
 */
public class AssignStmt extends Statement {
    private final String target;
    private final Expression value;

    public AssignStmt(SourceLocation location, String target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}

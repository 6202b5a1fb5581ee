package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.expr.Expression;

/**
 * if / elif 分支：条件 + 代码块
 */
public final class IfBranch {
    private final Expression condition;
    private final Block body;

    public IfBranch(Expression condition, Block body) {
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }
}

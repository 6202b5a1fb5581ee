package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式：按名称调用，参数按位置传递
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, String callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(callee).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}

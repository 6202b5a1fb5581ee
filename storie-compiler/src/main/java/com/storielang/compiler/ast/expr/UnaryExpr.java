package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    @Override
    public String toString() {
        return operator == UnaryOp.NOT
                ? "(not " + operand + ")"
                : "(-" + operand + ")";
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("not");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** 返回 DSL 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}

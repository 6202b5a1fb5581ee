package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSourceString() + " " + right + ")";
    }

    /**
     * 二元运算符，附带优先级（数值越大结合越紧）
     */
    public enum BinaryOp {
        // 逻辑
        OR("or", 1),
        AND("and", 2),

        // 比较
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 3),
        LE("<=", 3),
        GT(">", 3),
        GE(">=", 3),

        // 算术
        ADD("+", 4),
        SUB("-", 4),
        MUL("*", 5),
        DIV("/", 5),
        MOD("%", 5);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回 DSL 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isComparison() {
            return precedence == 3;
        }

        /**
         * 按源码文本查找运算符，未知返回 null
         */
        public static BinaryOp fromSource(String text) {
            for (BinaryOp op : values()) {
                if (op.source.equals(text)) {
                    return op;
                }
            }
            return null;
        }
    }
}

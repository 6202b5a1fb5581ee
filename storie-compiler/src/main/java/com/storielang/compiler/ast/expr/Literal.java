package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInt(SourceLocation location, long value) {
        return new Literal(location, value, LiteralKind.INT);
    }

    public static Literal ofFloat(SourceLocation location, double value) {
        return new Literal(location, value, LiteralKind.FLOAT);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public static Literal ofBoolean(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOLEAN);
    }

    /** INT 为 Long，FLOAT 为 Double，STRING 为 String，BOOLEAN 为 Boolean */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        return kind == LiteralKind.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        BOOLEAN;

        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}

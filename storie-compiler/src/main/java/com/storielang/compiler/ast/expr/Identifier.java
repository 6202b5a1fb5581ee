package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 标识符表达式（变量引用）
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}

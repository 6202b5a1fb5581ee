package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 代码块：缩进界定的语句序列
 *
 * <p>块不创建新作用域，语句在当前帧执行。</p>
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
    }

    public static Block empty(SourceLocation location) {
        return new Block(location, Collections.emptyList());
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}

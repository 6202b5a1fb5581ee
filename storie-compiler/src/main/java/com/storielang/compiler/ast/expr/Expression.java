package com.storielang.compiler.ast.expr;

import com.storielang.compiler.ast.AstNode;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}

package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstNode;
import com.storielang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}

package storie.runtime.interpreter;

import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.stmt.Block;
import com.storielang.compiler.ast.stmt.ProcStmt;
import storie.runtime.StorieFunction;

import java.util.Collections;
import java.util.List;

/**
 * 用户定义函数（proc）：有序参数名 + 函数体
 *
 * <p>不捕获声明处的环境；调用时新帧的父环境是调用方的当前环境。</p>
 */
public final class StorieUserFunction extends StorieFunction {

    private final List<String> paramNames;
    private final Block body;
    private final SourceLocation location;

    public StorieUserFunction(String name, List<String> paramNames, Block body, SourceLocation location) {
        super(name);
        this.paramNames = Collections.unmodifiableList(paramNames);
        this.body = body;
        this.location = location;
    }

    public static StorieUserFunction from(ProcStmt decl) {
        return new StorieUserFunction(decl.getName(), decl.getParamNames(), decl.getBody(), decl.getLocation());
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public int getArity() {
        return paramNames.size();
    }

    public Block getBody() {
        return body;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean isNative() {
        return false;
    }

    @Override
    public String getTypeName() {
        return "Function";
    }
}

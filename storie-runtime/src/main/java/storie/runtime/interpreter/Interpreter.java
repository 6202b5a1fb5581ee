package storie.runtime.interpreter;

import com.storielang.compiler.ast.AstNode;
import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.decl.Program;
import com.storielang.compiler.ast.expr.BinaryExpr;
import com.storielang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.storielang.compiler.ast.expr.CallExpr;
import com.storielang.compiler.ast.expr.Expression;
import com.storielang.compiler.ast.expr.Identifier;
import com.storielang.compiler.ast.expr.Literal;
import com.storielang.compiler.ast.expr.UnaryExpr;
import com.storielang.compiler.ast.stmt.AssignStmt;
import com.storielang.compiler.ast.stmt.Block;
import com.storielang.compiler.ast.stmt.ExpressionStmt;
import com.storielang.compiler.ast.stmt.ForStmt;
import com.storielang.compiler.ast.stmt.IfBranch;
import com.storielang.compiler.ast.stmt.IfStmt;
import com.storielang.compiler.ast.stmt.ProcStmt;
import com.storielang.compiler.ast.stmt.ReturnStmt;
import com.storielang.compiler.ast.stmt.Statement;
import com.storielang.compiler.ast.stmt.VarStmt;
import storie.runtime.StorieBoolean;
import storie.runtime.StorieException;
import storie.runtime.StorieFloat;
import storie.runtime.StorieFunction;
import storie.runtime.StorieInt;
import storie.runtime.StorieNull;
import storie.runtime.StorieOptions;
import storie.runtime.StorieString;
import storie.runtime.StorieValue;
import storie.runtime.types.Environment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Storie 树遍历解释器
 *
 * <p>以环境作为访问上下文：表达式返回求值结果，语句返回 null
 * （表达式语句除外，返回其值，供 REPL 回显）。</p>
 *
 * <p>作用域是动态的：用户函数调用时新建的帧以调用方的当前环境为父环境，
 * 而不是声明处的环境。if / for 的代码块不引入新作用域。</p>
 */
public class Interpreter implements AstVisitor<StorieValue, Environment> {

    private final Environment globals;
    private final StorieOptions options;

    // 文件名 -> 源码行，用于错误片段
    private final Map<String, String[]> sourceLines = new HashMap<>();

    private int callDepth = 0;

    public Interpreter() {
        this(StorieOptions.defaults());
    }

    public Interpreter(StorieOptions options) {
        this.options = options;
        this.globals = new Environment();
    }

    public Environment getGlobals() {
        return globals;
    }

    public StorieOptions getOptions() {
        return options;
    }

    public int getCallDepth() {
        return callDepth;
    }

    /**
     * 登记源码，运行时错误会附带出错行
     */
    public void registerSource(String fileName, String source) {
        if (fileName != null && source != null) {
            sourceLines.put(fileName, source.split("\r?\n", -1));
        }
    }

    // ============ 执行入口 ============

    /**
     * 在全局环境中执行程序
     */
    public StorieValue execute(Program program) {
        return execute(program, globals);
    }

    /**
     * 在指定环境中执行程序的顶层语句
     *
     * <p>顶层 return 结束本次执行，其值作为结果；否则返回最后一个表达式语句的值，
     * 没有则为 nil。</p>
     */
    public StorieValue execute(Program program, Environment env) {
        StorieValue last = StorieNull.NIL;
        try {
            for (Statement stmt : program.getStatements()) {
                StorieValue value = stmt.accept(this, env);
                if (value != null) {
                    last = value;
                }
            }
        } catch (ControlFlow flow) {
            return flow.getValue();
        }
        return last;
    }

    public StorieValue evaluate(Expression expr, Environment env) {
        return expr.accept(this, env);
    }

    private void executeBlock(Block block, Environment env) {
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, env);
        }
    }

    // ============ 语句 ============

    @Override
    public StorieValue visitProgram(Program node, Environment env) {
        return execute(node, env);
    }

    @Override
    public StorieValue visitBlock(Block node, Environment env) {
        executeBlock(node, env);
        return null;
    }

    @Override
    public StorieValue visitExpressionStmt(ExpressionStmt node, Environment env) {
        return evaluate(node.getExpression(), env);
    }

    @Override
    public StorieValue visitVarStmt(VarStmt node, Environment env) {
        env.define(node.getName(), evaluate(node.getInitializer(), env));
        return null;
    }

    @Override
    public StorieValue visitAssignStmt(AssignStmt node, Environment env) {
        env.assign(node.getTarget(), evaluate(node.getValue(), env));
        return null;
    }

    @Override
    public StorieValue visitIfStmt(IfStmt node, Environment env) {
        if (runBranch(node.getPrimary(), env)) {
            return null;
        }
        for (IfBranch branch : node.getElifBranches()) {
            if (runBranch(branch, env)) {
                return null;
            }
        }
        if (node.hasElse()) {
            executeBlock(node.getElseBranch(), env);
        }
        return null;
    }

    private boolean runBranch(IfBranch branch, Environment env) {
        if (!evaluate(branch.getCondition(), env).isTruthy()) {
            return false;
        }
        executeBlock(branch.getBody(), env);
        return true;
    }

    @Override
    public StorieValue visitForStmt(ForStmt node, Environment env) {
        long start = requireNumber(evaluate(node.getStart(), env), node.getStart(), "range").asLong();
        long end = requireNumber(evaluate(node.getEnd(), env), node.getEnd(), "range").asLong();
        long limit = options.getMaxLoopIterations();

        long iterations = 0;
        for (long i = start; i < end; i++) {
            if (limit > 0 && ++iterations > limit) {
                throw error("Maximum loop iterations exceeded (" + limit + ")", node);
            }
            env.assign(node.getVariable(), StorieInt.of(i));
            executeBlock(node.getBody(), env);
        }
        return null;
    }

    @Override
    public StorieValue visitProcStmt(ProcStmt node, Environment env) {
        env.define(node.getName(), StorieUserFunction.from(node));
        return null;
    }

    @Override
    public StorieValue visitReturnStmt(ReturnStmt node, Environment env) {
        throw ControlFlow.returnValue(evaluate(node.getValue(), env));
    }

    // ============ 表达式 ============

    @Override
    public StorieValue visitLiteral(Literal node, Environment env) {
        Object value = node.getValue();
        switch (node.getKind()) {
            case INT:
                return StorieInt.of((Long) value);
            case FLOAT:
                return StorieFloat.of((Double) value);
            case STRING:
                return StorieString.of((String) value);
            case BOOLEAN:
                return StorieBoolean.of((Boolean) value);
            default:
                throw error("Unknown literal kind: " + node.getKind(), node);
        }
    }

    @Override
    public StorieValue visitIdentifier(Identifier node, Environment env) {
        StorieValue value = env.tryGet(node.getName());
        if (value == null) {
            throw error("Undefined variable: " + node.getName(), node);
        }
        return value;
    }

    @Override
    public StorieValue visitUnaryExpr(UnaryExpr node, Environment env) {
        StorieValue operand = evaluate(node.getOperand(), env);
        switch (node.getOperator()) {
            case NOT:
                return StorieBoolean.of(!operand.isTruthy());
            case NEG:
                if (operand instanceof StorieInt) {
                    return StorieInt.of(-((StorieInt) operand).getValue());
                }
                if (operand instanceof StorieFloat) {
                    return StorieFloat.of(-((StorieFloat) operand).getValue());
                }
                throw error("Unsupported operand type for unary '-': " + operand.getTypeName(), node);
            default:
                throw error("Unknown unary operator: " + node.getOperator(), node);
        }
    }

    @Override
    public StorieValue visitBinaryExpr(BinaryExpr node, Environment env) {
        BinaryOp op = node.getOperator();

        // 短路求值
        if (op == BinaryOp.AND) {
            if (!evaluate(node.getLeft(), env).isTruthy()) {
                return StorieBoolean.FALSE;
            }
            return StorieBoolean.of(evaluate(node.getRight(), env).isTruthy());
        }
        if (op == BinaryOp.OR) {
            if (evaluate(node.getLeft(), env).isTruthy()) {
                return StorieBoolean.TRUE;
            }
            return StorieBoolean.of(evaluate(node.getRight(), env).isTruthy());
        }

        StorieValue left = evaluate(node.getLeft(), env);
        StorieValue right = evaluate(node.getRight(), env);
        if (!left.isNumber() || !right.isNumber()) {
            throw error("Unsupported operand types for '" + op.toSourceString() + "': "
                    + left.getTypeName() + " and " + right.getTypeName(), node);
        }

        double l = left.asDouble();
        double r = right.asDouble();
        switch (op) {
            case ADD: return StorieFloat.of(l + r);
            case SUB: return StorieFloat.of(l - r);
            case MUL: return StorieFloat.of(l * r);
            case DIV: return StorieFloat.of(l / r);
            case MOD: return StorieFloat.of(l % r);
            case EQ:  return StorieBoolean.of(l == r);
            case NE:  return StorieBoolean.of(l != r);
            case LT:  return StorieBoolean.of(l < r);
            case LE:  return StorieBoolean.of(l <= r);
            case GT:  return StorieBoolean.of(l > r);
            case GE:  return StorieBoolean.of(l >= r);
            default:
                throw error("Unknown binary operator: " + op, node);
        }
    }

    @Override
    public StorieValue visitCallExpr(CallExpr node, Environment env) {
        StorieValue callee = env.tryGet(node.getCallee());
        if (callee == null) {
            throw error("Undefined variable: " + node.getCallee(), node);
        }
        if (!(callee instanceof StorieFunction)) {
            throw error("'" + node.getCallee() + "' is not callable", node);
        }

        List<StorieValue> args = new ArrayList<>(node.getArguments().size());
        for (Expression arg : node.getArguments()) {
            args.add(evaluate(arg, env));
        }

        if (callee instanceof StorieNativeFunction) {
            return callNative((StorieNativeFunction) callee, args, env, node);
        }
        return callUser((StorieUserFunction) callee, args, env, node);
    }

    // ============ 函数调用 ============

    /**
     * 从宿主调用函数值（例如原生函数回调脚本函数）
     */
    public StorieValue call(StorieFunction function, List<StorieValue> args, Environment caller) {
        if (function instanceof StorieNativeFunction) {
            return ((StorieNativeFunction) function).call(caller, args);
        }
        return callUser((StorieUserFunction) function, args, caller, null);
    }

    private StorieValue callNative(StorieNativeFunction fn, List<StorieValue> args,
                                   Environment caller, CallExpr node) {
        try {
            return fn.call(caller, args);
        } catch (StorieRuntimeException e) {
            if (e.hasLocation()) {
                throw e;
            }
            throw new StorieRuntimeException(e.getRawMessage(), node.getLocation(),
                    sourceLine(node.getLocation()), e);
        } catch (StorieException e) {
            throw new StorieRuntimeException(e.getMessage(), node.getLocation(),
                    sourceLine(node.getLocation()), e);
        }
    }

    private StorieValue callUser(StorieUserFunction fn, List<StorieValue> args,
                                 Environment caller, AstNode site) {
        int maxDepth = options.getMaxRecursionDepth();
        if (maxDepth > 0 && callDepth >= maxDepth) {
            String message = "Maximum recursion depth exceeded (" + maxDepth + ")";
            throw site != null ? error(message, site) : new StorieRuntimeException(message);
        }

        Environment frame = new Environment(caller);
        List<String> params = fn.getParamNames();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i), i < args.size() ? args.get(i) : StorieNull.NIL);
        }

        callDepth++;
        try {
            executeBlock(fn.getBody(), frame);
            return StorieNull.NIL;
        } catch (ControlFlow flow) {
            return flow.getValue();
        } finally {
            callDepth--;
        }
    }

    // ============ 错误 ============

    private StorieValue requireNumber(StorieValue value, AstNode node, String context) {
        if (!value.isNumber()) {
            throw error("Expected numeric value in " + context + ", got " + value.getTypeName(), node);
        }
        return value;
    }

    private StorieRuntimeException error(String message, AstNode node) {
        SourceLocation loc = node.getLocation();
        return new StorieRuntimeException(message, loc, sourceLine(loc));
    }

    private String sourceLine(SourceLocation loc) {
        if (loc == null || !loc.isKnown()) {
            return null;
        }
        String[] lines = sourceLines.get(loc.getFile());
        if (lines == null || loc.getLine() > lines.length) {
            return null;
        }
        return lines[loc.getLine() - 1];
    }
}

package storie.runtime.interpreter;

import com.storielang.compiler.StorieCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import storie.runtime.StorieBoolean;
import storie.runtime.StorieFloat;
import storie.runtime.StorieInt;
import storie.runtime.StorieNull;
import storie.runtime.StorieOptions;
import storie.runtime.StorieString;
import storie.runtime.StorieValue;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 解释器语义测试
 */
class InterpreterTest {

    private Interpreter interpreter;
    private final List<List<StorieValue>> recorded = new ArrayList<>();

    @BeforeEach
    void setUp() {
        interpreter = newInterpreter(StorieOptions.defaults());
    }

    private Interpreter newInterpreter(StorieOptions options) {
        Interpreter interp = new Interpreter(options);
        interp.getGlobals().define("record", new StorieNativeFunction("record", (env, args) -> {
            recorded.add(new ArrayList<>(args));
            return null;
        }));
        return interp;
    }

    private StorieValue run(String source) {
        interpreter.registerSource("<test>", source);
        return interpreter.execute(StorieCompiler.compile(source, "<test>"));
    }

    private StorieValue global(String name) {
        return interpreter.getGlobals().tryGet(name);
    }

    private List<StorieValue> firstArgs() {
        List<StorieValue> values = new ArrayList<>();
        for (List<StorieValue> call : recorded) {
            values.add(call.get(0));
        }
        return values;
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("算术与比较")
    class ArithmeticTests {

        @Test
        @DisplayName("算术结果总是浮点数")
        void arithmeticIsFloat() {
            assertThat(run("3 + 4")).isEqualTo(StorieFloat.of(7.0));
            assertThat(run("7 / 2")).isEqualTo(StorieFloat.of(3.5));
            assertThat(run("7 % 4")).isEqualTo(StorieFloat.of(3.0));
            assertThat(run("2 * 1.5 - 1")).isEqualTo(StorieFloat.of(2.0));
        }

        @Test
        @DisplayName("除零遵循 IEEE 语义")
        void divisionByZero() {
            assertThat(run("1 / 0").asDouble()).isInfinite();
            assertThat(run("5 % 0").asDouble()).isNaN();
        }

        @Test
        @DisplayName("比较混合整数与浮点数")
        void comparisons() {
            assertThat(run("1 < 2.5")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("2 == 2.0")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("3 != 3")).isEqualTo(StorieBoolean.FALSE);
            assertThat(run("4 >= 5")).isEqualTo(StorieBoolean.FALSE);
        }

        @Test
        @DisplayName("一元负号保留整数类型")
        void unaryMinus() {
            assertThat(run("-5")).isEqualTo(StorieInt.of(-5));
            assertThat(run("-2.5")).isEqualTo(StorieFloat.of(-2.5));
            assertThat(run("-(1 + 1)")).isEqualTo(StorieFloat.of(-2.0));
        }

        @Test
        @DisplayName("not 取真值的反")
        void notOperator() {
            assertThat(run("not 0")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("not \"\"")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("not \"a\"")).isEqualTo(StorieBoolean.FALSE);
        }

        @Test
        @DisplayName("非数值操作数报错")
        void nonNumericOperands() {
            assertThatThrownBy(() -> run("\"a\" + 1"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .extracting(e -> ((StorieRuntimeException) e).getRawMessage())
                    .isEqualTo("Unsupported operand types for '+': String and Int");
            assertThatThrownBy(() -> run("-true"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .hasMessageContaining("unary '-'");
            assertThatThrownBy(() -> run("true == true"))
                    .isInstanceOf(StorieRuntimeException.class);
        }
    }

    @Nested
    @DisplayName("逻辑运算")
    class LogicTests {

        @Test
        @DisplayName("短路求值不触碰右侧")
        void shortCircuit() {
            assertThat(run("false and undefinedVar")).isEqualTo(StorieBoolean.FALSE);
            assertThat(run("true or undefinedVar")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("0 and record(1)")).isEqualTo(StorieBoolean.FALSE);
            assertThat(recorded).isEmpty();
        }

        @Test
        @DisplayName("结果总是布尔值")
        void resultIsBoolean() {
            assertThat(run("1 and \"x\"")).isEqualTo(StorieBoolean.TRUE);
            assertThat(run("0 or \"\"")).isEqualTo(StorieBoolean.FALSE);
        }

        @Test
        @DisplayName("右侧的错误照常抛出")
        void rightSideStillEvaluated() {
            assertThatThrownBy(() -> run("true and undefinedVar"))
                    .hasMessageContaining("Undefined variable: undefinedVar");
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("变量与控制流")
    class StatementTests {

        @Test
        @DisplayName("声明与赋值")
        void declarationAndAssignment() {
            run("var x = 40\nlet name = \"hero\"\nx = x + 2");
            assertThat(global("x")).isEqualTo(StorieFloat.of(42.0));
            assertThat(global("name")).isEqualTo(StorieString.of("hero"));
        }

        @Test
        @DisplayName("if / elif / else 只执行第一个为真的分支")
        void ifChain() {
            String src = "if x < 0:\n  record(\"neg\")\nelif x < 10:\n  record(\"small\")\n"
                    + "elif x < 100:\n  record(\"medium\")\nelse:\n  record(\"big\")\n";
            interpreter.getGlobals().define("x", StorieInt.of(5));
            run(src);
            interpreter.getGlobals().define("x", StorieInt.of(500));
            run(src);
            assertThat(firstArgs()).containsExactly(StorieString.of("small"), StorieString.of("big"));
        }

        @Test
        @DisplayName("if 代码块不引入新作用域")
        void ifBlockSharesScope() {
            run("if true:\n  var inside = 1\n");
            assertThat(global("inside")).isEqualTo(StorieInt.of(1));
        }

        @Test
        @DisplayName("range 为左闭右开")
        void forRangeIsHalfOpen() {
            run("for i in range(0, 5):\n  record(i)\n");
            assertThat(firstArgs()).containsExactly(
                    StorieInt.of(0), StorieInt.of(1), StorieInt.of(2), StorieInt.of(3), StorieInt.of(4));
            assertThat(global("i")).isEqualTo(StorieInt.of(4));
        }

        @Test
        @DisplayName("range 边界只求值一次并截断为整数")
        void forBoundsTruncated() {
            run("var n = 2.9\nfor i in range(0, n):\n  n = 10\n  record(i)\n");
            assertThat(firstArgs()).containsExactly(StorieInt.of(0), StorieInt.of(1));
        }

        @Test
        @DisplayName("空区间不执行循环体")
        void emptyRange() {
            run("for i in range(5, 5):\n  record(i)\nfor j in range(3, 1):\n  record(j)\n");
            assertThat(recorded).isEmpty();
        }

        @Test
        @DisplayName("真值规则")
        void truthiness() {
            run("proc f():\n  return 1\n"
                    + "if 0:\n  record(\"zero\")\n"
                    + "if 0.0:\n  record(\"zerof\")\n"
                    + "if \"\":\n  record(\"empty\")\n"
                    + "if \"s\":\n  record(\"string\")\n"
                    + "if f:\n  record(\"function\")\n"
                    + "if -1:\n  record(\"negative\")\n");
            assertThat(firstArgs()).containsExactly(
                    StorieString.of("string"), StorieString.of("function"), StorieString.of("negative"));
        }

        @Test
        @DisplayName("顶层 return 结束程序")
        void topLevelReturn() {
            StorieValue result = run("x = 1\nreturn 5\nx = 2\n");
            assertThat(result).isEqualTo(StorieInt.of(5));
            assertThat(global("x")).isEqualTo(StorieInt.of(1));
        }
    }

    // ================================================================
    // 函数
    // ================================================================

    @Nested
    @DisplayName("函数调用")
    class CallTests {

        @Test
        @DisplayName("proc 返回值")
        void procReturn() {
            assertThat(run("proc add(a:int, b:int):\n  return a + b\nadd(3, 7)"))
                    .isEqualTo(StorieFloat.of(10.0));
        }

        @Test
        @DisplayName("没有 return 时返回 nil")
        void implicitNil() {
            assertThat(run("proc noop():\n  x = 1\nnoop()")).isSameAs(StorieNull.NIL);
        }

        @Test
        @DisplayName("缺少的参数为 nil，多余的参数被忽略")
        void arityMismatch() {
            run("proc show(a: int, b: int):\n  record(a, b)\nshow(1)\nshow(1, 2, 3)\n");
            assertThat(recorded.get(0)).containsExactly(StorieInt.of(1), StorieNull.NIL);
            assertThat(recorded.get(1)).containsExactly(StorieInt.of(1), StorieInt.of(2));
        }

        @Test
        @DisplayName("循环中的 return 结束循环和函数")
        void returnInsideLoop() {
            StorieValue result = run("proc firstOver(limit: int):\n"
                    + "  for i in range(0, 100):\n"
                    + "    record(i)\n"
                    + "    if i > limit:\n"
                    + "      return i\n"
                    + "  return -1\n"
                    + "firstOver(2)");
            assertThat(result).isEqualTo(StorieInt.of(3));
            assertThat(recorded).hasSize(4);
        }

        @Test
        @DisplayName("递归")
        void recursion() {
            StorieValue result = run("proc fact(n: int):\n"
                    + "  if n <= 1:\n"
                    + "    return 1\n"
                    + "  return n * fact(n - 1)\n"
                    + "fact(5)");
            assertThat(result).isEqualTo(StorieFloat.of(120.0));
        }

        @Test
        @DisplayName("被调函数能看到调用方的局部变量")
        void dynamicScoping() {
            StorieValue result = run("proc readSecret():\n"
                    + "  return secret\n"
                    + "proc outer():\n"
                    + "  var secret = 42\n"
                    + "  return readSecret()\n"
                    + "outer()");
            assertThat(result).isEqualTo(StorieInt.of(42));
            assertThat(global("secret")).isNull();
        }

        @Test
        @DisplayName("函数内对新名字赋值创建局部变量")
        void assignmentInsideFunctionIsLocal() {
            run("proc f():\n  fresh = 1\n  record(fresh)\nf()\n");
            assertThat(global("fresh")).isNull();
            assertThat(firstArgs()).containsExactly(StorieInt.of(1));
        }

        @Test
        @DisplayName("函数内赋值修改已存在的全局变量")
        void assignmentUpdatesGlobal() {
            run("var hits = 0\nproc hit():\n  hits = hits + 1\nhit()\nhit()\n");
            assertThat(global("hits")).isEqualTo(StorieFloat.of(2.0));
        }

        @Test
        @DisplayName("原生函数收到调用方环境")
        void nativeSeesCallerEnvironment() {
            interpreter.getGlobals().define("peek", new StorieNativeFunction("peek",
                    (env, args) -> env.tryGet(NativeArgs.of("peek", args).expectString(0))));
            StorieValue result = run("proc f():\n  var local = 7\n  return peek(\"local\")\nf()");
            assertThat(result).isEqualTo(StorieInt.of(7));
        }

        @Test
        @DisplayName("未定义函数与不可调用的值")
        void callErrors() {
            assertThatThrownBy(() -> run("missing(1)"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .hasMessageStartingWith("Undefined variable: missing");
            assertThatThrownBy(() -> run("var n = 1\nn(2)"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .hasMessageStartingWith("'n' is not callable");
        }

        @Test
        @DisplayName("参数从左到右求值")
        void argumentOrder() {
            interpreter.getGlobals().define("tag", new StorieNativeFunction("tag", (env, args) -> {
                recorded.add(new ArrayList<>(args));
                return args.get(0);
            }));
            run("record(tag(1), tag(2), tag(3))");
            assertThat(firstArgs().subList(0, 3))
                    .containsExactly(StorieInt.of(1), StorieInt.of(2), StorieInt.of(3));
        }
    }

    // ================================================================
    // 错误与资源限制
    // ================================================================

    @Nested
    @DisplayName("错误报告")
    class ErrorTests {

        @Test
        @DisplayName("运行时错误带源码位置和片段")
        void errorLocation() {
            StorieRuntimeException e = catchThrowableOfType(
                    () -> run("var x = 1\nx = y + 1\n"), StorieRuntimeException.class);
            assertThat(e.getRawMessage()).isEqualTo("Undefined variable: y");
            assertThat(e.getLocation().getLine()).isEqualTo(2);
            assertThat(e.getLocation().getColumn()).isEqualTo(5);
            assertThat(e.getSourceLine()).isEqualTo("x = y + 1");
            assertThat(e.getMessage()).contains("--> <test>:2:5").contains("^");
        }

        @Test
        @DisplayName("原生函数的错误定位到调用处")
        void nativeErrorLocated() {
            interpreter.getGlobals().define("needsInt", new StorieNativeFunction("needsInt",
                    (env, args) -> StorieInt.of(NativeArgs.of("needsInt", args).expectInt(0))));
            StorieRuntimeException e = catchThrowableOfType(
                    () -> run("\nneedsInt(\"x\")"), StorieRuntimeException.class);
            assertThat(e.getRawMessage()).isEqualTo("needsInt: Expected int, got String");
            assertThat(e.getLocation().getLine()).isEqualTo(2);
        }

        @Test
        @DisplayName("出错后不再执行后续语句")
        void noPartialContinuation() {
            assertThatThrownBy(() -> run("record(1)\nboom()\nrecord(2)\n"))
                    .isInstanceOf(StorieRuntimeException.class);
            assertThat(firstArgs()).containsExactly(StorieInt.of(1));
        }

        @Test
        @DisplayName("递归深度限制")
        void recursionLimit() {
            interpreter = newInterpreter(StorieOptions.builder().maxRecursionDepth(10).build());
            assertThatThrownBy(() -> run("proc down(n: int):\n  return down(n + 1)\ndown(0)"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .hasMessageStartingWith("Maximum recursion depth exceeded (10)");
            assertThat(interpreter.getCallDepth()).isZero();
        }

        @Test
        @DisplayName("循环迭代次数限制")
        void loopLimit() {
            interpreter = newInterpreter(StorieOptions.builder().maxLoopIterations(3).build());
            run("for i in range(0, 3):\n  record(i)\n");
            assertThatThrownBy(() -> run("for i in range(0, 4):\n  record(i)\n"))
                    .isInstanceOf(StorieRuntimeException.class)
                    .hasMessageStartingWith("Maximum loop iterations exceeded (3)");
        }
    }
}

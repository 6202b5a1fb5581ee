package storie.runtime;

import com.storielang.compiler.CompileException;
import com.storielang.compiler.ErrorKind;
import com.storielang.compiler.StorieCompiler;
import com.storielang.compiler.ast.decl.Program;
import storie.runtime.interpreter.EventRegistry;
import storie.runtime.interpreter.Interpreter;
import storie.runtime.interpreter.StorieNativeFunction;
import storie.runtime.interpreter.StorieNativeFunction.NativeFunc;
import storie.runtime.interpreter.StorieRuntimeException;
import storie.runtime.interpreter.cache.CacheStats;
import storie.runtime.interpreter.cache.ProgramCache;
import storie.runtime.types.Environment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Storie 宿主 API
 *
 * <p>每个实例拥有独立的全局环境和事件注册表，多个实例可在同一 JVM 中共存。
 * 实例不是线程安全的。</p>
 *
 * <pre>
 * StorieRuntime rt = StorieRuntime.init();
 * rt.registerNative("drawText", (env, args) -> { ... });
 * rt.setGlobalInt("screenWidth", 800);
 * rt.registerEvent("render", "var x = 40\ndrawText(\"Hello\", x, 200, 24, \"yellow\")");
 * rt.triggerEvent("render");
 * </pre>
 */
public final class StorieRuntime {

    private static final Logger LOG = Logger.getLogger(StorieRuntime.class.getName());

    private final StorieOptions options;
    private final Interpreter interpreter;
    private final EventRegistry events = new EventRegistry();
    private final ProgramCache programCache;

    private StorieRuntime(StorieOptions options) {
        this.options = options;
        this.interpreter = new Interpreter(options);
        this.programCache = options.isProgramCacheEnabled()
                ? new ProgramCache(options.getProgramCacheSize())
                : null;
    }

    public static StorieRuntime init() {
        return new StorieRuntime(StorieOptions.defaults());
    }

    public static StorieRuntime init(StorieOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        return new StorieRuntime(options);
    }

    public StorieOptions getOptions() {
        return options;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    // ============ 原生函数 ============

    /**
     * 在全局环境中绑定原生函数（同名覆盖）
     */
    public StorieRuntime registerNative(String name, NativeFunc function) {
        interpreter.getGlobals().define(name, new StorieNativeFunction(name, function));
        LOG.fine("Registered native function: " + name);
        return this;
    }

    // ============ 事件 ============

    public StorieRuntime registerEvent(String name, Program program) {
        Program previous = events.register(name, program);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine((previous != null ? "Replaced event: " : "Registered event: ")
                    + name + " (" + program.size() + " statements)");
        }
        return this;
    }

    /**
     * 编译源码并注册为事件，文件名取事件名
     *
     * @throws CompileException 词法或语法错误，此时注册表不变
     */
    public StorieRuntime registerEvent(String name, String source) {
        return registerEvent(name, source, name);
    }

    public StorieRuntime registerEvent(String name, String source, String fileName) {
        Program program = compile(source, fileName);
        return registerEvent(name, program);
    }

    public boolean hasEvent(String name) {
        return events.contains(name);
    }

    public Set<String> eventNames() {
        return events.names();
    }

    /**
     * 在全局环境中执行事件程序，丢弃返回值
     *
     * <p>未注册的事件什么也不做。执行中出现的第一个错误会中止本次触发并抛出。</p>
     *
     * @throws StorieRuntimeException 运行时错误
     */
    public void triggerEvent(String name) {
        Program program = events.get(name);
        if (program == null) {
            LOG.fine("Trigger of unregistered event ignored: " + name);
            return;
        }
        run(program, interpreter.getGlobals());
    }

    /**
     * 与 {@link #triggerEvent} 相同，但不抛出错误，而是以 {@link EventOutcome} 返回
     */
    public EventOutcome tryTriggerEvent(String name) {
        try {
            triggerEvent(name);
            return EventOutcome.ok();
        } catch (StorieRuntimeException e) {
            LOG.log(Level.WARNING, "Event '" + name + "' failed: " + e.getRawMessage());
            return EventOutcome.failed(name, e.getKind(), e.getRawMessage(), e);
        } catch (StorieException e) {
            LOG.log(Level.WARNING, "Event '" + name + "' failed: " + e.getMessage());
            return EventOutcome.failed(name, ErrorKind.RUNTIME, e.getMessage(), e);
        }
    }

    // ============ 求值 ============

    /**
     * 在全局环境中执行一段源码，返回最后一个表达式语句的值（REPL 使用）
     */
    public StorieValue eval(String source, String fileName) {
        return run(compile(source, fileName), interpreter.getGlobals());
    }

    /**
     * 以全局环境作为调用方，调用一个全局函数
     */
    public StorieValue call(String functionName, Object... args) {
        StorieValue callee = interpreter.getGlobals().tryGet(functionName);
        if (callee == null) {
            throw new StorieRuntimeException("Undefined variable: " + functionName);
        }
        if (!(callee instanceof StorieFunction)) {
            throw new StorieRuntimeException("'" + functionName + "' is not callable");
        }
        List<StorieValue> values = new ArrayList<>(args.length);
        for (Object arg : Arrays.asList(args)) {
            values.add(StorieValue.fromJava(arg));
        }
        return guardStack(() -> interpreter.call((StorieFunction) callee, values, interpreter.getGlobals()));
    }

    public Program compile(String source, String fileName) {
        interpreter.registerSource(fileName, source);
        if (programCache != null) {
            return programCache.compile(source, fileName);
        }
        return StorieCompiler.compile(source, fileName);
    }

    private StorieValue run(Program program, Environment env) {
        return guardStack(() -> interpreter.execute(program, env));
    }

    private static StorieValue guardStack(Supplier<StorieValue> body) {
        try {
            return body.get();
        } catch (StackOverflowError e) {
            throw new StorieRuntimeException("Stack overflow (unbounded recursion?)", e);
        }
    }

    // ============ 全局变量 ============

    public StorieRuntime setGlobal(String name, StorieValue value) {
        interpreter.getGlobals().define(name, value);
        return this;
    }

    public StorieRuntime setGlobal(String name, Object value) {
        return setGlobal(name, StorieValue.fromJava(value));
    }

    public StorieRuntime setGlobalInt(String name, long value) {
        return setGlobal(name, StorieInt.of(value));
    }

    public StorieRuntime setGlobalFloat(String name, double value) {
        return setGlobal(name, StorieFloat.of(value));
    }

    public StorieRuntime setGlobalBool(String name, boolean value) {
        return setGlobal(name, StorieBoolean.of(value));
    }

    public StorieRuntime setGlobalString(String name, String value) {
        return setGlobal(name, StorieString.of(value));
    }

    /**
     * @return 全局变量的值，未绑定时为 null
     */
    public StorieValue getGlobal(String name) {
        return interpreter.getGlobals().tryGet(name);
    }

    public Environment getGlobals() {
        return interpreter.getGlobals();
    }

    /**
     * @return 编译缓存统计，缓存禁用时为 null
     */
    public CacheStats getProgramCacheStats() {
        return programCache != null ? programCache.getStats() : null;
    }
}

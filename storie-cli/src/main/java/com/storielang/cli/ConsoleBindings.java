package com.storielang.cli;

import storie.runtime.StorieRuntime;
import storie.runtime.StorieValue;
import storie.runtime.interpreter.NativeArgs;
import storie.runtime.interpreter.StorieRuntimeException;

import java.io.PrintStream;
import java.util.List;

/**
 * 控制台宿主绑定
 *
 * <p>无图形环境下的原生函数：print / log 输出文本，绘图函数输出一行绘制记录。
 * 同时登记颜色常量（字符串全局变量）。</p>
 */
public final class ConsoleBindings {

    static final String[] COLORS = {"WHITE", "BLACK", "RED", "GREEN", "BLUE", "YELLOW"};

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleBindings(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void install(StorieRuntime runtime) {
        for (String color : COLORS) {
            runtime.setGlobalString(color, color.toLowerCase());
        }

        runtime.registerNative("print", (env, args) -> {
            out.println(join(args));
            return null;
        });
        runtime.registerNative("log", (env, args) -> {
            err.println("[log] " + join(args));
            return null;
        });

        runtime.registerNative("drawText", (env, args) -> {
            NativeArgs a = expect("drawText", args, 5, "text, x, y, size, color");
            out.printf("drawText \"%s\" at (%d, %d) size %d %s%n",
                    a.expectString(0), a.expectInt(1), a.expectInt(2), a.expectInt(3), a.expectString(4));
            return null;
        });
        runtime.registerNative("drawRect", (env, args) -> {
            NativeArgs a = expect("drawRect", args, 5, "x, y, w, h, color");
            out.printf("drawRect (%d, %d) %dx%d %s%n",
                    a.expectInt(0), a.expectInt(1), a.expectInt(2), a.expectInt(3), a.expectString(4));
            return null;
        });
        runtime.registerNative("drawCircle", (env, args) -> {
            NativeArgs a = expect("drawCircle", args, 4, "cx, cy, radius, color");
            out.printf("drawCircle (%d, %d) r=%s %s%n",
                    a.expectInt(0), a.expectInt(1), a.expectFloat(2), a.expectString(3));
            return null;
        });
        runtime.registerNative("clear", (env, args) -> {
            NativeArgs a = NativeArgs.of("clear", args);
            out.println("clear " + a.optionalString(0, "black"));
            return null;
        });
    }

    private static NativeArgs expect(String name, List<StorieValue> args, int count, String signature) {
        if (args.size() < count) {
            throw new StorieRuntimeException(name + " expects " + count + " args: " + signature);
        }
        return NativeArgs.of(name, args);
    }

    private static String join(List<StorieValue> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(args.get(i));
        }
        return sb.toString();
    }
}

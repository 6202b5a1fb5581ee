package com.storielang.cli;

import com.storielang.compiler.CompileException;
import com.storielang.compiler.ErrorKind;
import storie.runtime.FrameClock;
import storie.runtime.StorieOptions;
import storie.runtime.StorieRuntime;
import storie.runtime.interpreter.StorieRuntimeException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 脚本执行器：把脚本文件注册为事件，按帧触发
 */
public class ScriptRunner {

    private final StorieOptions options;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(StorieOptions options) {
        this(options, System.out, System.err);
    }

    public ScriptRunner(StorieOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件
     *
     * @return 进程退出码：0 成功，1 出错
     */
    public int runScript(String filePath, FrameSettings frames) {
        Path path = Paths.get(filePath);
        if (!Files.isReadable(path)) {
            err.println("Error: cannot read file - " + filePath);
            return 1;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        return runSource(source, filePath, frames);
    }

    int runSource(String source, String fileName, FrameSettings frames) {
        StorieRuntime runtime = StorieRuntime.init(options);
        new ConsoleBindings(out, err).install(runtime);
        FrameClock clock = new FrameClock(runtime, frames.width, frames.height);

        try {
            runtime.registerEvent(frames.event, source, fileName);
            for (int i = 0; i < frames.count; i++) {
                clock.tick(frames.delta);
                runtime.triggerEvent(frames.event);
            }
            return 0;
        } catch (CompileException e) {
            err.println((e.getKind() == ErrorKind.LEXICAL ? "Lexical error: " : "Syntax error: ")
                    + e.getMessage());
            printSourceLocation(source, fileName, e.getLine(), e.getColumn(), e.getLength());
            return 1;
        } catch (StorieRuntimeException e) {
            err.println("Runtime error (frame " + clock.getFrame() + "): " + e.getMessage());
            return 1;
        }
    }

    /**
     * 打印出错位置的源码片段
     */
    void printSourceLocation(String source, String fileName, int line, int column, int length) {
        String[] lines = source.split("\r?\n", -1);
        if (line < 1 || line > lines.length) return;

        String lineNum = String.valueOf(line);
        String padding = spaces(lineNum.length());
        err.println("  --> " + fileName + ":" + line + ":" + column);
        err.println(padding + " |");
        err.println(lineNum + " | " + lines[line - 1]);
        StringBuilder caret = new StringBuilder(padding).append(" | ").append(spaces(Math.max(0, column - 1)));
        for (int i = 0; i < Math.max(1, length); i++) {
            caret.append('^');
        }
        err.println(caret);
    }

    private static String spaces(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) sb.append(' ');
        return sb.toString();
    }

    /**
     * 帧循环参数
     */
    public static final class FrameSettings {
        final String event;
        final int count;
        final double delta;
        final long width;
        final long height;

        public FrameSettings(String event, int count, double delta, long width, long height) {
            this.event = event;
            this.count = count;
            this.delta = delta;
            this.width = width;
            this.height = height;
        }
    }
}

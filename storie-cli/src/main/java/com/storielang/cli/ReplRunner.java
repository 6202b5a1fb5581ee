package com.storielang.cli;

import com.storielang.compiler.CompileException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import storie.runtime.FrameClock;
import storie.runtime.StorieOptions;
import storie.runtime.StorieRuntime;
import storie.runtime.StorieValue;
import storie.runtime.interpreter.StorieRuntimeException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL 交互模式
 *
 * <p>所有输入共享同一个全局环境。以 ':' 结尾的行开启代码块，输入空行结束；
 * 括号未闭合时自动续行。</p>
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";

    private final StorieOptions options;
    private final PrintStream out;
    private final PrintStream err;
    private StorieRuntime runtime;
    // 源名 <repl#N> 中的 N
    private int entryCount;

    private final StringBuilder buffer = new StringBuilder();

    public ReplRunner(StorieOptions options) {
        this(options, System.out, System.err);
    }

    ReplRunner(StorieOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
        reset();
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Storie v" + VERSION + " REPL");
        out.println("Type :help for help, :quit to exit");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            err.println("Terminal initialisation failed: " + e.getMessage());
            runFallbackLoop();
        }

        out.println("\nBye!");
    }

    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(prompt());
                if (line == null || !accept(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            out.print(prompt());
            out.flush();
            try {
                String line = reader.readLine();
                if (line == null || !accept(line)) break;
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                break;
            }
        }
    }

    private String prompt() {
        return buffer.length() > 0 ? "... " : "storie> ";
    }

    /**
     * 处理一行输入
     *
     * @return false 表示退出
     */
    boolean accept(String line) {
        if (buffer.length() == 0) {
            String trimmed = line.trim();
            if (trimmed.startsWith(":")) {
                return handleCommand(trimmed);
            }
            if (trimmed.isEmpty()) {
                return true;
            }
        }

        if (buffer.length() > 0 && line.trim().isEmpty() && !hasUnclosedParens(buffer)) {
            // 空行结束代码块
            flush();
            return true;
        }

        buffer.append(line).append('\n');
        if (!needsContinuation(buffer)) {
            flush();
        }
        return true;
    }

    private void flush() {
        String source = buffer.toString();
        buffer.setLength(0);
        evaluateAndPrint(source);
    }

    void evaluateAndPrint(String source) {
        try {
            StorieValue result = runtime.eval(source, "<repl#" + (++entryCount) + ">");
            if (result != null && !result.isNil()) {
                out.println(result);
            }
        } catch (CompileException e) {
            err.println("Syntax error: " + e.getMessage());
        } catch (StorieRuntimeException e) {
            err.println("Runtime error: " + e.getMessage());
        }
    }

    private boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
                out.println("  :help      show this help");
                out.println("  :globals   list global variables");
                out.println("  :reset     start over with a fresh runtime");
                out.println("  :quit      exit");
                return true;
            case ":globals":
                for (String name : runtime.getGlobals().getLocalNames()) {
                    out.println("  " + name + " = " + runtime.getGlobal(name));
                }
                return true;
            case ":reset":
                reset();
                out.println("Runtime reset");
                return true;
            default:
                err.println("Unknown command: " + command);
                return true;
        }
    }

    private void reset() {
        runtime = StorieRuntime.init(options);
        entryCount = 0;
        new ConsoleBindings(out, err).install(runtime);
        new FrameClock(runtime, 800, 600);
    }

    /**
     * 缓冲区是否还需要继续读入：括号未闭合，或处于以 ':' 开启的代码块中
     */
    static boolean needsContinuation(CharSequence text) {
        if (hasUnclosedParens(text)) return true;
        String s = text.toString();
        String[] lines = s.split("\n");
        for (String l : lines) {
            if (stripComment(l).trim().endsWith(":")) {
                return true;
            }
        }
        return false;
    }

    static boolean hasUnclosedParens(CharSequence text) {
        int parens = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote || c == '\n') quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                while (i < text.length() && text.charAt(i) != '\n') i++;
            } else if (c == '(') {
                parens++;
            } else if (c == ')') {
                parens--;
            }
        }
        return parens > 0;
    }

    private static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }
}

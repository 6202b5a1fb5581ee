package com.storielang.cli;

import storie.runtime.StorieOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Storie CLI 入口点（picocli）
 */
@Command(name = "storie", version = "Storie v0.1.0",
         mixinStandardHelpOptions = true,
         description = "Runs a Storie script as a frame event, or starts a REPL when no file is given.")
public class Main implements Callable<Integer> {

    @Option(names = "--event", defaultValue = "render", description = "事件名（默认 ${DEFAULT-VALUE}）")
    String event;

    @Option(names = {"-n", "--frames"}, defaultValue = "1", description = "触发帧数（默认 ${DEFAULT-VALUE}）")
    int frames;

    @Option(names = "--delta", defaultValue = "0.016666666666666666", description = "每帧秒数，写入全局变量 dt")
    double delta;

    @Option(names = "--width", defaultValue = "800", description = "画布宽度")
    long width;

    @Option(names = "--height", defaultValue = "600", description = "画布高度")
    long height;

    @Option(names = "--sandbox", description = "启用资源限制（递归深度 256，单循环 1000000 次）")
    boolean sandbox;

    @Option(names = "--max-recursion", description = "用户函数最大调用深度（0=无限制）")
    Integer maxRecursion;

    @Option(names = "--max-loop", description = "单个 for 循环最大迭代次数（0=无限制）")
    Long maxLoop;

    @Option(names = "--no-cache", description = "禁用编译缓存")
    boolean noCache;

    @Option(names = {"-v", "--verbose"}, description = "输出运行时调试日志")
    boolean verbose;

    @Parameters(arity = "0..1", description = "脚本文件")
    String file;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        StorieOptions options = resolveOptions();

        if (file != null) {
            if (frames < 0) {
                System.err.println("Error: --frames must not be negative");
                return 1;
            }
            return new ScriptRunner(options)
                    .runScript(file, new ScriptRunner.FrameSettings(event, frames, delta, width, height));
        }
        new ReplRunner(options).run();
        return 0;
    }

    StorieOptions resolveOptions() {
        StorieOptions.Builder builder = (sandbox ? StorieOptions.sandboxed() : StorieOptions.defaults()).toBuilder();
        if (maxRecursion != null) builder.maxRecursionDepth(maxRecursion);
        if (maxLoop != null) builder.maxLoopIterations(maxLoop);
        if (noCache) builder.programCacheSize(0);
        return builder.build();
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}

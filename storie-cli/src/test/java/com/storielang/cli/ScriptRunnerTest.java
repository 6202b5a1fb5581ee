package com.storielang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import storie.runtime.StorieOptions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("脚本执行器")
class ScriptRunnerTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new ScriptRunner(StorieOptions.defaults(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private ScriptRunner.FrameSettings frames(int count) {
        return new ScriptRunner.FrameSettings("render", count, 0.5, 800, 600);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("按帧触发并打印绘制记录")
    void runsFrames(@TempDir Path dir) throws IOException {
        Path script = dir.resolve("hello.storie");
        Files.write(script, ("var x = 40\n"
                + "drawText(\"Hello\", x + frame, 200, 24, YELLOW)\n").getBytes(StandardCharsets.UTF_8));

        int code = runner.runScript(script.toString(), frames(2));

        assertThat(code).isZero();
        assertThat(stdout()).contains("drawText \"Hello\" at (41, 200) size 24 yellow")
                .contains("drawText \"Hello\" at (42, 200) size 24 yellow");
    }

    @Test
    @DisplayName("print 与帧全局变量")
    void printAndGlobals() {
        int code = runner.runSource("print(frame, dt, screenWidth, screenHeight)", "t", frames(1));
        assertThat(code).isZero();
        assertThat(stdout()).isEqualTo("1 0.5 800 600" + System.lineSeparator());
    }

    @Test
    @DisplayName("log 写入标准错误")
    void logGoesToStderr() {
        runner.runSource("log(\"hi\", 1)", "t", frames(1));
        assertThat(stderr()).contains("[log] hi 1");
    }

    @Test
    @DisplayName("语法错误打印片段并返回 1")
    void syntaxError() {
        int code = runner.runSource("if x\n  y = 1\n", "bad.storie", frames(1));
        assertThat(code).isEqualTo(1);
        assertThat(stderr()).startsWith("Syntax error: ")
                .contains("--> bad.storie:1:5")
                .contains("1 | if x");
    }

    @Test
    @DisplayName("词法错误")
    void lexicalError() {
        int code = runner.runSource("x = 1 @ 2", "bad.storie", frames(1));
        assertThat(code).isEqualTo(1);
        assertThat(stderr()).startsWith("Lexical error: ").contains("^");
    }

    @Test
    @DisplayName("运行时错误报告帧号")
    void runtimeError() {
        int code = runner.runSource("if frame == 2:\n  boom()\n", "t", frames(5));
        assertThat(code).isEqualTo(1);
        assertThat(stderr()).startsWith("Runtime error (frame 2): Undefined variable: boom");
    }

    @Test
    @DisplayName("绘图函数参数不足")
    void drawArity() {
        int code = runner.runSource("drawCircle(1, 2)", "t", frames(1));
        assertThat(code).isEqualTo(1);
        assertThat(stderr()).contains("drawCircle expects 4 args: cx, cy, radius, color");
    }

    @Test
    @DisplayName("文件不存在")
    void missingFile(@TempDir Path dir) {
        int code = runner.runScript(dir.resolve("nope.storie").toString(), frames(1));
        assertThat(code).isEqualTo(1);
        assertThat(stderr()).contains("cannot read file");
    }
}

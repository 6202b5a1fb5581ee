package com.storielang.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import storie.runtime.StorieOptions;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

    @Test
    void defaults() {
        Main main = parse("game.storie");
        assertEquals("game.storie", main.file);
        assertEquals("render", main.event);
        assertEquals(1, main.frames);
        assertEquals(800, main.width);
        assertEquals(600, main.height);

        StorieOptions options = main.resolveOptions();
        assertEquals(0, options.getMaxRecursionDepth());
        assertTrue(options.isProgramCacheEnabled());
    }

    @Test
    void sandboxWithOverrides() {
        StorieOptions options = parse("--sandbox", "--max-loop", "10", "--no-cache").resolveOptions();
        assertEquals(256, options.getMaxRecursionDepth());
        assertEquals(10, options.getMaxLoopIterations());
        assertFalse(options.isProgramCacheEnabled());
    }

    @Test
    void frameOptions() {
        Main main = parse("--event", "update", "--frames", "30", "--delta", "0.5", "--width", "320", "--height", "240", "x.storie");
        assertEquals("update", main.event);
        assertEquals(30, main.frames);
        assertEquals(0.5, main.delta);
        assertEquals(320, main.width);
        assertEquals(240, main.height);
    }

    @Test
    void scriptExitCode() {
        int code = new CommandLine(new Main()).execute("does-not-exist.storie");
        assertEquals(1, code);
    }
}

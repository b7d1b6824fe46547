package com.github.musiKk.quench;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.musiKk.quench.compiler.ExecutionTest;

public class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    public void testParse() throws IOException {
        var file = write("x := 1;");

        assertEquals(Main.EXIT_OK, run("parse", file.toString()));
        assertEquals("""
                source_file [0:0 - 0:7] (0..7)
                  declaration [0:0 - 0:7] (0..7)
                    name: identifier [0:0 - 0:1] (0..1)
                    value: integer [0:5 - 0:6] (5..6)
                """, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testCompile() throws IOException {
        var file = write("main := _ => print \"hi\";");

        assertEquals(Main.EXIT_OK, run("compile", file.toString()));
        assertEquals("""
                import * as Immutable from "immutable";
                const $main = ($_) => console.log("hi");
                $main();
                """, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testCompileSyntaxError() throws IOException {
        var file = write("x := ;");

        assertEquals(Main.EXIT_FAILURE, run("compile", file.toString()));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("syntax error at 1:1"));
    }

    @Test
    public void testMissingFile() {
        assertEquals(Main.EXIT_FAILURE, run("compile", dir.resolve("missing.qn").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot read"));
    }

    @Test
    public void testRuntimeNotFound() throws IOException {
        var file = write("print 1;");
        var cfg = dir.resolve("quench.cfg");
        Files.writeString(cfg, "runtimeCommand=quench-test-no-such-runtime\n");

        int status = Main.run(new String[] { "run", file.toString() }, print(out), print(err), ConfigReader.readConfig(cfg));

        assertEquals(Main.EXIT_FAILURE, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot run quench-test-no-such-runtime"));
    }

    @Test
    public void testRunReturnsProgramStatus() throws IOException {
        assumeTrue(ExecutionTest.runtimeAvailable(), "node is not installed");
        var collections = Paths.get("src/test/resources/runtime/immutable.mjs").toAbsolutePath().toUri();
        var cfg = dir.resolve("quench.cfg");
        Files.writeString(cfg, "runtimeCommand=node\ncollectionsModule=" + collections + "\n");

        var ok = write("main := _ => [1, 2][0];");
        assertEquals(Main.EXIT_OK, Main.run(new String[] { "run", ok.toString(), "arg" }, print(out), print(err), ConfigReader.readConfig(cfg)));

        var failing = write("main := _ => 1 2;");
        assertEquals(1, Main.run(new String[] { "run", failing.toString() }, print(out), print(err), ConfigReader.readConfig(cfg)));
    }

    @Test
    public void testUsage() {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("compile"));
        assertEquals(Main.EXIT_USAGE, run("format", "x.qn"));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("usage:"));
    }

    private Path write(String source) throws IOException {
        var file = dir.resolve("test.qn");
        Files.writeString(file, source);
        return file;
    }

    private int run(String... args) {
        return Main.run(args, print(out), print(err), ConfigReader.readConfig(dir.resolve("quench.cfg")));
    }

    private static PrintStream print(ByteArrayOutputStream stream) {
        return new PrintStream(stream, true, StandardCharsets.UTF_8);
    }
}

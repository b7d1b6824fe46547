package com.github.musiKk.quench;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.quench.compiler.Compiler;
import com.github.musiKk.quench.parser.IncrementalParser;

/**
 * Command line front end.
 *
 * <pre>
 * quench parse &lt;file&gt;
 * quench compile &lt;file&gt;
 * quench run &lt;file&gt; [args...]
 * </pre>
 */
public class Main implements ConfigReader.ConfigTarget {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: quench (parse|compile|run) <file> [args...]";

    private final PrintStream out;
    private final PrintStream err;
    private final Compiler compiler = new Compiler();
    private String runtimeCommand = "node";

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void setRuntimeCommand(String runtimeCommand) {
        this.runtimeCommand = runtimeCommand;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, ConfigReader.readConfig()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, ConfigReader.Config config) {
        var main = new Main(out, err);
        config.applyConfig(main);
        config.applyConfig(main.compiler);
        return main.run(args);
    }

    int run(String[] args) {
        if (args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        var command = args[0];
        var file = Path.of(args[1]);
        try {
            switch (command) {
                case "parse" -> out.print(parse(file).debugString());
                case "compile" -> out.print(compile(file));
                case "run" -> {
                    return execute(compile(file), Arrays.copyOfRange(args, 2, args.length));
                }
                default -> {
                    err.println("unknown command " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (MalformedTreeException | IoFailureException e) {
            LOG.debug("{} {} failed", command, file, e);
            err.println(file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private IncrementalParser parse(Path file) {
        return IncrementalParser.create(read(file));
    }

    private String compile(Path file) {
        return compiler.compile(parse(file).tree());
    }

    private int execute(String module, String[] programArgs) {
        Path script = null;
        try {
            // bare module specifiers resolve relative to the script, so it lives in the working directory
            script = Files.createTempFile(Path.of("").toAbsolutePath(), ".quench-", ".mjs");
            Files.writeString(script, module, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(runtimeCommand);
            command.add(script.toString());
            command.addAll(Arrays.asList(programArgs));
            LOG.debug("running {}", command);

            var process = new ProcessBuilder(command).inheritIO().start();
            return process.waitFor();
        } catch (IOException e) {
            throw new IoFailureException("cannot run " + runtimeCommand, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IoFailureException("interrupted while running " + runtimeCommand, e);
        } finally {
            if (script != null) {
                deleteQuietly(script);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("cannot delete {}", path, e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException("cannot read " + file, e);
        }
    }
}

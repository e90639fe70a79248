package com.lapair.tool;

import com.lapair.ir.IrGraph;
import com.lapair.tool.config.AnalysisConfig;
import com.lapair.tool.config.AnalysisConfigReader;
import com.lapair.tool.frontend.FrontEnd;
import com.lapair.tool.frontend.SourceFileFrontEnd;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar lapair-tool-java.jar [--config <config.json>] [--analyze] \
 *     <source>... [-- <compiler-args>...]
 *
 * Single-dash arguments before {@code --} are passed to the front end as
 * compiler flags too, so {@code lapair a.cpp -std=c++17} works.
 */
public class ToolMain {

    static final String SUCCESS_MESSAGE = "Front end executed successfully.";
    static final String USAGE =
            "Usage: java -jar lapair-tool-java.jar [--config <file>] [--analyze] <source>... [-- <compiler-args>...]";

    public static void main(String[] args) {
        System.exit(execute(args, new SourceFileFrontEnd(), System.out));
    }

    /** Runs the tool and maps failures to an exit code instead of throwing. */
    static int execute(String[] args, FrontEnd frontEnd, PrintStream out) {
        try {
            run(args, frontEnd, out);
            return 0;
        } catch (UsageException e) {
            System.err.println("[lapair] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("[lapair] FATAL: " + e.getMessage());
            return 1;
        }
    }

    static void run(String[] args, FrontEnd frontEnd, PrintStream out) {
        String configPath = null;
        boolean analyze = false;
        List<Path> sources = new ArrayList<>();
        List<String> compilerArgs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--")) {
                for (int j = i + 1; j < args.length; j++) compilerArgs.add(args[j]);
                break;
            }
            switch (arg) {
                case "--config"  -> configPath = requireNext(args, i++, "--config");
                case "--analyze" -> analyze = true;
                default -> {
                    if (arg.startsWith("--")) throw new UsageException("Unknown flag: " + arg);
                    if (arg.startsWith("-")) compilerArgs.add(arg);
                    else sources.add(Paths.get(arg));
                }
            }
        }

        if (sources.isEmpty()) throw new UsageException("at least one source file is required");

        AnalysisConfig config = AnalysisConfig.defaults();
        if (configPath != null) {
            System.err.println("[lapair] Reading config: " + configPath);
            config = new AnalysisConfigReader().read(Paths.get(configPath));
        }

        List<String> effectiveArgs = new ArrayList<>(config.getCompilerArgs());
        effectiveArgs.addAll(compilerArgs);

        IrGraph graph = frontEnd.translate(sources, effectiveArgs);
        out.println(SUCCESS_MESSAGE);

        if (analyze) {
            for (String line : new AnalysisRunner().run(graph, config)) {
                System.err.println("[lapair] " + line);
            }
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}

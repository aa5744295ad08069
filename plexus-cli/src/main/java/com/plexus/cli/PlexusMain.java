package com.plexus.cli;

import com.plexus.core.compiler.GraphCompiler;
import com.plexus.core.decompiler.SourceDecompiler;
import com.plexus.core.ir.GraphCodec;
import com.plexus.core.ir.IrModel;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line front end.
 *
 * Usage:
 *   plexus decompile <input.py>   [-o|--output <graph.json>] [--config <plexus.json>]
 *   plexus compile   <graph.json> [-o|--output <out.py>]     [--config <plexus.json>]
 *
 * Without --output the result goes to stdout; progress goes to stderr.
 */
public class PlexusMain {

    private static final String USAGE =
            "Usage: plexus (decompile <input.py> | compile <graph.json>) [-o <output>] [--config <plexus.json>]";

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[plexus] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[plexus] ERROR: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("decompile") && !command.equals("compile")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        // Parse flags
        String inputFile = null;
        String outputFile = null;
        String configFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "-o", "--output" -> outputFile = requireNext(args, i++, "--output");
                case "--config"       -> configFile = requireNext(args, i++, "--config");
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (inputFile != null) {
                        throw new UsageException("Unexpected argument: " + args[i]);
                    }
                    inputFile = args[i];
                }
            }
        }

        if (inputFile == null) throw new UsageException("An input file is required");

        Path input = Paths.get(inputFile);
        Path output = outputFile != null ? Paths.get(outputFile) : null;
        if (!Files.exists(input)) {
            throw new CliException("Input file not found at '" + input + "'");
        }

        PlexusConfig config = configFile != null
                ? new ConfigReader().read(Paths.get(configFile))
                : PlexusConfig.defaults();

        if (command.equals("decompile")) {
            decompile(input, output, config, out);
        } else {
            compile(input, output, config, out);
        }
    }

    private static void decompile(Path input, Path output, PlexusConfig config, PrintStream out) {
        System.err.println("[plexus] Decompiling " + input + "...");
        String source = readText(input);
        IrModel.GraphIr graph = new SourceDecompiler(config.toDecompilerOptions()).decompile(source);
        System.err.println("[plexus] Decompiled " + graph.nodes.size() + " top-level nodes");

        GraphCodec codec = new GraphCodec();
        if (output != null) {
            codec.write(graph, output, config.isPrettyPrint());
            System.err.println("[plexus] Graph written: " + output);
        } else {
            out.println(codec.toJson(graph, config.isPrettyPrint()));
        }
    }

    private static void compile(Path input, Path output, PlexusConfig config, PrintStream out) {
        System.err.println("[plexus] Compiling " + input + "...");
        IrModel.GraphIr graph = new GraphCodec().read(input);
        String source = new GraphCompiler(config.toCompilerOptions()).compile(graph);

        if (output != null) {
            writeText(output, source);
            System.err.println("[plexus] Source written: " + output);
        } else {
            out.println(source);
        }
    }

    private static String readText(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CliException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static void writeText(Path path, String text) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CliException("Failed to write " + path + ": " + e.getMessage(), e);
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

    static class CliException extends RuntimeException {
        CliException(String msg) { super(msg); }
        CliException(String msg, Throwable cause) { super(msg, cause); }
    }
}

package com.proseparser.cli;

import ch.qos.logback.classic.Level;
import com.proseparser.CompilationException;
import com.proseparser.Compiler;
import com.proseparser.Lexer;
import com.proseparser.Token;
import com.proseparser.ast.Program;
import com.proseparser.codegen.PythonGenerator;
import com.proseparser.json.AstJsonProvider;
import com.proseparser.json.AstJsonSerializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command-line driver: compiles a script to Python, or dumps its tree or tokens as JSON.
 *
 * Usage:
 *   java -cp ... com.proseparser.cli.ParlanceCli [options] <input|->
 *
 * Options:
 *   -o PATH, --output=PATH   Write the result to PATH (default: stdout)
 *   --format=python|json|tokens
 *   --indent=N               Spaces per level in Python output (default: 4)
 *   --verbose                Debug logging
 *   --version, --help
 */
public class ParlanceCli {

    private static final Logger logger = LoggerFactory.getLogger(ParlanceCli.class);

    public static final String VERSION = "1.0.0";

    private final Config config;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage(System.err);
            System.exit(1);
        }

        int exitCode = new ParlanceCli(config).run(System.in, System.out, System.err);
        System.exit(exitCode);
    }

    public ParlanceCli(Config config) {
        this.config = config;
    }

    /**
     * @return the process exit code: 0 on success, 1 on any error
     */
    public int run(InputStream stdin, PrintStream out, PrintStream err) {
        if (config.help) {
            printUsage(out);
            return 0;
        }
        if (config.version) {
            out.println("parlance " + VERSION);
            return 0;
        }
        if (config.verbose) {
            enableDebugLogging();
        }

        String source;
        try {
            source = readSource(stdin);
        } catch (IOException e) {
            err.println("Error: Could not read '" + config.input + "': " + e.getMessage());
            return 1;
        }
        if (source == null) {
            err.println("Error: Input file '" + config.input + "' not found");
            return 1;
        }

        String result;
        try {
            result = render(source);
        } catch (CompilationException e) {
            logger.debug("Compilation failed", e);
            err.println("Syntax Error: " + e.getMessage());
            return 1;
        }

        if (config.output == null) {
            out.println(result);
            return 0;
        }
        try {
            Files.writeString(config.output, result + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Could not write '" + config.output + "': " + e.getMessage());
            return 1;
        }
        err.println("Compiled successfully: " + config.input + " -> " + config.output);
        return 0;
    }

    // null when the named file does not exist
    private String readSource(InputStream stdin) throws IOException {
        if (config.input.equals("-")) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Path.of(config.input);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        logger.info("Reading {}", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private String render(String source) {
        switch (config.format) {
            case TOKENS: {
                List<Token> tokens = Lexer.tokenize(source);
                return serializer().serializeTokens(tokens, true);
            }
            case JSON: {
                Program program = new Compiler().parse(source);
                return serializer().serializePretty(program);
            }
            default: {
                PythonGenerator generator = new PythonGenerator(" ".repeat(config.indent));
                return new Compiler(generator).compile(source);
            }
        }
    }

    private static AstJsonSerializer serializer() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        logger.debug("Using JSON provider {}", provider.getName());
        return provider.getSerializer();
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: ParlanceCli [options] <input|->");
        out.println();
        out.println("Compiles an English-like script to Python. Use '-' to read from stdin.");
        out.println();
        out.println("Options:");
        out.println("  -o PATH, --output=PATH        Output file (default: stdout)");
        out.println("  --format=python|json|tokens   Output format (default: python)");
        out.println("  --indent=N                    Spaces per indentation level (default: 4)");
        out.println("  --verbose                     Enable debug logging");
        out.println("  --version                     Print the version and exit");
        out.println("  --help                        Show this help");
        out.println();
        out.println("Examples:");
        out.println("  ParlanceCli input.uhl -o output.py");
        out.println("  echo \"declare a variable named x and set it to 5\" | ParlanceCli -");
    }

    // ========== Inner classes ==========

    public enum Format {
        PYTHON, JSON, TOKENS
    }

    public static class Config {
        Format format = Format.PYTHON;
        int indent = 4;
        Path output = null;
        String input = null;
        boolean verbose = false;
        boolean help = false;
        boolean version = false;

        /**
         * @return the configuration, or null (after printing the reason to stderr) when the
         *         arguments are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                } else if (arg.equals("--version")) {
                    config.version = true;
                } else if (arg.startsWith("--format=")) {
                    String format = arg.substring(9).toUpperCase(Locale.ROOT);
                    try {
                        config.format = Format.valueOf(format);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid format: " + arg.substring(9));
                        return null;
                    }
                } else if (arg.startsWith("--indent=")) {
                    try {
                        config.indent = Integer.parseInt(arg.substring(9));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid indent: " + arg.substring(9));
                        return null;
                    }
                    if (config.indent < 1) {
                        System.err.println("Indent must be at least 1");
                        return null;
                    }
                } else if (arg.startsWith("--output=")) {
                    config.output = Path.of(arg.substring(9));
                } else if (arg.equals("-o") || arg.equals("--output")) {
                    if (i + 1 >= args.length) {
                        System.err.println("Missing path after " + arg);
                        return null;
                    }
                    config.output = Path.of(args[++i]);
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (arg.equals("-") || !arg.startsWith("-")) {
                    if (config.input != null) {
                        System.err.println("Only one input may be given");
                        return null;
                    }
                    config.input = arg;
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.input == null && !config.help && !config.version) {
                System.err.println("Error: No input specified");
                return null;
            }

            return config;
        }

        public Format format() {
            return format;
        }

        public int indent() {
            return indent;
        }

        public Path output() {
            return output;
        }

        public String input() {
            return input;
        }

        public boolean verbose() {
            return verbose;
        }
    }
}

package com.fnparser.cli;

import com.fnparser.ParseErrors;
import com.fnparser.ParseResult;
import com.fnparser.Parser;
import com.fnparser.ReplLine;
import com.fnparser.ast.Arena;
import com.fnparser.ast.Expression;
import com.fnparser.ast.Node;
import com.fnparser.ast.SymbolTable;
import com.fnparser.ast.TypeCache;
import com.fnparser.ast.ValueBinding;
import com.fnparser.infix.BindingMetadata;
import com.fnparser.json.AstJsonProvider;
import com.fnparser.json.AstJsonSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Parses a source file and prints its AST, or its diagnostics, as JSON.
 *
 * Usage:
 *   java -cp ... com.fnparser.cli.FugueCli [options] <file>
 *
 * Options:
 *   --repl       Parse the file as a single REPL line
 *   --no-infix   Keep operator chains as the grammar produced them
 *   --pretty     Indent the AST output
 *
 * Exit codes: 0 parsed cleanly, 1 parse errors, 2 usage or I/O error.
 */
public class FugueCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARSE_ERRORS = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger log = LogManager.getLogger(FugueCli.class);

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;
    private final AstJsonSerializer serializer;

    public FugueCli(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.serializer = AstJsonProvider.getProvider().getSerializer();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        return new FugueCli(config, out, err).run();
    }

    public int run() {
        String source;
        try {
            source = Files.readString(config.file);
        } catch (IOException e) {
            log.error("Cannot read {}", config.file, e);
            err.println("Error: cannot read " + config.file + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        Arena arena = new Arena();
        SymbolTable symbols = new SymbolTable();
        ParseErrors errors = new ParseErrors();
        Node root = config.repl
            ? parseReplLine(arena, symbols, source, errors)
            : parseExpression(arena, symbols, source, errors);
        log.info("Parsed {} into {} nodes with {} errors", config.file, arena.size(), errors.size());

        if (errors.hasErrors()) {
            out.println(serializer.serializeDiagnostics(errors));
            return EXIT_PARSE_ERRORS;
        }
        if (root == null) {
            out.println("null");
        } else {
            out.println(config.pretty ? serializer.serializePretty(root) : serializer.serialize(root));
        }
        return EXIT_OK;
    }

    private Expression parseExpression(Arena arena, SymbolTable symbols, String source, ParseErrors errors) {
        ParseResult<Expression> result = Parser.parsePartialExpr(arena, symbols, new TypeCache(), source);
        errors.extend(result.errors());
        return result.value().map(expr -> reparse(arena, expr, errors)).orElse(null);
    }

    private Node parseReplLine(Arena arena, SymbolTable symbols, String source, ParseErrors errors) {
        ParseResult<Optional<ReplLine>> result = Parser.parsePartialReplLine(arena, symbols, source);
        errors.extend(result.errors());
        Optional<ReplLine> line = result.value().flatMap(l -> l);
        if (line.isEmpty()) {
            return null;
        }
        if (line.get() instanceof ReplLine.LetLine let) {
            ValueBinding binding = let.binding();
            Expression body = reparse(arena, binding.expression(), errors);
            return body == binding.expression() ? binding : arena.alloc(binding.withExpression(body));
        }
        return reparse(arena, ((ReplLine.ExprLine) line.get()).expression(), errors);
    }

    private Expression reparse(Arena arena, Expression expr, ParseErrors errors) {
        if (config.noInfix) {
            return expr;
        }
        ParseResult<Expression> result = Parser.reparseInfix(arena, BindingMetadata.collect(expr), expr);
        errors.extend(result.errors());
        return result.value().orElse(expr);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: FugueCli [options] <file>");
        err.println();
        err.println("Options:");
        err.println("  --repl       Parse the file as a single REPL line");
        err.println("  --no-infix   Keep operator chains as parsed, without fixity resolution");
        err.println("  --pretty     Indent the AST output");
        err.println("  --help       Show this help");
    }

    public static class Config {
        Path file;
        boolean repl = false;
        boolean noInfix = false;
        boolean pretty = false;

        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--repl")) {
                    config.repl = true;
                } else if (arg.equals("--no-infix")) {
                    config.noInfix = true;
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (!arg.startsWith("-") && config.file == null) {
                    config.file = Path.of(arg);
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.file == null) {
                err.println("Error: No input file specified");
                return null;
            }

            return config;
        }
    }
}

package com.fnparser;

import com.fnparser.ast.Arena;
import com.fnparser.ast.Expression;
import com.fnparser.ast.IdentEnv;
import com.fnparser.ast.Metadata;
import com.fnparser.ast.Symbol;
import com.fnparser.ast.TypeCache;
import com.fnparser.grammar.ExprGrammar;
import com.fnparser.grammar.GrammarError;
import com.fnparser.grammar.GrammarException;
import com.fnparser.grammar.TempVecs;
import com.fnparser.infix.FixityCollector;
import com.fnparser.infix.Reparser;
import com.fnparser.layout.Layout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry points of the parser.
 *
 * <p>Every call builds its own tokenizer, layout engine, grammar and scratch pools, so calls
 * are independent; the arena, identifier environment and type cache belong to the caller and
 * must not be shared between calls running at the same time.</p>
 */
public final class Parser {

    private static final Logger log = LogManager.getLogger(Parser.class);

    private Parser() {
    }

    /**
     * Parses {@code input} as a single expression, returning whatever tree could be built
     * together with every error found.
     */
    public static ParseResult<Expression> parsePartialExpr(Arena arena, IdentEnv env, TypeCache typeCache,
                                                           ParserSource input) {
        List<GrammarError> sink = new ArrayList<>();
        ExprGrammar grammar = grammar(arena, env, typeCache, input, sink);

        Expression expr = null;
        try {
            expr = grammar.parseExpression();
        } catch (GrammarException e) {
            sink.add(e.error());
        }

        ParseErrors errors = ErrorTranslator.transform(input.span(), sink);
        log.debug("Parsed {} chars at {} with {} errors", input.src().length(), input.startIndex(), errors.size());
        if (expr == null) {
            return ParseResult.failed(errors);
        }
        expr = SpanShrinker.shrink(arena, expr);
        return errors.isEmpty() ? ParseResult.ok(expr) : ParseResult.partial(expr, errors);
    }

    public static ParseResult<Expression> parsePartialExpr(Arena arena, IdentEnv env, TypeCache typeCache,
                                                           String input) {
        return parsePartialExpr(arena, env, typeCache, ParserSource.of(input));
    }

    /**
     * Parses {@code input} as a single expression.
     *
     * @throws ParseException carrying every error when the input did not parse cleanly
     */
    public static Expression parseExpr(Arena arena, IdentEnv env, TypeCache typeCache, ParserSource input) {
        return parsePartialExpr(arena, env, typeCache, input).orElseThrow();
    }

    public static Expression parseExpr(Arena arena, IdentEnv env, TypeCache typeCache, String input) {
        return parseExpr(arena, env, typeCache, ParserSource.of(input));
    }

    /**
     * Parses one REPL line. Blank input yields an empty value and no errors; a line holding
     * only a {@code let} binding yields a {@link ReplLine.LetLine}.
     */
    public static ParseResult<Optional<ReplLine>> parsePartialReplLine(Arena arena, IdentEnv env,
                                                                       ParserSource input) {
        List<GrammarError> sink = new ArrayList<>();
        ExprGrammar grammar = grammar(arena, env, new TypeCache(), input, sink);

        Optional<ReplLine> line = null;
        try {
            line = grammar.parseReplLine().map(l -> shrink(arena, l));
        } catch (GrammarException e) {
            sink.add(e.error());
        }

        ParseErrors errors = ErrorTranslator.transform(input.span(), sink);
        log.debug("Parsed REPL line of {} chars with {} errors", input.src().length(), errors.size());
        if (line == null) {
            return ParseResult.failed(errors);
        }
        return errors.isEmpty() ? ParseResult.ok(line) : ParseResult.partial(line, errors);
    }

    public static ParseResult<Optional<ReplLine>> parsePartialReplLine(Arena arena, IdentEnv env, String input) {
        return parsePartialReplLine(arena, env, ParserSource.of(input));
    }

    /**
     * Re-associates every operator chain in {@code expr} using the {@code infix} attributes in
     * {@code metadata}. The result always holds the best tree that could be built; operators
     * without a fixity are treated as left associative at precedence 0.
     */
    public static ParseResult<Expression> reparseInfix(Arena arena, Map<Symbol, Metadata> metadata, Expression expr) {
        ParseErrors errors = new ParseErrors();
        FixityCollector collector = new FixityCollector(metadata, errors);
        collector.visitExpression(expr);

        Expression result = new Reparser(arena, collector.table(), collector.unresolved(), errors).rewrite(expr);
        log.debug("Reparsed infix chains with {} declared operators, {} errors",
            collector.table().size(), errors.size());
        return errors.isEmpty() ? ParseResult.ok(result) : ParseResult.partial(result, errors);
    }

    private static ExprGrammar grammar(Arena arena, IdentEnv env, TypeCache typeCache, ParserSource input,
                                       List<GrammarError> sink) {
        Layout layout = new Layout(new Tokenizer(input));
        return new ExprGrammar(input, typeCache, arena, env, sink, new TempVecs(), layout);
    }

    private static ReplLine shrink(Arena arena, ReplLine line) {
        if (line instanceof ReplLine.LetLine let) {
            Expression body = SpanShrinker.shrink(arena, let.binding().expression());
            return body == let.binding().expression() ? line
                : new ReplLine.LetLine(arena.alloc(let.binding().withExpression(body)));
        }
        ReplLine.ExprLine exprLine = (ReplLine.ExprLine) line;
        return new ReplLine.ExprLine(SpanShrinker.shrink(arena, exprLine.expression()));
    }
}

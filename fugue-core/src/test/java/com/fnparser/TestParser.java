package com.fnparser;

import com.fnparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TestParser {

    private final Arena arena = new Arena();
    private final SymbolTable symbols = new SymbolTable();
    private final TypeCache typeCache = new TypeCache();

    private ParseResult<Expression> parse(String source) {
        return Parser.parsePartialExpr(arena, symbols, typeCache, source);
    }

    private Expression parseOk(String source) {
        ParseResult<Expression> result = parse(source);
        assertTrue(result.isOk(), () -> "Unexpected errors:\n" + result.errors());
        return result.value().orElseThrow();
    }

    @Test
    void testIncompleteInfixReportsEndOfInput() {
        ParseResult<Expression> result = parse("1 + ");
        assertTrue(result.value().isEmpty());
        assertEquals(1, result.errors().size());

        Spanned<ParseError> error = result.errors().get(0);
        ParseError.UnexpectedEof eof = assertInstanceOf(ParseError.UnexpectedEof.class, error.value());
        assertFalse(eof.expected().isEmpty());
        assertTrue(eof.expected().contains("identifier"), eof.expected().toString());
        assertEquals(Span.at(4), error.span());
        assertTrue(error.value().message().startsWith("Unexpected end of file\nExpected one of"));
    }

    @Test
    void testParseExprThrowsWithAllErrors() {
        ParseException e = assertThrows(ParseException.class,
            () -> Parser.parseExpr(arena, symbols, typeCache, "1 +"));
        assertEquals(1, e.errors().size());
    }

    @Test
    void testEmptyInputReportsEndOfSource() {
        ParseResult<Expression> result = Parser.parsePartialExpr(arena, symbols, typeCache, ParserSource.of("", 50));
        assertTrue(result.value().isEmpty());
        assertEquals(Span.at(50), result.errors().get(0).span());
    }

    @Test
    void testOperatorsParseLeftNested() {
        InfixExpression outer = assertInstanceOf(InfixExpression.class, parseOk("1 + 2 * 3"));
        assertEquals("*", outer.operator().name().name());
        assertEquals(0, outer.start());
        assertEquals(9, outer.end());
        InfixExpression inner = assertInstanceOf(InfixExpression.class, outer.left());
        assertEquals("+", inner.operator().name().name());
        assertEquals(0, inner.start());
    }

    @Test
    void testStartIndexOffsetsSpans() {
        Expression expr = Parser.parseExpr(arena, symbols, typeCache, ParserSource.of("x + y", 100));
        assertEquals(new Span(100, 105), expr.span());
    }

    @Test
    void testLetStatementTakesRestOfBlock() {
        LetExpression let = assertInstanceOf(LetExpression.class, parseOk("let x = 1\nx"));
        assertEquals(new Span(0, 11), let.span());

        ValueBinding binding = let.bindings().get(0);
        IdentifierPattern name = assertInstanceOf(IdentifierPattern.class, binding.name());
        assertEquals("x", name.ident().name().name());
        assertEquals(new Span(0, 9), binding.span());
        Literal one = assertInstanceOf(Literal.class, binding.expression());
        assertEquals(1L, one.value());

        // The single-statement block is collapsed by the shrink pass
        Identifier body = assertInstanceOf(Identifier.class, let.body());
        assertEquals("x", body.name().name());
    }

    @Test
    void testLetIn() {
        LetExpression let = assertInstanceOf(LetExpression.class, parseOk("let x = 1 in x"));
        assertInstanceOf(Identifier.class, let.body());
        assertEquals(14, let.end());
    }

    @Test
    void testFunctionBindingWithIndentedBody() {
        String source = String.join("\n",
            "let f x y =",
            "    let z = x",
            "    z",
            "f 1 2");
        LetExpression let = assertInstanceOf(LetExpression.class, parseOk(source));
        ValueBinding f = let.bindings().get(0);
        assertEquals(List.of("x", "y"), f.parameters().stream().map(p -> p.name().name()).toList());
        assertInstanceOf(LetExpression.class, f.expression());

        Application call = assertInstanceOf(Application.class, let.body());
        assertEquals("f", ((Identifier) call.function()).name().name());
        assertEquals(2, call.arguments().size());
    }

    @Test
    void testMultipleStatementsStayInBlock() {
        BlockExpression block = assertInstanceOf(BlockExpression.class, parseOk("f 1\ng 2"));
        assertEquals(2, block.body().size());
        assertEquals(new Span(0, 7), block.span());
    }

    @Test
    void testSingleStatementBlockEqualsItsExpression() {
        LetExpression let = assertInstanceOf(LetExpression.class, parseOk("let x =\n    1 + 2\nx"));
        Expression inner = Parser.parseExpr(arena, symbols, typeCache, ParserSource.of("1 + 2", 12));
        assertEquals(inner, let.bindings().get(0).expression());

        Expression parenthesized = parseOk("(1 + 2)");
        assertEquals(Parser.parseExpr(arena, symbols, typeCache, ParserSource.of("1 + 2", 1)), parenthesized);
    }

    @Test
    void testMultiLineStringInsideIndentedBlock() {
        Application app = assertInstanceOf(Application.class, parseOk("    f \"a\nb\" y"));
        assertEquals(2, app.arguments().size());
        Literal string = assertInstanceOf(Literal.class, app.arguments().get(0));
        assertEquals("a\nb", string.value());
        assertEquals(new Span(12, 13), app.arguments().get(1).span());
    }

    @Test
    void testLambdaIfAndMatch() {
        LambdaExpression lambda = assertInstanceOf(LambdaExpression.class, parseOk("\\x y -> x"));
        assertEquals(2, lambda.parameters().size());
        assertEquals(9, lambda.end());

        IfExpression ifExpr = assertInstanceOf(IfExpression.class, parseOk("if a then b else c"));
        assertEquals("c", ((Identifier) ifExpr.alternate()).name().name());

        String source = String.join("\n",
            "match x with",
            "| Some y -> y",
            "| None -> 0");
        MatchExpression match = assertInstanceOf(MatchExpression.class, parseOk(source));
        assertEquals(2, match.alternatives().size());
        ConstructorPattern some = assertInstanceOf(ConstructorPattern.class, match.alternatives().get(0).pattern());
        assertEquals("Some", some.constructor().name().name());
        assertEquals(1, some.arguments().size());
        assertEquals(source.length(), match.end());
    }

    @Test
    void testIndentedMatchAlternatives() {
        String source = String.join("\n",
            "match x with",
            "    | A -> 1",
            "    | B ->",
            "        2");
        MatchExpression match = assertInstanceOf(MatchExpression.class, parseOk(source));
        assertEquals(2, match.alternatives().size());
        assertInstanceOf(Literal.class, match.alternatives().get(1).expression());
    }

    @Test
    void testTypeBinding() {
        String source = String.join("\n",
            "type Option a =",
            "    | None",
            "    | Some a",
            "Some 1");
        TypeExpression type = assertInstanceOf(TypeExpression.class, parseOk(source));
        TypeBinding binding = type.bindings().get(0);
        assertEquals("Option", binding.name().name().name());
        VariantType variants = assertInstanceOf(VariantType.class, binding.definition());
        assertEquals(2, variants.variants().size());
        assertEquals(1, variants.variants().get(1).arguments().size());
        assertInstanceOf(Application.class, type.body());
    }

    @Test
    void testDoBinding() {
        DoExpression doExpr = assertInstanceOf(DoExpression.class, parseOk("do x = f 1\ng x"));
        assertInstanceOf(IdentifierPattern.class, doExpr.binding());
        assertInstanceOf(Application.class, doExpr.bound());
        assertInstanceOf(Application.class, doExpr.body());
        assertEquals(14, doExpr.end());
    }

    @Test
    void testDataLiterals() {
        TupleExpression tuple = assertInstanceOf(TupleExpression.class, parseOk("(1, \"two\", 'c')"));
        assertEquals(3, tuple.elements().size());

        ArrayExpression array = assertInstanceOf(ArrayExpression.class, parseOk("[1, 2, 3]"));
        assertEquals(3, array.elements().size());

        RecordExpression record = assertInstanceOf(RecordExpression.class, parseOk("{ x = 1, y }"));
        assertNotNull(record.fields().get(0).value());
        assertNull(record.fields().get(1).value());

        ProjectionExpression projection = assertInstanceOf(ProjectionExpression.class, parseOk("a.b.c"));
        assertEquals("c", projection.property().name().name());
        assertInstanceOf(ProjectionExpression.class, projection.object());

        assertInstanceOf(TupleExpression.class, parseOk("()"));
        Identifier op = assertInstanceOf(Identifier.class, parseOk("(+)"));
        assertTrue(op.name().isOperator());
    }

    @Test
    void testLiteralSuffix() {
        Literal literal = assertInstanceOf(Literal.class, parseOk("10px"));
        assertEquals(LiteralKind.INT, literal.kind());
        assertEquals("px", literal.suffix().value());
        assertEquals(new Span(2, 4), literal.suffix().span());
        assertEquals(new Span(0, 4), literal.span());
    }

    @Test
    void testTypeAnnotation() {
        AnnotatedExpression annotated = assertInstanceOf(AnnotatedExpression.class, parseOk("f x : Int -> Int"));
        assertInstanceOf(FunctionType.class, annotated.annotation());
    }

    @Test
    void testMetadataIsAttachedToBinding() {
        String source = String.join("\n",
            "/// Adds things",
            "#[infix(left, 6)]",
            "let (+) x y = x",
            "1 + 2");
        LetExpression let = assertInstanceOf(LetExpression.class, parseOk(source));
        ValueBinding binding = let.bindings().get(0);
        assertEquals("Adds things", binding.metadata().comment());
        assertEquals(Optional.of("left, 6"), binding.metadata().getAttribute("infix"));
        IdentifierPattern name = assertInstanceOf(IdentifierPattern.class, binding.name());
        assertEquals("+", name.ident().name().name());
        assertInstanceOf(InfixExpression.class, let.body());
    }

    @Test
    void testBadStatementIsRecovered() {
        ParseResult<Expression> result = parse("let x = then\nx");
        BlockExpression block = assertInstanceOf(BlockExpression.class, result.value().orElseThrow());
        assertInstanceOf(ErrorExpression.class, block.body().get(0));
        assertInstanceOf(Identifier.class, block.body().get(1));

        assertEquals(1, result.errors().size());
        ParseError.UnexpectedToken error = assertInstanceOf(ParseError.UnexpectedToken.class,
            result.errors().get(0).value());
        assertEquals("then", error.token());
        assertTrue(error.expected().contains("("), error.expected().toString());
        assertEquals(new Span(8, 12), result.errors().get(0).span());
    }

    @Test
    void testExtraTokenAfterOutermostBlock() {
        ParseResult<Expression> result = parse("  x\ny");
        assertInstanceOf(Identifier.class, result.value().orElseThrow());
        ParseError.ExtraToken extra = assertInstanceOf(ParseError.ExtraToken.class, result.errors().get(0).value());
        assertEquals("y", extra.token());
        assertEquals(new Span(4, 5), result.errors().get(0).span());
        assertEquals("Extra token: y", extra.message());
    }

    @Test
    void testDuplicateRecordField() {
        ParseResult<Expression> result = parse("{ x = 1, x = 2 }");
        assertInstanceOf(RecordExpression.class, result.value().orElseThrow());
        assertEquals(1, result.errors().size());
        assertEquals(new ParseError.Message("Duplicate field `x` in record"), result.errors().get(0).value());
        assertEquals(new Span(9, 10), result.errors().get(0).span());
    }

    @Test
    void testSuffixInPatternIsInvalidToken() {
        ParseResult<Expression> result = parse("match x with | 1px -> 2");
        assertInstanceOf(ErrorExpression.class, result.value().orElseThrow());
        assertEquals(new ParseError.InvalidToken(), result.errors().get(0).value());
        assertEquals(Span.at(16), result.errors().get(0).span());
    }

    @Test
    void testTokenizerErrorsKeepTheTree() {
        ParseResult<Expression> result = parse("a ` b");
        Application app = assertInstanceOf(Application.class, result.value().orElseThrow());
        assertEquals(1, app.arguments().size());
        assertEquals(1, result.errors().size());
        assertInstanceOf(ParseError.Tokenize.class, result.errors().get(0).value());
        assertEquals(new Span(2, 3), result.errors().get(0).span());
    }

    @Test
    void testLayoutErrorThenEndOfInput() {
        ParseResult<Expression> result = parse("(1");
        assertTrue(result.value().isEmpty());
        assertEquals(2, result.errors().size());
        assertInstanceOf(ParseError.Layout.class, result.errors().get(0).value());
        assertEquals(new Span(0, 1), result.errors().get(0).span());
        assertInstanceOf(ParseError.UnexpectedEof.class, result.errors().get(1).value());
        assertEquals(Span.at(2), result.errors().get(1).span());
    }

    @Test
    void testNodesAreAllocatedInArena() {
        Arena local = new Arena();
        Parser.parseExpr(local, symbols, typeCache, "f 1 2");
        assertTrue(local.size() >= 4, "arena holds " + local.size() + " nodes");
        assertTrue(local.nodes().stream().anyMatch(n -> n instanceof Application));
    }

    @Test
    void testReplLines() {
        ParseResult<Optional<ReplLine>> let = Parser.parsePartialReplLine(arena, symbols, "let x = 1");
        ReplLine.LetLine letLine = assertInstanceOf(ReplLine.LetLine.class, let.orElseThrow().orElseThrow());
        assertEquals("x", ((IdentifierPattern) letLine.binding().name()).ident().name().name());

        ParseResult<Optional<ReplLine>> expr = Parser.parsePartialReplLine(arena, symbols, "1 + 1");
        ReplLine.ExprLine exprLine = assertInstanceOf(ReplLine.ExprLine.class, expr.orElseThrow().orElseThrow());
        assertInstanceOf(InfixExpression.class, exprLine.expression());

        ParseResult<Optional<ReplLine>> letIn = Parser.parsePartialReplLine(arena, symbols, "let x = 1 in x");
        ReplLine.ExprLine letInLine = assertInstanceOf(ReplLine.ExprLine.class, letIn.orElseThrow().orElseThrow());
        assertInstanceOf(LetExpression.class, letInLine.expression());

        ParseResult<Optional<ReplLine>> blank = Parser.parsePartialReplLine(arena, symbols, "   ");
        assertTrue(blank.isOk());
        assertTrue(blank.value().orElseThrow().isEmpty());
    }

    @Test
    void testReplLetWithError() {
        ParseResult<Optional<ReplLine>> result = Parser.parsePartialReplLine(arena, symbols, "let x = )");
        assertFalse(result.isOk());
        ReplLine.ExprLine line = assertInstanceOf(ReplLine.ExprLine.class, result.value().orElseThrow().orElseThrow());
        assertInstanceOf(ErrorExpression.class, line.expression());
    }
}

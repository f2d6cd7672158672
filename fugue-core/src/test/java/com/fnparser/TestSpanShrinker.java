package com.fnparser;

import com.fnparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestSpanShrinker {

    private final Arena arena = new Arena();
    private final SymbolTable symbols = new SymbolTable();
    private final TypeCache typeCache = new TypeCache();

    private Identifier ident(String name, int start) {
        return new Identifier(start, start + name.length(), TypedIdent.of(symbols.fromStr(name), typeCache));
    }

    @Test
    void testInfixEndsAtRightOperand() {
        Expression wide = new InfixExpression(0, 20, ident("a", 0), ident("+", 2), ident("b", 4));
        Expression shrunk = SpanShrinker.shrink(arena, wide);
        assertEquals(new Span(0, 5), shrunk.span());
    }

    @Test
    void testSingleElementBlockIsReplaced() {
        Identifier x = ident("x", 3);
        assertSame(x, SpanShrinker.shrink(arena, new BlockExpression(0, 9, List.of(x))));
    }

    @Test
    void testBlockEndsAtLastElement() {
        Expression block = new BlockExpression(0, 30, List.of(ident("a", 0), ident("b", 5)));
        BlockExpression shrunk = assertInstanceOf(BlockExpression.class, SpanShrinker.shrink(arena, block));
        assertEquals(new Span(0, 6), shrunk.span());
        assertEquals(2, shrunk.body().size());
    }

    @Test
    void testNestedNodesShrinkBottomUp() {
        Expression infix = new InfixExpression(10, 40, ident("a", 10), ident("+", 12), ident("b", 14));
        Expression block = new BlockExpression(10, 40, List.of(infix));
        ValueBinding binding = new ValueBinding(0, 40, Metadata.EMPTY,
            new IdentifierPattern(4, 5, TypedIdent.of(symbols.fromStr("x"), typeCache)), List.of(), null,
            new BlockExpression(8, 40, List.of(ident("y", 8))));
        Expression let = new LetExpression(0, 40, List.of(binding), block);
        Expression lambda = new LambdaExpression(0, 50, List.of(), let);

        LambdaExpression shrunk = assertInstanceOf(LambdaExpression.class, SpanShrinker.shrink(arena, lambda));
        assertEquals(new Span(0, 15), shrunk.span());
        LetExpression shrunkLet = assertInstanceOf(LetExpression.class, shrunk.body());
        assertEquals(new Span(0, 15), shrunkLet.span());
        assertEquals(new Span(10, 15), shrunkLet.body().span());
        assertEquals(new Span(0, 9), shrunkLet.bindings().get(0).span());
        assertInstanceOf(Identifier.class, shrunkLet.bindings().get(0).expression());
    }

    @Test
    void testMatchAndIfEndAtLastBranch() {
        Expression match = new MatchExpression(0, 40, ident("x", 6), List.of(
            new Alternative(13, 40, new IdentifierPattern(15, 16, TypedIdent.of(symbols.fromStr("y"), typeCache)),
                ident("y", 20))));
        assertEquals(21, SpanShrinker.shrink(arena, match).end());

        Expression ifExpr = new IfExpression(0, 40, ident("a", 3), ident("b", 10), ident("c", 17));
        assertEquals(18, SpanShrinker.shrink(arena, ifExpr).end());
    }

    @Test
    void testShrinkIsIdempotent() {
        Expression parsed = Parser.parseExpr(arena, symbols, typeCache, String.join("\n",
            "let f x y =",
            "    let z = x",
            "    z",
            "match f 1 2 with",
            "| A -> if a then b else c",
            "| B -> \\x -> x + 1"));
        Expression again = SpanShrinker.shrink(arena, parsed);
        assertSame(parsed, again);
    }

    @Test
    void testUnchangedTreeKeepsInstances() {
        Expression app = new Application(0, 3, ident("f", 0), List.of(ident("x", 2)));
        assertSame(app, SpanShrinker.shrink(arena, app));
    }
}

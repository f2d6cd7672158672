package com.fnparser.layout;

import com.fnparser.ParseError;
import com.fnparser.Token;
import com.fnparser.TokenType;
import com.fnparser.Tokenizer;
import com.fnparser.ast.Span;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.fnparser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestLayout {

    private static List<Token> layout(Layout layout) {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = layout.next();
            tokens.add(t);
        } while (t.type() != EOF);
        return tokens;
    }

    private static List<TokenType> types(String source) {
        List<TokenType> types = new ArrayList<>();
        for (Token t : layout(new Layout(new Tokenizer(source)))) {
            types.add(t.type());
        }
        return types;
    }

    @Test
    void testSeparatorAtSameColumn() {
        List<Token> tokens = layout(new Layout(new Tokenizer("let x = 1\nx")));
        List<TokenType> types = new ArrayList<>();
        tokens.forEach(t -> types.add(t.type()));
        assertEquals(List.of(OPEN_BLOCK, LET, IDENTIFIER, EQUALS, INT, SEPARATOR, IDENTIFIER, CLOSE_BLOCK, EOF), types);

        Token separator = tokens.get(5);
        assertTrue(separator.isVirtual());
        assertEquals(10, separator.start());
        assertEquals(10, separator.end());
    }

    @Test
    void testNestedBlocks() {
        String source = String.join("\n",
            "let f x =",
            "    let y = x",
            "    y",
            "f 1");
        Layout layout = new Layout(new Tokenizer(source));
        List<TokenType> types = new ArrayList<>();
        layout(layout).forEach(t -> types.add(t.type()));
        assertEquals(List.of(
            OPEN_BLOCK, LET, IDENTIFIER, IDENTIFIER, EQUALS,
            OPEN_BLOCK, LET, IDENTIFIER, EQUALS, IDENTIFIER,
            SEPARATOR, IDENTIFIER,
            CLOSE_BLOCK, SEPARATOR, IDENTIFIER, INT,
            CLOSE_BLOCK, EOF), types);
        assertEquals(0, layout.depth());
    }

    @Test
    void testDeeperLineContinuesExpression() {
        assertEquals(List.of(OPEN_BLOCK, IDENTIFIER, IDENTIFIER, CLOSE_BLOCK, EOF), types("f\n  x"));
    }

    @Test
    void testElseAtBlockColumnIsNotSeparated() {
        assertEquals(List.of(OPEN_BLOCK, IF, IDENTIFIER, THEN, IDENTIFIER, ELSE, IDENTIFIER, CLOSE_BLOCK, EOF),
            types("if a then b\nelse c"));
    }

    @Test
    void testMultiLineStringDoesNotStartANewLine() {
        String source = String.join("\n",
            "let x =",
            "    f \"a",
            "b\" y",
            "x");
        assertEquals(List.of(
            OPEN_BLOCK, LET, IDENTIFIER, EQUALS,
            OPEN_BLOCK, IDENTIFIER, STRING, IDENTIFIER,
            CLOSE_BLOCK, SEPARATOR, IDENTIFIER,
            CLOSE_BLOCK, EOF), types(source));
    }

    @Test
    void testNoSeparatorsInsideBrackets() {
        assertEquals(List.of(OPEN_BLOCK, LBRACKET, INT, COMMA, INT, RBRACKET, CLOSE_BLOCK, EOF),
            types("[1,\n2]"));
    }

    @Test
    void testCloserEndsImplicitBlocks() {
        assertEquals(List.of(OPEN_BLOCK, LPAREN, BACKSLASH, IDENTIFIER, ARROW, OPEN_BLOCK, IDENTIFIER, CLOSE_BLOCK,
            RPAREN, CLOSE_BLOCK, EOF), types("(\\x ->\n    x)"));
    }

    @Test
    void testAttributeAttachesToNextLine() {
        assertEquals(List.of(
            OPEN_BLOCK, ATTRIBUTE_OPEN, IDENTIFIER, LPAREN, IDENTIFIER, COMMA, INT, RPAREN, RBRACKET,
            LET, LPAREN, OPERATOR, RPAREN, IDENTIFIER, IDENTIFIER, EQUALS, INT,
            SEPARATOR, IDENTIFIER, CLOSE_BLOCK, EOF),
            types("#[infix(left, 6)]\nlet (+) x y = 1\nx"));
    }

    @Test
    void testMismatchedDelimiter() {
        List<Token> tokens = layout(new Layout(new Tokenizer("(1]")));
        assertEquals(ERROR, tokens.get(3).type());
        assertEquals(RBRACKET, tokens.get(4).type());
        ParseError.Layout error = assertInstanceOf(ParseError.Layout.class, tokens.get(3).error());
        LayoutError.MismatchedDelimiter mismatch = assertInstanceOf(LayoutError.MismatchedDelimiter.class, error.error());
        assertEquals("(", mismatch.open());
        assertEquals(new Span(0, 1), mismatch.openSpan());
        assertEquals("]", mismatch.close());
        assertEquals(new Span(2, 3), mismatch.closeSpan());
    }

    @Test
    void testUnmatchedDelimiter() {
        List<Token> tokens = layout(new Layout(new Tokenizer("1)")));
        assertEquals(List.of(OPEN_BLOCK, INT, ERROR, RPAREN, CLOSE_BLOCK, EOF),
            tokens.stream().map(Token::type).toList());
        ParseError.Layout error = assertInstanceOf(ParseError.Layout.class, tokens.get(2).error());
        assertInstanceOf(LayoutError.UnmatchedDelimiter.class, error.error());
    }

    @Test
    void testUnclosedDelimiterAtEndOfInput() {
        Layout layout = new Layout(new Tokenizer("(1"));
        List<Token> tokens = layout(layout);
        assertEquals(List.of(OPEN_BLOCK, LPAREN, INT, ERROR, CLOSE_BLOCK, EOF),
            tokens.stream().map(Token::type).toList());
        ParseError.Layout error = assertInstanceOf(ParseError.Layout.class, tokens.get(3).error());
        assertEquals(new LayoutError.UnclosedDelimiter("("), error.error());
        assertEquals(0, layout.depth());
    }

    @Test
    void testEmptyInput() {
        Layout layout = new Layout(new Tokenizer(""));
        assertEquals(EOF, layout.next().type());
        assertEquals(0, layout.depth());
    }

    @Test
    void testTokenizerErrorsPassThrough() {
        assertEquals(List.of(OPEN_BLOCK, IDENTIFIER, ERROR, IDENTIFIER, CLOSE_BLOCK, EOF), types("a ` b"));
    }
}

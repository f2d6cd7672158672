package com.fnparser.layout;

import com.fnparser.ParseError;
import com.fnparser.Token;
import com.fnparser.TokenSource;
import com.fnparser.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Turns indentation into explicit {@link TokenType#OPEN_BLOCK}, {@link TokenType#SEPARATOR}
 * and {@link TokenType#CLOSE_BLOCK} tokens so the grammar never looks at columns.
 *
 * <p>The engine keeps a stack of {@link LayoutContext}s. At the start of every line the column
 * of the first token is compared with the innermost context:</p>
 * <ul>
 *   <li>greater, right after a block-opening token ({@code = -> then else in with}): a new
 *   implicit block is pushed and opened;</li>
 *   <li>equal, inside an implicit block: a separator is emitted;</li>
 *   <li>smaller: implicit blocks are closed until the innermost one starts at or before the
 *   column, then the equal case is re-checked.</li>
 * </ul>
 * <p>Brackets push explicit contexts. Inside them no separators are inserted, and a closing
 * bracket first closes every implicit block opened inside it. Layout errors are emitted as
 * {@link TokenType#ERROR} tokens in stream order.</p>
 */
public class Layout implements TokenSource {

    private final TokenSource tokens;
    private final Deque<LayoutContext> stack = new ArrayDeque<>();
    private final Deque<Token> queue = new ArrayDeque<>();

    private Token previous;
    private boolean started = false;
    // The token after a doc comment or attribute belongs to the same statement
    private boolean attachNext = false;

    public Layout(TokenSource tokens) {
        this.tokens = tokens;
    }

    @Override
    public Token next() {
        if (!queue.isEmpty()) {
            return queue.poll();
        }

        Token token = tokens.next();
        if (token.type() == TokenType.ERROR) {
            return token;
        }
        if (token.type() == TokenType.EOF) {
            closeAll(token);
            queue.add(token);
            return queue.poll();
        }

        if (!started) {
            started = true;
            pushImplicit(token);
        } else if (token.line() > previous.endLine() && !attachNext) {
            newLine(token);
        }
        attachNext = false;

        TokenType type = token.type();
        if (type.isOpener()) {
            stack.push(new LayoutContext(LayoutContext.Kind.opened(type), token.column(), token.span()));
        } else if (type.isCloser()) {
            close(token);
        } else if (type == TokenType.COMMA) {
            if (innermostExplicit() != null) {
                closeImplicitBlocks(token);
            }
        } else if (type == TokenType.DOC_COMMENT) {
            attachNext = true;
        }

        queue.add(token);
        previous = token;
        return queue.poll();
    }

    /**
     * Number of open contexts. Zero once {@code EOF} has been returned.
     */
    public int depth() {
        return stack.size();
    }

    private void newLine(Token token) {
        int column = token.column();
        while (!stack.isEmpty() && stack.peek().isImplicit() && column < stack.peek().column()) {
            stack.pop();
            queue.add(Token.virtual(TokenType.CLOSE_BLOCK, token));
        }
        if (stack.isEmpty()) {
            // Everything after the outermost block is left for the grammar to reject
            return;
        }

        LayoutContext top = stack.peek();
        if (column > top.column()) {
            if (previous.type().opensBlock()) {
                pushImplicit(token);
            }
        } else if (column == top.column() && top.isImplicit() && !token.type().continuesLine()) {
            queue.add(Token.virtual(TokenType.SEPARATOR, token));
        }
    }

    private void close(Token closer) {
        LayoutContext explicit = innermostExplicit();
        if (explicit == null) {
            queue.add(layoutError(new LayoutError.UnmatchedDelimiter(closer.lexeme()), closer));
            return;
        }
        closeImplicitBlocks(closer);
        LayoutContext frame = stack.pop();
        if (frame.kind().closer() != closer.type()) {
            queue.add(layoutError(new LayoutError.MismatchedDelimiter(
                frame.kind().open(), frame.openSpan(), closer.lexeme(), closer.span()), closer));
        } else if (frame.kind() == LayoutContext.Kind.ATTRIBUTE) {
            attachNext = true;
        }
    }

    private void closeAll(Token eof) {
        while (!stack.isEmpty()) {
            LayoutContext frame = stack.pop();
            if (frame.isImplicit()) {
                queue.add(Token.virtual(TokenType.CLOSE_BLOCK, eof));
            } else {
                queue.add(Token.error(new ParseError.Layout(new LayoutError.UnclosedDelimiter(frame.kind().open())),
                    frame.openSpan().start(), frame.openSpan().end(), eof.line(), eof.column()));
            }
        }
    }

    private void closeImplicitBlocks(Token token) {
        while (stack.peek().isImplicit()) {
            stack.pop();
            queue.add(Token.virtual(TokenType.CLOSE_BLOCK, token));
        }
    }

    private void pushImplicit(Token token) {
        stack.push(new LayoutContext(LayoutContext.Kind.BLOCK, token.column(), token.span()));
        queue.add(Token.virtual(TokenType.OPEN_BLOCK, token));
    }

    private LayoutContext innermostExplicit() {
        Iterator<LayoutContext> it = stack.iterator();
        while (it.hasNext()) {
            LayoutContext frame = it.next();
            if (frame.isExplicit()) {
                return frame;
            }
        }
        return null;
    }

    private static Token layoutError(LayoutError error, Token at) {
        return Token.error(new ParseError.Layout(error), at.start(), at.end(), at.line(), at.column());
    }
}

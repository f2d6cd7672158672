package com.fnparser.infix;

import com.fnparser.ParseError;
import com.fnparser.ParseErrors;
import com.fnparser.ast.Arena;
import com.fnparser.ast.AstRewriter;
import com.fnparser.ast.Expression;
import com.fnparser.ast.Identifier;
import com.fnparser.ast.InfixExpression;
import com.fnparser.ast.Span;
import com.fnparser.ast.Spanned;
import com.fnparser.ast.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Re-associates the left-nested operator chains the grammar produces according to an
 * {@link OpTable}.
 *
 * <p>A chain is the left spine of infix nodes that share the start offset of its root. A
 * parenthesized operand starts after its {@code (}, so it is never part of the enclosing chain
 * and is reparsed on its own. Combined nodes on the left spine keep the chain's start, which
 * makes a second pass a no-op.</p>
 */
public class Reparser extends AstRewriter {

    private static final Logger log = LogManager.getLogger(Reparser.class);

    private final OpTable operators;
    private final Set<Symbol> unresolved;
    private final ParseErrors errors;

    public Reparser(Arena arena, OpTable operators, Set<Symbol> unresolved, ParseErrors errors) {
        super(arena);
        this.operators = operators;
        this.unresolved = unresolved;
        this.errors = errors;
    }

    @Override
    public Expression rewrite(Expression expr) {
        if (expr instanceof InfixExpression infix) {
            return reparse(infix);
        }
        return super.rewrite(expr);
    }

    private Expression reparse(InfixExpression root) {
        int chainStart = root.start();
        List<Expression> operands = new ArrayList<>();
        List<Identifier> ops = new ArrayList<>();
        Expression current = root;
        while (current instanceof InfixExpression infix && infix.start() == chainStart) {
            operands.add(infix.right());
            ops.add(infix.operator());
            current = infix.left();
        }
        operands.add(current);
        Collections.reverse(operands);
        Collections.reverse(ops);
        log.debug("Reparsing chain of {} operators at {}", ops.size(), chainStart);

        int firstStart = operands.get(0).start();
        Deque<Expression> output = new ArrayDeque<>();
        Deque<Identifier> pending = new ArrayDeque<>();
        Deque<OpMeta> pendingMeta = new ArrayDeque<>();

        output.push(rewrite(operands.get(0)));
        for (int i = 0; i < ops.size(); i++) {
            Identifier op = ops.get(i);
            OpMeta meta = lookup(op);
            while (!pending.isEmpty() && reduceFirst(pending.peek(), pendingMeta.peek(), op, meta)) {
                reduce(output, pending, pendingMeta, chainStart, firstStart);
            }
            pending.push(op);
            pendingMeta.push(meta);
            output.push(rewrite(operands.get(i + 1)));
        }
        while (!pending.isEmpty()) {
            reduce(output, pending, pendingMeta, chainStart, firstStart);
        }
        return output.pop();
    }

    private boolean reduceFirst(Identifier top, OpMeta topMeta, Identifier next, OpMeta nextMeta) {
        if (topMeta.precedence() != nextMeta.precedence()) {
            return topMeta.precedence() > nextMeta.precedence();
        }
        if (topMeta.fixity() != nextMeta.fixity()) {
            errors.push(new Span(top.start(), next.end()), new ParseError.Infix(new InfixError.ConflictingFixities(
                new Spanned<>(top.span(), top.name().name()), topMeta,
                new Spanned<>(next.span(), next.name().name()), nextMeta)));
            return true;
        }
        return topMeta.fixity() == Fixity.LEFT;
    }

    private void reduce(Deque<Expression> output, Deque<Identifier> pending, Deque<OpMeta> pendingMeta,
                        int chainStart, int firstStart) {
        Identifier op = pending.pop();
        pendingMeta.pop();
        Expression right = output.pop();
        Expression left = output.pop();
        int start = left.start() == firstStart ? chainStart : left.start();
        output.push(arena.alloc(new InfixExpression(start, right.end(), left, op, right)));
    }

    private OpMeta lookup(Identifier op) {
        Symbol name = op.name();
        return operators.get(name).orElseGet(() -> {
            if (unresolved.add(name)) {
                errors.push(op.span(), new ParseError.Infix(new InfixError.UndefinedFixity(name.name())));
            }
            return OpMeta.DEFAULT;
        });
    }
}

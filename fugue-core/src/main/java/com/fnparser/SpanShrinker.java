package com.fnparser;

import com.fnparser.ast.*;

import java.util.List;

/**
 * Narrows spans that the grammar let run past the node's last child, and replaces blocks holding
 * a single expression by that expression. Applying it twice gives the same tree.
 */
public final class SpanShrinker {

    private SpanShrinker() {
    }

    public static Expression shrink(Arena arena, Expression expr) {
        return new Shrinker(arena).rewrite(expr);
    }

    private static final class Shrinker extends AstRewriter {

        Shrinker(Arena arena) {
            super(arena);
        }

        @Override
        protected Expression transform(Expression expr) {
            if (expr instanceof BlockExpression block) {
                List<Expression> body = block.body();
                if (body.size() == 1) {
                    return body.get(0);
                }
                if (body.isEmpty() || block.end() == last(body).end()) {
                    return block;
                }
                return arena.alloc(new BlockExpression(block.start(), last(body).end(), body));
            }
            if (expr instanceof InfixExpression infix && infix.end() != infix.right().end()) {
                return arena.alloc(new InfixExpression(infix.start(), infix.right().end(),
                    infix.left(), infix.operator(), infix.right()));
            }
            if (expr instanceof IfExpression ifExpr && ifExpr.end() != ifExpr.alternate().end()) {
                return arena.alloc(new IfExpression(ifExpr.start(), ifExpr.alternate().end(),
                    ifExpr.test(), ifExpr.consequent(), ifExpr.alternate()));
            }
            if (expr instanceof LetExpression let && let.end() != let.body().end()) {
                return arena.alloc(new LetExpression(let.start(), let.body().end(), let.bindings(), let.body()));
            }
            if (expr instanceof TypeExpression typeExpr && typeExpr.end() != typeExpr.body().end()) {
                return arena.alloc(new TypeExpression(typeExpr.start(), typeExpr.body().end(),
                    typeExpr.bindings(), typeExpr.body()));
            }
            if (expr instanceof DoExpression doExpr && doExpr.end() != doExpr.body().end()) {
                return arena.alloc(new DoExpression(doExpr.start(), doExpr.body().end(),
                    doExpr.binding(), doExpr.bound(), doExpr.body()));
            }
            if (expr instanceof LambdaExpression lambda && lambda.end() != lambda.body().end()) {
                return arena.alloc(new LambdaExpression(lambda.start(), lambda.body().end(),
                    lambda.parameters(), lambda.body()));
            }
            if (expr instanceof MatchExpression match && !match.alternatives().isEmpty()) {
                int end = match.alternatives().get(match.alternatives().size() - 1).expression().end();
                if (end != match.end()) {
                    return arena.alloc(new MatchExpression(match.start(), end, match.discriminant(),
                        match.alternatives()));
                }
            }
            return expr;
        }

        private static Expression last(List<Expression> exprs) {
            return exprs.get(exprs.size() - 1);
        }
    }
}

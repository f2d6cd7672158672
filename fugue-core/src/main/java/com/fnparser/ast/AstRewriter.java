package com.fnparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up rewrite of an expression tree. Children are rewritten first; a node whose children
 * all came back as the same instances is passed to {@link #transform(Expression)} unchanged,
 * otherwise a copy with the new children is allocated in the arena.
 *
 * <p>Subclasses override {@link #transform(Expression)} to replace nodes, or
 * {@link #rewrite(Expression)} to take over a whole subtree.</p>
 */
public abstract class AstRewriter {

    protected final Arena arena;

    protected AstRewriter(Arena arena) {
        this.arena = arena;
    }

    /**
     * Called once per node after its children have been rewritten.
     */
    protected Expression transform(Expression expr) {
        return expr;
    }

    public Expression rewrite(Expression expr) {
        return transform(rebuild(expr));
    }

    protected ValueBinding rewriteBinding(ValueBinding binding) {
        Expression expression = rewrite(binding.expression());
        return expression == binding.expression() ? binding : arena.alloc(binding.withExpression(expression));
    }

    protected Expression rebuild(Expression expr) {
        if (expr instanceof Application app) {
            Expression function = rewrite(app.function());
            List<Expression> arguments = rewriteAll(app.arguments());
            if (function == app.function() && arguments == app.arguments()) {
                return app;
            }
            return arena.alloc(new Application(app.start(), app.end(), function, arguments));
        }
        if (expr instanceof InfixExpression infix) {
            Expression left = rewrite(infix.left());
            Expression right = rewrite(infix.right());
            if (left == infix.left() && right == infix.right()) {
                return infix;
            }
            return arena.alloc(new InfixExpression(infix.start(), infix.end(), left, infix.operator(), right));
        }
        if (expr instanceof LambdaExpression lambda) {
            Expression body = rewrite(lambda.body());
            if (body == lambda.body()) {
                return lambda;
            }
            return arena.alloc(new LambdaExpression(lambda.start(), lambda.end(), lambda.parameters(), body));
        }
        if (expr instanceof IfExpression ifExpr) {
            Expression test = rewrite(ifExpr.test());
            Expression consequent = rewrite(ifExpr.consequent());
            Expression alternate = rewrite(ifExpr.alternate());
            if (test == ifExpr.test() && consequent == ifExpr.consequent() && alternate == ifExpr.alternate()) {
                return ifExpr;
            }
            return arena.alloc(new IfExpression(ifExpr.start(), ifExpr.end(), test, consequent, alternate));
        }
        if (expr instanceof LetExpression let) {
            List<ValueBinding> bindings = new ArrayList<>(let.bindings().size());
            boolean changed = false;
            for (ValueBinding binding : let.bindings()) {
                ValueBinding rewritten = rewriteBinding(binding);
                changed |= rewritten != binding;
                bindings.add(rewritten);
            }
            Expression body = rewrite(let.body());
            if (!changed && body == let.body()) {
                return let;
            }
            return arena.alloc(new LetExpression(let.start(), let.end(),
                changed ? List.copyOf(bindings) : let.bindings(), body));
        }
        if (expr instanceof TypeExpression typeExpr) {
            Expression body = rewrite(typeExpr.body());
            if (body == typeExpr.body()) {
                return typeExpr;
            }
            return arena.alloc(new TypeExpression(typeExpr.start(), typeExpr.end(), typeExpr.bindings(), body));
        }
        if (expr instanceof MatchExpression match) {
            Expression discriminant = rewrite(match.discriminant());
            List<Alternative> alternatives = new ArrayList<>(match.alternatives().size());
            boolean changed = discriminant != match.discriminant();
            for (Alternative alt : match.alternatives()) {
                Expression body = rewrite(alt.expression());
                if (body != alt.expression()) {
                    changed = true;
                    alt = arena.alloc(new Alternative(alt.start(), alt.end(), alt.pattern(), body));
                }
                alternatives.add(alt);
            }
            if (!changed) {
                return match;
            }
            return arena.alloc(new MatchExpression(match.start(), match.end(), discriminant,
                List.copyOf(alternatives)));
        }
        if (expr instanceof DoExpression doExpr) {
            Expression bound = rewrite(doExpr.bound());
            Expression body = rewrite(doExpr.body());
            if (bound == doExpr.bound() && body == doExpr.body()) {
                return doExpr;
            }
            return arena.alloc(new DoExpression(doExpr.start(), doExpr.end(), doExpr.binding(), bound, body));
        }
        if (expr instanceof BlockExpression block) {
            List<Expression> body = rewriteAll(block.body());
            return body == block.body() ? block : arena.alloc(new BlockExpression(block.start(), block.end(), body));
        }
        if (expr instanceof ProjectionExpression projection) {
            Expression object = rewrite(projection.object());
            if (object == projection.object()) {
                return projection;
            }
            return arena.alloc(new ProjectionExpression(projection.start(), projection.end(), object,
                projection.property()));
        }
        if (expr instanceof ArrayExpression array) {
            List<Expression> elements = rewriteAll(array.elements());
            return elements == array.elements() ? array
                : arena.alloc(new ArrayExpression(array.start(), array.end(), elements));
        }
        if (expr instanceof TupleExpression tuple) {
            List<Expression> elements = rewriteAll(tuple.elements());
            return elements == tuple.elements() ? tuple
                : arena.alloc(new TupleExpression(tuple.start(), tuple.end(), elements));
        }
        if (expr instanceof RecordExpression recordExpr) {
            List<ExprField> fields = new ArrayList<>(recordExpr.fields().size());
            boolean changed = false;
            for (ExprField field : recordExpr.fields()) {
                if (field.value() != null) {
                    Expression value = rewrite(field.value());
                    if (value != field.value()) {
                        changed = true;
                        field = arena.alloc(new ExprField(field.start(), field.end(), field.name(), value));
                    }
                }
                fields.add(field);
            }
            return changed ? arena.alloc(new RecordExpression(recordExpr.start(), recordExpr.end(), List.copyOf(fields)))
                : recordExpr;
        }
        if (expr instanceof AnnotatedExpression annotated) {
            Expression inner = rewrite(annotated.expression());
            if (inner == annotated.expression()) {
                return annotated;
            }
            return arena.alloc(new AnnotatedExpression(annotated.start(), annotated.end(), inner,
                annotated.annotation()));
        }
        // Identifier, Literal, ErrorExpression
        return expr;
    }

    /**
     * Rewrites every element, returning {@code exprs} itself when nothing changed.
     */
    protected List<Expression> rewriteAll(List<Expression> exprs) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression rewritten = rewrite(original);
            if (result == null && rewritten != original) {
                result = new ArrayList<>(exprs.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result == null ? exprs : List.copyOf(result);
    }
}

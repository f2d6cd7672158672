package com.fnparser.ast;

/**
 * Read-only pre-order traversal. Override a {@code visit} method and call {@code super} to keep
 * descending.
 */
public abstract class AstWalker {

    public void visitExpression(Expression expr) {
        if (expr instanceof Application app) {
            visitExpression(app.function());
            app.arguments().forEach(this::visitExpression);
        } else if (expr instanceof InfixExpression infix) {
            visitExpression(infix.left());
            visitExpression(infix.operator());
            visitExpression(infix.right());
        } else if (expr instanceof LambdaExpression lambda) {
            visitExpression(lambda.body());
        } else if (expr instanceof IfExpression ifExpr) {
            visitExpression(ifExpr.test());
            visitExpression(ifExpr.consequent());
            visitExpression(ifExpr.alternate());
        } else if (expr instanceof LetExpression let) {
            let.bindings().forEach(this::visitBinding);
            visitExpression(let.body());
        } else if (expr instanceof TypeExpression typeExpr) {
            visitExpression(typeExpr.body());
        } else if (expr instanceof MatchExpression match) {
            visitExpression(match.discriminant());
            for (Alternative alt : match.alternatives()) {
                visitPattern(alt.pattern());
                visitExpression(alt.expression());
            }
        } else if (expr instanceof DoExpression doExpr) {
            if (doExpr.binding() != null) {
                visitPattern(doExpr.binding());
            }
            visitExpression(doExpr.bound());
            visitExpression(doExpr.body());
        } else if (expr instanceof BlockExpression block) {
            block.body().forEach(this::visitExpression);
        } else if (expr instanceof ProjectionExpression projection) {
            visitExpression(projection.object());
        } else if (expr instanceof ArrayExpression array) {
            array.elements().forEach(this::visitExpression);
        } else if (expr instanceof TupleExpression tuple) {
            tuple.elements().forEach(this::visitExpression);
        } else if (expr instanceof RecordExpression recordExpr) {
            for (ExprField field : recordExpr.fields()) {
                if (field.value() != null) {
                    visitExpression(field.value());
                }
            }
        } else if (expr instanceof AnnotatedExpression annotated) {
            visitExpression(annotated.expression());
        }
    }

    public void visitBinding(ValueBinding binding) {
        visitPattern(binding.name());
        visitExpression(binding.expression());
    }

    public void visitPattern(Pattern pattern) {
        if (pattern instanceof ConstructorPattern constructor) {
            constructor.arguments().forEach(this::visitPattern);
        } else if (pattern instanceof RecordPattern recordPattern) {
            for (PatternField field : recordPattern.fields()) {
                if (field.value() != null) {
                    visitPattern(field.value());
                }
            }
        } else if (pattern instanceof TuplePattern tuple) {
            tuple.elements().forEach(this::visitPattern);
        } else if (pattern instanceof AsPattern as) {
            visitPattern(as.binding());
            visitPattern(as.pattern());
        }
    }
}

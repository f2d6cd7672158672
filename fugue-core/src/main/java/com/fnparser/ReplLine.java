package com.fnparser;

import com.fnparser.ast.Expression;
import com.fnparser.ast.ValueBinding;

/**
 * A line typed at the REPL: an expression to evaluate or a binding to add to the session.
 */
public sealed interface ReplLine {

    record ExprLine(Expression expression) implements ReplLine {
    }

    record LetLine(ValueBinding binding) implements ReplLine {
    }
}

package com.fnparser.infix;

import com.fnparser.ast.AstWalker;
import com.fnparser.ast.Expression;
import com.fnparser.ast.IdentifierPattern;
import com.fnparser.ast.Metadata;
import com.fnparser.ast.Symbol;
import com.fnparser.ast.ValueBinding;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads the metadata attached to {@code let} bindings so a freshly parsed tree can be reparsed
 * without a separate metadata pass. Record destructuring binds names without metadata of their
 * own; callers that know those fixities pass them in explicitly.
 */
public final class BindingMetadata {

    private BindingMetadata() {
    }

    public static Map<Symbol, Metadata> collect(Expression expr) {
        Map<Symbol, Metadata> result = new HashMap<>();
        new AstWalker() {
            @Override
            public void visitBinding(ValueBinding binding) {
                if (binding.name() instanceof IdentifierPattern ident && !binding.metadata().isEmpty()) {
                    result.put(ident.ident().name(), binding.metadata());
                }
                super.visitBinding(binding);
            }
        }.visitExpression(expr);
        return result;
    }
}

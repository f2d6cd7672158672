package com.fnparser.infix;

import com.fnparser.ParseError;
import com.fnparser.ParseErrors;
import com.fnparser.ast.AsPattern;
import com.fnparser.ast.AstWalker;
import com.fnparser.ast.ConstructorPattern;
import com.fnparser.ast.IdentifierPattern;
import com.fnparser.ast.Metadata;
import com.fnparser.ast.Pattern;
import com.fnparser.ast.PatternField;
import com.fnparser.ast.RecordPattern;
import com.fnparser.ast.Span;
import com.fnparser.ast.Symbol;
import com.fnparser.ast.TuplePattern;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link OpTable} from the {@code infix} attributes of every name a pattern binds.
 *
 * <p>Every binding of an operator without a usable {@code infix} attribute is reported at that
 * binding, and the name is remembered as unresolved so its uses are not reported again.</p>
 */
public class FixityCollector extends AstWalker {

    private final Map<Symbol, Metadata> metadata;
    private final ParseErrors errors;
    private final OpTable table = new OpTable();
    private final Set<Symbol> unresolved = new HashSet<>();

    public FixityCollector(Map<Symbol, Metadata> metadata, ParseErrors errors) {
        this.metadata = metadata;
        this.errors = errors;
    }

    public OpTable table() {
        return table;
    }

    public Set<Symbol> unresolved() {
        return unresolved;
    }

    @Override
    public void visitPattern(Pattern pattern) {
        collect(pattern);
    }

    private void collect(Pattern pattern) {
        if (pattern instanceof IdentifierPattern ident) {
            insert(ident.ident().name(), ident.span());
        } else if (pattern instanceof RecordPattern recordPattern) {
            for (PatternField field : recordPattern.fields()) {
                if (field.isPunned()) {
                    insert(field.name().value(), field.name().span());
                } else {
                    collect(field.value());
                }
            }
        } else if (pattern instanceof ConstructorPattern constructor) {
            constructor.arguments().forEach(this::collect);
        } else if (pattern instanceof TuplePattern tuple) {
            tuple.elements().forEach(this::collect);
        } else if (pattern instanceof AsPattern as) {
            collect(as.binding());
            collect(as.pattern());
        }
    }

    private void insert(Symbol name, Span span) {
        Metadata meta = metadata.get(name);
        String infix = meta == null ? null : meta.getAttribute("infix").orElse(null);
        if (infix != null) {
            try {
                table.put(name, OpMeta.parse(infix));
            } catch (InfixException e) {
                unresolved.add(name);
                errors.push(span, new ParseError.Infix(e.error()));
            }
        } else if (name.isOperator()) {
            unresolved.add(name);
            errors.push(span, new ParseError.Infix(new InfixError.UndefinedFixity(name.name())));
        }
    }
}

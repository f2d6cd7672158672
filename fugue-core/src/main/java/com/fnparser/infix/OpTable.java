package com.fnparser.infix;

import com.fnparser.ast.Symbol;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixity of every operator declared in the tree being reparsed.
 */
public final class OpTable {

    private final Map<Symbol, OpMeta> operators = new HashMap<>();

    public void put(Symbol operator, OpMeta meta) {
        operators.put(operator, meta);
    }

    public Optional<OpMeta> get(Symbol operator) {
        return Optional.ofNullable(operators.get(operator));
    }

    public boolean contains(Symbol operator) {
        return operators.containsKey(operator);
    }

    public int size() {
        return operators.size();
    }
}

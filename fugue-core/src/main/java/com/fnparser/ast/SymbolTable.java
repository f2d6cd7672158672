package com.fnparser.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Default {@link IdentEnv} interning every name into a single {@link Symbol} instance.
 */
public class SymbolTable implements IdentEnv {

    private final Map<String, Symbol> symbols = new HashMap<>();

    @Override
    public Symbol fromStr(String name) {
        return symbols.computeIfAbsent(name, Symbol::new);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public int size() {
        return symbols.size();
    }
}

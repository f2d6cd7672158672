package com.fnparser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Caller-owned region that every node built during a parse is allocated into.
 *
 * <p>The parser borrows the arena for the duration of a call and never clears it; nodes stay
 * reachable until the caller drops the arena. Allocation is append-only, so an arena must not
 * be shared by two parses running at the same time. Reading trees that a finished call
 * returned is safe from any thread.</p>
 */
public final class Arena {

    private final List<Node> nodes = new ArrayList<>();

    public <T extends Node> T alloc(T node) {
        nodes.add(node);
        return node;
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}

package com.fnparser.ast;

/**
 * Capability for turning source text into identifiers. Owned by the caller of the parser.
 */
public interface IdentEnv {

    Symbol fromStr(String name);
}

package com.fnparser.json;

import com.fnparser.ParseErrors;
import com.fnparser.ast.Node;

/**
 * Writes AST nodes and parse diagnostics as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node. Every node object carries a {@code type} discriminator and its
     * {@code start} and {@code end} offsets.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes errors as an array of {@code {start, end, severity, message}} objects, in the
     * order they were reported.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeDiagnostics(ParseErrors errors) throws AstJsonException;
}

package com.fnparser.ast;

/**
 * Type syntax as written in annotations and type bindings. Only the shapes the parser needs
 * to hand over to type inference are modelled.
 */
public sealed interface AstType extends Node permits
    TypeHole,
    TypeName,
    TypeApplication,
    FunctionType,
    VariantType {
}

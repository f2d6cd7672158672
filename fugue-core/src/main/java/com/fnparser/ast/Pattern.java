package com.fnparser.ast;

public sealed interface Pattern extends Node permits
    IdentifierPattern,
    ConstructorPattern,
    RecordPattern,
    TuplePattern,
    AsPattern,
    LiteralPattern,
    ErrorPattern {
}

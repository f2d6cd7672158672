package com.fnparser.ast;

public enum LiteralKind {
    INT,
    BYTE,
    FLOAT,
    STRING,
    CHAR
}

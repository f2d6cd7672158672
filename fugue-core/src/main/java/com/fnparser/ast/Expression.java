package com.fnparser.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    Application,
    InfixExpression,
    LambdaExpression,
    IfExpression,
    LetExpression,
    TypeExpression,
    MatchExpression,
    DoExpression,
    BlockExpression,
    ProjectionExpression,
    ArrayExpression,
    RecordExpression,
    TupleExpression,
    AnnotatedExpression,
    ErrorExpression {
}

package com.fnparser.infix;

import com.fnparser.ast.Spanned;

public sealed interface InfixError {

    String message();

    record InvalidFixity() implements InfixError {
        @Override
        public String message() {
            return "Only `left` or `right` is valid associativity specifications";
        }
    }

    record InvalidPrecedence() implements InfixError {
        @Override
        public String message() {
            return "Only positive integers are valid precedences";
        }
    }

    record UndefinedFixity(String operator) implements InfixError {
        @Override
        public String message() {
            return "No fixity specified for `" + operator + "`. Fixity must be specified with the `#[infix]` attribute";
        }
    }

    record ConflictingFixities(Spanned<String> left, OpMeta leftMeta, Spanned<String> right, OpMeta rightMeta)
        implements InfixError {
        @Override
        public String message() {
            return "Conflicting fixities at the same precedence level. left: `" + leftMeta + " " + left.value()
                + "`, right: `" + rightMeta + " " + right.value() + "`";
        }
    }
}

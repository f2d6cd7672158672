package com.fnparser.layout;

import com.fnparser.ast.Span;

public sealed interface LayoutError {

    String message();

    /**
     * A closing delimiter that does not match the innermost open one.
     */
    record MismatchedDelimiter(String open, Span openSpan, String close, Span closeSpan) implements LayoutError {
        @Override
        public String message() {
            return "Mismatched closing delimiter `" + close + "`, expected the closing delimiter for `"
                + open + "` opened at " + openSpan;
        }
    }

    record UnmatchedDelimiter(String close) implements LayoutError {
        @Override
        public String message() {
            return "Unmatched closing delimiter `" + close + "`";
        }
    }

    record UnclosedDelimiter(String open) implements LayoutError {
        @Override
        public String message() {
            return "Unclosed delimiter `" + open + "`";
        }
    }
}

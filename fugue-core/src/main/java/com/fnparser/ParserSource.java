package com.fnparser;

import com.fnparser.ast.Span;

/**
 * Source text together with the offset its first character has in the caller's coordinate
 * space (for example the position of a file inside a larger source map).
 */
public interface ParserSource {

    String src();

    int startIndex();

    default Span span() {
        return new Span(startIndex(), startIndex() + src().length());
    }

    static ParserSource of(String src) {
        return of(src, 0);
    }

    static ParserSource of(String src, int startIndex) {
        return new ParserSource() {
            @Override
            public String src() {
                return src;
            }

            @Override
            public int startIndex() {
                return startIndex;
            }
        };
    }
}

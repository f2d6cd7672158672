package com.fnparser;

/**
 * Medium independent form of an error, consumed by reporting layers.
 */
public record Diagnostic(Severity severity, String message) {

    public enum Severity {
        ERROR,
        WARNING,
        NOTE
    }
}

package com.archlint.core.extractor.impl.python.util;

/**
 * Thrown when Python source does not parse.
 */
public class PythonSyntaxException extends RuntimeException {

    private final int line;

    public PythonSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public PythonSyntaxException(String message, int line, Throwable cause) {
        super(message + " (line " + line + ")", cause);
        this.line = line;
    }

    /**
     * Returns the 1-based line of the error.
     */
    public int getLine() {
        return line;
    }
}

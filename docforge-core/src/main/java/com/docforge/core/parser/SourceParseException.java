package com.docforge.core.parser;

/**
 * Thrown when source text is not syntactically valid.
 *
 * <p>Fatal for the file being processed only; batch runs report the file as failed and continue.
 */
public class SourceParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final String diagnostic;

    /**
     * Creates a parse error.
     *
     * @param diagnostic human-readable description of the problem
     * @param line 1-indexed line
     * @param column 1-indexed column
     */
    public SourceParseException(String diagnostic, int line, int column) {
        super(diagnostic + " (line " + line + ", column " + column + ")");
        this.diagnostic = diagnostic;
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}

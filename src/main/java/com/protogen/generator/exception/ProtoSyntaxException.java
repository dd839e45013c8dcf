package com.protogen.generator.exception;

/**
 * Malformed schema source. Aborts the parse of the offending file.
 */
public class ProtoSyntaxException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String sourceFile;
    private final int line;
    private final int column;

    public ProtoSyntaxException(String sourceFile, int line, int column, String detail) {
        super(sourceFile + ":" + line + ":" + column + ": " + detail);
        this.sourceFile = sourceFile;
        this.line = line;
        this.column = column;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

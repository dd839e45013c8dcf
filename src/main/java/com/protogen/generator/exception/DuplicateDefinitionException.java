package com.protogen.generator.exception;

/**
 * Two declarations share a name (or an enum number) in the same scope.
 */
public class DuplicateDefinitionException extends ProtoSyntaxException {

    private static final long serialVersionUID = 1L;

    private final String definitionName;

    public DuplicateDefinitionException(String sourceFile, int line, int column, String definitionName, String detail) {
        super(sourceFile, line, column, detail);
        this.definitionName = definitionName;
    }

    public String getDefinitionName() {
        return definitionName;
    }
}

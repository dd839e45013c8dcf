package com.protogen.generator.exception;

/**
 * A field or method names a type that no reachable scope defines.
 */
public class UnresolvedTypeException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String rawType;
    private final String memberName;
    private final String ownerName;
    private final String sourceFile;

    public UnresolvedTypeException(String rawType, String memberDescription, String memberName,
                                   String ownerDescription, String ownerName, String sourceFile) {
        super("Could not resolve " + memberDescription + " " + memberName
                + " on " + ownerDescription + " " + ownerName
                + " : " + rawType
                + (sourceFile != null ? " (in " + sourceFile + ")" : ""));
        this.rawType = rawType;
        this.memberName = memberName;
        this.ownerName = ownerName;
        this.sourceFile = sourceFile;
    }

    public String getRawType() {
        return rawType;
    }

    public String getMemberName() {
        return memberName;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getSourceFile() {
        return sourceFile;
    }
}

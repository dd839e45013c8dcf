package com.protogen.generator.exception;

import java.util.List;

/**
 * A root file or an import could not be found on any search root.
 */
public class UnresolvedImportException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final String importedFrom;
    private final List<String> attemptedPaths;

    public UnresolvedImportException(String fileName, String importedFrom, List<String> attemptedPaths) {
        super(buildMessage(fileName, importedFrom, attemptedPaths));
        this.fileName = fileName;
        this.importedFrom = importedFrom;
        this.attemptedPaths = List.copyOf(attemptedPaths);
    }

    private static String buildMessage(String fileName, String importedFrom, List<String> attemptedPaths) {
        StringBuilder sb = new StringBuilder("File \"").append(fileName).append("\" could not be resolved");
        if (importedFrom != null) {
            sb.append(" (imported from ").append(importedFrom).append(")");
        }
        sb.append("; tried: ").append(String.join(", ", attemptedPaths));
        return sb.toString();
    }

    public String getFileName() {
        return fileName;
    }

    public String getImportedFrom() {
        return importedFrom;
    }

    public List<String> getAttemptedPaths() {
        return attemptedPaths;
    }
}

package com.raditha.astcore.error;

import com.raditha.astcore.model.Token;

import java.util.List;

/**
 * Fatal failure of the analysis of one translation unit.
 * <p>
 * Raised when a structural invariant is violated or when an analysis pass
 * misuses the core. It is never recovered from inside the core; the unit
 * driver reports it as an internal diagnostic, separate from findings.
 */
public class InternalAnalysisException extends RuntimeException {

    private final transient Token token;
    private final InternalErrorType type;
    private final int fileIndex;
    private final int line;
    private final int column;

    public InternalAnalysisException(Token token, String message) {
        this(token, message, InternalErrorType.INTERNAL);
    }

    public InternalAnalysisException(Token token, String message, InternalErrorType type) {
        super(message);
        this.token = token;
        this.type = type;
        this.fileIndex = token == null ? -1 : token.fileIndex();
        this.line = token == null ? 0 : token.lineNumber();
        this.column = token == null ? 0 : token.column();
    }

    /**
     * The offending token, or null when the failure has no position.
     */
    public Token getToken() {
        return token;
    }

    public InternalErrorType getType() {
        return type;
    }

    public int getFileIndex() {
        return fileIndex;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Format as "[file:line:column] message" for diagnostics.
     */
    public String toDiagnostic(List<String> fileNames) {
        String file = fileIndex >= 0 && fileNames != null && fileIndex < fileNames.size()
                ? fileNames.get(fileIndex)
                : String.valueOf(fileIndex);
        return "[" + file + ":" + line + ":" + column + "] " + type + ": " + getMessage();
    }
}

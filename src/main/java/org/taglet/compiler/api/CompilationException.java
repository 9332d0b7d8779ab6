package org.taglet.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * Every instance carries a {@link CompilerErrorCode} so callers and tests can tell the
 * failure kinds apart without parsing translated messages.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(CompilerErrorCode.UNKNOWN_ERROR, message, null, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        this(CompilerErrorCode.UNKNOWN_ERROR, message, null, cause);
    }

    /**
     * Constructs a new compilation exception with an error code and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source information, may be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    private CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code classifying this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The location of the offending markup, or null if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}

package org.taglet.compiler.diagnostics;

import org.taglet.compiler.api.CompilerErrorCode;
import org.taglet.compiler.api.SourceInfo;

/**
 * Represents a single error that occurred during the compilation process.
 *
 * @param code The error code.
 * @param message The diagnostic message.
 * @param sourceInfo The offending location, or null if unknown.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        SourceInfo sourceInfo
) {
    @Override
    public String toString() {
        String where = sourceInfo != null ? sourceInfo.toString() : "unknown";
        return String.format("[ERROR] %s: %s", where, message);
    }
}

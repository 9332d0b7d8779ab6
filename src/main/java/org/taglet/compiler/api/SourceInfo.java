package org.taglet.compiler.api;

/**
 * A pure data class representing a position in the markup source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the markup is located.
 * @param lineNumber The line number.
 * @param columnNumber The column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}

package org.taglet.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the translated error messages.
 */
public enum CompilerErrorCode {
    // region Attribute Errors
    /** An attribute required by a tag was not present on the element. */
    MISSING_REQUIRED_ATTRIBUTE,
    /** A boolean attribute held something other than true/yes/false/no. */
    INVALID_BOOLEAN_LITERAL,
    // endregion

    // region Dispatch Errors
    /** No tag handler method (and no namespace handler) exists for an element. */
    UNRESOLVED_HANDLER,
    /** An element named an internal or base handler method. */
    RESERVED_METHOD_INVOCATION,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}

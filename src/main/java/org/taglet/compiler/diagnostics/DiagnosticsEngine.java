package org.taglet.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.taglet.compiler.api.CompilationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the errors of one compilation.
 * <p>
 * This decouples error reporting from the handlers that detect the problems.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a compilation failure as an error.
     * @param exception The failure.
     */
    public void reportError(CompilationException exception) {
        Diagnostic d = new Diagnostic(exception.getErrorCode(), exception.getMessage(), exception.getSourceInfo());
        diagnostics.add(d);
        LOG.warn("{}", d);
    }

    /**
     * Forgets everything reported so far, before the next compilation starts.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * @return {@code true} if at least one error was reported, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}

package org.taglet.compiler.tags;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Formats already-rendered values as a comma-separated call argument list.
 * <p>
 * Example with the standard null literal:
 * <pre>
 *   argList(["'a'", null, "'b'", null], true)  == "'a', null, 'b'"
 *   argList(["'a'", null, "'b'", null], false) == "'a', null, 'b', null"
 * </pre>
 * Arguments are NOT quoted here; callers usually pass values from the attribute readers,
 * which already quote.
 */
public final class ArgumentList {

    private final String nullLiteral;

    /**
     * @param nullLiteral Rendered in place of omitted arguments.
     */
    public ArgumentList(String nullLiteral) {
        this.nullLiteral = nullLiteral;
    }

    /**
     * @param args The arguments; null entries are omitted values.
     * @param pruneTail If true, trailing omitted values are dropped.
     * @return The joined list, empty if no argument remains.
     */
    public String argList(List<String> args, boolean pruneTail) {
        List<String> remaining = new ArrayList<>(args);
        if (pruneTail) {
            while (!remaining.isEmpty() && remaining.get(remaining.size() - 1) == null) {
                remaining.remove(remaining.size() - 1);
            }
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (String arg : remaining) {
            joiner.add(arg != null ? arg : nullLiteral);
        }
        return joiner.toString();
    }
}

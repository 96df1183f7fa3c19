package com.testlantern.tree;

/**
 * One line of a dump that could not be placed in the tree.
 *
 * @param kind       what went wrong
 * @param lineNumber 1-based position in the input, or 0 when the problem concerns the whole dump
 * @param line       the offending text as it appeared in the input
 * @param detail     human-readable explanation
 */
public record ParseProblem(Kind kind, int lineNumber, String line, String detail) {

    public enum Kind {
        /** The line does not fit the dump grammar; the whole dump is rejected. */
        MALFORMED_LINE,
        /** The line is more than one level deeper than the nearest open ancestor. */
        DEPTH_JUMP,
        /** The line is at or above the root's depth once a root exists. */
        OUTSIDE_ROOT,
        /** A full debug description did not contain an element subtree section. */
        MISSING_SECTION,
        /** The input held no element lines at all. */
        EMPTY_DUMP
    }

    /** True for problems that leave the dump without any tree. */
    public boolean isFatal() {
        return kind == Kind.MALFORMED_LINE || kind == Kind.MISSING_SECTION || kind == Kind.EMPTY_DUMP;
    }

    @Override
    public String toString() {
        return lineNumber > 0
            ? String.format("%s at line %d (%s): %s", kind, lineNumber, detail, line)
            : String.format("%s (%s)", kind, detail);
    }
}

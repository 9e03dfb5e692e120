package org.dxworks.patternframe.model;

public enum ErrorKind {
    /** A right-hand operand of a kind the operand classifier does not know. */
    UNSUPPORTED_NODE_KIND,
    /** A concatenation node with more than one non-comment right-hand operand. */
    MALFORMED_CHAIN,
    /** A literal span reached twice; the walker's exclusivity invariant is broken. */
    DUPLICATE_LITERAL_VISIT,
    /** A named sink that was never declared as an accumulator. */
    UNRESOLVED_ACCUMULATOR_REFERENCE
}

package com.sysmuse.logik;

/**
 * Syntactic role of a token, used by the parser to decide what may begin a factor
 * and what may follow one.
 */
public enum TokenCategory {
    /**
     * Parentheses, optionally carrying the sub-expression highlight marker.
     */
    GROUPING,

    /**
     * A boolean constant such as true or 0.
     */
    LITERAL,

    /**
     * A single-character atomic proposition.
     */
    VARIABLE,

    /**
     * A unary operator written before its operand, e.g. not p.
     */
    OP_UNARY_RIGHT,

    /**
     * A binary operator written between its operands, e.g. p and q.
     */
    OP_BINARY_INFIX
}

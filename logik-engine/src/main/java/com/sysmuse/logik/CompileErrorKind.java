package com.sysmuse.logik;

/**
 * Reasons a piece of text fails to compile into a {@link Statement}.
 */
public enum CompileErrorKind {
    /**
     * A word, or the remainder of one, matches no token kind.
     */
    UNKNOWN_TOKEN,

    /**
     * A specific token (a closing parenthesis) was required but another one was found.
     */
    TOKEN_MISMATCH,

    /**
     * The text ended where an operand or a closing parenthesis was still expected.
     */
    UNEXPECTED_END_OF_INPUT,

    /**
     * A token appears where it cannot start or continue an expression.
     */
    MISPLACED_TOKEN,

    /**
     * Parentheses or negations are nested deeper than the configured limit, or the
     * syntax tree grows taller than {@link Parser#MAX_TREE_HEIGHT}.
     */
    NESTING_TOO_DEEP
}

package com.sysmuse.logik;

/**
 * Binding strength of operators, weakest first. LOWEST is the parser's entry tier and
 * holds no operator; HIGHEST is reserved for negation.
 */
public enum OperatorPrecedence {
    TOKEN_NOT_OPERATOR,
    LOWEST,
    LOW,
    MEDIUM,
    HIGH,
    HIGHEST;

    private static final OperatorPrecedence[] VALUES = values();

    public OperatorPrecedence next() {
        if (this == HIGHEST) {
            throw new IllegalStateException("No precedence tier above " + this);
        }
        return VALUES[ordinal() + 1];
    }
}

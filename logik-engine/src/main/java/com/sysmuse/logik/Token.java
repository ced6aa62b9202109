package com.sysmuse.logik;

import java.util.Objects;

/**
 * A lexical unit: the kind it was recognised as and the exact text that matched.
 */
public final class Token {

    private final TokenType type;
    private final String lexeme;

    public Token(TokenType type, String lexeme) {
        this.type = Objects.requireNonNull(type, "type");
        this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public TokenCategory getCategory() {
        return type.getCategory();
    }

    public OperatorPrecedence getPrecedence() {
        return type.getPrecedence();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme);
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')";
    }
}

package com.sysmuse.logik;

import java.util.List;

public final class Literal extends Node {

    private final boolean value;

    public Literal(Token token) {
        super(token, List.of());
        if (token.getType() != TokenType.BOOLEAN) {
            throw new IllegalArgumentException("Not a boolean literal: " + token);
        }
        this.value = parseValue(token.getLexeme());
    }

    /**
     * {@code true}, {@code t}, {@code 1} and {@code y} are true; {@code false}, {@code f},
     * {@code 0} and {@code n} are false. Case is ignored.
     */
    static boolean parseValue(String lexeme) {
        switch (lexeme.toLowerCase()) {
            case "true":
            case "t":
            case "1":
            case "y":
                return true;
            case "false":
            case "f":
            case "0":
            case "n":
                return false;
            default:
                throw new IllegalArgumentException("Not a boolean literal: " + lexeme);
        }
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public boolean evaluate(VariableAssignment assignment) {
        return value;
    }

    @Override
    public String toLaTeX() {
        return value ? "\\top" : "\\bot";
    }

    @Override
    public String toString() {
        return getToken().getLexeme();
    }
}

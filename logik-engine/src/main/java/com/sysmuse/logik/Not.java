package com.sysmuse.logik;

import java.util.List;

public final class Not extends Node {

    private final Node operand;

    public Not(Token token, Node operand) {
        super(token, List.of(operand));
        if (token.getType() != TokenType.NOT) {
            throw new IllegalArgumentException("Not a negation: " + token);
        }
        this.operand = operand;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(operand);
    }

    @Override
    public boolean evaluate(VariableAssignment assignment) {
        return !operand.evaluate(assignment);
    }

    @Override
    public String toLaTeX() {
        return "\\lnot " + operand.toLaTeX();
    }

    @Override
    public String toString() {
        return "(" + getToken().getLexeme() + " " + operand + ")";
    }
}

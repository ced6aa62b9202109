package com.sysmuse.logik;

import java.util.List;

public final class VariableRef extends Node {

    private final Variable variable;

    public VariableRef(Token token, Variable variable) {
        super(token, List.of());
        this.variable = variable;
    }

    public Variable getVariable() {
        return variable;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public boolean evaluate(VariableAssignment assignment) {
        return assignment.getValue(variable);
    }

    @Override
    public String toLaTeX() {
        return variable.getName();
    }

    @Override
    public String toString() {
        return variable.getName();
    }
}

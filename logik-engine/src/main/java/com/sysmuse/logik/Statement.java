package com.sysmuse.logik;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A compiled logical expression. Obtain one from {@link Logik#parse(String)}.
 * <p>
 * {@link #getVariables()} is sorted by name, which fixes the column and row order of the
 * statement's truth table. {@link #getSubExpressions()} lists the highlighted groups in
 * the order their closing parentheses were read, so nested groups come innermost first.
 * A statement never changes after compilation.
 */
public final class Statement {

    private final String text;
    private final List<Token> tokens;
    private final Node root;
    private final List<Variable> variables;
    private final List<Node> subExpressions;

    Statement(String text, List<Token> tokens, Node root, List<Variable> variables, List<Node> subExpressions) {
        this.text = text;
        this.tokens = List.copyOf(tokens);
        this.root = root;
        this.variables = List.copyOf(variables);
        this.subExpressions = List.copyOf(subExpressions);
    }

    public String getText() {
        return text;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public Node getRoot() {
        return root;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public List<Node> getSubExpressions() {
        return subExpressions;
    }

    public boolean declares(Variable variable) {
        return Collections.binarySearch(variables, variable) >= 0;
    }

    /**
     * @return the variable with this name, or null if the statement has none
     */
    public Variable findVariable(String name) {
        for (Variable variable : variables) {
            if (variable.getName().equals(name)) {
                return variable;
            }
        }
        return null;
    }

    /**
     * Evaluates with every variable set to true.
     */
    public boolean evaluate() {
        return evaluate(new VariableAssignment(this));
    }

    /**
     * @throws IllegalArgumentException if the assignment was made for another statement
     * @throws LogikEvaluationException if the assignment lacks a variable the statement reads
     */
    public boolean evaluate(VariableAssignment assignment) {
        if (assignment.getStatement() != this) {
            throw new IllegalArgumentException("Assignment was created for statement '"
                    + assignment.getStatement().getText() + "', not '" + text + "'");
        }
        return root.evaluate(assignment);
    }

    /**
     * Evaluates with the named variables set as given and every other variable true.
     *
     * @throws LogikEvaluationException if a name is not a variable of this statement
     */
    public boolean evaluate(Map<String, Boolean> values) {
        return evaluate(new VariableAssignment(this, values));
    }

    public TruthTable truthTable() {
        return new TruthTable(this, LogikConfig.DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * A copy of this statement whose variable list also holds the given names, so its
     * truth table can be compared row by row with a statement over more variables.
     * The syntax tree is shared.
     */
    public Statement withRedundantVariables(String... names) {
        List<Variable> merged = new ArrayList<>(variables);
        for (String name : names) {
            Variable variable = new Variable(name);
            if (!merged.contains(variable)) {
                merged.add(variable);
            }
        }
        merged.sort(null);
        return new Statement(text, tokens, root, merged, subExpressions);
    }

    @Override
    public String toString() {
        return text;
    }
}

package com.sysmuse.logik;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Truth values for the variables of one {@link Statement}, kept in the statement's
 * variable order. Only variables the statement declares can be read or written.
 * <p>
 * Two assignments are equal when they hold the same variables with the same values in
 * the same order.
 */
public class VariableAssignment {

    private final Statement statement;
    private final LinkedHashMap<Variable, Boolean> values;

    private VariableAssignment(LinkedHashMap<Variable, Boolean> values, Statement statement) {
        this.statement = statement;
        this.values = values;
    }

    /**
     * Every variable of the statement set to true.
     */
    public VariableAssignment(Statement statement) {
        this(new LinkedHashMap<Variable, Boolean>(), statement);
        for (Variable variable : statement.getVariables()) {
            values.put(variable, Boolean.TRUE);
        }
    }

    /**
     * Every variable true except those named in {@code overrides}.
     *
     * @throws LogikEvaluationException if a name is not a variable of the statement
     */
    public VariableAssignment(Statement statement, Map<String, Boolean> overrides) {
        this(statement);
        for (Map.Entry<String, Boolean> entry : overrides.entrySet()) {
            setValue(entry.getKey(), entry.getValue());
        }
    }

    public VariableAssignment(VariableAssignment other) {
        this(new LinkedHashMap<>(other.values), other.statement);
    }

    /**
     * Only the named variables, with no defaults. Evaluating a statement that reads a
     * variable missing from the result fails.
     *
     * @throws LogikEvaluationException if a name is not a variable of the statement
     */
    public static VariableAssignment partial(Statement statement, Map<String, Boolean> values) {
        for (String name : values.keySet()) {
            requireVariable(statement, name);
        }
        LinkedHashMap<Variable, Boolean> ordered = new LinkedHashMap<>();
        for (Variable variable : statement.getVariables()) {
            Boolean value = values.get(variable.getName());
            if (value != null) {
                ordered.put(variable, value);
            }
        }
        return new VariableAssignment(ordered, statement);
    }

    /**
     * Row {@code index} of the statement's truth table: the variable at position j is true
     * iff bit (n-1-j) of the index is clear.
     */
    static VariableAssignment forRow(Statement statement, long index) {
        List<Variable> variables = statement.getVariables();
        int n = variables.size();
        LinkedHashMap<Variable, Boolean> row = new LinkedHashMap<>();
        for (int j = 0; j < n; j++) {
            row.put(variables.get(j), ((index >>> (n - 1 - j)) & 1L) == 0);
        }
        return new VariableAssignment(row, statement);
    }

    public Statement getStatement() {
        return statement;
    }

    /**
     * @throws LogikEvaluationException if the variable has no value here
     */
    public boolean getValue(Variable variable) {
        Boolean value = values.get(variable);
        if (value == null) {
            throw new LogikEvaluationException(variable.getName(), statement.getText());
        }
        return value;
    }

    public boolean getValue(String name) {
        return getValue(new Variable(name));
    }

    /**
     * @throws LogikEvaluationException if the statement does not declare the variable
     */
    public void setValue(Variable variable, boolean value) {
        if (!statement.declares(variable)) {
            throw new LogikEvaluationException(variable.getName(), statement.getText());
        }
        values.put(variable, value);
    }

    public void setValue(String name, boolean value) {
        setValue(requireVariable(statement, name), value);
    }

    public boolean contains(Variable variable) {
        return values.containsKey(variable);
    }

    public List<Variable> getVariables() {
        return new ArrayList<>(values.keySet());
    }

    public Map<Variable, Boolean> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    private static Variable requireVariable(Statement statement, String name) {
        Variable variable = statement.findVariable(name);
        if (variable == null) {
            throw new LogikEvaluationException(name, statement.getText());
        }
        return variable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariableAssignment other = (VariableAssignment) o;
        return new ArrayList<>(values.entrySet()).equals(new ArrayList<>(other.values.entrySet()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(values.entrySet()).hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Variable, Boolean> entry : values.entrySet()) {
            if (sb.length() > 0) {
                sb.append(" | ");
            }
            sb.append(entry.getKey().getName()).append(" = ").append(entry.getValue());
        }
        return sb.toString();
    }
}

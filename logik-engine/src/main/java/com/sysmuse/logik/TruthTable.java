package com.sysmuse.logik;

import com.sysmuse.logik.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Every assignment of a statement's variables with the resulting truth values.
 * <p>
 * There are 2^n rows for n variables. The first variable is true in the first half of
 * the rows and false in the second; the last variable alternates on every row. Each
 * row's results hold one value per highlighted sub-expression, in statement order,
 * followed by the value of the whole statement.
 */
public class TruthTable {

    /**
     * Above this many variables the row count no longer fits an int.
     */
    public static final int MAX_VARIABLES = 30;

    private final Statement statement;
    private final List<Row> rows;

    public TruthTable(Statement statement, int parallelThreshold) {
        this.statement = statement;
        int variableCount = statement.getVariables().size();
        if (variableCount > MAX_VARIABLES) {
            throw new IllegalArgumentException("Cannot enumerate " + variableCount
                    + " variables; the limit is " + MAX_VARIABLES);
        }

        int size = 1 << variableCount;
        Row[] computed = new Row[size];
        boolean parallel = variableCount >= parallelThreshold;
        IntStream indexes = IntStream.range(0, size);
        if (parallel) {
            indexes = indexes.parallel();
        }
        indexes.forEach(i -> computed[i] = computeRow(i));
        this.rows = Collections.unmodifiableList(Arrays.asList(computed));

        LoggingUtil.debug("Truth table for '" + statement.getText() + "': " + size
                + " rows over " + variableCount + " variables" + (parallel ? " (parallel)" : ""));
    }

    private Row computeRow(int index) {
        VariableAssignment assignment = VariableAssignment.forRow(statement, index);
        List<Node> subExpressions = statement.getSubExpressions();
        List<Boolean> results = new ArrayList<>(subExpressions.size() + 1);
        for (Node subExpression : subExpressions) {
            results.add(subExpression.evaluate(assignment));
        }
        results.add(statement.evaluate(assignment));
        return new Row(assignment, results);
    }

    public Statement getStatement() {
        return statement;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    public VariableAssignment getAssignment(int index) {
        return rows.get(index).getAssignment();
    }

    public List<Boolean> getResults(int index) {
        return rows.get(index).getResults();
    }

    public boolean finalValue(int index) {
        return rows.get(index).getValue();
    }

    public int trueRowCount() {
        int count = 0;
        for (Row row : rows) {
            if (row.getValue()) {
                count++;
            }
        }
        return count;
    }

    public boolean isTautology() {
        return trueRowCount() == rows.size();
    }

    public boolean isContradiction() {
        return trueRowCount() == 0;
    }

    /**
     * The rows as an ordered map from assignment to results. The keys are copies.
     */
    public Map<VariableAssignment, List<Boolean>> asMap() {
        Map<VariableAssignment, List<Boolean>> mapping = new LinkedHashMap<>();
        for (Row row : rows) {
            mapping.put(row.getAssignment(), row.getResults());
        }
        return mapping;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return rows.equals(((TruthTable) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return TruthTableFormatter.format(this, TableFormat.TEXT, new LogikConfig());
    }

    /**
     * One assignment and the values computed for it.
     */
    public static final class Row {

        private final VariableAssignment assignment;
        private final List<Boolean> results;

        Row(VariableAssignment assignment, List<Boolean> results) {
            this.assignment = assignment;
            this.results = Collections.unmodifiableList(results);
        }

        /**
         * A copy of this row's assignment; changing it does not affect the table.
         */
        public VariableAssignment getAssignment() {
            return new VariableAssignment(assignment);
        }

        public boolean valueOf(Variable variable) {
            return assignment.getValue(variable);
        }

        /**
         * Sub-expression values in statement order, then the statement's value.
         */
        public List<Boolean> getResults() {
            return results;
        }

        public List<Boolean> getSubExpressionResults() {
            return results.subList(0, results.size() - 1);
        }

        public boolean getValue() {
            return results.get(results.size() - 1);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Row)) return false;
            Row other = (Row) o;
            return assignment.equals(other.assignment) && results.equals(other.results);
        }

        @Override
        public int hashCode() {
            return Objects.hash(assignment, results);
        }

        @Override
        public String toString() {
            return assignment + " -> " + results;
        }
    }
}

package com.sysmuse.logik;

/**
 * Thrown when a variable is read, written or supplied for a statement that does not
 * declare it, or when evaluation reaches a variable the assignment does not hold.
 */
public class LogikEvaluationException extends RuntimeException {

    private final String variableName;

    public LogikEvaluationException(String variableName, String statementText) {
        super("Variable " + variableName + " is not defined for statement " + statementText);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}

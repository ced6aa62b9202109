package com.sysmuse.logik;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;

/**
 * Writes truth tables as JSON.
 *
 * <pre>
 * {
 *   "statement": "*(p and q) or r",
 *   "variables": ["p", "q", "r"],
 *   "subExpressions": ["(and p q)"],
 *   "rows": [
 *     { "assignment": {"p": true, "q": true, "r": true}, "subExpressions": [true], "value": true },
 *     ...
 *   ]
 * }
 * </pre>
 */
public class TruthTableJsonExporter {

    private final ObjectMapper objectMapper;

    /**
     * Create an exporter with pretty-printing enabled.
     */
    public TruthTableJsonExporter() {
        this(true);
    }

    public TruthTableJsonExporter(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper();
        if (prettyPrint) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public ObjectNode toJson(TruthTable table) {
        Statement statement = table.getStatement();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("statement", statement.getText());

        ArrayNode variables = root.putArray("variables");
        for (Variable variable : statement.getVariables()) {
            variables.add(variable.getName());
        }

        ArrayNode subExpressions = root.putArray("subExpressions");
        for (Node node : statement.getSubExpressions()) {
            subExpressions.add(node.toString());
        }

        ArrayNode rows = root.putArray("rows");
        for (TruthTable.Row row : table.getRows()) {
            ObjectNode rowNode = rows.addObject();
            ObjectNode assignment = rowNode.putObject("assignment");
            row.getAssignment().asMap().forEach((variable, value) -> assignment.put(variable.getName(), value));
            ArrayNode subValues = rowNode.putArray("subExpressions");
            for (Boolean value : row.getSubExpressionResults()) {
                subValues.add(value);
            }
            rowNode.put("value", row.getValue());
        }
        return root;
    }

    public String exportToString(TruthTable table) throws IOException {
        return objectMapper.writeValueAsString(toJson(table));
    }

    /**
     * Export a table to a JSON file, creating parent directories as needed.
     */
    public void exportToFile(TruthTable table, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(file, toJson(table));
    }
}

package com.sysmuse.logik;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders truth tables for people. Which columns and rows appear, and how true and false
 * are spelled, come from the {@link LogikConfig}.
 */
public class TruthTableFormatter {

    public static String format(TruthTable table, TableFormat format, LogikConfig config) {
        switch (format) {
            case TEXT:
                return toText(table, config);
            case LATEX:
                return toLaTeX(table, config);
            case JSON:
                try {
                    return new TruthTableJsonExporter().exportToString(table);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to render truth table as JSON", e);
                }
            default:
                throw new IllegalArgumentException("Unsupported TableFormat: " + format);
        }
    }

    /**
     * One column per variable, then the highlighted sub-expressions (when shown), then
     * the statement. Every cell is padded to its column's widest entry.
     * <pre>
     * | p     | q     | p and q |
     * | true  | true  | true    |
     * </pre>
     */
    public static String toText(TruthTable table, LogikConfig config) {
        Statement statement = table.getStatement();
        boolean showSub = config.isShowSubExpressions();
        int valueWidth = Math.max(config.getTrueText().length(), config.getFalseText().length());

        List<String> headers = new ArrayList<>();
        for (Variable variable : statement.getVariables()) {
            headers.add(variable.getName());
        }
        if (showSub) {
            for (Node node : statement.getSubExpressions()) {
                headers.add(node.toString());
            }
        }
        headers.add(statement.getText());

        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.max(headers.get(i).length(), valueWidth);
        }

        StringBuilder builder = new StringBuilder();
        appendTextLine(builder, headers, widths);
        for (TruthTable.Row row : table.getRows()) {
            if (config.isOnlyShowTrueRows() && !row.getValue()) {
                continue;
            }
            appendTextLine(builder, rowCells(row, statement, showSub, config), widths);
        }
        return builder.toString();
    }

    /**
     * A math-mode array with a double rule between the variables and the computed columns.
     */
    public static String toLaTeX(TruthTable table, LogikConfig config) {
        Statement statement = table.getStatement();
        boolean showSub = config.isShowSubExpressions();
        int variableCount = statement.getVariables().size();
        int resultCount = (showSub ? statement.getSubExpressions().size() : 0) + 1;

        StringBuilder builder = new StringBuilder();
        builder.append("\\[\n");
        builder.append("\\begin{array}{");
        builder.append(String.join("|", repeat("c", variableCount)));
        if (variableCount > 0) {
            builder.append("||");
        }
        builder.append(String.join("|", repeat("c", resultCount)));
        builder.append("}\n");

        List<String> headers = new ArrayList<>();
        for (Variable variable : statement.getVariables()) {
            headers.add(variable.getName());
        }
        if (showSub) {
            for (Node node : statement.getSubExpressions()) {
                headers.add(node.toLaTeX());
            }
        }
        headers.add(statement.getRoot().toLaTeX());
        builder.append(String.join(" & ", headers)).append(" \\\\ \\hline\n");

        for (TruthTable.Row row : table.getRows()) {
            if (config.isOnlyShowTrueRows() && !row.getValue()) {
                continue;
            }
            builder.append(String.join(" & ", rowCells(row, statement, showSub, config))).append(" \\\\\n");
        }
        builder.append("\\end{array}\n");
        builder.append("\\]\n");
        return builder.toString();
    }

    private static List<String> rowCells(TruthTable.Row row, Statement statement, boolean showSub, LogikConfig config) {
        List<String> cells = new ArrayList<>();
        for (Variable variable : statement.getVariables()) {
            cells.add(config.display(row.valueOf(variable)));
        }
        if (showSub) {
            for (Boolean value : row.getSubExpressionResults()) {
                cells.add(config.display(value));
            }
        }
        cells.add(config.display(row.getValue()));
        return cells;
    }

    private static void appendTextLine(StringBuilder builder, List<String> cells, int[] widths) {
        for (int i = 0; i < cells.size(); i++) {
            builder.append("| ").append(pad(cells.get(i), widths[i])).append(' ');
        }
        builder.append("|\n");
    }

    private static String pad(String text, int width) {
        StringBuilder padded = new StringBuilder(text);
        while (padded.length() < width) {
            padded.append(' ');
        }
        return padded.toString();
    }

    private static List<String> repeat(String value, int count) {
        List<String> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(value);
        }
        return values;
    }
}

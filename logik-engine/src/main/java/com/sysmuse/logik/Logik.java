package com.sysmuse.logik;

import com.sysmuse.logik.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for compiling propositional-logic text into {@link Statement}s and working
 * with their truth tables.
 * <pre>
 * Statement s = Logik.parse("p and q implies r");
 * boolean v = s.evaluate(Map.of("p", true, "q", false));
 * TruthTable table = s.truthTable();
 * </pre>
 * The static {@link #parse(String)} uses the default configuration. Create an instance to
 * compile with a different highlight marker or nesting limit.
 */
public class Logik {

    private static final Logik DEFAULT = new Logik();

    private final LogikConfig config;
    private final Tokenizer tokenizer;

    public Logik() {
        this(new LogikConfig());
    }

    public Logik(LogikConfig config) {
        this.config = new LogikConfig(config);
        this.tokenizer = new Tokenizer(this.config.getHighlightMarker());
    }

    /**
     * Compiles text with the default configuration.
     *
     * @throws LogikCompileException if the text is not a well-formed expression
     */
    public static Statement parse(String text) {
        return DEFAULT.compile(text);
    }

    public LogikConfig getConfig() {
        return new LogikConfig(config);
    }

    /**
     * @throws LogikCompileException if the text is not a well-formed expression
     */
    public Statement compile(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Expression text must not be null");
        }
        List<Token> tokens = tokenizer.tokenize(text);
        Statement statement = new Parser(text, tokens, config.getHighlightMarker(), config.getMaxNestingDepth()).parse();
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Compiled '" + text + "' -> " + statement.getRoot()
                    + " variables=" + statement.getVariables()
                    + " subExpressions=" + statement.getSubExpressions().size());
        }
        return statement;
    }

    public boolean evaluate(Statement statement) {
        return statement.evaluate();
    }

    public boolean evaluate(Statement statement, VariableAssignment assignment) {
        return statement.evaluate(assignment);
    }

    public boolean evaluate(Statement statement, Map<String, Boolean> values) {
        return statement.evaluate(values);
    }

    public TruthTable truthTable(Statement statement) {
        return new TruthTable(statement, config.getParallelThreshold());
    }

    public String format(TruthTable table, TableFormat format) {
        return TruthTableFormatter.format(table, format, config);
    }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Command-line driver. Prints the truth table of the expression made of the
     * non-option arguments and returns the process exit status: 0 on success, 1 if the
     * expression does not compile, 2 on bad usage or an unreadable configuration.
     */
    static int run(String[] args, PrintStream out) {
        LogikConfig config = new LogikConfig();
        TableFormat format = TableFormat.TEXT;
        Boolean showSub = null;
        Boolean trueOnly = null;
        List<String> words = new ArrayList<>();

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config":
                        config = LogikConfigLoader.loadFromFile(new File(requireValue(args, ++i, arg)));
                        break;
                    case "--format":
                        format = TableFormat.valueOf(requireValue(args, ++i, arg).toUpperCase());
                        break;
                    case "--sub":
                        showSub = Boolean.TRUE;
                        break;
                    case "--true-only":
                        trueOnly = Boolean.TRUE;
                        break;
                    default:
                        words.add(arg);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            LoggingUtil.error(e.getMessage());
            printUsage(System.err);
            return 2;
        }

        if (words.isEmpty()) {
            printUsage(System.err);
            return 2;
        }
        if (showSub != null) {
            config.setShowSubExpressions(showSub);
        }
        if (trueOnly != null) {
            config.setOnlyShowTrueRows(trueOnly);
        }
        LoggingUtil.initialize(config);

        Logik logik = new Logik(config);
        try {
            Statement statement = logik.compile(String.join(" ", words));
            out.print(logik.format(logik.truthTable(statement), format));
            return 0;
        } catch (LogikCompileException e) {
            LoggingUtil.error("Cannot compile expression: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            LoggingUtil.error(e.getMessage());
            return 1;
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java com.sysmuse.logik.Logik [--config <file.json>] [--format text|latex|json]"
                + " [--sub] [--true-only] <expression...>");
    }
}

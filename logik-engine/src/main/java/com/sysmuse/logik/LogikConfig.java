package com.sysmuse.logik;

/**
 * Settings for compiling statements and presenting truth tables.
 * <p>
 * A config is passed explicitly to {@link Logik}, the tokenizer and the formatters; nothing
 * in the engine reads it from a global. Load one from JSON with {@link LogikConfigLoader}.
 */
public class LogikConfig {

    public static final char DEFAULT_HIGHLIGHT_MARKER = '*';
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 16;

    // Compilation
    private Character highlightMarker = DEFAULT_HIGHLIGHT_MARKER;
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

    // Truth table generation and display
    private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
    private String trueText = "true";
    private String falseText = "false";
    private boolean showSubExpressions = false;
    private boolean onlyShowTrueRows = false;

    // Logging
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "logik.log";

    public LogikConfig() {
    }

    public LogikConfig(LogikConfig other) {
        this.highlightMarker = other.highlightMarker;
        this.maxNestingDepth = other.maxNestingDepth;
        this.parallelThreshold = other.parallelThreshold;
        this.trueText = other.trueText;
        this.falseText = other.falseText;
        this.showSubExpressions = other.showSubExpressions;
        this.onlyShowTrueRows = other.onlyShowTrueRows;
        this.loggingLevel = other.loggingLevel;
        this.consoleLoggingEnabled = other.consoleLoggingEnabled;
        this.fileLoggingEnabled = other.fileLoggingEnabled;
        this.logFileName = other.logFileName;
    }

    /**
     * The character that, written immediately before an opening parenthesis, records the
     * enclosed expression as a sub-expression, e.g. {@code *(p and q) or r}.
     * {@code null} disables marking and every parenthesis is plain grouping.
     */
    public Character getHighlightMarker() {
        return highlightMarker;
    }

    public void setHighlightMarker(Character highlightMarker) {
        if (highlightMarker != null) {
            char c = highlightMarker;
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '!') {
                throw new IllegalArgumentException("Unusable highlight marker: '" + c + "'");
            }
        }
        this.highlightMarker = highlightMarker;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Variable count from which truth table rows are computed in parallel.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be positive: " + parallelThreshold);
        }
        this.parallelThreshold = parallelThreshold;
    }

    public String getTrueText() {
        return trueText;
    }

    public void setTrueText(String trueText) {
        this.trueText = requireText(trueText, "trueText");
    }

    public String getFalseText() {
        return falseText;
    }

    public void setFalseText(String falseText) {
        this.falseText = requireText(falseText, "falseText");
    }

    public String display(boolean value) {
        return value ? trueText : falseText;
    }

    public boolean isShowSubExpressions() {
        return showSubExpressions;
    }

    public void setShowSubExpressions(boolean showSubExpressions) {
        this.showSubExpressions = showSubExpressions;
    }

    public boolean isOnlyShowTrueRows() {
        return onlyShowTrueRows;
    }

    public void setOnlyShowTrueRows(boolean onlyShowTrueRows) {
        this.onlyShowTrueRows = onlyShowTrueRows;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value;
    }
}

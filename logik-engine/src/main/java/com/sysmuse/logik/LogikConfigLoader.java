package com.sysmuse.logik;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sysmuse.logik.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads and writes {@link LogikConfig} as JSON. Every section and key is optional;
 * missing ones keep their defaults and unknown ones are ignored.
 *
 * <pre>
 * {
 *   "compiler": { "highlightMarker": "*", "maxNestingDepth": 256 },
 *   "truthTable": { "parallelThreshold": 16 },
 *   "display": { "trueText": "T", "falseText": "F",
 *                "showSubExpressions": true, "onlyShowTrueRows": false },
 *   "logging": { "level": "DEBUG", "console": true, "file": false, "fileName": "logik.log" }
 * }
 * </pre>
 */
public class LogikConfigLoader {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static LogikConfig fromJson(JsonNode root) {
        LogikConfig config = new LogikConfig();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return config;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Logik configuration must be a JSON object");
        }

        JsonNode compiler = root.path("compiler");
        if (compiler.has("highlightMarker")) {
            config.setHighlightMarker(parseMarker(compiler.get("highlightMarker")));
        }
        if (compiler.has("maxNestingDepth")) {
            config.setMaxNestingDepth(compiler.get("maxNestingDepth").asInt());
        }

        JsonNode truthTable = root.path("truthTable");
        if (truthTable.has("parallelThreshold")) {
            config.setParallelThreshold(truthTable.get("parallelThreshold").asInt());
        }

        JsonNode display = root.path("display");
        if (display.has("trueText")) {
            config.setTrueText(display.get("trueText").asText());
        }
        if (display.has("falseText")) {
            config.setFalseText(display.get("falseText").asText());
        }
        if (display.has("showSubExpressions")) {
            config.setShowSubExpressions(display.get("showSubExpressions").asBoolean());
        }
        if (display.has("onlyShowTrueRows")) {
            config.setOnlyShowTrueRows(display.get("onlyShowTrueRows").asBoolean());
        }

        JsonNode logging = root.path("logging");
        if (logging.has("level")) {
            config.setLoggingLevel(logging.get("level").asText());
        }
        if (logging.has("console")) {
            config.setConsoleLoggingEnabled(logging.get("console").asBoolean());
        }
        if (logging.has("file")) {
            config.setFileLoggingEnabled(logging.get("file").asBoolean());
        }
        if (logging.has("fileName")) {
            config.setLogFileName(logging.get("fileName").asText());
        }

        return config;
    }

    public static LogikConfig loadFromFile(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Configuration file not found: " + file.getPath());
        }
        LogikConfig config = fromJson(mapper.readTree(file));
        LoggingUtil.info("Loaded Logik configuration from " + file.getPath());
        return config;
    }

    /**
     * Loads a configuration from the classpath, e.g. {@code "/logik-config.json"}.
     */
    public static LogikConfig loadFromResource(String resourceName) throws IOException {
        try (InputStream in = LogikConfigLoader.class.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resourceName);
            }
            LogikConfig config = fromJson(mapper.readTree(in));
            LoggingUtil.info("Loaded Logik configuration from resource " + resourceName);
            return config;
        }
    }

    public static ObjectNode toJson(LogikConfig config) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode compiler = root.putObject("compiler");
        Character marker = config.getHighlightMarker();
        if (marker == null) {
            compiler.putNull("highlightMarker");
        } else {
            compiler.put("highlightMarker", marker.toString());
        }
        compiler.put("maxNestingDepth", config.getMaxNestingDepth());

        root.putObject("truthTable").put("parallelThreshold", config.getParallelThreshold());

        ObjectNode display = root.putObject("display");
        display.put("trueText", config.getTrueText());
        display.put("falseText", config.getFalseText());
        display.put("showSubExpressions", config.isShowSubExpressions());
        display.put("onlyShowTrueRows", config.isOnlyShowTrueRows());

        ObjectNode logging = root.putObject("logging");
        logging.put("level", config.getLoggingLevel());
        logging.put("console", config.isConsoleLoggingEnabled());
        logging.put("file", config.isFileLoggingEnabled());
        logging.put("fileName", config.getLogFileName());

        return root;
    }

    public static void saveToFile(LogikConfig config, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(file, toJson(config));
    }

    private static Character parseMarker(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        String text = node.asText();
        if (text.isEmpty()) {
            return null;
        }
        if (text.length() != 1) {
            throw new IllegalArgumentException("highlightMarker must be a single character: \"" + text + "\"");
        }
        return text.charAt(0);
    }
}

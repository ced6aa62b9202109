package com.sysmuse.logik;

import com.sysmuse.logik.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into {@link Token}s.
 * <p>
 * Parentheses and {@code !} are padded with spaces and the text is split into words on
 * whitespace. A word that is exactly one alias becomes one token. Otherwise the word is
 * consumed from the left: the first kind (in declaration order) matching at the start of
 * what is left supplies the next token, so {@code p&&q} reads as p, &amp;&amp;, q.
 */
public class Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Character highlightMarker;
    private final Map<TokenType, Pattern> patterns = new EnumMap<>(TokenType.class);

    public Tokenizer() {
        this(LogikConfig.DEFAULT_HIGHLIGHT_MARKER);
    }

    public Tokenizer(Character highlightMarker) {
        this.highlightMarker = highlightMarker;
        for (TokenType type : TokenType.values()) {
            patterns.put(type, type.pattern(highlightMarker));
        }
    }

    public Character getHighlightMarker() {
        return highlightMarker;
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        for (String word : splitWords(text)) {
            tokens.addAll(tokenizeWord(word));
        }
        LoggingUtil.debug("tokenize: '" + text + "' -> " + tokens);
        return Collections.unmodifiableList(tokens);
    }

    List<String> splitWords(String text) {
        String spaced = text
                .replace("(", "( ")
                .replace(")", " )")
                .replace("!", " ! ");
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(spaced)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    List<Token> tokenizeWord(String word) {
        TokenType whole = fullMatch(word);
        if (whole != null) {
            return List.of(new Token(whole, word));
        }

        List<Token> tokens = new ArrayList<>();
        String rest = word;
        while (!rest.isEmpty()) {
            whole = fullMatch(rest);
            if (whole != null) {
                tokens.add(new Token(whole, rest));
                break;
            }
            Token next = prefixMatch(rest);
            if (next == null) {
                throw LogikCompileException.unknownToken(rest);
            }
            tokens.add(next);
            rest = rest.substring(next.getLexeme().length());
        }
        return tokens;
    }

    private TokenType fullMatch(String word) {
        for (TokenType type : TokenType.values()) {
            if (patterns.get(type).matcher(word).matches()) {
                return type;
            }
        }
        return null;
    }

    private Token prefixMatch(String word) {
        for (TokenType type : TokenType.values()) {
            Matcher matcher = patterns.get(type).matcher(word);
            // an empty match would never consume anything
            if (matcher.lookingAt() && matcher.end() > 0) {
                return new Token(type, matcher.group());
            }
        }
        return null;
    }
}

package com.sysmuse.logik;

import java.util.regex.Pattern;

/**
 * Every kind of token the tokenizer recognises, together with the aliases that spell it.
 * <p>
 * Declaration order matters: when a word could be read as more than one kind, the
 * earliest kind wins. Word aliases such as {@code and} are whole words, so {@code andy}
 * is not an AND followed by {@code y}.
 * <ul>
 *   <li>not     - ¬, !, not, lnot, \not, \lnot</li>
 *   <li>and     - ∧, &amp;&amp;, &amp;, and, land, \and, \land</li>
 *   <li>or      - ∨, ||, or, lor, \or, \lor (a single | is nand)</li>
 *   <li>nand    - |, sh, nand, lnand, \nand, \lnand</li>
 *   <li>xor     - ⊕, xor, lxor, oplus, \xor, \lxor, \oplus</li>
 *   <li>implies - ⇒, =⇒, implies, \implies</li>
 *   <li>iff     - ⇔, iff, liff, \iff, \liff</li>
 *   <li>boolean - true, false and the single characters t f 1 0 y n (either case)</li>
 *   <li>variable - any other single word character</li>
 * </ul>
 */
public enum TokenType {
    NOT("¬|!|\\bl?not\\b|\\\\l?not\\b",
            TokenCategory.OP_UNARY_RIGHT, OperatorPrecedence.HIGHEST),
    AND("∧|&&|&|\\bl?and\\b|\\\\l?and\\b",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.HIGH),
    OR("∨|\\|\\||\\bl?or\\b|\\\\l?or\\b",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.HIGH),
    NAND("\\bsh\\b|\\bl?nand\\b|\\\\l?nand\\b|\\|",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.HIGH),
    XOR("⊕|\\bl?xor\\b|\\\\l?xor\\b|\\boplus\\b|\\\\oplus\\b",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.HIGH),
    IMPLIES("=?⇒|\\bimplies\\b|\\\\implies\\b",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.MEDIUM),
    IFF("⇔|\\bl?iff\\b|\\\\l?iff\\b",
            TokenCategory.OP_BINARY_INFIX, OperatorPrecedence.LOW),
    OPEN_PAREN("\\(",
            TokenCategory.GROUPING, OperatorPrecedence.TOKEN_NOT_OPERATOR),
    CLOSE_PAREN("\\)",
            TokenCategory.GROUPING, OperatorPrecedence.TOKEN_NOT_OPERATOR),
    BOOLEAN("\\btrue\\b|\\bfalse\\b|\\b[tTfF01yYnN]\\b",
            TokenCategory.LITERAL, OperatorPrecedence.TOKEN_NOT_OPERATOR),
    VARIABLE("\\b\\w\\b",
            TokenCategory.VARIABLE, OperatorPrecedence.TOKEN_NOT_OPERATOR);

    static final int PATTERN_FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private final String regex;
    private final TokenCategory category;
    private final OperatorPrecedence precedence;

    TokenType(String regex, TokenCategory category, OperatorPrecedence precedence) {
        this.regex = regex;
        this.category = category;
        this.precedence = precedence;
    }

    /**
     * The alias alternation for this kind. OPEN_PAREN is extended with the optional
     * highlight marker by {@link #pattern(Character)}.
     */
    public String getRegex() {
        return regex;
    }

    public TokenCategory getCategory() {
        return category;
    }

    public OperatorPrecedence getPrecedence() {
        return precedence;
    }

    public boolean isOperator() {
        return precedence != OperatorPrecedence.TOKEN_NOT_OPERATOR;
    }

    /**
     * Compiles the pattern for this kind. A non-null marker lets an opening parenthesis
     * carry it as a prefix, e.g. {@code *(}.
     */
    public Pattern pattern(Character highlightMarker) {
        if (this == OPEN_PAREN && highlightMarker != null) {
            return Pattern.compile("(?:" + Pattern.quote(highlightMarker.toString()) + ")?" + regex, PATTERN_FLAGS);
        }
        return Pattern.compile(regex, PATTERN_FLAGS);
    }
}

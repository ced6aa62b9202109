package com.sysmuse.logik;

/**
 * Thrown when text cannot be tokenized or parsed. No partial statement is ever produced.
 * Positions are token indexes; -1 when the failure has no position (unknown words).
 */
public class LogikCompileException extends RuntimeException {

    private final CompileErrorKind kind;
    private final String word;
    private final TokenType expected;
    private final Token found;
    private final int position;

    private LogikCompileException(CompileErrorKind kind, String message, String word,
                                  TokenType expected, Token found, int position) {
        super(message);
        this.kind = kind;
        this.word = word;
        this.expected = expected;
        this.found = found;
        this.position = position;
    }

    public static LogikCompileException unknownToken(String word) {
        return new LogikCompileException(CompileErrorKind.UNKNOWN_TOKEN,
                "Unknown token " + word, word, null, null, -1);
    }

    public static LogikCompileException tokenMismatch(TokenType expected, Token found, int position) {
        return new LogikCompileException(CompileErrorKind.TOKEN_MISMATCH,
                "Required " + expected + ", but it was " + found.getType()
                        + " ('" + found.getLexeme() + "') at word index " + position,
                found.getLexeme(), expected, found, position);
    }

    public static LogikCompileException unexpectedEndOfInput(int position) {
        return new LogikCompileException(CompileErrorKind.UNEXPECTED_END_OF_INPUT,
                "Expected an expression at word index " + position + ", but the text ended",
                null, null, null, position);
    }

    public static LogikCompileException unexpectedEndOfInput(TokenType expected, int position) {
        return new LogikCompileException(CompileErrorKind.UNEXPECTED_END_OF_INPUT,
                "Expected " + expected + " at word index " + position + ", but the text ended",
                null, expected, null, position);
    }

    public static LogikCompileException misplacedToken(Token token, int position) {
        return new LogikCompileException(CompileErrorKind.MISPLACED_TOKEN,
                "Incorrectly placed token " + token + " at word index " + position,
                token.getLexeme(), null, token, position);
    }

    public static LogikCompileException nestingTooDeep(int limit, int position) {
        return new LogikCompileException(CompileErrorKind.NESTING_TOO_DEEP,
                "Expression nested deeper than " + limit + " levels at word index " + position,
                null, null, null, position);
    }

    public static LogikCompileException treeTooTall(int limit, int position) {
        return new LogikCompileException(CompileErrorKind.NESTING_TOO_DEEP,
                "Expression tree taller than " + limit + " at word index " + position,
                null, null, null, position);
    }

    public CompileErrorKind getKind() {
        return kind;
    }

    /**
     * The offending text, when there is one.
     */
    public String getWord() {
        return word;
    }

    public TokenType getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    public int getPosition() {
        return position;
    }
}

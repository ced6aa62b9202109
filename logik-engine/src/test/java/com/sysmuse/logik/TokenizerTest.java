package com.sysmuse.logik;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    public void setup() {
        tokenizer = new Tokenizer();
    }

    private List<TokenType> types(String text) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : tokenizer.tokenize(text)) {
            types.add(token.getType());
        }
        return types;
    }

    private TokenType single(String word) {
        List<Token> tokens = tokenizer.tokenize(word);
        assertEquals(1, tokens.size(), "expected one token for " + word + " but got " + tokens);
        return tokens.get(0).getType();
    }

    @Test
    public void testWordAliases() {
        for (String alias : List.of("¬", "!", "not", "lnot", "\\not", "\\lnot")) {
            assertEquals(TokenType.NOT, single(alias), alias);
        }
        for (String alias : List.of("∧", "&&", "&", "and", "land", "\\and", "\\land")) {
            assertEquals(TokenType.AND, single(alias), alias);
        }
        for (String alias : List.of("∨", "||", "or", "lor", "\\or", "\\lor")) {
            assertEquals(TokenType.OR, single(alias), alias);
        }
        for (String alias : List.of("|", "sh", "nand", "lnand", "\\nand", "\\lnand")) {
            assertEquals(TokenType.NAND, single(alias), alias);
        }
        for (String alias : List.of("⊕", "xor", "lxor", "oplus", "\\xor", "\\lxor", "\\oplus")) {
            assertEquals(TokenType.XOR, single(alias), alias);
        }
        for (String alias : List.of("⇒", "=⇒", "implies", "\\implies")) {
            assertEquals(TokenType.IMPLIES, single(alias), alias);
        }
        for (String alias : List.of("⇔", "iff", "liff", "\\iff", "\\liff")) {
            assertEquals(TokenType.IFF, single(alias), alias);
        }
    }

    @Test
    public void testLiteralsAndVariables() {
        for (String literal : List.of("true", "false", "t", "F", "1", "0", "y", "N")) {
            assertEquals(TokenType.BOOLEAN, single(literal), literal);
        }
        for (String variable : List.of("p", "q", "Z", "2", "_")) {
            assertEquals(TokenType.VARIABLE, single(variable), variable);
        }
    }

    @Test
    public void testSymbolsSplitWithoutSpaces() {
        assertEquals(List.of(TokenType.VARIABLE, TokenType.AND, TokenType.VARIABLE), types("2&&3"));
        assertEquals(List.of(TokenType.VARIABLE, TokenType.AND, TokenType.VARIABLE), types("p∧q"));
        assertEquals(List.of(TokenType.NOT, TokenType.VARIABLE), types("¬p"));
        assertEquals(List.of(TokenType.NOT, TokenType.VARIABLE), types("!p"));
        assertEquals(List.of(TokenType.VARIABLE, TokenType.IMPLIES, TokenType.VARIABLE), types("p=⇒q"));

        List<Token> tokens = tokenizer.tokenize("2&&3");
        assertEquals("2", tokens.get(0).getLexeme());
        assertEquals("&&", tokens.get(1).getLexeme());
        assertEquals("3", tokens.get(2).getLexeme());
    }

    @Test
    public void testSingleBarIsNand() {
        assertEquals(List.of(TokenType.VARIABLE, TokenType.NAND, TokenType.VARIABLE), types("p|q"));
        assertEquals(List.of(TokenType.VARIABLE, TokenType.OR, TokenType.VARIABLE), types("p||q"));
    }

    @Test
    public void testParenthesesAreSeparated() {
        assertEquals(List.of(TokenType.OPEN_PAREN, TokenType.VARIABLE, TokenType.OR,
                        TokenType.VARIABLE, TokenType.CLOSE_PAREN, TokenType.AND, TokenType.VARIABLE),
                types("(p or q)and r"));
        assertEquals(List.of(TokenType.NOT, TokenType.OPEN_PAREN, TokenType.VARIABLE, TokenType.CLOSE_PAREN),
                types("!(p)"));
    }

    @Test
    public void testHighlightMarkerJoinsOpenParen() {
        List<Token> tokens = tokenizer.tokenize("*(p and q)");
        assertEquals(TokenType.OPEN_PAREN, tokens.get(0).getType());
        assertEquals("*(", tokens.get(0).getLexeme());
        assertEquals(5, tokens.size());
    }

    @Test
    public void testCustomMarker() {
        Tokenizer hashes = new Tokenizer('#');
        assertEquals("#(", hashes.tokenize("#(p)").get(0).getLexeme());

        LogikCompileException e = assertThrows(LogikCompileException.class, () -> hashes.tokenize("*(p)"));
        assertEquals(CompileErrorKind.UNKNOWN_TOKEN, e.getKind());
    }

    @Test
    public void testMarkerDisabled() {
        Tokenizer plain = new Tokenizer(null);
        assertEquals(TokenType.OPEN_PAREN, plain.tokenize("(p)").get(0).getType());

        LogikCompileException e = assertThrows(LogikCompileException.class, () -> plain.tokenize("*(p)"));
        assertEquals(CompileErrorKind.UNKNOWN_TOKEN, e.getKind());
        assertEquals("*(", e.getWord());
    }

    @Test
    public void testUnknownToken() {
        LogikCompileException e = assertThrows(LogikCompileException.class, () -> tokenizer.tokenize("p and pq"));
        assertEquals(CompileErrorKind.UNKNOWN_TOKEN, e.getKind());
        assertEquals("pq", e.getWord());

        e = assertThrows(LogikCompileException.class, () -> tokenizer.tokenize("andy"));
        assertEquals("andy", e.getWord());

        e = assertThrows(LogikCompileException.class, () -> tokenizer.tokenize("p&$"));
        assertEquals("$", e.getWord());
    }

    @Test
    public void testBlankText() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("  \t ").isEmpty());
    }

    @Test
    public void testCategoriesAndPrecedence() {
        assertEquals(OperatorPrecedence.LOW, TokenType.IFF.getPrecedence());
        assertEquals(OperatorPrecedence.MEDIUM, TokenType.IMPLIES.getPrecedence());
        for (TokenType type : List.of(TokenType.AND, TokenType.OR, TokenType.XOR, TokenType.NAND)) {
            assertEquals(OperatorPrecedence.HIGH, type.getPrecedence(), type.name());
            assertEquals(TokenCategory.OP_BINARY_INFIX, type.getCategory(), type.name());
        }
        assertEquals(OperatorPrecedence.HIGHEST, TokenType.NOT.getPrecedence());
        assertEquals(TokenCategory.OP_UNARY_RIGHT, TokenType.NOT.getCategory());
        assertEquals(OperatorPrecedence.TOKEN_NOT_OPERATOR, TokenType.VARIABLE.getPrecedence());
        assertFalse(TokenType.OPEN_PAREN.isOperator());

        assertEquals(OperatorPrecedence.LOW, OperatorPrecedence.LOWEST.next());
        assertThrows(IllegalStateException.class, OperatorPrecedence.HIGHEST::next);
    }

    @Test
    public void testTokenValueSemantics() {
        Token token = new Token(TokenType.AND, "&&");
        assertEquals(new Token(TokenType.AND, "&&"), token);
        assertNotEquals(new Token(TokenType.AND, "and"), token);
        assertEquals("AND('&&')", token.toString());
    }
}

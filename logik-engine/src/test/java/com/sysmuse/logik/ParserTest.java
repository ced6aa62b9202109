package com.sysmuse.logik;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private Logik logik;

    @BeforeEach
    public void setup() {
        logik = new Logik();
    }

    private String tree(String text) {
        return logik.compile(text).getRoot().toString();
    }

    private LogikCompileException failure(String text) {
        return assertThrows(LogikCompileException.class, () -> logik.compile(text));
    }

    @Test
    public void testSameTierFoldsLeft() {
        assertEquals("(or (and p q) r)", tree("p and q or r"));
        assertEquals("(and (or p q) r)", tree("p or q and r"));
        assertEquals("(xor (xor p q) r)", tree("p xor q xor r"));
        assertEquals("(implies (implies p q) r)", tree("p implies q implies r"));
    }

    @Test
    public void testTiers() {
        assertEquals("(iff (implies p q) r)", tree("p implies q iff r"));
        assertEquals("(iff p (implies q r))", tree("p iff q implies r"));
        assertEquals("(implies (and p q) (or r s))", tree("p and q implies r or s"));
        assertEquals("(and (not p) q)", tree("not p and q"));
        assertEquals("(not (not p))", tree("not not p"));
    }

    @Test
    public void testParenthesesOverrideTiers() {
        assertEquals("(and p (or q r))", tree("p and (q or r)"));
        assertEquals("(not (and p q))", tree("not (p and q)"));
        assertEquals("p", tree("((p))"));
    }

    @Test
    public void testLiteralsAndVariables() {
        Statement statement = logik.compile("p and true or r implies 0");
        assertEquals(List.of(new Variable("p"), new Variable("r")), statement.getVariables());
        assertEquals("(implies (or (and p true) r) 0)", statement.getRoot().toString());
    }

    @Test
    public void testVariablesSortedAndDistinct() {
        Statement statement = logik.compile("r and p or q and p");
        assertEquals(List.of(new Variable("p"), new Variable("q"), new Variable("r")), statement.getVariables());
        assertTrue(statement.declares(new Variable("q")));
        assertFalse(statement.declares(new Variable("s")));
        assertNull(statement.findVariable("s"));
    }

    @Test
    public void testAliasesBuildSameShape() {
        Statement words = logik.compile("2 and 3");
        Statement symbols = logik.compile("2&&3");
        assertEquals(words.getVariables(), symbols.getVariables());
        assertEquals(words.truthTable().getRows(), symbols.truthTable().getRows());
        // the operator lexemes differ
        assertNotEquals(words.getRoot(), symbols.getRoot());
        assertEquals(words.getRoot(), logik.compile("2  and   3").getRoot());
    }

    @Test
    public void testMarkedSubExpressions() {
        Statement statement = logik.compile("*(*(p and q) or r) xor s");
        List<Node> subExpressions = statement.getSubExpressions();
        assertEquals(2, subExpressions.size());
        assertEquals("(and p q)", subExpressions.get(0).toString());
        assertEquals("(or (and p q) r)", subExpressions.get(1).toString());
        assertEquals("(xor (or (and p q) r) s)", statement.getRoot().toString());
    }

    @Test
    public void testUnmarkedGroupsAreNotRecorded() {
        assertTrue(logik.compile("(p and q) or r").getSubExpressions().isEmpty());
    }

    @Test
    public void testUnexpectedEnd() {
        LogikCompileException e = failure("p and");
        assertEquals(CompileErrorKind.UNEXPECTED_END_OF_INPUT, e.getKind());
        assertEquals(2, e.getPosition());

        e = failure("not");
        assertEquals(CompileErrorKind.UNEXPECTED_END_OF_INPUT, e.getKind());
        assertEquals(1, e.getPosition());

        e = failure("");
        assertEquals(CompileErrorKind.UNEXPECTED_END_OF_INPUT, e.getKind());
        assertEquals(0, e.getPosition());
    }

    @Test
    public void testMissingCloseParen() {
        LogikCompileException e = failure("(p and q");
        assertEquals(CompileErrorKind.UNEXPECTED_END_OF_INPUT, e.getKind());
        assertEquals(TokenType.CLOSE_PAREN, e.getExpected());
        assertEquals(4, e.getPosition());
    }

    @Test
    public void testTokenMismatch() {
        LogikCompileException e = failure("(p q)");
        assertEquals(CompileErrorKind.TOKEN_MISMATCH, e.getKind());
        assertEquals(TokenType.CLOSE_PAREN, e.getExpected());
        assertEquals(TokenType.VARIABLE, e.getFound().getType());
        assertEquals(2, e.getPosition());
    }

    @Test
    public void testMisplacedTokens() {
        LogikCompileException e = failure("and p");
        assertEquals(CompileErrorKind.MISPLACED_TOKEN, e.getKind());
        assertEquals(0, e.getPosition());

        e = failure("p )");
        assertEquals(CompileErrorKind.MISPLACED_TOKEN, e.getKind());
        assertEquals(1, e.getPosition());
        assertEquals(TokenType.CLOSE_PAREN, e.getFound().getType());

        e = failure("()");
        assertEquals(CompileErrorKind.MISPLACED_TOKEN, e.getKind());
        assertEquals(1, e.getPosition());

        e = failure("p q");
        assertEquals(CompileErrorKind.MISPLACED_TOKEN, e.getKind());
        assertEquals(1, e.getPosition());
    }

    @Test
    public void testUnknownTokenSurfacesFromCompile() {
        LogikCompileException e = failure("p and $");
        assertEquals(CompileErrorKind.UNKNOWN_TOKEN, e.getKind());
        assertEquals("$", e.getWord());
        assertEquals(-1, e.getPosition());
    }

    @Test
    public void testNestingLimit() {
        LogikConfig config = new LogikConfig();
        config.setMaxNestingDepth(3);
        Logik shallow = new Logik(config);

        assertEquals("p", shallow.compile("(((p)))").getRoot().toString());
        LogikCompileException e = assertThrows(LogikCompileException.class, () -> shallow.compile("((((p))))"));
        assertEquals(CompileErrorKind.NESTING_TOO_DEEP, e.getKind());

        e = assertThrows(LogikCompileException.class, () -> shallow.compile("not not not p"));
        assertEquals(CompileErrorKind.NESTING_TOO_DEEP, e.getKind());

        // a flat chain does not nest
        assertEquals(4, shallow.compile("p and q and r and s").getRoot().getDepth());
    }

    private static String chain(int operands) {
        StringBuilder text = new StringBuilder("p");
        for (int i = 1; i < operands; i++) {
            text.append(i % 2 == 0 ? " or p" : " or q");
        }
        return text.toString();
    }

    @Test
    public void testLongFlatChain() {
        Statement statement = logik.compile(chain(1000));
        assertEquals(1000, statement.getRoot().getDepth());
        assertEquals(2, statement.getVariables().size());
        assertTrue(statement.evaluate());
        assertFalse(statement.evaluate(Map.of("p", false, "q", false)));
        assertEquals(statement.getRoot(), logik.compile(chain(1000)).getRoot());
    }

    @Test
    public void testTreeHeightCap() {
        assertEquals(Parser.MAX_TREE_HEIGHT,
                logik.compile(chain(Parser.MAX_TREE_HEIGHT)).getRoot().getDepth());
        LogikCompileException e = failure(chain(Parser.MAX_TREE_HEIGHT + 1));
        assertEquals(CompileErrorKind.NESTING_TOO_DEEP, e.getKind());
    }

    @Test
    public void testDefaultLimitRejectsRunawayNesting() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 2000; i++) {
            text.append('(');
        }
        text.append('p');
        for (int i = 0; i < 2000; i++) {
            text.append(')');
        }
        LogikCompileException e = failure(text.toString());
        assertEquals(CompileErrorKind.NESTING_TOO_DEEP, e.getKind());
    }

    @Test
    public void testNullText() {
        assertThrows(IllegalArgumentException.class, () -> logik.compile(null));
    }
}

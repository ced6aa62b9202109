package com.sysmuse.logik;

import com.sysmuse.logik.util.LoggingUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Precedence-climbing recursive descent over a token list.
 * <pre>
 * expression(p) = expression(p+1) (infix(p) expression(p+1))*
 * factor        = literal | variable | NOT factor | '(' expression(LOWEST) ')'
 * </pre>
 * Tiers from weakest: iff, implies, {and, or, xor, nand}, not. Operators sharing a tier
 * fold left to right.
 */
public class Parser {

    /**
     * Height cap for the syntax tree. Flat operator chains grow the tree without nesting,
     * so they are bounded here rather than by the nesting limit.
     */
    public static final int MAX_TREE_HEIGHT = 2048;

    private final String text;
    private final List<Token> tokens;
    private final Character highlightMarker;
    private final int maxNestingDepth;

    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final List<Node> subExpressions = new ArrayList<>();
    private int position = 0;
    private int nesting = 0;

    public Parser(String text, List<Token> tokens, Character highlightMarker, int maxNestingDepth) {
        this.text = text;
        this.tokens = tokens;
        this.highlightMarker = highlightMarker;
        this.maxNestingDepth = maxNestingDepth;
    }

    public Statement parse() {
        if (tokens.isEmpty()) {
            throw LogikCompileException.unexpectedEndOfInput(0);
        }
        Node root = parseExpression(OperatorPrecedence.LOWEST);
        if (!isAtEnd()) {
            throw LogikCompileException.misplacedToken(peek(), position);
        }

        List<Variable> sorted = new ArrayList<>(variables.values());
        sorted.sort(null);
        return new Statement(text, tokens, root, sorted, subExpressions);
    }

    private Node parseExpression(OperatorPrecedence precedence) {
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("parseExpression(" + precedence + ") at pos=" + position
                    + " token=" + (isAtEnd() ? "<end>" : peek()));
        }
        Node node = parseOperand(precedence);
        while (!isAtEnd()
                && peek().getCategory() == TokenCategory.OP_BINARY_INFIX
                && peek().getPrecedence() == precedence) {
            Token operator = advance();
            Node right = parseOperand(precedence);
            node = checkDepth(new BinaryOperation(operator, node, right));
        }
        return node;
    }

    private Node parseOperand(OperatorPrecedence precedence) {
        return precedence == OperatorPrecedence.HIGHEST
                ? parseFactor()
                : parseExpression(precedence.next());
    }

    private Node parseFactor() {
        if (isAtEnd()) {
            throw LogikCompileException.unexpectedEndOfInput(position);
        }
        Token token = peek();
        switch (token.getCategory()) {
            case LITERAL:
                advance();
                return new Literal(token);
            case VARIABLE:
                advance();
                return new VariableRef(token, declare(token.getLexeme()));
            case OP_UNARY_RIGHT: {
                advance();
                enterNesting();
                Node operand = parseFactor();
                nesting--;
                return checkDepth(new Not(token, operand));
            }
            case GROUPING:
                if (token.getType() == TokenType.OPEN_PAREN) {
                    return parseGroup(token);
                }
                break;
            default:
                break;
        }
        throw LogikCompileException.misplacedToken(token, position);
    }

    private Node parseGroup(Token open) {
        advance();
        enterNesting();
        Node inner = parseExpression(OperatorPrecedence.LOWEST);
        consume(TokenType.CLOSE_PAREN);
        nesting--;
        if (isMarked(open)) {
            if (LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("Marked sub-expression " + inner);
            }
            subExpressions.add(inner);
        }
        return inner;
    }

    private boolean isMarked(Token open) {
        String lexeme = open.getLexeme();
        return highlightMarker != null
                && lexeme.length() > 1
                && lexeme.charAt(0) == highlightMarker;
    }

    private Variable declare(String name) {
        return variables.computeIfAbsent(name, Variable::new);
    }

    private void enterNesting() {
        if (++nesting > maxNestingDepth) {
            throw LogikCompileException.nestingTooDeep(maxNestingDepth, position);
        }
    }

    private Node checkDepth(Node node) {
        if (node.getDepth() > MAX_TREE_HEIGHT) {
            throw LogikCompileException.treeTooTall(MAX_TREE_HEIGHT, position);
        }
        return node;
    }

    private Token consume(TokenType expected) {
        if (isAtEnd()) {
            throw LogikCompileException.unexpectedEndOfInput(expected, position);
        }
        if (peek().getType() != expected) {
            throw LogikCompileException.tokenMismatch(expected, peek(), position);
        }
        return advance();
    }

    private Token advance() {
        return tokens.get(position++);
    }

    private Token peek() {
        return tokens.get(position);
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }
}

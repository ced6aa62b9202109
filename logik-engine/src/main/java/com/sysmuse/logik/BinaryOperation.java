package com.sysmuse.logik;

import java.util.List;

/**
 * An infix connective. Both operands are always evaluated, left first.
 */
public final class BinaryOperation extends Node {

    private final TokenType operator;
    private final Node left;
    private final Node right;

    public BinaryOperation(Token token, Node left, Node right) {
        super(token, List.of(left, right));
        if (token.getCategory() != TokenCategory.OP_BINARY_INFIX) {
            throw new IllegalArgumentException("Not a binary operator: " + token);
        }
        this.operator = token.getType();
        this.left = left;
        this.right = right;
    }

    public TokenType getOperator() {
        return operator;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(left, right);
    }

    @Override
    public boolean evaluate(VariableAssignment assignment) {
        boolean l = left.evaluate(assignment);
        boolean r = right.evaluate(assignment);
        return apply(operator, l, r);
    }

    static boolean apply(TokenType operator, boolean l, boolean r) {
        switch (operator) {
            case AND: return l && r;
            case OR: return l || r;
            case XOR: return l != r;
            case NAND: return !(l && r);
            case IMPLIES: return !l || r;
            case IFF: return l == r;
            default:
                throw new IllegalStateException("Unsupported binary operator: " + operator);
        }
    }

    @Override
    public String toLaTeX() {
        return "(" + left.toLaTeX() + " " + latexSymbol(operator) + " " + right.toLaTeX() + ")";
    }

    private static String latexSymbol(TokenType operator) {
        return switch (operator) {
            case AND -> "\\land";
            case OR -> "\\lor";
            case XOR -> "\\oplus";
            case NAND -> "\\mid";
            case IMPLIES -> "\\implies";
            case IFF -> "\\iff";
            default -> throw new IllegalStateException("Unsupported binary operator: " + operator);
        };
    }

    @Override
    public String toString() {
        return "(" + getToken().getLexeme() + " " + left + " " + right + ")";
    }
}

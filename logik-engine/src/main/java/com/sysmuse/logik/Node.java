package com.sysmuse.logik;

import java.util.List;
import java.util.Objects;

/**
 * A node of a compiled statement's syntax tree. The variants are {@link Literal},
 * {@link VariableRef}, {@link Not} and {@link BinaryOperation}; each owns its children.
 * <p>
 * Two nodes are equal when they are the same variant, came from equal tokens (so
 * {@code p and q} and {@code p && q} differ) and have equal children.
 */
public abstract class Node {

    private final Token token;
    private final int depth;

    Node(Token token, List<Node> children) {
        this.token = Objects.requireNonNull(token, "token");
        int deepest = 0;
        for (Node child : children) {
            deepest = Math.max(deepest, child.depth);
        }
        this.depth = deepest + 1;
    }

    public Token getToken() {
        return token;
    }

    /**
     * Height of the subtree rooted here; a leaf has depth 1.
     */
    public int getDepth() {
        return depth;
    }

    public abstract List<Node> getChildren();

    /**
     * Truth value of this subtree under the given assignment.
     *
     * @throws LogikEvaluationException if a referenced variable has no value
     */
    public abstract boolean evaluate(VariableAssignment assignment);

    /**
     * This subtree as LaTeX math, e.g. {@code (p \land \lnot q)}.
     */
    public abstract String toLaTeX();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node other = (Node) o;
        return token.equals(other.token) && getChildren().equals(other.getChildren());
    }

    @Override
    public int hashCode() {
        return 31 * token.hashCode() + getChildren().hashCode();
    }
}

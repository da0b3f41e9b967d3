package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * A node or token at one position of one {@link SourceTree} snapshot.
 *
 * <p>Two elements are equal when they denote the same position in the same snapshot. This is the
 * identity replacement maps are keyed on.
 */
public abstract class SyntaxElement {
    final SourceTree tree;
    final int index;

    SyntaxElement(SourceTree tree, int index) {
        this.tree = tree;
        this.index = index;
    }

    public SourceTree getTree() {
        return tree;
    }

    /**
     * Preorder position of this element in its snapshot.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Preorder index one past the last element of this element's subtree.
     */
    public int getSubtreeEnd() {
        return tree.subtreeEndOf(index);
    }

    public SyntaxKind getKind() {
        return tree.greenAt(index).getKind();
    }

    public boolean isKind(SyntaxKind kind) {
        return getKind() == kind;
    }

    public abstract GreenElement getGreen();

    public abstract boolean isToken();

    public boolean isNode() {
        return !isToken();
    }

    public SyntaxNode asNode() {
        return (SyntaxNode) this;
    }

    public SyntaxToken asToken() {
        return (SyntaxToken) this;
    }

    public SyntaxNode getParent() {
        int parent = tree.parentOf(index);
        return parent < 0 ? null : new SyntaxNode(tree, parent);
    }

    /**
     * Parent, grandparent and so on up to the root.
     */
    public List<SyntaxNode> getAncestors() {
        List<SyntaxNode> ancestors = new ArrayList<>();
        for (SyntaxNode current = getParent(); current != null; current = current.getParent()) {
            ancestors.add(current);
        }
        return ancestors;
    }

    /**
     * Whether {@code other} is this element or lies inside its subtree.
     */
    public boolean contains(SyntaxElement other) {
        return other.tree == tree && other.index >= index && other.index < tree.subtreeEndOf(index);
    }

    /**
     * Span including leading and trailing trivia.
     */
    public TextSpan getFullSpan() {
        int start = tree.fullStartOf(index);
        return new TextSpan(start, start + getGreen().getFullWidth());
    }

    /**
     * Span of the text without the outer leading and trailing trivia.
     */
    public abstract TextSpan getSpan();

    public abstract SyntaxToken getFirstToken();

    public abstract SyntaxToken getLastToken();

    public TriviaList getLeadingTrivia() {
        return getGreen().getLeadingTrivia();
    }

    public TriviaList getTrailingTrivia() {
        return getGreen().getTrailingTrivia();
    }

    public String toFullString() {
        return getGreen().toFullString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxElement)) {
            return false;
        }
        SyntaxElement other = (SyntaxElement) o;
        return tree == other.tree && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(tree) + index;
    }

    @Override
    public String toString() {
        TextSpan span = getSpan();
        return getKind() + span.toString() + " " + tree.getText().toString(span.getStart(), span.getEnd());
    }
}

package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * An inner node at one position of a {@link SourceTree}.
 */
public final class SyntaxNode extends SyntaxElement {

    SyntaxNode(SourceTree tree, int index) {
        super(tree, index);
    }

    @Override
    public GreenNode getGreen() {
        return (GreenNode) tree.greenAt(index);
    }

    @Override
    public boolean isToken() {
        return false;
    }

    public List<SyntaxElement> getChildren() {
        int[] kids = tree.childrenOf(index);
        List<SyntaxElement> children = new ArrayList<>(kids.length);
        for (int kid : kids) {
            children.add(tree.elementAt(kid));
        }
        return children;
    }

    public List<SyntaxNode> getChildNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (int kid : tree.childrenOf(index)) {
            if (!tree.greenAt(kid).isToken()) {
                nodes.add(new SyntaxNode(tree, kid));
            }
        }
        return nodes;
    }

    public List<SyntaxToken> getChildTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        for (int kid : tree.childrenOf(index)) {
            if (tree.greenAt(kid).isToken()) {
                tokens.add(new SyntaxToken(tree, kid));
            }
        }
        return tokens;
    }

    /**
     * First child node of the given kind, or {@code null}.
     */
    public SyntaxNode getChildNode(SyntaxKind kind) {
        for (int kid : tree.childrenOf(index)) {
            if (tree.greenAt(kid).getKind() == kind) {
                return new SyntaxNode(tree, kid);
            }
        }
        return null;
    }

    /**
     * First child token of the given kind, or {@code null}.
     */
    public SyntaxToken getChildToken(SyntaxKind kind) {
        for (int kid : tree.childrenOf(index)) {
            if (tree.greenAt(kid).getKind() == kind) {
                return new SyntaxToken(tree, kid);
            }
        }
        return null;
    }

    /**
     * Position of {@code child} among this node's children, or -1.
     */
    public int indexOfChild(SyntaxElement child) {
        if (child.tree != tree) {
            return -1;
        }
        int[] kids = tree.childrenOf(index);
        for (int i = 0; i < kids.length; i++) {
            if (kids[i] == child.index) {
                return i;
            }
        }
        return -1;
    }

    /**
     * All nodes below this one, in document order.
     */
    public List<SyntaxNode> getDescendantNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (int i = index + 1; i < tree.subtreeEndOf(index); i++) {
            if (!tree.greenAt(i).isToken()) {
                nodes.add(new SyntaxNode(tree, i));
            }
        }
        return nodes;
    }

    public List<SyntaxToken> getDescendantTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        for (int i = index + 1; i < tree.subtreeEndOf(index); i++) {
            if (tree.greenAt(i).isToken()) {
                tokens.add(new SyntaxToken(tree, i));
            }
        }
        return tokens;
    }

    @Override
    public SyntaxToken getFirstToken() {
        for (int i = index + 1; i < tree.subtreeEndOf(index); i++) {
            if (tree.greenAt(i).isToken()) {
                return new SyntaxToken(tree, i);
            }
        }
        return null;
    }

    @Override
    public SyntaxToken getLastToken() {
        for (int i = tree.subtreeEndOf(index) - 1; i > index; i--) {
            if (tree.greenAt(i).isToken()) {
                return new SyntaxToken(tree, i);
            }
        }
        return null;
    }

    @Override
    public TextSpan getSpan() {
        SyntaxToken first = getFirstToken();
        SyntaxToken last = getLastToken();
        if (first == null) {
            return getFullSpan();
        }
        return new TextSpan(first.getSpan().getStart(), last.getSpan().getEnd());
    }
}

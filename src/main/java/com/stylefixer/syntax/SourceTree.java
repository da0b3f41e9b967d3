package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One immutable snapshot of a parsed source file.
 *
 * <p>The snapshot indexes its green tree in preorder: every node and token gets an index, and the
 * parent, full start offset, subtree extent and token ordinal of each index live in side tables.
 * {@link SyntaxNode} and {@link SyntaxToken} are handles into these tables, so navigation never
 * needs a back-pointer inside the green data and the green data can be shared by later snapshots.
 */
public final class SourceTree {
    private final GreenNode root;
    private final SourceText text;
    private final GreenElement[] elements;
    private final int[] parents;
    private final int[] fullStarts;
    private final int[] subtreeEnds;
    private final int[][] childIndices;
    private final int[] tokenOrdinals;
    private final int[] tokenIndices;

    public SourceTree(GreenNode root) {
        this.root = Objects.requireNonNull(root, "root");
        Indexer indexer = new Indexer();
        indexer.visit(root, -1, 0);

        int count = indexer.elements.size();
        this.elements = indexer.elements.toArray(new GreenElement[0]);
        this.parents = toArray(indexer.parents);
        this.fullStarts = toArray(indexer.fullStarts);
        this.subtreeEnds = new int[count];
        this.childIndices = new int[count][];
        this.tokenOrdinals = new int[count];
        for (int i = 0; i < count; i++) {
            subtreeEnds[i] = indexer.subtreeEnds[i];
            childIndices[i] = indexer.children[i];
            tokenOrdinals[i] = -1;
        }
        this.tokenIndices = toArray(indexer.tokens);
        for (int ordinal = 0; ordinal < tokenIndices.length; ordinal++) {
            tokenOrdinals[tokenIndices[ordinal]] = ordinal;
        }
        this.text = SourceText.from(root.toFullString());
    }

    public SyntaxNode getRoot() {
        return new SyntaxNode(this, 0);
    }

    public GreenNode getGreenRoot() {
        return root;
    }

    public SourceText getText() {
        return text;
    }

    public String toFullString() {
        return text.toString();
    }

    public int getTokenCount() {
        return tokenIndices.length;
    }

    public List<SyntaxToken> getTokens() {
        List<SyntaxToken> tokens = new ArrayList<>(tokenIndices.length);
        for (int index : tokenIndices) {
            tokens.add(new SyntaxToken(this, index));
        }
        return tokens;
    }

    /**
     * Returns the token whose full span (text plus trivia) contains {@code position}. The end of the
     * text maps to the end-of-file token.
     */
    public SyntaxToken findToken(int position) {
        if (position < 0 || position > text.length()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside text of length " + text.length());
        }
        if (tokenIndices.length == 0) {
            throw new IllegalStateException("Tree has no tokens");
        }
        int low = 0;
        int high = tokenIndices.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (fullStarts[tokenIndices[mid]] <= position) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new SyntaxToken(this, tokenIndices[low]);
    }

    public SyntaxNode findNode(TextSpan span) {
        return findNode(span, false);
    }

    /**
     * Returns the smallest node whose full span contains {@code span}. Unless
     * {@code innermostNodeForTie} is set, climbs to the outermost ancestor sharing that full span.
     */
    public SyntaxNode findNode(TextSpan span, boolean innermostNodeForTie) {
        if (span.getEnd() > text.length()) {
            throw new IndexOutOfBoundsException("Span " + span + " outside text of length " + text.length());
        }
        SyntaxNode node = findToken(span.getStart()).getParent();
        while (!node.getFullSpan().contains(span) && node.getParent() != null) {
            node = node.getParent();
        }
        if (!innermostNodeForTie) {
            while (node.getParent() != null && node.getParent().getFullSpan().equals(node.getFullSpan())) {
                node = node.getParent();
            }
        }
        return node;
    }

    SyntaxElement elementAt(int index) {
        return elements[index].isToken() ? new SyntaxToken(this, index) : new SyntaxNode(this, index);
    }

    GreenElement greenAt(int index) {
        return elements[index];
    }

    int parentOf(int index) {
        return parents[index];
    }

    int fullStartOf(int index) {
        return fullStarts[index];
    }

    int subtreeEndOf(int index) {
        return subtreeEnds[index];
    }

    int[] childrenOf(int index) {
        return childIndices[index];
    }

    int tokenOrdinalOf(int index) {
        return tokenOrdinals[index];
    }

    SyntaxToken tokenAtOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= tokenIndices.length) {
            return null;
        }
        return new SyntaxToken(this, tokenIndices[ordinal]);
    }

    private static int[] toArray(List<Integer> values) {
        int[] result = new int[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    private static final class Indexer {
        private final List<GreenElement> elements = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<Integer> fullStarts = new ArrayList<>();
        private final List<Integer> tokens = new ArrayList<>();
        private int[] subtreeEnds = new int[64];
        private int[][] children = new int[64][];

        private int visit(GreenElement element, int parent, int fullStart) {
            int index = elements.size();
            elements.add(element);
            parents.add(parent);
            fullStarts.add(fullStart);
            ensureCapacity(index + 1);

            if (element instanceof GreenToken) {
                tokens.add(index);
                children[index] = new int[0];
            } else {
                List<GreenElement> kids = ((GreenNode) element).getChildren();
                int[] kidIndices = new int[kids.size()];
                int position = fullStart;
                for (int i = 0; i < kids.size(); i++) {
                    GreenElement kid = kids.get(i);
                    kidIndices[i] = visit(kid, index, position);
                    position += kid.getFullWidth();
                }
                children[index] = kidIndices;
            }
            subtreeEnds[index] = elements.size();
            return index;
        }

        private void ensureCapacity(int size) {
            if (size > subtreeEnds.length) {
                int newLength = Math.max(size, subtreeEnds.length * 2);
                int[] ends = new int[newLength];
                System.arraycopy(subtreeEnds, 0, ends, 0, subtreeEnds.length);
                subtreeEnds = ends;
                int[][] kids = new int[newLength][];
                System.arraycopy(children, 0, kids, 0, children.length);
                children = kids;
            }
        }
    }
}

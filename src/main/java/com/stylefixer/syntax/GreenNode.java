package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An inner node: a kind plus an ordered list of child nodes and tokens.
 */
public final class GreenNode extends GreenElement {
    private final List<GreenElement> children;
    private final int fullWidth;

    public GreenNode(SyntaxKind kind, List<? extends GreenElement> children) {
        this(kind, children, false);
    }

    public GreenNode(SyntaxKind kind, List<? extends GreenElement> children, boolean formattingExempt) {
        super(kind, formattingExempt);
        if (kind.isToken()) {
            throw new IllegalArgumentException("Not a node kind: " + kind);
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        int width = 0;
        for (GreenElement child : this.children) {
            width += child.getFullWidth();
        }
        this.fullWidth = width;
    }

    @Override
    public boolean isToken() {
        return false;
    }

    public List<GreenElement> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public GreenElement getChild(int index) {
        return children.get(index);
    }

    /**
     * Index of the first child of the given kind, or -1.
     */
    public int indexOf(SyntaxKind kind) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).isKind(kind)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public int getFullWidth() {
        return fullWidth;
    }

    public GreenToken getFirstToken() {
        for (GreenElement child : children) {
            if (child instanceof GreenToken) {
                return (GreenToken) child;
            }
            GreenToken token = ((GreenNode) child).getFirstToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    public GreenToken getLastToken() {
        for (int i = children.size() - 1; i >= 0; i--) {
            GreenElement child = children.get(i);
            if (child instanceof GreenToken) {
                return (GreenToken) child;
            }
            GreenToken token = ((GreenNode) child).getLastToken();
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    @Override
    public TriviaList getLeadingTrivia() {
        GreenToken first = getFirstToken();
        return first == null ? TriviaList.EMPTY : first.getLeadingTrivia();
    }

    @Override
    public TriviaList getTrailingTrivia() {
        GreenToken last = getLastToken();
        return last == null ? TriviaList.EMPTY : last.getTrailingTrivia();
    }

    public GreenNode withChildren(List<? extends GreenElement> newChildren) {
        return new GreenNode(getKind(), newChildren, isFormattingExempt());
    }

    public GreenNode replaceChild(int index, GreenElement replacement) {
        List<GreenElement> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return withChildren(copy);
    }

    @Override
    public GreenNode withLeadingTrivia(TriviaList trivia) {
        for (int i = 0; i < children.size(); i++) {
            GreenElement child = children.get(i);
            if (child.isToken() || ((GreenNode) child).getFirstToken() != null) {
                return replaceChild(i, child.withLeadingTrivia(trivia));
            }
        }
        return this;
    }

    @Override
    public GreenNode withTrailingTrivia(TriviaList trivia) {
        for (int i = children.size() - 1; i >= 0; i--) {
            GreenElement child = children.get(i);
            if (child.isToken() || ((GreenNode) child).getLastToken() != null) {
                return replaceChild(i, child.withTrailingTrivia(trivia));
            }
        }
        return this;
    }

    @Override
    public GreenNode withFormattingExempt(boolean exempt) {
        if (exempt == isFormattingExempt()) {
            return this;
        }
        return new GreenNode(getKind(), children, exempt);
    }

    @Override
    void writeTo(StringBuilder sb) {
        for (GreenElement child : children) {
            child.writeTo(sb);
        }
    }
}

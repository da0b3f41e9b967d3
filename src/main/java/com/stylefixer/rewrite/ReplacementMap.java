package com.stylefixer.rewrite;

import com.stylefixer.syntax.GreenElement;
import com.stylefixer.syntax.GreenNode;
import com.stylefixer.syntax.GreenToken;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxElement;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Replacements for elements of one {@link SourceTree} snapshot, keyed by position.
 *
 * <p>A token is replaced by exactly one token. A node is replaced by any number of nodes, which lets
 * a fix split one declaration into several or remove it. Keys never overlap: no key is the same as,
 * or nested inside, another key of the same map.
 */
public final class ReplacementMap {
    private final SourceTree tree;
    private final TreeMap<Integer, Entry> entries = new TreeMap<>();

    public ReplacementMap(SourceTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public SourceTree getTree() {
        return tree;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Replaces a token with another token.
     */
    public ReplacementMap put(SyntaxToken original, GreenToken replacement) {
        return add(original, Collections.singletonList(replacement));
    }

    /**
     * Replaces a node with the given nodes, in order. An empty list removes the node.
     */
    public ReplacementMap put(SyntaxNode original, List<GreenNode> replacements) {
        return add(original, new ArrayList<>(replacements));
    }

    public ReplacementMap put(SyntaxNode original, GreenNode replacement) {
        return add(original, Collections.singletonList(replacement));
    }

    public boolean containsKey(SyntaxElement element) {
        Entry entry = entries.get(element.getIndex());
        return entry != null && entry.original.equals(element);
    }

    /**
     * Replacement recorded for {@code element}, or {@code null}.
     */
    public List<GreenElement> get(SyntaxElement element) {
        Entry entry = entries.get(element.getIndex());
        return entry != null && entry.original.equals(element) ? entry.replacements : null;
    }

    /**
     * Replaced elements in document order.
     */
    public List<SyntaxElement> keys() {
        List<SyntaxElement> keys = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            keys.add(entry.original);
        }
        return keys;
    }

    /**
     * Merges maps computed against the same snapshot. The result does not depend on the order of
     * {@code maps}; any shared or nested key fails the whole merge.
     *
     * @throws ConflictingEditException if two maps touch the same or nested positions
     */
    public static ReplacementMap union(SourceTree tree, Collection<ReplacementMap> maps,
                                       CancellationToken cancellationToken) throws ConflictingEditException {
        List<Entry> all = new ArrayList<>();
        for (ReplacementMap map : maps) {
            cancellationToken.throwIfCancellationRequested();
            if (map.tree != tree) {
                throw new IllegalArgumentException("Replacement map belongs to a different snapshot");
            }
            all.addAll(map.entries.values());
        }
        // Sorting by position makes the sweep, and the reported conflict, independent of input order.
        all.sort((a, b) -> Integer.compare(a.original.getIndex(), b.original.getIndex()));

        ReplacementMap result = new ReplacementMap(tree);
        Entry open = null;
        for (Entry entry : all) {
            cancellationToken.throwIfCancellationRequested();
            if (open != null && entry.original.getIndex() < open.original.getSubtreeEnd()) {
                throw new ConflictingEditException(open.original, entry.original);
            }
            result.entries.put(entry.original.getIndex(), entry);
            open = entry;
        }
        return result;
    }

    /**
     * Performs every replacement in one pass and returns the new snapshot. Subtrees without
     * replacements are shared with the old snapshot.
     */
    public SourceTree applyTo(SourceTree target) {
        if (target != tree) {
            throw new IllegalArgumentException("Replacement map belongs to a different snapshot");
        }
        if (entries.isEmpty()) {
            return tree;
        }
        List<GreenElement> root = rewrite(tree.getRoot());
        if (root.size() != 1 || root.get(0).isToken()) {
            throw new IllegalStateException("The root must be replaced by exactly one node");
        }
        return new SourceTree((GreenNode) root.get(0));
    }

    private List<GreenElement> rewrite(SyntaxElement element) {
        Entry entry = entries.get(element.getIndex());
        if (entry != null) {
            return entry.replacements;
        }
        if (element.isToken() || !hasKeyInside(element)) {
            return Collections.singletonList(element.getGreen());
        }
        SyntaxNode node = element.asNode();
        List<GreenElement> children = new ArrayList<>();
        for (SyntaxElement child : node.getChildren()) {
            children.addAll(rewrite(child));
        }
        return Collections.singletonList(node.getGreen().withChildren(children));
    }

    private boolean hasKeyInside(SyntaxElement element) {
        Integer next = entries.higherKey(element.getIndex());
        return next != null && next < element.getSubtreeEnd();
    }

    private ReplacementMap add(SyntaxElement original, List<? extends GreenElement> replacements) {
        if (original.getTree() != tree) {
            throw new IllegalArgumentException(original + " is not part of this snapshot");
        }
        for (GreenElement replacement : replacements) {
            Objects.requireNonNull(replacement, "replacement");
            if (replacement.isToken() != original.isToken()) {
                throw new IllegalArgumentException("Cannot replace " + original.getKind() + " with " + replacement.getKind());
            }
        }
        Map.Entry<Integer, Entry> before = entries.floorEntry(original.getIndex());
        if (before != null && original.getIndex() < before.getValue().original.getSubtreeEnd()) {
            throw new IllegalArgumentException(original + " overlaps " + before.getValue().original);
        }
        if (hasKeyInside(original)) {
            throw new IllegalArgumentException(original + " contains an element that is already replaced");
        }
        entries.put(original.getIndex(), new Entry(original, Collections.unmodifiableList(new ArrayList<>(replacements))));
        return this;
    }

    @Override
    public String toString() {
        return "ReplacementMap" + keys();
    }

    private static final class Entry {
        private final SyntaxElement original;
        private final List<GreenElement> replacements;

        private Entry(SyntaxElement original, List<GreenElement> replacements) {
            this.original = original;
            this.replacements = replacements;
        }
    }
}

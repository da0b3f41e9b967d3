package com.stylefixer.rewrite;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Fixes every diagnostic of one rule in one document as a single transformation.
 *
 * <p>Each diagnostic is fixed independently against the same snapshot, optionally in parallel on
 * the supplied executor. The single fixes are then merged under this coordinator's exclusive
 * ownership and applied once. A coordinator serves exactly one document and is not thread-safe.
 */
public class BatchFixCoordinator {
    private static final Logger logger = LoggerUtil.getLogger(BatchFixCoordinator.class);

    private static final Comparator<Diagnostic> DOCUMENT_ORDER = Comparator
            .comparingInt((Diagnostic d) -> d.getSpan().getStart())
            .thenComparingInt(d -> d.getSpan().getEnd());

    private final SourceTree tree;
    private final CodeFix fix;
    private final IndentationSettings settings;
    private final ExecutorService executor;

    /**
     * @param executor pool for computing single fixes, or {@code null} to compute them on the caller
     */
    public BatchFixCoordinator(SourceTree tree, CodeFix fix, IndentationSettings settings, ExecutorService executor) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.fix = Objects.requireNonNull(fix, "fix");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = executor;
    }

    public SourceTree getTree() {
        return tree;
    }

    /**
     * Computes and merges the fixes for {@code diagnostics}. The result does not depend on the order
     * of the diagnostics. Nothing is applied; see {@link BatchFixResult#apply()}.
     *
     * @throws ConflictingEditException if two single fixes touch the same or nested positions
     * @throws CancellationException if {@code cancellationToken} is cancelled; no partial map is returned
     */
    public BatchFixResult computeBatchFix(Collection<Diagnostic> diagnostics, CancellationToken cancellationToken)
            throws ConflictingEditException {
        List<Diagnostic> ordered = prepare(diagnostics);
        List<Optional<ReplacementMap>> singleFixes = executor == null
                ? computeSequentially(ordered, cancellationToken)
                : computeInParallel(ordered, cancellationToken);

        List<ReplacementMap> maps = new ArrayList<>();
        List<Diagnostic> fixed = new ArrayList<>();
        List<Diagnostic> notApplicable = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            cancellationToken.throwIfCancellationRequested();
            Optional<ReplacementMap> single = singleFixes.get(i);
            if (single.isPresent() && !single.get().isEmpty()) {
                maps.add(single.get());
                fixed.add(ordered.get(i));
            } else {
                notApplicable.add(ordered.get(i));
            }
        }

        ReplacementMap merged = ReplacementMap.union(tree, maps, cancellationToken);
        logger.fine("Merged " + fixed.size() + " " + fix.getRuleId() + " fixes (" + notApplicable.size()
                + " not applicable) into " + merged.size() + " replacements");
        return new BatchFixResult(merged, fixed, notApplicable);
    }

    /**
     * Computes, merges and applies the fixes, returning the new snapshot.
     */
    public SourceTree fixAll(Collection<Diagnostic> diagnostics, CancellationToken cancellationToken)
            throws ConflictingEditException {
        return computeBatchFix(diagnostics, cancellationToken).apply();
    }

    private List<Diagnostic> prepare(Collection<Diagnostic> diagnostics) {
        LinkedHashSet<Diagnostic> unique = new LinkedHashSet<>(diagnostics);
        for (Diagnostic diagnostic : unique) {
            if (!diagnostic.getRuleId().equals(fix.getRuleId())) {
                throw new IllegalArgumentException("Diagnostic " + diagnostic + " does not belong to rule " + fix.getRuleId());
            }
            if (diagnostic.getSpan().getEnd() > tree.getText().length()) {
                throw new IllegalArgumentException("Diagnostic " + diagnostic + " lies outside the document");
            }
        }
        List<Diagnostic> ordered = new ArrayList<>(unique);
        ordered.sort(DOCUMENT_ORDER);
        return ordered;
    }

    private List<Optional<ReplacementMap>> computeSequentially(List<Diagnostic> diagnostics,
                                                               CancellationToken cancellationToken) {
        List<Optional<ReplacementMap>> results = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            cancellationToken.throwIfCancellationRequested();
            results.add(computeSingle(diagnostic));
        }
        return results;
    }

    private List<Optional<ReplacementMap>> computeInParallel(List<Diagnostic> diagnostics,
                                                             CancellationToken cancellationToken) {
        List<Future<Optional<ReplacementMap>>> futures = new ArrayList<>(diagnostics.size());
        try {
            for (Diagnostic diagnostic : diagnostics) {
                cancellationToken.throwIfCancellationRequested();
                futures.add(executor.submit(() -> computeSingle(diagnostic)));
            }

            List<Optional<ReplacementMap>> results = new ArrayList<>(futures.size());
            for (Future<Optional<ReplacementMap>> future : futures) {
                cancellationToken.throwIfCancellationRequested();
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while computing fixes");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Fix computation failed", cause);
        } finally {
            for (Future<Optional<ReplacementMap>> future : futures) {
                future.cancel(true);
            }
        }
    }

    private Optional<ReplacementMap> computeSingle(Diagnostic diagnostic) {
        SyntaxNode target = tree.findNode(diagnostic.getSpan());
        Optional<ReplacementMap> result = fix.computeFix(target, tree.getText(), settings);
        if (result.isPresent() && result.get().getTree() != tree) {
            throw new IllegalStateException("Fix for " + diagnostic + " was computed against another snapshot");
        }
        return result;
    }
}

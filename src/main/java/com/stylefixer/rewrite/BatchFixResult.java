package com.stylefixer.rewrite;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.syntax.SourceTree;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a document-wide fix: the merged replacements plus which diagnostics they cover.
 */
public final class BatchFixResult {
    private final ReplacementMap replacementMap;
    private final List<Diagnostic> fixed;
    private final List<Diagnostic> notApplicable;

    BatchFixResult(ReplacementMap replacementMap, List<Diagnostic> fixed, List<Diagnostic> notApplicable) {
        this.replacementMap = replacementMap;
        this.fixed = Collections.unmodifiableList(fixed);
        this.notApplicable = Collections.unmodifiableList(notApplicable);
    }

    public ReplacementMap getReplacementMap() {
        return replacementMap;
    }

    /**
     * Diagnostics that contributed replacements, in document order.
     */
    public List<Diagnostic> getFixed() {
        return fixed;
    }

    /**
     * Diagnostics whose target had no fixable shape.
     */
    public List<Diagnostic> getNotApplicable() {
        return notApplicable;
    }

    /**
     * Applies the merged replacements; the snapshot they were computed on is returned unchanged
     * when there is nothing to apply.
     */
    public SourceTree apply() {
        return replacementMap.applyTo(replacementMap.getTree());
    }
}

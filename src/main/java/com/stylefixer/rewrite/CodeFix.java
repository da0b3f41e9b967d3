package com.stylefixer.rewrite;

import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Computes the minimal rewrite that resolves one violation.
 *
 * <p>Implementations must be pure: the result depends only on the arguments, so that fixes for
 * independent violations can be computed in parallel and merged. Every element they synthesize is
 * marked formatting-exempt.
 */
public interface CodeFix {

    /**
     * Rule whose violations this fix resolves.
     */
    String getRuleId();

    /**
     * Returns the replacements for {@code violation}, or empty when the node does not have a shape
     * this fix knows how to rewrite.
     */
    Optional<ReplacementMap> computeFix(SyntaxNode violation, SourceText text, IndentationSettings settings);
}

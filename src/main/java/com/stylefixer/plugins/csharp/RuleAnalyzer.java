package com.stylefixer.plugins.csharp;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.syntax.SourceTree;

import java.util.List;

/**
 * Interface for rule analyzers that scan a parsed file for violations of one rule.
 */
public interface RuleAnalyzer {
    String getRuleId();
    List<Diagnostic> analyze(SourceTree tree);
}

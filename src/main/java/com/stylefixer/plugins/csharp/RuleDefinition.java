package com.stylefixer.plugins.csharp;

import com.stylefixer.rewrite.CodeFix;

/**
 * Pairs a rule's analyzer with the fix that resolves its violations.
 */
public class RuleDefinition {
    private final String ruleId;
    private final String title;
    private final RuleAnalyzer analyzer;
    private final CodeFix fix;

    public RuleDefinition(String ruleId, String title, RuleAnalyzer analyzer, CodeFix fix) {
        if (!ruleId.equals(analyzer.getRuleId()) || !ruleId.equals(fix.getRuleId())) {
            throw new IllegalArgumentException("Analyzer and fix must both serve rule " + ruleId);
        }
        this.ruleId = ruleId;
        this.title = title;
        this.analyzer = analyzer;
        this.fix = fix;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getTitle() {
        return title;
    }

    public RuleAnalyzer getAnalyzer() {
        return analyzer;
    }

    public CodeFix getFix() {
        return fix;
    }
}

package com.stylefixer.plugins.csharp.analyzers;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.plugins.csharp.RuleAnalyzer;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * SA1107: a statement starts on the line where the previous statement of the same block ends.
 */
public class MultipleStatementsAnalyzer implements RuleAnalyzer {
    public static final String RULE_ID = "SA1107";
    static final String MESSAGE = "Code should not contain multiple statements on one line";

    @Override
    public String getRuleId() {
        return RULE_ID;
    }

    @Override
    public List<Diagnostic> analyze(SourceTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        SourceText text = tree.getText();

        for (SyntaxNode block : tree.getRoot().getDescendantNodes()) {
            if (!block.isKind(SyntaxKind.BLOCK)) {
                continue;
            }

            SyntaxNode previous = null;
            for (SyntaxNode statement : block.getChildNodes()) {
                if (!statement.getKind().isStatement()) {
                    continue;
                }
                if (previous != null && _startsOnLineWhere(statement, previous, text)) {
                    diagnostics.add(new Diagnostic(RULE_ID, statement.getSpan(), MESSAGE));
                }
                previous = statement;
            }
        }

        return diagnostics;
    }

    private static boolean _startsOnLineWhere(SyntaxNode statement, SyntaxNode previous, SourceText text) {
        int previousEndLine = text.getLineNumber(previous.getSpan().getEnd());
        return statement.getFirstToken().getLine() == previousEndLine;
    }
}

package com.stylefixer.plugins.csharp.analyzers;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.plugins.csharp.RuleAnalyzer;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * SA1132: one field or event declaration introduces several variables. Local declarations inside
 * blocks are included when {@code includeLocals} is set.
 */
public class CombinedDeclarationAnalyzer implements RuleAnalyzer {
    public static final String RULE_ID = "SA1132";
    static final String MESSAGE = "Each field should be declared on its own line";

    private final boolean includeLocals;

    public CombinedDeclarationAnalyzer(boolean includeLocals) {
        this.includeLocals = includeLocals;
    }

    @Override
    public String getRuleId() {
        return RULE_ID;
    }

    @Override
    public List<Diagnostic> analyze(SourceTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (SyntaxNode node : tree.getRoot().getDescendantNodes()) {
            if (!_isCandidate(node)) {
                continue;
            }
            SyntaxNode declaration = node.getChildNode(SyntaxKind.VARIABLE_DECLARATION);
            if (declaration != null && _countDeclarators(declaration) > 1) {
                diagnostics.add(new Diagnostic(RULE_ID, node.getSpan(), MESSAGE));
            }
        }

        return diagnostics;
    }

    private boolean _isCandidate(SyntaxNode node) {
        switch (node.getKind()) {
            case FIELD_DECLARATION:
            case EVENT_FIELD_DECLARATION:
                return true;
            case LOCAL_DECLARATION_STATEMENT:
                return includeLocals && node.getParent().isKind(SyntaxKind.BLOCK);
            default:
                return false;
        }
    }

    private static int _countDeclarators(SyntaxNode declaration) {
        int count = 0;
        for (SyntaxNode child : declaration.getChildNodes()) {
            if (child.isKind(SyntaxKind.VARIABLE_DECLARATOR)) {
                count++;
            }
        }
        return count;
    }
}

package com.stylefixer.plugins.csharp.fixes;

import com.stylefixer.plugins.csharp.analyzers.MultipleStatementsAnalyzer;
import com.stylefixer.rewrite.CodeFix;
import com.stylefixer.rewrite.EndOfLineInference;
import com.stylefixer.rewrite.Formatting;
import com.stylefixer.rewrite.IndentationCalculator;
import com.stylefixer.rewrite.IndentationSettings;
import com.stylefixer.rewrite.ReplacementMap;
import com.stylefixer.syntax.GreenToken;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaList;

import java.util.Optional;

/**
 * Moves a statement that shares a line with the previous statement of its block onto a line of its
 * own.
 *
 * <p>The token before the statement loses its trailing whitespace and gains a line break; the
 * statement's first token gets the indentation of the line it is moved off, computed from the first
 * token on that line. Only these two tokens change.
 */
public class StatementSeparatorFixer implements CodeFix {

    @Override
    public String getRuleId() {
        return MultipleStatementsAnalyzer.RULE_ID;
    }

    @Override
    public Optional<ReplacementMap> computeFix(SyntaxNode violation, SourceText text, IndentationSettings settings) {
        SyntaxNode block = violation.getParent();
        if (block == null || !block.isKind(SyntaxKind.BLOCK) || !_hasPreviousStatement(block, violation)) {
            return Optional.empty();
        }

        SyntaxToken firstToken = violation.getFirstToken();
        if (firstToken == null || firstToken.isFirstOnLine()) {
            return Optional.empty();
        }
        SyntaxToken previousToken = firstToken.getPreviousToken();
        if (previousToken == null) {
            return Optional.empty();
        }

        SyntaxTrivia endOfLine = EndOfLineInference.inferEndOfLine(firstToken, text, settings);
        TriviaList indentation = IndentationCalculator.indentationFor(
                IndentationCalculator.firstTokenOnLine(firstToken), settings);

        GreenToken newPrevious = previousToken.getGreen()
                .withTrailingTrivia(previousToken.getTrailingTrivia().withoutTrailingWhitespace().add(endOfLine));
        GreenToken newFirst = firstToken.getGreen()
                .withLeadingTrivia(indentation.addAll(firstToken.getLeadingTrivia().withoutLeadingWhitespace()));

        ReplacementMap replacements = new ReplacementMap(violation.getTree())
                .put(previousToken, Formatting.withoutFormatting(newPrevious))
                .put(firstToken, Formatting.withoutFormatting(newFirst));
        return Optional.of(replacements);
    }

    private static boolean _hasPreviousStatement(SyntaxNode block, SyntaxNode statement) {
        for (SyntaxNode child : block.getChildNodes()) {
            if (child.equals(statement)) {
                return false;
            }
            if (child.getKind().isStatement()) {
                return true;
            }
        }
        return false;
    }
}

package com.stylefixer.plugins.csharp.fixes;

import com.stylefixer.plugins.csharp.analyzers.CombinedDeclarationAnalyzer;
import com.stylefixer.rewrite.CodeFix;
import com.stylefixer.rewrite.EndOfLineInference;
import com.stylefixer.rewrite.Formatting;
import com.stylefixer.rewrite.IndentationCalculator;
import com.stylefixer.rewrite.IndentationSettings;
import com.stylefixer.rewrite.ReplacementMap;
import com.stylefixer.rewrite.TriviaClassifier;
import com.stylefixer.syntax.GreenElement;
import com.stylefixer.syntax.GreenNode;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxElement;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a declaration of several variables into one declaration per variable.
 *
 * <p>Every new declaration repeats the modifiers and the type. The first keeps the original leading
 * trivia. Each later one takes that trivia without directives and leading blank lines, gets a blank
 * line first when it opens with a comment, and is re-indented for its depth. A declaration ends with
 * the trivia that followed its comma, or with a line break; the last one ends with the trivia that
 * followed the original semicolon.
 */
public class DeclarationSplitter implements CodeFix {

    @Override
    public String getRuleId() {
        return CombinedDeclarationAnalyzer.RULE_ID;
    }

    @Override
    public Optional<ReplacementMap> computeFix(SyntaxNode violation, SourceText text, IndentationSettings settings) {
        if (!_isSplittable(violation)) {
            return Optional.empty();
        }
        SyntaxNode declaration = violation.getChildNode(SyntaxKind.VARIABLE_DECLARATION);
        SyntaxToken firstToken = violation.getFirstToken();
        if (declaration == null || firstToken == null) {
            return Optional.empty();
        }

        List<SyntaxElement> parts = declaration.getChildren();
        if (parts.size() < 4 || parts.get(0).getKind().getCategory() != SyntaxKind.Category.TYPE) {
            return Optional.empty();
        }

        GreenNode greenDeclaration = violation.getGreen();
        int declarationSlot = violation.indexOfChild(declaration);
        GreenElement type = parts.get(0).getGreen();
        SyntaxTrivia leadingEndOfLine = EndOfLineInference.inferEndOfLine(firstToken, text, settings);
        TriviaList indentation = IndentationCalculator.indentationFor(firstToken, settings);

        List<GreenNode> split = new ArrayList<>();
        GreenNode pending = null;
        for (int i = 1; i < parts.size(); i++) {
            SyntaxElement part = parts.get(i);
            if (pending == null) {
                if (!part.isKind(SyntaxKind.VARIABLE_DECLARATOR)) {
                    return Optional.empty();
                }
                GreenNode declarator = part.asNode().getGreen();
                declarator = declarator.withLeadingTrivia(declarator.getLeadingTrivia().withoutLeadingWhitespace());
                GreenNode variables = declaration.getGreen().withChildren(List.of(type, declarator));
                pending = greenDeclaration.replaceChild(declarationSlot, variables);
                if (!split.isEmpty()) {
                    pending = pending.withLeadingTrivia(
                            _followingLeadingTrivia(pending.getLeadingTrivia(), leadingEndOfLine, indentation));
                }
            } else {
                if (!part.isKind(SyntaxKind.COMMA)) {
                    return Optional.empty();
                }
                split.add(pending.withTrailingTrivia(_separatorTrivia(part.asToken(), text, settings)));
                pending = null;
            }
        }
        if (pending == null) {
            return Optional.empty();
        }
        split.add(pending.withTrailingTrivia(violation.getTrailingTrivia()));

        List<GreenNode> replacements = new ArrayList<>(split.size());
        for (GreenNode node : split) {
            replacements.add(Formatting.withoutFormatting(node));
        }
        return Optional.of(new ReplacementMap(violation.getTree()).put(violation, replacements));
    }

    private static boolean _isSplittable(SyntaxNode node) {
        switch (node.getKind()) {
            case FIELD_DECLARATION:
            case EVENT_FIELD_DECLARATION:
                return true;
            case LOCAL_DECLARATION_STATEMENT:
                return node.getParent() != null && node.getParent().isKind(SyntaxKind.BLOCK);
            default:
                return false;
        }
    }

    private static TriviaList _followingLeadingTrivia(TriviaList original, SyntaxTrivia endOfLine,
                                                      TriviaList indentation) {
        TriviaList trivia = original.withoutStructuredTrivia();

        int firstNonBlankLine = TriviaClassifier.indexOfFirstNonBlankLine(trivia);
        if (firstNonBlankLine > 0) {
            trivia = trivia.removeRange(0, firstNonBlankLine);
        }

        int firstNonWhitespace = TriviaClassifier.indexOfFirstNonWhitespace(trivia, false);
        if (firstNonWhitespace >= 0 && TriviaClassifier.isComment(trivia.get(firstNonWhitespace))) {
            trivia = trivia.insert(0, endOfLine);
        }

        // Re-indent the line the declaration itself starts on.
        int lineStart = TriviaClassifier.lastIndexOfEndOfLine(trivia) + 1;
        TriviaList lastLine = trivia.subList(lineStart, trivia.size()).withoutLeadingWhitespace();
        return trivia.subList(0, lineStart).addAll(indentation).addAll(lastLine);
    }

    private static TriviaList _separatorTrivia(SyntaxToken comma, SourceText text, IndentationSettings settings) {
        SyntaxTrivia endOfLine = EndOfLineInference.inferEndOfLine(comma, text, settings);
        TriviaList trailing = comma.getTrailingTrivia();
        if (trailing.isEmpty()) {
            return TriviaList.of(endOfLine);
        }
        if (!TriviaClassifier.isEndOfLine(trailing.last())) {
            return trailing.withoutTrailingWhitespace().add(endOfLine);
        }
        return trailing;
    }
}

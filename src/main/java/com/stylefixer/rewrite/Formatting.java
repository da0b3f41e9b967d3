package com.stylefixer.rewrite;

import com.stylefixer.syntax.GreenElement;
import com.stylefixer.syntax.GreenNode;
import com.stylefixer.syntax.GreenToken;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaList;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks synthesized syntax so that a later formatting pass leaves it as written.
 */
public final class Formatting {

    private Formatting() {
    }

    /**
     * Returns a copy of {@code element} in which the element, every descendant and every piece of
     * trivia (structured trivia included) is formatting-exempt.
     */
    @SuppressWarnings("unchecked")
    public static <T extends GreenElement> T withoutFormatting(T element) {
        if (element instanceof GreenToken) {
            GreenToken token = (GreenToken) element;
            return (T) token.withLeadingTrivia(withoutFormatting(token.getLeadingTrivia()))
                    .withTrailingTrivia(withoutFormatting(token.getTrailingTrivia()))
                    .withFormattingExempt(true);
        }
        GreenNode node = (GreenNode) element;
        List<GreenElement> children = new ArrayList<>(node.getChildCount());
        for (GreenElement child : node.getChildren()) {
            children.add(withoutFormatting(child));
        }
        return (T) new GreenNode(node.getKind(), children, true);
    }

    public static TriviaList withoutFormatting(TriviaList trivia) {
        List<SyntaxTrivia> marked = new ArrayList<>(trivia.size());
        for (SyntaxTrivia item : trivia) {
            marked.add(withoutFormatting(item));
        }
        return TriviaList.of(marked);
    }

    public static SyntaxTrivia withoutFormatting(SyntaxTrivia trivia) {
        SyntaxTrivia result = trivia;
        if (trivia.hasStructure()) {
            result = result.withStructure(withoutFormatting(trivia.getStructure()));
        }
        return result.withFormattingExempt(true);
    }
}

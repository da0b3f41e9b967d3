package com.stylefixer.plugins.csharp.parser;

import com.stylefixer.syntax.GreenNode;
import com.stylefixer.syntax.GreenToken;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaKind;
import com.stylefixer.syntax.TriviaList;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits C# source into green tokens with their trivia attached.
 *
 * <p>Trailing trivia of a token runs up to and including the first line break on the same line;
 * everything after that is leading trivia of the next token. A {@code #} that starts a line opens a
 * directive, kept as structured trivia. Characters that start no token are kept as skipped trivia,
 * so concatenating all tokens reproduces the input exactly. Contextual keywords are returned as
 * identifiers; the parser reclassifies them.
 */
public class CSharpLexer {
    private final String text;
    private final SourceText sourceText;
    private int position;

    public CSharpLexer(String text) {
        this.text = text;
        this.sourceText = SourceText.from(text);
    }

    /**
     * Lexes the whole input. The last token is always {@link SyntaxKind#END_OF_FILE}.
     */
    public List<GreenToken> tokenize() {
        List<GreenToken> tokens = new ArrayList<>();
        while (true) {
            TriviaList leading = scanLeadingTrivia();
            if (position >= text.length()) {
                tokens.add(new GreenToken(SyntaxKind.END_OF_FILE, "", leading, TriviaList.EMPTY));
                return tokens;
            }
            int start = position;
            SyntaxKind kind = scanToken();
            String tokenText = text.substring(start, position);
            TriviaList trailing = scanTrailingTrivia();
            tokens.add(new GreenToken(kind, tokenText, leading, trailing));
        }
    }

    private TriviaList scanLeadingTrivia() {
        List<SyntaxTrivia> trivia = new ArrayList<>();
        while (position < text.length()) {
            char c = text.charAt(position);
            if (isWhitespace(c)) {
                trivia.add(scanWhitespace());
            } else if (SourceText.isLineBreak(c)) {
                trivia.add(scanEndOfLine());
            } else if (c == '/' && peek(1) == '/') {
                trivia.add(scanSingleLineComment());
            } else if (c == '/' && peek(1) == '*') {
                trivia.add(scanMultiLineComment());
            } else if (c == '#' && isAtLineStart()) {
                trivia.add(scanDirective());
            } else if (!startsToken(c)) {
                trivia.add(SyntaxTrivia.create(TriviaKind.OTHER, String.valueOf(c)));
                position++;
            } else {
                break;
            }
        }
        return TriviaList.of(trivia);
    }

    private TriviaList scanTrailingTrivia() {
        List<SyntaxTrivia> trivia = new ArrayList<>();
        while (position < text.length()) {
            char c = text.charAt(position);
            if (isWhitespace(c)) {
                trivia.add(scanWhitespace());
            } else if (SourceText.isLineBreak(c)) {
                trivia.add(scanEndOfLine());
                break;
            } else if (c == '/' && peek(1) == '/') {
                trivia.add(scanSingleLineComment());
            } else if (c == '/' && peek(1) == '*') {
                trivia.add(scanMultiLineComment());
            } else {
                break;
            }
        }
        return TriviaList.of(trivia);
    }

    private SyntaxTrivia scanWhitespace() {
        int start = position;
        while (position < text.length() && isWhitespace(text.charAt(position))) {
            position++;
        }
        return SyntaxTrivia.whitespace(text.substring(start, position));
    }

    private SyntaxTrivia scanEndOfLine() {
        if (text.charAt(position) == '\r' && peek(1) == '\n') {
            position += 2;
            return SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED;
        }
        char c = text.charAt(position++);
        return c == '\n' ? SyntaxTrivia.LINE_FEED : SyntaxTrivia.endOfLine(String.valueOf(c));
    }

    private SyntaxTrivia scanSingleLineComment() {
        int start = position;
        while (position < text.length() && !SourceText.isLineBreak(text.charAt(position))) {
            position++;
        }
        return SyntaxTrivia.create(TriviaKind.SINGLE_LINE_COMMENT, text.substring(start, position));
    }

    private SyntaxTrivia scanMultiLineComment() {
        int start = position;
        int end = text.indexOf("*/", position + 2);
        position = end < 0 ? text.length() : end + 2;
        return SyntaxTrivia.create(TriviaKind.MULTI_LINE_COMMENT, text.substring(start, position));
    }

    /**
     * Reads {@code #name rest-of-line} plus its line break into a directive node.
     */
    private SyntaxTrivia scanDirective() {
        position++;
        GreenToken hash = GreenToken.of(SyntaxKind.HASH);
        int start = position;
        while (position < text.length() && !SourceText.isLineBreak(text.charAt(position))) {
            position++;
        }
        String message = text.substring(start, position);
        TriviaList trailing = position < text.length() ? TriviaList.of(scanEndOfLine()) : TriviaList.EMPTY;
        GreenToken body = new GreenToken(SyntaxKind.PREPROCESSING_MESSAGE, message, TriviaList.EMPTY, trailing);
        return SyntaxTrivia.structured(new GreenNode(SyntaxKind.DIRECTIVE_TRIVIA, List.of(hash, body)));
    }

    private SyntaxKind scanToken() {
        char c = text.charAt(position);
        if (c == '@' && peek(1) == '"') {
            position++;
            scanVerbatimString();
            return SyntaxKind.STRING_LITERAL;
        }
        if (c == '$' && peek(1) == '"') {
            position++;
            scanString('"');
            return SyntaxKind.STRING_LITERAL;
        }
        if (c == '"') {
            scanString('"');
            return SyntaxKind.STRING_LITERAL;
        }
        if (c == '\'') {
            scanString('\'');
            return SyntaxKind.CHARACTER_LITERAL;
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            scanNumber();
            return SyntaxKind.NUMERIC_LITERAL;
        }
        if (isIdentifierStart(c) || (c == '@' && isIdentifierStart(peek(1)))) {
            int start = position;
            position++;
            while (position < text.length() && isIdentifierPart(text.charAt(position))) {
                position++;
            }
            SyntaxKind keyword = SyntaxKind.keyword(text.substring(start, position));
            return keyword != null ? keyword : SyntaxKind.IDENTIFIER;
        }
        if (position + 1 < text.length()) {
            SyntaxKind pair = SyntaxKind.punctuation(text.substring(position, position + 2));
            if (pair != null) {
                position += 2;
                return pair;
            }
        }
        SyntaxKind single = SyntaxKind.punctuation(String.valueOf(c));
        if (single == null) {
            throw error("Unexpected character '" + c + "'", position);
        }
        position++;
        return single;
    }

    private void scanString(char quote) {
        int start = position;
        position++;
        while (position < text.length()) {
            char c = text.charAt(position);
            if (c == '\\') {
                position += 2;
            } else if (c == quote) {
                position++;
                return;
            } else if (SourceText.isLineBreak(c)) {
                break;
            } else {
                position++;
            }
        }
        throw error("Unterminated literal", start);
    }

    private void scanVerbatimString() {
        int start = position;
        position++;
        while (position < text.length()) {
            if (text.charAt(position) == '"') {
                if (peek(1) == '"') {
                    position += 2;
                    continue;
                }
                position++;
                return;
            }
            position++;
        }
        throw error("Unterminated verbatim string", start);
    }

    private void scanNumber() {
        while (position < text.length()) {
            char c = text.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || (c == '.' && Character.isDigit(peek(1)))) {
                position++;
            } else {
                break;
            }
        }
    }

    private boolean isAtLineStart() {
        for (int i = position - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (SourceText.isLineBreak(c)) {
                return true;
            }
            if (!isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private boolean startsToken(char c) {
        if (c == '"' || c == '\'' || Character.isDigit(c) || isIdentifierStart(c)) {
            return true;
        }
        if (c == '@' && (peek(1) == '"' || isIdentifierStart(peek(1)))) {
            return true;
        }
        if (c == '$' && peek(1) == '"') {
            return true;
        }
        return SyntaxKind.punctuation(String.valueOf(c)) != null && c != '#';
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private SyntaxException error(String message, int offset) {
        int line = sourceText.getLineNumber(offset);
        return new SyntaxException(message, line + 1, sourceText.getColumn(offset) + 1);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\u00A0' || c == '\uFEFF';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}

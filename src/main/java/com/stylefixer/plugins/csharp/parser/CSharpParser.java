package com.stylefixer.plugins.csharp.parser;

import com.stylefixer.syntax.GreenElement;
import com.stylefixer.syntax.GreenNode;
import com.stylefixer.syntax.GreenToken;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported C# subset.
 *
 * <p>Produces a lossless tree: every character of the input, trivia included, is kept in a token
 * of the result. The first construct the parser cannot read raises a {@link SyntaxException}.
 */
public class CSharpParser {
    private static final Set<SyntaxKind> ASSIGNMENT_OPERATORS = EnumSet.of(
            SyntaxKind.EQUALS, SyntaxKind.PLUS_EQUALS, SyntaxKind.MINUS_EQUALS,
            SyntaxKind.ASTERISK_EQUALS, SyntaxKind.SLASH_EQUALS);

    private static final Set<SyntaxKind> PREFIX_OPERATORS = EnumSet.of(
            SyntaxKind.EXCLAMATION, SyntaxKind.MINUS, SyntaxKind.PLUS, SyntaxKind.TILDE,
            SyntaxKind.PLUS_PLUS, SyntaxKind.MINUS_MINUS);

    /** Binary operators from the loosest to the tightest binding level. */
    private static final List<Set<SyntaxKind>> BINARY_LEVELS = List.of(
            EnumSet.of(SyntaxKind.QUESTION_QUESTION),
            EnumSet.of(SyntaxKind.BAR_BAR),
            EnumSet.of(SyntaxKind.AMPERSAND_AMPERSAND),
            EnumSet.of(SyntaxKind.BAR),
            EnumSet.of(SyntaxKind.CARET),
            EnumSet.of(SyntaxKind.AMPERSAND),
            EnumSet.of(SyntaxKind.EQUALS_EQUALS, SyntaxKind.EXCLAMATION_EQUALS),
            EnumSet.of(SyntaxKind.LESS, SyntaxKind.GREATER, SyntaxKind.LESS_EQUALS, SyntaxKind.GREATER_EQUALS),
            EnumSet.of(SyntaxKind.PLUS, SyntaxKind.MINUS),
            EnumSet.of(SyntaxKind.ASTERISK, SyntaxKind.SLASH, SyntaxKind.PERCENT));

    private final List<GreenToken> tokens;
    private final int[] tokenStarts;
    private final SourceText sourceText;
    private int position;

    public CSharpParser(String text) {
        this.sourceText = SourceText.from(text);
        this.tokens = new CSharpLexer(text).tokenize();
        this.tokenStarts = new int[tokens.size()];
        int offset = 0;
        for (int i = 0; i < tokens.size(); i++) {
            GreenToken token = tokens.get(i);
            tokenStarts[i] = offset + token.getLeadingTrivia().getFullWidth();
            offset += token.getFullWidth();
        }
    }

    /**
     * Parses {@code text} into a new snapshot.
     */
    public static SourceTree parse(String text) {
        return new SourceTree(new CSharpParser(text).parseCompilationUnit());
    }

    public GreenNode parseCompilationUnit() {
        List<GreenElement> children = new ArrayList<>();
        while (at(SyntaxKind.USING_KEYWORD)) {
            children.add(parseUsingDirective());
        }
        while (!at(SyntaxKind.END_OF_FILE)) {
            children.add(parseMemberDeclaration());
        }
        children.add(eat(SyntaxKind.END_OF_FILE));
        return new GreenNode(SyntaxKind.COMPILATION_UNIT, children);
    }

    // Declarations

    private GreenNode parseUsingDirective() {
        return node(SyntaxKind.USING_DIRECTIVE, eat(SyntaxKind.USING_KEYWORD), parseName(), eat(SyntaxKind.SEMICOLON));
    }

    private GreenNode parseMemberDeclaration() {
        if (at(SyntaxKind.NAMESPACE_KEYWORD)) {
            return parseNamespaceDeclaration();
        }

        List<GreenElement> children = new ArrayList<>();
        while (currentKind().isModifier()) {
            children.add(advance());
        }

        switch (currentKind()) {
            case CLASS_KEYWORD:
                return parseTypeDeclaration(SyntaxKind.CLASS_DECLARATION, children);
            case STRUCT_KEYWORD:
                return parseTypeDeclaration(SyntaxKind.STRUCT_DECLARATION, children);
            case INTERFACE_KEYWORD:
                return parseTypeDeclaration(SyntaxKind.INTERFACE_DECLARATION, children);
            case EVENT_KEYWORD:
                children.add(advance());
                children.add(parseVariableDeclaration());
                children.add(eat(SyntaxKind.SEMICOLON));
                return new GreenNode(SyntaxKind.EVENT_FIELD_DECLARATION, children);
            default:
                break;
        }

        if (at(SyntaxKind.IDENTIFIER) && peekKind(1) == SyntaxKind.OPEN_PAREN) {
            children.add(advance());
            children.add(parseParameterList(false));
            parseMemberBody(children);
            return new GreenNode(SyntaxKind.CONSTRUCTOR_DECLARATION, children);
        }

        GreenNode type = parseType();
        GreenToken name = eat(SyntaxKind.IDENTIFIER);
        switch (currentKind()) {
            case OPEN_PAREN:
            case LESS:
                children.add(type);
                children.add(name);
                if (at(SyntaxKind.LESS)) {
                    children.add(parseTypeArgumentList());
                }
                children.add(parseParameterList(false));
                parseMemberBody(children);
                return new GreenNode(SyntaxKind.METHOD_DECLARATION, children);
            case OPEN_BRACE:
                children.add(type);
                children.add(name);
                children.add(parseAccessorList());
                if (at(SyntaxKind.EQUALS)) {
                    children.add(parseEqualsValueClause());
                    children.add(eat(SyntaxKind.SEMICOLON));
                }
                return new GreenNode(SyntaxKind.PROPERTY_DECLARATION, children);
            case EQUALS_GREATER:
                children.add(type);
                children.add(name);
                children.add(parseArrowExpressionClause());
                children.add(eat(SyntaxKind.SEMICOLON));
                return new GreenNode(SyntaxKind.PROPERTY_DECLARATION, children);
            default:
                children.add(parseVariableDeclarators(type, name));
                children.add(eat(SyntaxKind.SEMICOLON));
                return new GreenNode(SyntaxKind.FIELD_DECLARATION, children);
        }
    }

    private GreenNode parseNamespaceDeclaration() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.NAMESPACE_KEYWORD));
        children.add(parseName());
        children.add(eat(SyntaxKind.OPEN_BRACE));
        while (at(SyntaxKind.USING_KEYWORD)) {
            children.add(parseUsingDirective());
        }
        while (!at(SyntaxKind.CLOSE_BRACE)) {
            expectNotEndOfFile("}");
            children.add(parseMemberDeclaration());
        }
        children.add(eat(SyntaxKind.CLOSE_BRACE));
        return new GreenNode(SyntaxKind.NAMESPACE_DECLARATION, children);
    }

    private GreenNode parseTypeDeclaration(SyntaxKind kind, List<GreenElement> children) {
        children.add(advance());
        children.add(eat(SyntaxKind.IDENTIFIER));
        if (at(SyntaxKind.LESS)) {
            children.add(parseTypeArgumentList());
        }
        if (at(SyntaxKind.COLON)) {
            List<GreenElement> bases = new ArrayList<>();
            bases.add(advance());
            bases.add(parseType());
            while (at(SyntaxKind.COMMA)) {
                bases.add(advance());
                bases.add(parseType());
            }
            children.add(new GreenNode(SyntaxKind.BASE_LIST, bases));
        }
        children.add(eat(SyntaxKind.OPEN_BRACE));
        while (!at(SyntaxKind.CLOSE_BRACE)) {
            expectNotEndOfFile("}");
            children.add(parseMemberDeclaration());
        }
        children.add(eat(SyntaxKind.CLOSE_BRACE));
        if (at(SyntaxKind.SEMICOLON)) {
            children.add(advance());
        }
        return new GreenNode(kind, children);
    }

    /**
     * Adds a block body, an expression body with its semicolon, or a bare semicolon.
     */
    private void parseMemberBody(List<GreenElement> children) {
        if (at(SyntaxKind.OPEN_BRACE)) {
            children.add(parseBlock());
        } else if (at(SyntaxKind.EQUALS_GREATER)) {
            children.add(parseArrowExpressionClause());
            children.add(eat(SyntaxKind.SEMICOLON));
        } else {
            children.add(eat(SyntaxKind.SEMICOLON));
        }
    }

    private GreenNode parseAccessorList() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.OPEN_BRACE));
        while (!at(SyntaxKind.CLOSE_BRACE)) {
            List<GreenElement> accessor = new ArrayList<>();
            while (currentKind().isModifier()) {
                accessor.add(advance());
            }
            if (isContextual(SyntaxKind.GET_KEYWORD, 0)) {
                accessor.add(eatContextual(SyntaxKind.GET_KEYWORD));
            } else {
                accessor.add(eatContextual(SyntaxKind.SET_KEYWORD));
            }
            parseMemberBody(accessor);
            children.add(new GreenNode(SyntaxKind.ACCESSOR_DECLARATION, accessor));
        }
        children.add(eat(SyntaxKind.CLOSE_BRACE));
        return new GreenNode(SyntaxKind.ACCESSOR_LIST, children);
    }

    private GreenNode parseArrowExpressionClause() {
        return node(SyntaxKind.ARROW_EXPRESSION_CLAUSE, eat(SyntaxKind.EQUALS_GREATER), parseExpression());
    }

    private GreenNode parseParameterList(boolean allowImplicitTypes) {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.OPEN_PAREN));
        if (!at(SyntaxKind.CLOSE_PAREN)) {
            children.add(parseParameter(allowImplicitTypes));
            while (at(SyntaxKind.COMMA)) {
                children.add(advance());
                children.add(parseParameter(allowImplicitTypes));
            }
        }
        children.add(eat(SyntaxKind.CLOSE_PAREN));
        return new GreenNode(SyntaxKind.PARAMETER_LIST, children);
    }

    private GreenNode parseParameter(boolean allowImplicitType) {
        if (allowImplicitType && at(SyntaxKind.IDENTIFIER)
                && (peekKind(1) == SyntaxKind.COMMA || peekKind(1) == SyntaxKind.CLOSE_PAREN)) {
            return node(SyntaxKind.PARAMETER, advance());
        }
        List<GreenElement> children = new ArrayList<>();
        if (at(SyntaxKind.THIS_KEYWORD)) {
            children.add(advance());
        }
        children.add(parseType());
        children.add(eat(SyntaxKind.IDENTIFIER));
        if (at(SyntaxKind.EQUALS)) {
            children.add(parseEqualsValueClause());
        }
        return new GreenNode(SyntaxKind.PARAMETER, children);
    }

    private GreenNode parseVariableDeclaration() {
        GreenNode type = parseType();
        return parseVariableDeclarators(type, eat(SyntaxKind.IDENTIFIER));
    }

    /**
     * Parses the declarators of a declaration whose type and first name are already consumed.
     */
    private GreenNode parseVariableDeclarators(GreenNode type, GreenToken firstName) {
        List<GreenElement> children = new ArrayList<>();
        children.add(type);
        children.add(parseVariableDeclarator(firstName));
        while (at(SyntaxKind.COMMA)) {
            children.add(advance());
            children.add(parseVariableDeclarator(eat(SyntaxKind.IDENTIFIER)));
        }
        return new GreenNode(SyntaxKind.VARIABLE_DECLARATION, children);
    }

    private GreenNode parseVariableDeclarator(GreenToken name) {
        if (at(SyntaxKind.EQUALS)) {
            return node(SyntaxKind.VARIABLE_DECLARATOR, name, parseEqualsValueClause());
        }
        return node(SyntaxKind.VARIABLE_DECLARATOR, name);
    }

    private GreenNode parseEqualsValueClause() {
        return node(SyntaxKind.EQUALS_VALUE_CLAUSE, eat(SyntaxKind.EQUALS), parseExpression());
    }

    // Types and names

    private GreenNode parseType() {
        GreenNode type;
        if (currentKind().isPredefinedType()) {
            type = node(SyntaxKind.PREDEFINED_TYPE, advance());
        } else if (at(SyntaxKind.IDENTIFIER)) {
            type = parseName();
        } else {
            throw error("Expected a type but found '" + current().getText() + "'");
        }
        if (at(SyntaxKind.QUESTION)) {
            type = node(SyntaxKind.NULLABLE_TYPE, type, advance());
        }
        while (at(SyntaxKind.OPEN_BRACKET) && peekKind(1) == SyntaxKind.CLOSE_BRACKET) {
            type = node(SyntaxKind.ARRAY_TYPE, type, node(SyntaxKind.ARRAY_RANK_SPECIFIER, advance(), advance()));
        }
        return type;
    }

    private GreenNode parseName() {
        GreenNode name = parseSimpleName();
        while (at(SyntaxKind.DOT) && peekKind(1) == SyntaxKind.IDENTIFIER) {
            name = node(SyntaxKind.QUALIFIED_NAME, name, advance(), parseSimpleName());
        }
        return name;
    }

    private GreenNode parseSimpleName() {
        GreenToken identifier = eat(SyntaxKind.IDENTIFIER);
        if (at(SyntaxKind.LESS)) {
            int saved = position;
            try {
                return node(SyntaxKind.GENERIC_NAME, identifier, parseTypeArgumentList());
            } catch (SyntaxException e) {
                // Not a type argument list; '<' is a comparison.
                position = saved;
            }
        }
        return node(SyntaxKind.IDENTIFIER_NAME, identifier);
    }

    private GreenNode parseTypeArgumentList() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.LESS));
        children.add(parseType());
        while (at(SyntaxKind.COMMA)) {
            children.add(advance());
            children.add(parseType());
        }
        children.add(eat(SyntaxKind.GREATER));
        return new GreenNode(SyntaxKind.TYPE_ARGUMENT_LIST, children);
    }

    // Statements

    private GreenNode parseBlock() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.OPEN_BRACE));
        while (!at(SyntaxKind.CLOSE_BRACE)) {
            expectNotEndOfFile("}");
            children.add(parseStatement());
        }
        children.add(eat(SyntaxKind.CLOSE_BRACE));
        return new GreenNode(SyntaxKind.BLOCK, children);
    }

    private GreenNode parseStatement() {
        switch (currentKind()) {
            case OPEN_BRACE:
                return parseBlock();
            case SEMICOLON:
                return node(SyntaxKind.EMPTY_STATEMENT, advance());
            case IF_KEYWORD:
                return parseIfStatement();
            case WHILE_KEYWORD:
                return node(SyntaxKind.WHILE_STATEMENT, advance(), eat(SyntaxKind.OPEN_PAREN), parseExpression(),
                        eat(SyntaxKind.CLOSE_PAREN), parseStatement());
            case FOR_KEYWORD:
                return parseForStatement();
            case FOREACH_KEYWORD:
                return node(SyntaxKind.FOREACH_STATEMENT, advance(), eat(SyntaxKind.OPEN_PAREN), parseType(),
                        eat(SyntaxKind.IDENTIFIER), eat(SyntaxKind.IN_KEYWORD), parseExpression(),
                        eat(SyntaxKind.CLOSE_PAREN), parseStatement());
            case RETURN_KEYWORD: {
                GreenToken keyword = advance();
                GreenNode value = at(SyntaxKind.SEMICOLON) ? null : parseExpression();
                return node(SyntaxKind.RETURN_STATEMENT, keyword, value, eat(SyntaxKind.SEMICOLON));
            }
            case BREAK_KEYWORD:
                return node(SyntaxKind.BREAK_STATEMENT, advance(), eat(SyntaxKind.SEMICOLON));
            case CONTINUE_KEYWORD:
                return node(SyntaxKind.CONTINUE_STATEMENT, advance(), eat(SyntaxKind.SEMICOLON));
            case CONST_KEYWORD:
                return node(SyntaxKind.LOCAL_DECLARATION_STATEMENT, advance(), parseVariableDeclaration(),
                        eat(SyntaxKind.SEMICOLON));
            default:
                if (isLocalDeclarationStart()) {
                    return node(SyntaxKind.LOCAL_DECLARATION_STATEMENT, parseVariableDeclaration(),
                            eat(SyntaxKind.SEMICOLON));
                }
                return node(SyntaxKind.EXPRESSION_STATEMENT, parseExpression(), eat(SyntaxKind.SEMICOLON));
        }
    }

    private GreenNode parseIfStatement() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.IF_KEYWORD));
        children.add(eat(SyntaxKind.OPEN_PAREN));
        children.add(parseExpression());
        children.add(eat(SyntaxKind.CLOSE_PAREN));
        children.add(parseStatement());
        if (at(SyntaxKind.ELSE_KEYWORD)) {
            children.add(node(SyntaxKind.ELSE_CLAUSE, advance(), parseStatement()));
        }
        return new GreenNode(SyntaxKind.IF_STATEMENT, children);
    }

    private GreenNode parseForStatement() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(SyntaxKind.FOR_KEYWORD));
        children.add(eat(SyntaxKind.OPEN_PAREN));
        if (isLocalDeclarationStart()) {
            children.add(parseVariableDeclaration());
        } else if (!at(SyntaxKind.SEMICOLON)) {
            parseExpressionList(children);
        }
        children.add(eat(SyntaxKind.SEMICOLON));
        if (!at(SyntaxKind.SEMICOLON)) {
            children.add(parseExpression());
        }
        children.add(eat(SyntaxKind.SEMICOLON));
        if (!at(SyntaxKind.CLOSE_PAREN)) {
            parseExpressionList(children);
        }
        children.add(eat(SyntaxKind.CLOSE_PAREN));
        children.add(parseStatement());
        return new GreenNode(SyntaxKind.FOR_STATEMENT, children);
    }

    private void parseExpressionList(List<GreenElement> into) {
        into.add(parseExpression());
        while (at(SyntaxKind.COMMA)) {
            into.add(advance());
            into.add(parseExpression());
        }
    }

    /**
     * Whether a type followed by a declared name starts here. Does not consume anything.
     */
    private boolean isLocalDeclarationStart() {
        if (!at(SyntaxKind.IDENTIFIER) && !currentKind().isPredefinedType()) {
            return false;
        }
        int saved = position;
        try {
            parseType();
            if (!at(SyntaxKind.IDENTIFIER)) {
                return false;
            }
            SyntaxKind next = peekKind(1);
            return next == SyntaxKind.EQUALS || next == SyntaxKind.SEMICOLON || next == SyntaxKind.COMMA;
        } catch (SyntaxException e) {
            return false;
        } finally {
            position = saved;
        }
    }

    // Expressions

    private GreenNode parseExpression() {
        if (isLambdaStart()) {
            return parseLambda();
        }
        if (isQueryStart()) {
            return parseQueryExpression();
        }
        GreenNode left = parseConditional();
        if (ASSIGNMENT_OPERATORS.contains(currentKind())) {
            GreenToken operator = advance();
            return node(SyntaxKind.ASSIGNMENT_EXPRESSION, left, operator, parseExpression());
        }
        return left;
    }

    private GreenNode parseConditional() {
        GreenNode condition = parseBinary(0);
        if (!at(SyntaxKind.QUESTION)) {
            return condition;
        }
        GreenToken question = advance();
        GreenNode whenTrue = parseExpression();
        GreenToken colon = eat(SyntaxKind.COLON);
        return node(SyntaxKind.CONDITIONAL_EXPRESSION, condition, question, whenTrue, colon, parseExpression());
    }

    private GreenNode parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseUnary();
        }
        GreenNode left = parseBinary(level + 1);
        while (BINARY_LEVELS.get(level).contains(currentKind())) {
            GreenToken operator = advance();
            left = node(SyntaxKind.BINARY_EXPRESSION, left, operator, parseBinary(level + 1));
        }
        return left;
    }

    private GreenNode parseUnary() {
        if (PREFIX_OPERATORS.contains(currentKind())) {
            GreenToken operator = advance();
            return node(SyntaxKind.PREFIX_UNARY_EXPRESSION, operator, parseUnary());
        }
        return parsePostfix(parsePrimary());
    }

    private GreenNode parsePostfix(GreenNode expression) {
        while (true) {
            switch (currentKind()) {
                case DOT:
                    expression = node(SyntaxKind.MEMBER_ACCESS_EXPRESSION, expression, advance(),
                            node(SyntaxKind.IDENTIFIER_NAME, eat(SyntaxKind.IDENTIFIER)));
                    break;
                case OPEN_PAREN:
                    expression = node(SyntaxKind.INVOCATION_EXPRESSION, expression,
                            parseArgumentList(SyntaxKind.ARGUMENT_LIST, SyntaxKind.OPEN_PAREN, SyntaxKind.CLOSE_PAREN));
                    break;
                case OPEN_BRACKET:
                    expression = node(SyntaxKind.ELEMENT_ACCESS_EXPRESSION, expression,
                            parseArgumentList(SyntaxKind.BRACKETED_ARGUMENT_LIST, SyntaxKind.OPEN_BRACKET,
                                    SyntaxKind.CLOSE_BRACKET));
                    break;
                case PLUS_PLUS:
                case MINUS_MINUS:
                    expression = node(SyntaxKind.POSTFIX_UNARY_EXPRESSION, expression, advance());
                    break;
                default:
                    return expression;
            }
        }
    }

    private GreenNode parsePrimary() {
        SyntaxKind kind = currentKind();
        switch (kind) {
            case IDENTIFIER:
                return node(SyntaxKind.IDENTIFIER_NAME, advance());
            case NUMERIC_LITERAL:
            case STRING_LITERAL:
            case CHARACTER_LITERAL:
            case TRUE_KEYWORD:
            case FALSE_KEYWORD:
            case NULL_KEYWORD:
                return node(SyntaxKind.LITERAL_EXPRESSION, advance());
            case THIS_KEYWORD:
                return node(SyntaxKind.THIS_EXPRESSION, advance());
            case OPEN_PAREN:
                return node(SyntaxKind.PARENTHESIZED_EXPRESSION, advance(), parseExpression(),
                        eat(SyntaxKind.CLOSE_PAREN));
            case NEW_KEYWORD: {
                GreenToken keyword = advance();
                GreenNode type = parseType();
                GreenNode arguments = at(SyntaxKind.OPEN_PAREN)
                        ? parseArgumentList(SyntaxKind.ARGUMENT_LIST, SyntaxKind.OPEN_PAREN, SyntaxKind.CLOSE_PAREN)
                        : null;
                return node(SyntaxKind.OBJECT_CREATION_EXPRESSION, keyword, type, arguments);
            }
            default:
                if (kind.isPredefinedType()) {
                    return node(SyntaxKind.PREDEFINED_TYPE, advance());
                }
                throw error("Expected an expression but found '" + current().getText() + "'");
        }
    }

    private GreenNode parseArgumentList(SyntaxKind kind, SyntaxKind open, SyntaxKind close) {
        List<GreenElement> children = new ArrayList<>();
        children.add(eat(open));
        if (!at(close)) {
            children.add(node(SyntaxKind.ARGUMENT, parseExpression()));
            while (at(SyntaxKind.COMMA)) {
                children.add(advance());
                children.add(node(SyntaxKind.ARGUMENT, parseExpression()));
            }
        }
        children.add(eat(close));
        return new GreenNode(kind, children);
    }

    private boolean isLambdaStart() {
        if (at(SyntaxKind.IDENTIFIER)) {
            return peekKind(1) == SyntaxKind.EQUALS_GREATER;
        }
        if (!at(SyntaxKind.OPEN_PAREN)) {
            return false;
        }
        int depth = 0;
        for (int i = position; i < tokens.size(); i++) {
            SyntaxKind kind = tokens.get(i).getKind();
            if (kind == SyntaxKind.OPEN_PAREN) {
                depth++;
            } else if (kind == SyntaxKind.CLOSE_PAREN && --depth == 0) {
                return i + 1 < tokens.size() && tokens.get(i + 1).getKind() == SyntaxKind.EQUALS_GREATER;
            } else if (kind == SyntaxKind.END_OF_FILE || kind == SyntaxKind.SEMICOLON) {
                return false;
            }
        }
        return false;
    }

    private GreenNode parseLambda() {
        if (at(SyntaxKind.IDENTIFIER)) {
            GreenNode parameter = node(SyntaxKind.PARAMETER, advance());
            return node(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION, parameter, eat(SyntaxKind.EQUALS_GREATER), parseLambdaBody());
        }
        GreenNode parameters = parseParameterList(true);
        return node(SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION, parameters, eat(SyntaxKind.EQUALS_GREATER),
                parseLambdaBody());
    }

    private GreenNode parseLambdaBody() {
        return at(SyntaxKind.OPEN_BRACE) ? parseBlock() : parseExpression();
    }

    // Query expressions

    private boolean isQueryStart() {
        if (!isContextual(SyntaxKind.FROM_KEYWORD, 0)) {
            return false;
        }
        if (peekKind(1) == SyntaxKind.IDENTIFIER && peekKind(2) == SyntaxKind.IN_KEYWORD) {
            return true;
        }
        int saved = position;
        try {
            position++;
            parseType();
            return at(SyntaxKind.IDENTIFIER) && peekKind(1) == SyntaxKind.IN_KEYWORD;
        } catch (SyntaxException e) {
            return false;
        } finally {
            position = saved;
        }
    }

    private GreenNode parseQueryExpression() {
        return node(SyntaxKind.QUERY_EXPRESSION, parseFromClause(), parseQueryBody());
    }

    private GreenNode parseFromClause() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eatContextual(SyntaxKind.FROM_KEYWORD));
        if (!(at(SyntaxKind.IDENTIFIER) && peekKind(1) == SyntaxKind.IN_KEYWORD)) {
            children.add(parseType());
        }
        children.add(eat(SyntaxKind.IDENTIFIER));
        children.add(eat(SyntaxKind.IN_KEYWORD));
        children.add(parseExpression());
        return new GreenNode(SyntaxKind.FROM_CLAUSE, children);
    }

    private GreenNode parseQueryBody() {
        List<GreenElement> children = new ArrayList<>();
        while (true) {
            if (isContextual(SyntaxKind.FROM_KEYWORD, 0)) {
                children.add(parseFromClause());
            } else if (isContextual(SyntaxKind.LET_KEYWORD, 0)) {
                children.add(node(SyntaxKind.LET_CLAUSE, eatContextual(SyntaxKind.LET_KEYWORD),
                        eat(SyntaxKind.IDENTIFIER), eat(SyntaxKind.EQUALS), parseExpression()));
            } else if (isContextual(SyntaxKind.WHERE_KEYWORD, 0)) {
                children.add(node(SyntaxKind.WHERE_CLAUSE, eatContextual(SyntaxKind.WHERE_KEYWORD), parseExpression()));
            } else if (isContextual(SyntaxKind.JOIN_KEYWORD, 0)) {
                children.add(parseJoinClause());
            } else if (isContextual(SyntaxKind.ORDERBY_KEYWORD, 0)) {
                children.add(parseOrderByClause());
            } else {
                break;
            }
        }

        if (isContextual(SyntaxKind.SELECT_KEYWORD, 0)) {
            children.add(node(SyntaxKind.SELECT_CLAUSE, eatContextual(SyntaxKind.SELECT_KEYWORD), parseExpression()));
        } else if (isContextual(SyntaxKind.GROUP_KEYWORD, 0)) {
            children.add(node(SyntaxKind.GROUP_CLAUSE, eatContextual(SyntaxKind.GROUP_KEYWORD), parseExpression(),
                    eatContextual(SyntaxKind.BY_KEYWORD), parseExpression()));
        } else {
            throw error("Expected 'select' or 'group' but found '" + current().getText() + "'");
        }

        if (isContextual(SyntaxKind.INTO_KEYWORD, 0)) {
            children.add(node(SyntaxKind.QUERY_CONTINUATION, eatContextual(SyntaxKind.INTO_KEYWORD),
                    eat(SyntaxKind.IDENTIFIER), parseQueryBody()));
        }
        return new GreenNode(SyntaxKind.QUERY_BODY, children);
    }

    private GreenNode parseJoinClause() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eatContextual(SyntaxKind.JOIN_KEYWORD));
        if (!(at(SyntaxKind.IDENTIFIER) && peekKind(1) == SyntaxKind.IN_KEYWORD)) {
            children.add(parseType());
        }
        children.add(eat(SyntaxKind.IDENTIFIER));
        children.add(eat(SyntaxKind.IN_KEYWORD));
        children.add(parseExpression());
        children.add(eatContextual(SyntaxKind.ON_KEYWORD));
        children.add(parseExpression());
        children.add(eatContextual(SyntaxKind.EQUALS_KEYWORD));
        children.add(parseExpression());
        if (isContextual(SyntaxKind.INTO_KEYWORD, 0)) {
            children.add(eatContextual(SyntaxKind.INTO_KEYWORD));
            children.add(eat(SyntaxKind.IDENTIFIER));
        }
        return new GreenNode(SyntaxKind.JOIN_CLAUSE, children);
    }

    private GreenNode parseOrderByClause() {
        List<GreenElement> children = new ArrayList<>();
        children.add(eatContextual(SyntaxKind.ORDERBY_KEYWORD));
        children.add(parseOrdering());
        while (at(SyntaxKind.COMMA)) {
            children.add(advance());
            children.add(parseOrdering());
        }
        return new GreenNode(SyntaxKind.ORDER_BY_CLAUSE, children);
    }

    private GreenNode parseOrdering() {
        GreenNode expression = parseExpression();
        if (isContextual(SyntaxKind.ASCENDING_KEYWORD, 0)) {
            return node(SyntaxKind.ORDERING, expression, eatContextual(SyntaxKind.ASCENDING_KEYWORD));
        }
        if (isContextual(SyntaxKind.DESCENDING_KEYWORD, 0)) {
            return node(SyntaxKind.ORDERING, expression, eatContextual(SyntaxKind.DESCENDING_KEYWORD));
        }
        return node(SyntaxKind.ORDERING, expression);
    }

    // Token helpers

    private GreenToken current() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    private SyntaxKind currentKind() {
        return current().getKind();
    }

    private SyntaxKind peekKind(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1)).getKind();
    }

    private boolean at(SyntaxKind kind) {
        return currentKind() == kind;
    }

    private boolean isContextual(SyntaxKind keyword, int offset) {
        GreenToken token = tokens.get(Math.min(position + offset, tokens.size() - 1));
        return token.getKind() == SyntaxKind.IDENTIFIER && token.getText().equals(keyword.getText());
    }

    private GreenToken advance() {
        GreenToken token = current();
        if (token.getKind() != SyntaxKind.END_OF_FILE) {
            position++;
        }
        return token;
    }

    private GreenToken eat(SyntaxKind kind) {
        if (!at(kind)) {
            String expected = kind.getText() != null ? "'" + kind.getText() + "'" : kind.name().toLowerCase();
            throw error("Expected " + expected + " but found '" + current().getText() + "'");
        }
        return advance();
    }

    private GreenToken eatContextual(SyntaxKind keyword) {
        if (!isContextual(keyword, 0)) {
            throw error("Expected '" + keyword.getText() + "' but found '" + current().getText() + "'");
        }
        return advance().withKind(keyword);
    }

    private void expectNotEndOfFile(String closing) {
        if (at(SyntaxKind.END_OF_FILE)) {
            throw error("Expected '" + closing + "' before end of file");
        }
    }

    private SyntaxException error(String message) {
        int offset = tokenStarts[Math.min(position, tokenStarts.length - 1)];
        return new SyntaxException(message, sourceText.getLineNumber(offset) + 1, sourceText.getColumn(offset) + 1);
    }

    private static GreenNode node(SyntaxKind kind, GreenElement... children) {
        List<GreenElement> present = new ArrayList<>(children.length);
        for (GreenElement child : children) {
            if (child != null) {
                present.add(child);
            }
        }
        return new GreenNode(kind, present);
    }
}

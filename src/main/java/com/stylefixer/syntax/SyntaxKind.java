package com.stylefixer.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of node and token kinds of the supported C# subset.
 *
 * <p>Every kind carries the facts the rewrite engine dispatches on: its category, its fixed text
 * (punctuation and keywords), the way it affects indentation and its role when deciding whether a
 * position sits inside a translated expression.
 */
public enum SyntaxKind {
    // Punctuation
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),
    SEMICOLON(";"),
    COMMA(","),
    DOT("."),
    COLON(":"),
    QUESTION("?"),
    QUESTION_QUESTION("??"),
    EQUALS("="),
    EQUALS_GREATER("=>"),
    EQUALS_EQUALS("=="),
    EXCLAMATION("!"),
    EXCLAMATION_EQUALS("!="),
    LESS("<"),
    LESS_EQUALS("<="),
    GREATER(">"),
    GREATER_EQUALS(">="),
    PLUS("+"),
    PLUS_PLUS("++"),
    PLUS_EQUALS("+="),
    MINUS("-"),
    MINUS_MINUS("--"),
    MINUS_EQUALS("-="),
    ASTERISK("*"),
    ASTERISK_EQUALS("*="),
    SLASH("/"),
    SLASH_EQUALS("/="),
    PERCENT("%"),
    AMPERSAND("&"),
    AMPERSAND_AMPERSAND("&&"),
    BAR("|"),
    BAR_BAR("||"),
    CARET("^"),
    TILDE("~"),
    HASH("#"),

    // Reserved keywords
    USING_KEYWORD("using"),
    NAMESPACE_KEYWORD("namespace"),
    CLASS_KEYWORD("class"),
    STRUCT_KEYWORD("struct"),
    INTERFACE_KEYWORD("interface"),
    PUBLIC_KEYWORD("public"),
    PRIVATE_KEYWORD("private"),
    PROTECTED_KEYWORD("protected"),
    INTERNAL_KEYWORD("internal"),
    STATIC_KEYWORD("static"),
    READONLY_KEYWORD("readonly"),
    CONST_KEYWORD("const"),
    ABSTRACT_KEYWORD("abstract"),
    VIRTUAL_KEYWORD("virtual"),
    OVERRIDE_KEYWORD("override"),
    SEALED_KEYWORD("sealed"),
    EVENT_KEYWORD("event"),
    VOID_KEYWORD("void"),
    INT_KEYWORD("int"),
    LONG_KEYWORD("long"),
    SHORT_KEYWORD("short"),
    BYTE_KEYWORD("byte"),
    FLOAT_KEYWORD("float"),
    DOUBLE_KEYWORD("double"),
    DECIMAL_KEYWORD("decimal"),
    BOOL_KEYWORD("bool"),
    CHAR_KEYWORD("char"),
    STRING_KEYWORD("string"),
    OBJECT_KEYWORD("object"),
    IF_KEYWORD("if"),
    ELSE_KEYWORD("else"),
    WHILE_KEYWORD("while"),
    FOR_KEYWORD("for"),
    FOREACH_KEYWORD("foreach"),
    IN_KEYWORD("in"),
    RETURN_KEYWORD("return"),
    BREAK_KEYWORD("break"),
    CONTINUE_KEYWORD("continue"),
    NEW_KEYWORD("new"),
    TRUE_KEYWORD("true"),
    FALSE_KEYWORD("false"),
    NULL_KEYWORD("null"),
    THIS_KEYWORD("this"),

    // Contextual keywords, only recognised by the parser in the right position
    GET_KEYWORD("get", true),
    SET_KEYWORD("set", true),
    FROM_KEYWORD("from", true),
    LET_KEYWORD("let", true),
    WHERE_KEYWORD("where", true),
    JOIN_KEYWORD("join", true),
    ON_KEYWORD("on", true),
    EQUALS_KEYWORD("equals", true),
    INTO_KEYWORD("into", true),
    ORDERBY_KEYWORD("orderby", true),
    ASCENDING_KEYWORD("ascending", true),
    DESCENDING_KEYWORD("descending", true),
    SELECT_KEYWORD("select", true),
    GROUP_KEYWORD("group", true),
    BY_KEYWORD("by", true),

    // Tokens with variable text
    IDENTIFIER(Category.TOKEN),
    NUMERIC_LITERAL(Category.TOKEN),
    STRING_LITERAL(Category.TOKEN),
    CHARACTER_LITERAL(Category.TOKEN),
    PREPROCESSING_MESSAGE(Category.TOKEN),
    END_OF_FILE(Category.TOKEN),

    // Structure
    COMPILATION_UNIT(Category.STRUCTURE),
    USING_DIRECTIVE(Category.STRUCTURE),
    DIRECTIVE_TRIVIA(Category.STRUCTURE),
    BASE_LIST(Category.STRUCTURE),
    PARAMETER_LIST(Category.STRUCTURE),
    PARAMETER(Category.STRUCTURE),
    ARGUMENT_LIST(Category.STRUCTURE),
    BRACKETED_ARGUMENT_LIST(Category.STRUCTURE),
    ARGUMENT(Category.STRUCTURE),
    ACCESSOR_LIST(Category.STRUCTURE, IndentationRole.BRACED_BODY),
    ACCESSOR_DECLARATION(Category.STRUCTURE),
    ARROW_EXPRESSION_CLAUSE(Category.STRUCTURE),
    VARIABLE_DECLARATION(Category.STRUCTURE),
    VARIABLE_DECLARATOR(Category.STRUCTURE),
    EQUALS_VALUE_CLAUSE(Category.STRUCTURE),
    ELSE_CLAUSE(Category.STRUCTURE, IndentationRole.EMBEDDED_STATEMENT),

    // Declarations
    NAMESPACE_DECLARATION(Category.DECLARATION, IndentationRole.BRACED_BODY),
    CLASS_DECLARATION(Category.DECLARATION, IndentationRole.BRACED_BODY),
    STRUCT_DECLARATION(Category.DECLARATION, IndentationRole.BRACED_BODY),
    INTERFACE_DECLARATION(Category.DECLARATION, IndentationRole.BRACED_BODY),
    FIELD_DECLARATION(Category.DECLARATION),
    EVENT_FIELD_DECLARATION(Category.DECLARATION),
    PROPERTY_DECLARATION(Category.DECLARATION),
    METHOD_DECLARATION(Category.DECLARATION),
    CONSTRUCTOR_DECLARATION(Category.DECLARATION),

    // Types and names
    PREDEFINED_TYPE(Category.TYPE),
    IDENTIFIER_NAME(Category.TYPE),
    GENERIC_NAME(Category.TYPE),
    TYPE_ARGUMENT_LIST(Category.TYPE),
    QUALIFIED_NAME(Category.TYPE),
    ARRAY_TYPE(Category.TYPE),
    ARRAY_RANK_SPECIFIER(Category.TYPE),
    NULLABLE_TYPE(Category.TYPE),

    // Statements
    BLOCK(Category.STATEMENT, IndentationRole.BRACED_BODY),
    LOCAL_DECLARATION_STATEMENT(Category.STATEMENT),
    EXPRESSION_STATEMENT(Category.STATEMENT),
    IF_STATEMENT(Category.STATEMENT, IndentationRole.EMBEDDED_STATEMENT),
    WHILE_STATEMENT(Category.STATEMENT, IndentationRole.EMBEDDED_STATEMENT),
    FOR_STATEMENT(Category.STATEMENT, IndentationRole.EMBEDDED_STATEMENT),
    FOREACH_STATEMENT(Category.STATEMENT, IndentationRole.EMBEDDED_STATEMENT),
    RETURN_STATEMENT(Category.STATEMENT),
    BREAK_STATEMENT(Category.STATEMENT),
    CONTINUE_STATEMENT(Category.STATEMENT),
    EMPTY_STATEMENT(Category.STATEMENT),

    // Expressions
    ASSIGNMENT_EXPRESSION(Category.EXPRESSION),
    CONDITIONAL_EXPRESSION(Category.EXPRESSION),
    BINARY_EXPRESSION(Category.EXPRESSION),
    PREFIX_UNARY_EXPRESSION(Category.EXPRESSION),
    POSTFIX_UNARY_EXPRESSION(Category.EXPRESSION),
    INVOCATION_EXPRESSION(Category.EXPRESSION),
    MEMBER_ACCESS_EXPRESSION(Category.EXPRESSION),
    ELEMENT_ACCESS_EXPRESSION(Category.EXPRESSION),
    OBJECT_CREATION_EXPRESSION(Category.EXPRESSION),
    LITERAL_EXPRESSION(Category.EXPRESSION),
    THIS_EXPRESSION(Category.EXPRESSION),
    PARENTHESIZED_EXPRESSION(Category.EXPRESSION),
    SIMPLE_LAMBDA_EXPRESSION(Category.EXPRESSION, ExpressionContextRole.LAMBDA),
    PARENTHESIZED_LAMBDA_EXPRESSION(Category.EXPRESSION, ExpressionContextRole.LAMBDA),
    QUERY_EXPRESSION(Category.EXPRESSION),

    // Query expression parts
    QUERY_BODY(Category.CLAUSE),
    QUERY_CONTINUATION(Category.CLAUSE),
    FROM_CLAUSE(Category.CLAUSE, ExpressionContextRole.QUERY_CLAUSE),
    LET_CLAUSE(Category.CLAUSE, ExpressionContextRole.QUERY_CLAUSE),
    WHERE_CLAUSE(Category.CLAUSE, ExpressionContextRole.QUERY_CLAUSE),
    JOIN_CLAUSE(Category.CLAUSE, ExpressionContextRole.QUERY_CLAUSE),
    ORDER_BY_CLAUSE(Category.CLAUSE, ExpressionContextRole.QUERY_CLAUSE),
    ORDERING(Category.CLAUSE, ExpressionContextRole.PROJECTION),
    SELECT_CLAUSE(Category.CLAUSE, ExpressionContextRole.PROJECTION),
    GROUP_CLAUSE(Category.CLAUSE, ExpressionContextRole.PROJECTION);

    /**
     * Broad grouping of kinds.
     */
    public enum Category {
        PUNCTUATION,
        KEYWORD,
        CONTEXTUAL_KEYWORD,
        TOKEN,
        STRUCTURE,
        DECLARATION,
        TYPE,
        STATEMENT,
        EXPRESSION,
        CLAUSE
    }

    /**
     * How a construct contributes to the indentation of the lines it contains.
     */
    public enum IndentationRole {
        NONE,
        /** Everything strictly between the construct's own braces is one step deeper. */
        BRACED_BODY,
        /** A non-block statement embedded in the construct is one step deeper. */
        EMBEDDED_STATEMENT
    }

    /**
     * Role a node plays when checking for a translated (quoted) expression context.
     */
    public enum ExpressionContextRole {
        NONE,
        LAMBDA,
        PROJECTION,
        QUERY_CLAUSE
    }

    private static final Map<String, SyntaxKind> KEYWORDS = new HashMap<>();
    private static final Map<String, SyntaxKind> CONTEXTUAL_KEYWORDS = new HashMap<>();
    private static final Map<String, SyntaxKind> PUNCTUATION = new HashMap<>();

    static {
        for (SyntaxKind kind : values()) {
            switch (kind.category) {
                case KEYWORD -> KEYWORDS.put(kind.text, kind);
                case CONTEXTUAL_KEYWORD -> CONTEXTUAL_KEYWORDS.put(kind.text, kind);
                case PUNCTUATION -> PUNCTUATION.put(kind.text, kind);
                default -> {
                }
            }
        }
    }

    private final Category category;
    private final String text;
    private final IndentationRole indentationRole;
    private final ExpressionContextRole expressionContextRole;

    SyntaxKind(String text) {
        this(Character.isLetter(text.charAt(0)) ? Category.KEYWORD : Category.PUNCTUATION, text,
                IndentationRole.NONE, ExpressionContextRole.NONE);
    }

    SyntaxKind(String text, boolean contextual) {
        this(contextual ? Category.CONTEXTUAL_KEYWORD : Category.KEYWORD, text,
                IndentationRole.NONE, ExpressionContextRole.NONE);
    }

    SyntaxKind(Category category) {
        this(category, null, IndentationRole.NONE, ExpressionContextRole.NONE);
    }

    SyntaxKind(Category category, IndentationRole indentationRole) {
        this(category, null, indentationRole, ExpressionContextRole.NONE);
    }

    SyntaxKind(Category category, ExpressionContextRole expressionContextRole) {
        this(category, null, IndentationRole.NONE, expressionContextRole);
    }

    SyntaxKind(Category category, String text, IndentationRole indentationRole,
               ExpressionContextRole expressionContextRole) {
        this.category = category;
        this.text = text;
        this.indentationRole = indentationRole;
        this.expressionContextRole = expressionContextRole;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Fixed text of a punctuation or keyword kind, {@code null} for every other kind.
     */
    public String getText() {
        return text;
    }

    public IndentationRole getIndentationRole() {
        return indentationRole;
    }

    public ExpressionContextRole getExpressionContextRole() {
        return expressionContextRole;
    }

    public boolean isToken() {
        return category == Category.PUNCTUATION
                || category == Category.KEYWORD
                || category == Category.CONTEXTUAL_KEYWORD
                || category == Category.TOKEN;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isModifier() {
        return switch (this) {
            case PUBLIC_KEYWORD, PRIVATE_KEYWORD, PROTECTED_KEYWORD, INTERNAL_KEYWORD, STATIC_KEYWORD,
                    READONLY_KEYWORD, CONST_KEYWORD, ABSTRACT_KEYWORD, VIRTUAL_KEYWORD, OVERRIDE_KEYWORD,
                    SEALED_KEYWORD -> true;
            default -> false;
        };
    }

    public boolean isPredefinedType() {
        return switch (this) {
            case VOID_KEYWORD, INT_KEYWORD, LONG_KEYWORD, SHORT_KEYWORD, BYTE_KEYWORD, FLOAT_KEYWORD,
                    DOUBLE_KEYWORD, DECIMAL_KEYWORD, BOOL_KEYWORD, CHAR_KEYWORD, STRING_KEYWORD,
                    OBJECT_KEYWORD -> true;
            default -> false;
        };
    }

    /**
     * Returns the reserved keyword spelled {@code text}, or {@code null}.
     */
    public static SyntaxKind keyword(String text) {
        return KEYWORDS.get(text);
    }

    /**
     * Returns the contextual keyword spelled {@code text}, or {@code null}.
     */
    public static SyntaxKind contextualKeyword(String text) {
        return CONTEXTUAL_KEYWORDS.get(text);
    }

    /**
     * Returns the punctuation spelled {@code text}, or {@code null}.
     */
    public static SyntaxKind punctuation(String text) {
        return PUNCTUATION.get(text);
    }
}

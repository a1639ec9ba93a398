package aurum.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    BOOL_LITERAL,

    // keywords
    FUNC,
    MAIN,
    IF,
    ELIF,
    ELSE,
    WHILE,
    FOR,
    BREAK,
    CONTINUE,
    RETURN,
    READ,

    // types
    INT,
    FLOAT,
    BOOL,
    STRING,
    VOID,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    ARROW,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    SEMICOLON, COMMA, DOT,

    // recognized, never emitted
    COMMENT,
    WHITESPACE,

    EOF;

    public boolean isTypeKeyword() {
        return this == INT || this == FLOAT || this == BOOL || this == STRING;
    }
}

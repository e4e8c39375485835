package lox.lang;

import lombok.NonNull;

record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    Value literal,
    int line) {

    Token(Type type, String lexeme, int line) {
        this(type, lexeme, null, line);
    }

    @Override
    public String toString() {
        var literalText = literal != null ? literal.display() : "null";
        return type + " " + lexeme + " " + literalText;
    }

    enum Type {
        // single-character tokens
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACE,
        RIGHT_BRACE,
        COMMA,
        DOT,
        MINUS,
        PLUS,
        SEMICOLON,
        SLASH,
        STAR,

        // one or two character tokens
        BANG,
        BANG_EQUAL,
        EQUAL,
        EQUAL_EQUAL,
        GREATER,
        GREATER_EQUAL,
        LESS,
        LESS_EQUAL,

        // literals
        IDENTIFIER,
        STRING,
        NUMBER,

        // keywords
        AND,
        CLASS,
        ELSE,
        FALSE,
        FUN,
        FOR,
        IF,
        NIL,
        OR,
        PRINT,
        RETURN,
        SUPER,
        THIS,
        TRUE,
        VAR,
        WHILE,

        // end-of-file
        EOF;
    }
}

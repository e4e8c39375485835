package lox.lang;

import static lox.lang.Token.Type.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class Parser {

    @AllArgsConstructor
    @Getter
    private static class ParseError extends RuntimeException {
        private final Token token;
        private final String parserMessage;
    }

    private static final Set<Token.Type> STATEMENT_START = EnumSet.of(
        CLASS, FUN, VAR, FOR, IF, WHILE, PRINT, RETURN);

    private final @NonNull TokenStream tokens;
    private final @NonNull Reporter reporter;

    Parser(List<Token> tokens, Reporter reporter) {
        this(new TokenStream(tokens), reporter);
    }

    /**
     * Parses a single expression. After an unrecoverable syntax error the error is
     * recorded with the {@link Reporter} and a placeholder literal is returned.
     */
    public Expr parse() {
        try {
            return expression();
        } catch (ParseError ex) {
            report(ex);
            synchronize();
            return new Expr.Literal(null);
        }
    }

    //// grammar rules ////

    /**
     * <pre>
     *  expression  :: equality
     * </pre>
     */
    private Expr expression() {
        return equality();
    }

    /**
     * <pre>
     *  equality    :: comparison ( ( "!=" | "==" ) comparison )*
     * </pre>
     */
    private Expr equality() {
        var expr = comparison();
        while (match(BANG_EQUAL, EQUAL_EQUAL)) {
            var operator = previous();
            var right = comparison();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  comparison  :: term ( ( ">" | ">=" | "<" | "<=" ) term )*
     * </pre>
     */
    private Expr comparison() {
        var expr = term();
        while (match(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
            var operator = previous();
            var right = term();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  term        :: factor ( ( "-" | "+" ) factor )*
     * </pre>
     */
    private Expr term() {
        var expr = factor();
        while (match(MINUS, PLUS)) {
            var operator = previous();
            var right = factor();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  factor      :: unary ( ( "/" | "*" ) unary )*
     * </pre>
     */
    private Expr factor() {
        var expr = unary();
        while (match(SLASH, STAR)) {
            var operator = previous();
            var right = unary();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  unary       :: ( "!" | "-" ) unary | primary
     * </pre>
     */
    private Expr unary() {
        if (match(BANG, MINUS)) {
            var operator = previous();
            var right = unary();
            return new Expr.Unary(operator, right);
        }
        return primary();
    }

    /**
     * <pre>
     *  primary     :: NUMBER | STRING | "true" | "false" | "nil"
     *              | ( "(" expression ")" )
     * </pre>
     */
    private Expr primary() {
        if (match(FALSE)) {
            return new Expr.Literal(Value.of(false));
        }
        if (match(TRUE)) {
            return new Expr.Literal(Value.of(true));
        }
        if (match(NIL)) {
            return new Expr.Literal(Value.Nil.INSTANCE);
        }
        if (match(NUMBER, STRING)) {
            return new Expr.Literal(previous().literal());
        }
        if (match(LEFT_PAREN)) {
            var expression = expression();
            try {
                consume(RIGHT_PAREN, "Expect ')' after expression.");
            } catch (ParseError ex) {
                // keep the partial group
                report(ex);
                synchronize();
            }
            return new Expr.Grouping(expression);
        }
        throw error(peek(), "Expect expression.");
    }

    //// utility methods ////

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), message);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }

    private void report(ParseError ex) {
        reporter.error(ex.getToken(), ex.getParserMessage());
    }

    private void synchronize() {
        advance();

        while (!isAtEnd()) {
            if (previous().type() == SEMICOLON) {
                return;
            }
            if (STATEMENT_START.contains(peek().type())) {
                return;
            }
            advance();
        }
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token previous() {
        return tokens.previous();
    }
}

package lox.lang;

import static java.util.Map.entry;
import static lox.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class Scanner {

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("and", AND),
        entry("class", CLASS),
        entry("else", ELSE),
        entry("false", FALSE),
        entry("for", FOR),
        entry("fun", FUN),
        entry("if", IF),
        entry("nil", NIL),
        entry("or", OR),
        entry("print", PRINT),
        entry("return", RETURN),
        entry("super", SUPER),
        entry("this", THIS),
        entry("true", TRUE),
        entry("var", VAR),
        entry("while", WHILE));

    private final @NonNull String source;
    private final @NonNull Reporter reporter;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;

    List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return tokens;
        }

        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        tokens.add(new Token(EOF, "", line));
        return tokens;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        var c = advance();
        switch (c) {
        case '(':
            addToken(LEFT_PAREN);
            break;
        case ')':
            addToken(RIGHT_PAREN);
            break;
        case '{':
            addToken(LEFT_BRACE);
            break;
        case '}':
            addToken(RIGHT_BRACE);
            break;
        case ',':
            addToken(COMMA);
            break;
        case '.':
            addToken(DOT);
            break;
        case '-':
            addToken(MINUS);
            break;
        case '+':
            addToken(PLUS);
            break;
        case ';':
            addToken(SEMICOLON);
            break;
        case '*':
            addToken(STAR);
            break;
        case '!':
            addToken(match('=') ? BANG_EQUAL : BANG);
            break;
        case '=':
            addToken(match('=') ? EQUAL_EQUAL : EQUAL);
            break;
        case '<':
            addToken(match('=') ? LESS_EQUAL : LESS);
            break;
        case '>':
            addToken(match('=') ? GREATER_EQUAL : GREATER);
            break;
        case '/':
            if (match('/')) {
                while (peek() != '\n' && !isAtEnd()) {
                    advance();
                }
            } else {
                addToken(SLASH);
            }
            break;

        // whitespace
        case ' ':
        case '\r':
        case '\t':
            break;

        case '\n':
            line++;
            break;

        case '"':
            string();
            break;

        default:
            if (isDigit(c)) {
                number();
            } else if (isAlpha(source.codePointAt(start))) {
                identifier();
            } else {
                unexpected(c);
            }
        }
    }

    private static boolean isAlphaNumeric(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }

    private static boolean isAlpha(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void identifier() {
        // by code point, so letters outside the BMP stay in the identifier
        current = start;
        while (!isAtEnd() && isAlphaNumeric(source.codePointAt(current))) {
            current += Character.charCount(source.codePointAt(current));
        }
        var text = source.substring(start, current);
        var type = keywords.getOrDefault(text, IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }

        // a '.' only belongs to the number when a digit follows it
        if (peek() == '.' && isDigit(peekNext())) {
            advance();

            while (isDigit(peek())) {
                advance();
            }
        }

        var text = source.substring(start, current);
        addToken(NUMBER, Value.of(Double.parseDouble(text)));
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                line++;
            }
            advance();
        }

        if (isAtEnd()) {
            reporter.error(line, "Unterminated string.");
            return;
        }

        // the closing quote
        advance();

        var value = source.substring(start + 1, current - 1);
        addToken(STRING, Value.of(value));
    }

    private void unexpected(char c) {
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
            advance();
            reporter.error(line, "Unexpected character: " + source.substring(start, current));
        } else if (Character.isSurrogate(c)) {
            reporter.error(line, "Invalid code point at offset " + start);
        } else {
            reporter.error(line, "Unexpected character: " + c);
        }
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private void addToken(Token.Type type) {
        addToken(type, null);
    }

    private void addToken(Token.Type type, Value literal) {
        var text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }
}

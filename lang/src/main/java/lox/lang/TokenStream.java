package lox.lang;

import static lox.lang.Token.Type.EOF;

import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Cursor over a scanned token list. Never moves past the trailing {@code EOF}.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return peek().type() == EOF;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token advance() {
        previous = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        return previous;
    }
}

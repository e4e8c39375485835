package lox.lang;

import static lox.lang.Token.Type.EOF;
import static lox.lang.Token.Type.NUMBER;
import static lox.lang.Token.Type.PLUS;
import static lox.lang.Token.Type.SEMICOLON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
        assertEquals(expect, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "1 +\n2;\n";
        var scanner = new Scanner(source, new Reporter());
        stream = new TokenStream(scanner.getTokens());
        expectAtEnd = false;
    }

    @Test
    void walksTokensInOrder() {
        assertNextToken(new Token(NUMBER, "1", Value.of(1.0), 1));
        assertNextToken(new Token(PLUS, "+", 1));
        assertNextToken(new Token(NUMBER, "2", Value.of(2.0), 2));
        assertNextToken(new Token(SEMICOLON, ";", 2));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 3));
    }

    @Test
    void staysOnEof() {
        while (!stream.isAtEnd()) {
            stream.advance();
        }
        var eof = stream.advance();
        assertEquals(EOF, eof.type());
        assertEquals(eof, stream.advance());
        assertEquals(eof, stream.peek());
        assertTrue(stream.isAtEnd());
    }

    @Test
    void previousBeforeAdvanceIsCurrent() {
        assertEquals(stream.peek(), stream.previous());
        stream.advance();
        assertEquals(PLUS, stream.peek().type());
    }
}

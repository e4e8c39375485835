package lox.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LoxTest {

    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private Lox lox(String stdin) {
        var in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return new Lox(in,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void tokenize() {
        assertEquals(Lox.EXIT_OK, lox("").tokenize("(1.5)"));
        assertEquals("LEFT_PAREN ( null\nNUMBER 1.5 1.5\nRIGHT_PAREN ) null\nEOF  null\n", out());
    }

    @Test
    void tokenizeWithErrorsStillPrintsTokens() {
        assertEquals(Lox.EXIT_DATA_ERROR, lox("").tokenize(",$"));
        assertEquals("COMMA , null\nEOF  null\n", out());
        assertEquals("[line 1] Error: Unexpected character: $\n", err());
    }

    @Test
    void parse() {
        assertEquals(Lox.EXIT_OK, lox("").parse("1 + 2"));
        assertEquals("(+ 1.0 2.0)\n", out());
    }

    @Test
    void parseError() {
        assertEquals(Lox.EXIT_DATA_ERROR, lox("").parse("(1"));
        assertEquals("", out());
        assertEquals("[line 1] Error at the end: Expect ')' after expression.\n", err());
    }

    @Test
    void evaluate() {
        assertEquals(Lox.EXIT_OK, lox("").evaluate("\"hello\" + \" world\""));
        assertEquals("hello world\n", out());
    }

    @Test
    void evaluateTypeError() {
        assertEquals(Lox.EXIT_SOFTWARE, lox("").evaluate("1 + \"a\""));
        assertEquals("\n", out());
        assertTrue(err().startsWith("[line 1] Error at '+': Incompatible types"));
    }

    @Test
    void executeReadsFile() throws IOException {
        var file = tempDir.resolve("test.lox");
        Files.writeString(file, "(2/3)+(2*3)");
        assertEquals(Lox.EXIT_OK, lox("").execute("evaluate", file.toString()));
        assertEquals("6.666666666666667\n", out());
    }

    @Test
    void executeReadsStdin() {
        assertEquals(Lox.EXIT_OK, lox("!true").execute("evaluate", "-"));
        assertEquals("false\n", out());
    }

    @Test
    void executeMissingFile() {
        var missing = tempDir.resolve("missing.lox").toString();
        assertEquals(Lox.EXIT_NO_INPUT, lox("").execute("parse", missing));
    }

    @Test
    void usage() {
        assertEquals(Lox.EXIT_USAGE, lox("").execute("tokenize"));
        assertEquals(Lox.EXIT_USAGE, lox("").execute("compile", "-"));
        assertTrue(err().contains("Unknown command: compile"));
    }

    @Test
    void prompt() {
        assertEquals(Lox.EXIT_OK, lox("1 + 2\n:ast true\n-3\n$\n:q\n4\n").execute());
        assertEquals("> 3.0\n> print ast: true\n> (- 3.0)\n-3.0\n> > ", out());
        assertEquals(
            "[line 1] Error: Unexpected character: $\n[line 1] Error at the end: Expect expression.\n",
            err());
    }

    @Test
    void promptPrintsTokens() {
        assertEquals(Lox.EXIT_OK, lox(":tok\n:tok true\n1\n:tok false\n2\n").execute());
        assertEquals(
            "> print tokens: false\n"
                + "> print tokens: true\n"
                + "> NUMBER 1 1.0\nEOF  null\n1.0\n"
                + "> print tokens: false\n"
                + "> 2.0\n"
                + "> ",
            out());
        assertEquals("", err());
    }
}

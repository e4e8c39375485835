package lox.lang;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Collects lexical and syntax errors for one run. The same instance is handed to
 * the {@link Scanner} and the {@link Parser} so that {@link #hadError()} covers
 * both stages.
 */
public final class Reporter {

    @Getter
    private final List<String> errors = new ArrayList<>();

    public boolean hadError() {
        return !errors.isEmpty();
    }

    void error(int line, String message) {
        report(line, "", message);
    }

    void error(Token token, String message) {
        if (token.type() == Token.Type.EOF) {
            report(token.line(), " at the end", message);
        } else {
            report(token.line(), " at '" + token.lexeme() + "'", message);
        }
    }

    private void report(int line, String where, String message) {
        errors.add("[line " + line + "] Error" + where + ": " + message);
    }
}

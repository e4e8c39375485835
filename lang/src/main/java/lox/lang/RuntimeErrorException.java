package lox.lang;

import lombok.Getter;

/**
 * Raised while evaluating an expression whose operator does not accept the types of
 * its operands. Caught at the {@link Interpreter#evaluate(Expr)} boundary.
 */
public class RuntimeErrorException extends RuntimeException {
    @Getter
    private final Token token;

    RuntimeErrorException(Token token, String message) {
        super(message);
        this.token = token;
    }

    Interpreter.Message asMessage() {
        return new Interpreter.Message(getMessage(), token);
    }
}

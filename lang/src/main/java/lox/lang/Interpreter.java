package lox.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

final class Interpreter {

    public record Message(String message, Token token) {
        @Override
        public String toString() {
            return "[line " + token.line() + "] Error at '" + token.lexeme() + "': " + message;
        }
    }

    @Getter
    private final List<Message> errors = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Evaluates a tree to its value. The result is empty for the placeholder literal
     * and when an operator met operands of the wrong type; the latter also records a
     * {@link Message}. {@code nil} evaluates to {@link Value.Nil}, never to empty.
     */
    public Optional<Value> evaluate(Expr expr) {
        try {
            return Optional.ofNullable(eval(expr));
        } catch (RuntimeErrorException ex) {
            errors.add(ex.asMessage());
            return Optional.empty();
        }
    }

    private Value eval(Expr node) {
        if (node instanceof Expr.Literal literal) {
            return literal.value();
        }

        if (node instanceof Expr.Grouping grouping) {
            return eval(grouping.expression());
        }

        if (node instanceof Expr.Unary unary) {
            return evaluateUnaryExpr(unary);
        }

        if (node instanceof Expr.Binary binary) {
            return evaluateBinaryExpr(binary);
        }

        var nodeClazz = node != null ? node.getClass() : null;
        throw new IllegalArgumentException("unsupported expression: " + nodeClazz);
    }

    private Value evaluateUnaryExpr(Expr.Unary unary) {
        var right = eval(unary.right());
        if (right == null) {
            return null;
        }

        var operator = unary.operator();
        switch (operator.type()) {
            case MINUS:
                if (right instanceof Value.Num num) {
                    return Value.of(-num.value());
                }
                throw new RuntimeErrorException(operator, "Operand must be a number, got " + describe(right));
            case BANG:
                if (right instanceof Value.Bool bool) {
                    return Value.of(!bool.value());
                }
                throw new RuntimeErrorException(operator, "Operand must be a boolean, got " + describe(right));
            default:
                throw new RuntimeErrorException(operator, "Unsupported unary operator.");
        }
    }

    private Value evaluateBinaryExpr(Expr.Binary binary) {
        var left = eval(binary.left());
        var right = eval(binary.right());
        if (left == null || right == null) {
            return null;
        }

        var operator = binary.operator();
        checkCompatible(operator, left, right);

        switch (operator.type()) {
            case BANG_EQUAL:
                return Value.of(!Value.equal(left, right));
            case EQUAL_EQUAL:
                return Value.of(Value.equal(left, right));
            case PLUS:
                if (left instanceof Value.Str a && right instanceof Value.Str b) {
                    return Value.of(a.value() + b.value());
                }
                return Value.of(number(left) + number(right));
            case MINUS:
                return Value.of(number(left) - number(right));
            case SLASH:
                return Value.of(number(left) / number(right));
            case STAR:
                return Value.of(number(left) * number(right));
            case GREATER:
                return Value.of(number(left) > number(right));
            case GREATER_EQUAL:
                return Value.of(number(left) >= number(right));
            case LESS:
                return Value.of(number(left) < number(right));
            case LESS_EQUAL:
                return Value.of(number(left) <= number(right));
            default:
                throw new IllegalStateException("unreachable: " + operator.type());
        }
    }

    // **** UTILITIES ****

    private static void checkCompatible(Token operator, Value left, Value right) {
        if (!isCompatible(operator.type(), left, right)) {
            throw new RuntimeErrorException(operator,
                "Incompatible types for operator '" + operator.lexeme() + "': "
                    + describe(left) + ", " + describe(right));
        }
    }

    private static boolean isCompatible(Token.Type operator, Value left, Value right) {
        var numbers = left instanceof Value.Num && right instanceof Value.Num;
        switch (operator) {
            case PLUS:
                return numbers || (left instanceof Value.Str && right instanceof Value.Str);
            case MINUS:
            case SLASH:
            case STAR:
            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return numbers;
            case BANG_EQUAL:
            case EQUAL_EQUAL:
                return true;
            default:
                return false;
        }
    }

    private static double number(Value value) {
        return ((Value.Num) value).value();
    }

    private static String describe(Value value) {
        var text = value instanceof Value.Str str ? "\"" + str.value() + "\"" : value.display();
        return value.typeName() + " " + text;
    }
}

package lox.lang;

import lombok.NonNull;

/**
 * Expression tree produced by the {@link Parser}. Consumers dispatch over the four
 * node types with {@code instanceof} patterns.
 */
sealed interface Expr {

    /**
     * A literal value; {@code value} is null for the placeholder the parser returns
     * after an unrecoverable syntax error.
     */
    record Literal(Value value) implements Expr {}

    record Grouping(@NonNull Expr expression) implements Expr {}

    record Unary(@NonNull Token operator, @NonNull Expr right) implements Expr {}

    record Binary(@NonNull Expr left, @NonNull Token operator, @NonNull Expr right) implements Expr {}
}

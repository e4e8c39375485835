package lox.lang;

/**
 * Renders a tree in fully parenthesized prefix form, e.g. {@code (+ 1.0 (group 2.0))}.
 */
final class AstPrinter {

    String print(Expr expr) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value() != null ? literal.value().display() : "null";
        }

        if (expr instanceof Expr.Grouping grouping) {
            return parenthesize("group", grouping.expression());
        }

        if (expr instanceof Expr.Unary unary) {
            return parenthesize(unary.operator().lexeme(), unary.right());
        }

        if (expr instanceof Expr.Binary binary) {
            return parenthesize(binary.operator().lexeme(), binary.left(), binary.right());
        }

        throw new IllegalArgumentException("unsupported expression: " + expr);
    }

    private String parenthesize(String name, Expr... exprs) {
        var builder = new StringBuilder();
        builder.append('(').append(name);
        for (var expr : exprs) {
            builder.append(' ').append(print(expr));
        }
        builder.append(')');
        return builder.toString();
    }
}

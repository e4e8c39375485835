package lox.lang;

import java.math.BigDecimal;

import lombok.NonNull;

/**
 * A runtime value: the literal carried by a token, or the result of evaluating an
 * expression.
 */
sealed interface Value {

    /**
     * Renders the value the way a Lox user sees it.
     */
    String display();

    /**
     * Short name of the value's type, for diagnostics.
     */
    String typeName();

    static Value of(String text) {
        return new Str(text);
    }

    static Value of(double number) {
        return new Num(number);
    }

    static Value of(boolean bool) {
        return bool ? Bool.TRUE : Bool.FALSE;
    }

    /**
     * Structural equality across all value types. Values of different types are
     * never equal; numbers compare with {@code ==}, so {@code NaN} is not equal to
     * itself and {@code 0.0} equals {@code -0.0}.
     */
    static boolean equal(Value a, Value b) {
        if (a instanceof Num x && b instanceof Num y) {
            return x.value() == y.value();
        }
        return a != null && a.equals(b);
    }

    record Str(@NonNull String value) implements Value {
        @Override
        public String display() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    record Num(double value) implements Value {
        @Override
        public String display() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            var text = Double.toString(value);
            if (text.indexOf('E') < 0) {
                return text;
            }
            // no exponent notation
            text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
            return text.indexOf('.') < 0 ? text + ".0" : text;
        }

        @Override
        public String typeName() {
            return "number";
        }
    }

    record Bool(boolean value) implements Value {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public String display() {
            return Boolean.toString(value);
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record Nil() implements Value {
        static final Nil INSTANCE = new Nil();

        @Override
        public String display() {
            return "nil";
        }

        @Override
        public String typeName() {
            return "nil";
        }
    }
}

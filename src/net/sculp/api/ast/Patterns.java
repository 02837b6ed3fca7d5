package net.sculp.api.ast;

import java.util.List;

/**
 * Expressions matching message content.
 */
public final class Patterns {

    public static class Wildcard extends Expression {

        public Wildcard() {
            super(Kind.WILDCARD);
        }

        public String toString() {
            return "*";
        }

        public boolean equals(Object other) {
            return (other instanceof Wildcard);
        }

        public int hashCode() {
            return getKind().hashCode();
        }

        protected void visitChildren(ChildVisitor v) {
            /* No children */
        }

    }

    /**
     * A double-quoted string.
     * The value is kept verbatim (backslash escapes included), so that
     * rendering reproduces the source text.
     */
    public static class StringLiteral extends Expression {

        private final String value;

        public StringLiteral(String value) {
            super(Kind.STRING);
            if (value == null)
                throw new NullPointerException(
                    "String value may not be null");
            this.value = value;
        }

        public String toString() {
            return '"' + value + '"';
        }

        public boolean equals(Object other) {
            if (! (other instanceof StringLiteral)) return false;
            return value.equals(((StringLiteral) other).getValue());
        }

        public int hashCode() {
            return getKind().hashCode() ^ value.hashCode();
        }

        public String getValue() {
            return value;
        }

        protected void visitChildren(ChildVisitor v) {
            /* No children */
        }

    }

    public static class Concat extends NaryExpression {

        public Concat(List<? extends Expression> parts) {
            super(Kind.PATTERN_CONCAT, parts);
        }
        public Concat(Expression left, Expression right) {
            super(Kind.PATTERN_CONCAT, left, right);
        }

        protected String getSeparator() {
            return " . ";
        }

        protected int getPrecedence() {
            return PREC_CONCAT;
        }

    }

    public static class And extends NaryExpression {

        public And(List<? extends Expression> operands) {
            super(Kind.PATTERN_AND, operands);
        }
        public And(Expression left, Expression right) {
            super(Kind.PATTERN_AND, left, right);
        }

        protected String getSeparator() {
            return " & ";
        }

        protected int getPrecedence() {
            return PREC_AND;
        }

    }

    public static class Or extends NaryExpression {

        public Or(List<? extends Expression> operands) {
            super(Kind.PATTERN_OR, operands);
        }
        public Or(Expression left, Expression right) {
            super(Kind.PATTERN_OR, left, right);
        }

        protected String getSeparator() {
            return " v ";
        }

        protected int getPrecedence() {
            return PREC_OR;
        }

    }

    // Prevent construction.
    private Patterns() {}

}

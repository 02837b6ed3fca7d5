package net.sculp.api.ast;

/**
 * Leaf helpers that belong to no family.
 */
public final class Terms {

    /**
     * The identifier of a space, as written after "@".
     */
    public static class SpacePath extends Expression {

        private Expression path;

        public SpacePath(Expression path) {
            super(Kind.SPACE_PATH);
            this.path = checkChild(path, "Space path");
        }

        public String toString() {
            return "@ " + path;
        }

        public boolean equals(Object other) {
            if (! (other instanceof SpacePath)) return false;
            return path.equals(((SpacePath) other).getPath());
        }

        public int hashCode() {
            return getKind().hashCode() ^ path.hashCode();
        }

        public Expression getPath() {
            return path;
        }
        public void setPath(Expression p) {
            path = checkChild(p, "Space path");
        }

        protected void visitChildren(ChildVisitor v) {
            path = v.visit(path);
        }

    }

    public static class Identifier extends Expression {

        private final String name;

        public Identifier(String name) {
            super(Kind.IDENTIFIER);
            if (name == null)
                throw new NullPointerException(
                    "Identifier name may not be null");
            this.name = name;
        }

        public String toString() {
            return name;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Identifier)) return false;
            return name.equals(((Identifier) other).getName());
        }

        public int hashCode() {
            return getKind().hashCode() ^ name.hashCode();
        }

        public String getName() {
            return name;
        }

        protected void visitChildren(ChildVisitor v) {
            /* No children */
        }

    }

    public static class Number extends Expression {

        private final long value;

        public Number(long value) {
            super(Kind.NUMBER);
            this.value = value;
        }

        public String toString() {
            return Long.toString(value);
        }

        public boolean equals(Object other) {
            if (! (other instanceof Number)) return false;
            return value == ((Number) other).getValue();
        }

        public int hashCode() {
            return (int) (value ^ value >>> 32);
        }

        public long getValue() {
            return value;
        }

        protected void visitChildren(ChildVisitor v) {
            /* No children */
        }

    }

    // Prevent construction.
    private Terms() {}

}

package net.sculp.api.ast;

/**
 * Statements introduced by a keyword.
 */
public final class Instructions {

    /**
     * Common base of enter and exit.
     */
    public abstract static class Scoped extends Expression {

        private Expression space;
        private Expression body;

        protected Scoped(Kind kind, Expression space, Expression body) {
            super(kind);
            this.space = checkChild(space, "Space");
            this.body = checkChild(body, "Body");
        }

        protected abstract String getKeyword();

        public String toString() {
            return getKeyword() + " " + space + " do " + renderBody(body);
        }

        public boolean equals(Object other) {
            if (! (other instanceof Scoped)) return false;
            Scoped so = (Scoped) other;
            return (getKind() == so.getKind() &&
                    space.equals(so.getSpace()) &&
                    body.equals(so.getBody()));
        }

        public int hashCode() {
            return getKind().hashCode() ^ space.hashCode() ^ body.hashCode();
        }

        public Expression getSpace() {
            return space;
        }
        public void setSpace(Expression s) {
            space = checkChild(s, "Space");
        }

        public Expression getBody() {
            return body;
        }
        public void setBody(Expression b) {
            body = checkChild(b, "Body");
        }

        protected void visitChildren(ChildVisitor v) {
            space = v.visit(space);
            body = v.visit(body);
        }

        protected boolean isOpenEnded() {
            return body.isOpenEnded();
        }

    }

    public static class Enter extends Scoped {

        public Enter(Expression space, Expression body) {
            super(Kind.ENTER, space, body);
        }

        protected String getKeyword() {
            return "enter";
        }

    }

    public static class Exit extends Scoped {

        public Exit(Expression space, Expression body) {
            super(Kind.EXIT, space, body);
        }

        protected String getKeyword() {
            return "exit";
        }

    }

    /**
     * Common base of the instructions consisting of a leading keyword, a
     * condition, a separating keyword, and a body.
     */
    public abstract static class Conditional extends Expression {

        private Expression condition;
        private Expression body;

        protected Conditional(Kind kind, Expression condition,
                              Expression body) {
            super(kind);
            this.condition = checkChild(condition, "Condition");
            this.body = checkChild(body, "Body");
        }

        protected abstract String getKeyword();

        protected abstract String getSeparator();

        public String toString() {
            return getKeyword() + " " + condition + " " + getSeparator() +
                " " + renderBody(body);
        }

        public boolean equals(Object other) {
            if (! (other instanceof Conditional)) return false;
            Conditional co = (Conditional) other;
            return (getKind() == co.getKind() &&
                    condition.equals(co.getCondition()) &&
                    body.equals(co.getBody()));
        }

        public int hashCode() {
            return getKind().hashCode() ^ condition.hashCode() ^
                body.hashCode();
        }

        public Expression getCondition() {
            return condition;
        }
        public void setCondition(Expression c) {
            condition = checkChild(c, "Condition");
        }

        public Expression getBody() {
            return body;
        }
        public void setBody(Expression b) {
            body = checkChild(b, "Body");
        }

        protected void visitChildren(ChildVisitor v) {
            condition = v.visit(condition);
            body = v.visit(body);
        }

        protected boolean isOpenEnded() {
            return body.isOpenEnded();
        }

    }

    public static class If extends Conditional {

        public If(Expression condition, Expression body) {
            super(Kind.IF, condition, body);
        }

        protected String getKeyword() {
            return "if";
        }

        protected String getSeparator() {
            return "then";
        }

    }

    public static class When extends Conditional {

        public When(Expression condition, Expression body) {
            super(Kind.WHEN, condition, body);
        }

        protected String getKeyword() {
            return "when";
        }

        protected String getSeparator() {
            return "do";
        }

    }

    public static class Whenever extends Conditional {

        public Whenever(Expression condition, Expression body) {
            super(Kind.WHENEVER, condition, body);
        }

        protected String getKeyword() {
            return "whenever";
        }

        protected String getSeparator() {
            return "do";
        }

    }

    public static class While extends Conditional {

        public While(Expression condition, Expression body) {
            super(Kind.WHILE, condition, body);
        }

        protected String getKeyword() {
            return "while";
        }

        protected String getSeparator() {
            return "do";
        }

    }

    public static class Unless extends Conditional {

        public Unless(Expression condition, Expression body) {
            super(Kind.UNLESS, condition, body);
        }

        protected String getKeyword() {
            return "unless";
        }

        protected String getSeparator() {
            return "next";
        }

    }

    /**
     * "do body until condition": the condition trails the body.
     */
    public static class Until extends Expression {

        private Expression body;
        private Expression condition;

        public Until(Expression body, Expression condition) {
            super(Kind.UNTIL);
            this.body = checkChild(body, "Body");
            this.condition = checkChild(condition, "Condition");
        }

        public String toString() {
            String b = (body.isOpenEnded()) ? "(" + body + ")" :
                body.toString();
            return "do " + b + " until " + condition;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Until)) return false;
            Until uo = (Until) other;
            return (body.equals(uo.getBody()) &&
                    condition.equals(uo.getCondition()));
        }

        public int hashCode() {
            return getKind().hashCode() ^ body.hashCode() ^
                condition.hashCode();
        }

        public Expression getBody() {
            return body;
        }
        public void setBody(Expression b) {
            body = checkChild(b, "Body");
        }

        public Expression getCondition() {
            return condition;
        }
        public void setCondition(Expression c) {
            condition = checkChild(c, "Condition");
        }

        protected void visitChildren(ChildVisitor v) {
            body = v.visit(body);
            condition = v.visit(condition);
        }

    }

    public static class Define extends Expression {

        private final String name;
        private Expression body;

        public Define(String name, Expression body) {
            super(Kind.DEFINE);
            if (name == null)
                throw new NullPointerException(
                    "Definition name may not be null");
            this.name = name;
            this.body = checkChild(body, "Body");
        }

        public String toString() {
            return "def " + name + " as " + body;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Define)) return false;
            Define dfo = (Define) other;
            return (name.equals(dfo.getName()) &&
                    body.equals(dfo.getBody()));
        }

        public int hashCode() {
            return getKind().hashCode() ^ name.hashCode() ^ body.hashCode();
        }

        public String getName() {
            return name;
        }

        public Expression getBody() {
            return body;
        }
        public void setBody(Expression b) {
            body = checkChild(b, "Body");
        }

        protected void visitChildren(ChildVisitor v) {
            body = v.visit(body);
        }

        protected boolean isOpenEnded() {
            return true;
        }

    }

    public static class Repeat extends Expression {

        private Expression body;

        public Repeat(Expression body) {
            super(Kind.REPEAT);
            this.body = checkChild(body, "Body");
        }

        public String toString() {
            return "repeat " + body;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Repeat)) return false;
            return body.equals(((Repeat) other).getBody());
        }

        public int hashCode() {
            return getKind().hashCode() ^ body.hashCode();
        }

        public Expression getBody() {
            return body;
        }
        public void setBody(Expression b) {
            body = checkChild(b, "Body");
        }

        protected void visitChildren(ChildVisitor v) {
            body = v.visit(body);
        }

        protected boolean isOpenEnded() {
            return true;
        }

    }

    // Prevent construction.
    private Instructions() {}

}

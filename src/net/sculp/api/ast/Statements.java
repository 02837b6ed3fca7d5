package net.sculp.api.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Executable processes that are not introduced by a keyword.
 */
public final class Statements {

    public static class Skip extends Expression {

        public Skip() {
            super(Kind.SKIP);
        }

        public String toString() {
            return "skip";
        }

        public boolean equals(Object other) {
            return (other instanceof Skip);
        }

        public int hashCode() {
            return getKind().hashCode();
        }

        protected void visitChildren(ChildVisitor v) {
            /* No children */
        }

    }

    /**
     * A call of an externally provided procedure.
     * The parser checks the parameters against the procedure's signature
     * when it creates the node; later modifications are not re-validated.
     */
    public static class Procedure extends Expression {

        private final String name;
        private final List<Expression> params;
        private final List<Expression> paramsView;

        public Procedure(String name, List<? extends Expression> params) {
            super(Kind.PROCEDURE);
            if (name == null)
                throw new NullPointerException(
                    "Procedure name may not be null");
            this.name = name;
            this.params = new ArrayList<Expression>();
            this.paramsView = Collections.unmodifiableList(this.params);
            for (Expression p : params) addParameter(p);
        }
        public Procedure(String name) {
            this(name, Collections.<Expression>emptyList());
        }

        public String toString() {
            if (params.isEmpty()) return name;
            return name + "(" + join(params, ", ") + ")";
        }

        public boolean equals(Object other) {
            if (! (other instanceof Procedure)) return false;
            Procedure po = (Procedure) other;
            return (name.equals(po.getName()) &&
                    params.equals(po.params));
        }

        public int hashCode() {
            return name.hashCode() ^ params.hashCode();
        }

        public String getName() {
            return name;
        }

        public List<Expression> getParameters() {
            return paramsView;
        }

        public void setParameter(int index, Expression param) {
            params.set(index, checkChild(param, "Procedure parameter"));
        }

        /**
         * Append a parameter.
         * Strings are wrapped into StringLiteral-s; Expression-s are
         * appended as they are; anything else is rejected with an
         * IllegalArgumentException.
         */
        public void addParameter(Object param) {
            if (param instanceof String) {
                params.add(new Patterns.StringLiteral((String) param));
            } else if (param instanceof Expression) {
                params.add((Expression) param);
            } else {
                String type = (param == null) ? "null" :
                    param.getClass().getName();
                throw new IllegalArgumentException("Parameter type " + type +
                    " is not String or Expression");
            }
        }

        protected void visitChildren(ChildVisitor v) {
            visitEach(params, v);
        }

    }

    /**
     * Statements running concurrently.
     * Rendered within parentheses so that the group can be embedded into
     * any other statement unambiguously.
     */
    public static class ParallelExecution extends NaryExpression {

        public ParallelExecution(List<? extends Expression> branches) {
            super(Kind.PARALLEL_EXECUTION, branches);
        }
        public ParallelExecution(Expression left, Expression right) {
            super(Kind.PARALLEL_EXECUTION, left, right);
        }

        public String toString() {
            return "(" + super.toString() + ")";
        }

        protected String getSeparator() {
            return " || ";
        }

        protected int getPrecedence() {
            return PREC_PARALLEL;
        }

    }

    /**
     * Statements running one after another.
     * A prefix "next s" is represented as the sequence (skip, s).
     */
    public static class SequentialExecution extends NaryExpression {

        public SequentialExecution(List<? extends Expression> steps) {
            super(Kind.SEQUENTIAL_EXECUTION, steps);
        }
        public SequentialExecution(Expression left, Expression right) {
            super(Kind.SEQUENTIAL_EXECUTION, left, right);
        }

        protected String getSeparator() {
            return " next ";
        }

        protected int getPrecedence() {
            return PREC_SEQUENCE;
        }

    }

    // Prevent construction.
    private Statements() {}

}

package net.sculp.api.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boolean conditions over messages.
 */
public final class Constraints {

    /**
     * A single message field matched against a pattern.
     */
    public static class Match extends Expression {

        private final String field;
        private Expression pattern;

        public Match(String field, Expression pattern) {
            super(Kind.MATCH);
            if (field == null)
                throw new NullPointerException(
                    "Match field may not be null");
            this.field = field;
            this.pattern = checkChild(pattern, "Match pattern");
        }

        public String toString() {
            return field + ": " + pattern;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Match)) return false;
            Match mo = (Match) other;
            return (field.equals(mo.getField()) &&
                    pattern.equals(mo.getPattern()));
        }

        public int hashCode() {
            return field.hashCode() ^ pattern.hashCode();
        }

        public String getField() {
            return field;
        }

        public Expression getPattern() {
            return pattern;
        }
        public void setPattern(Expression p) {
            pattern = checkChild(p, "Match pattern");
        }

        protected void visitChildren(ChildVisitor v) {
            pattern = v.visit(pattern);
        }

    }

    /**
     * A set of field matches that must hold together.
     * Field names are unique; adding a match for a field that is already
     * present replaces the previous one (retaining its position).
     */
    public static class MatchList extends Expression {

        private final Map<String, Expression> matches;

        public MatchList() {
            super(Kind.MATCH_LIST);
            matches = new LinkedHashMap<String, Expression>();
        }
        public MatchList(List<Match> items) {
            this();
            for (Match m : items) put(m);
        }

        public String toString() {
            if (matches.isEmpty()) return "{}";
            return "{ " + join(getMatches(), ", ") + " }";
        }

        public boolean equals(Object other) {
            if (! (other instanceof MatchList)) return false;
            return matches.equals(((MatchList) other).matches);
        }

        public int hashCode() {
            return getKind().hashCode() ^ matches.hashCode();
        }

        public void put(Match m) {
            checkChild(m, "MatchList entry");
            matches.put(m.getField(), m);
        }

        public Expression get(String field) {
            return matches.get(field);
        }

        public List<String> getFields() {
            return Collections.unmodifiableList(
                new ArrayList<String>(matches.keySet()));
        }

        /**
         * The entries of this list, in insertion order.
         * Entries are Match instances unless a patch() replaced them.
         */
        public List<Expression> getMatches() {
            return Collections.unmodifiableList(
                new ArrayList<Expression>(matches.values()));
        }

        protected void visitChildren(ChildVisitor v) {
            for (Map.Entry<String, Expression> ent : matches.entrySet()) {
                ent.setValue(v.visit(ent.getValue()));
            }
        }

    }

    /**
     * A constraint group starting with a pattern is only flattened into
     * the front of another one; elsewhere, its leading patterns would be
     * parsed as a single pattern group when rendered without parentheses.
     */
    private static boolean absorbsGroup(NaryExpression operand,
                                        int position) {
        return (position == 0 ||
                ! operand.getMembers().get(0).isA(Family.PATTERN));
    }

    public static class And extends NaryExpression {

        public And(List<? extends Expression> operands) {
            super(Kind.LOGICAL_AND, operands);
        }
        public And(Expression left, Expression right) {
            super(Kind.LOGICAL_AND, left, right);
        }

        protected boolean absorbs(NaryExpression operand, int position) {
            return absorbsGroup(operand, position);
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
            super(Kind.LOGICAL_OR, operands);
        }
        public Or(Expression left, Expression right) {
            super(Kind.LOGICAL_OR, left, right);
        }

        protected boolean absorbs(NaryExpression operand, int position) {
            return absorbsGroup(operand, position);
        }

        protected String getSeparator() {
            return " v ";
        }

        protected int getPrecedence() {
            return PREC_OR;
        }

    }

    // Prevent construction.
    private Constraints() {}

}

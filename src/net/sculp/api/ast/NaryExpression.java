package net.sculp.api.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An expression combining at least two members with the same operator.
 * Operands of the same kind as the expression being constructed are
 * flattened into it (one level deep, which suffices as they are flat
 * themselves), so that "a || b || c" yields a single three-member node.
 */
public abstract class NaryExpression extends Expression {

    /* Relative binding strengths of the operators. */
    protected static final int PREC_SEQUENCE = 0;
    protected static final int PREC_PARALLEL = 1;
    protected static final int PREC_OR = 2;
    protected static final int PREC_AND = 3;
    protected static final int PREC_CONCAT = 4;

    private final List<Expression> members;
    private final List<Expression> membersView;

    protected NaryExpression(Kind kind, List<? extends Expression> operands) {
        super(kind);
        members = new ArrayList<Expression>();
        membersView = Collections.unmodifiableList(members);
        int position = 0;
        for (Expression op : operands) {
            checkChild(op, kind.getName() + " member");
            if (op.getKind() == kind &&
                    absorbs((NaryExpression) op, position)) {
                members.addAll(((NaryExpression) op).getMembers());
            } else {
                members.add(op);
            }
            position++;
        }
        if (members.size() < 2)
            throw new IllegalArgumentException(kind.getName() +
                " requires at least two members, got " + members.size());
    }
    protected NaryExpression(Kind kind, Expression left, Expression right) {
        this(kind, Arrays.asList(left, right));
    }

    /**
     * Whether an operand of this expression's own kind at the given
     * (0-based) position is flattened into it.
     * Invoked during construction; must not depend on instance state.
     */
    protected boolean absorbs(NaryExpression operand, int position) {
        return true;
    }

    /**
     * The text placed between two adjacent members when rendering.
     */
    protected abstract String getSeparator();

    /**
     * How tightly this operator binds (see the PREC_* constants).
     * Members binding less tightly than their parent are parenthesized.
     */
    protected abstract int getPrecedence();

    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < members.size(); i++) {
            Expression m = members.get(i);
            if (i != 0) sb.append(getSeparator());
            boolean last = (i == members.size() - 1);
            if (needsGrouping(m, i) || (! last && m.isOpenEnded())) {
                sb.append('(').append(m).append(')');
            } else {
                sb.append(m);
            }
        }
        return sb.toString();
    }

    /**
     * Whether the member at the given position must be parenthesized.
     * Weaker operators always are; a later member using the same operator
     * (which can only be one that was not flattened, or a pattern group
     * inside a constraint group) is as well.
     */
    private boolean needsGrouping(Expression member, int position) {
        if (! (member instanceof NaryExpression)) return false;
        NaryExpression nm = (NaryExpression) member;
        if (nm.getPrecedence() < getPrecedence()) return true;
        return (position != 0 &&
                nm.getSeparator().equals(getSeparator()));
    }

    public boolean equals(Object other) {
        if (! (other instanceof NaryExpression)) return false;
        NaryExpression no = (NaryExpression) other;
        return (getKind() == no.getKind() &&
                members.equals(no.members));
    }

    public int hashCode() {
        return getKind().hashCode() ^ members.hashCode();
    }

    /**
     * An immutable view of the members, in source order.
     */
    public List<Expression> getMembers() {
        return membersView;
    }

    protected void visitChildren(ChildVisitor v) {
        visitEach(members, v);
    }

}

package net.sculp.api.ast;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * A node of a SCULP syntax tree.
 * Every node has a Kind (which never changes during the node's lifetime), a
 * canonical textual form (returned by toString(); parsing it again yields an
 * equal tree), and a fixed set of child fields, each holding either a single
 * Expression or an ordered list of them.
 * Syntax trees are pure trees: a node must not be the child of more than one
 * parent, and cyclic trees make traverse() and patch() diverge.
 */
public abstract class Expression {

    /**
     * Callback interface for traverse().
     */
    public interface Traverser<C> {

        /**
         * Visit the given node.
         * The returned Step determines whether (and with which context)
         * the node's children are visited.
         */
        Step<C> visit(Expression expr, C context);

    }

    /**
     * The outcome of a Traverser invocation.
     */
    public static final class Step<C> {

        private static final Step<Object> STOP = new Step<Object>(null, true);

        private final C context;
        private final boolean stop;

        private Step(C context, boolean stop) {
            this.context = context;
            this.stop = stop;
        }

        public String toString() {
            return (stop) ? "Step.stop()" : "Step.into(" + context + ")";
        }

        public C getContext() {
            return context;
        }

        public boolean isStop() {
            return stop;
        }

        /**
         * Visit the children of the current node with the given context.
         */
        public static <C> Step<C> into(C context) {
            return new Step<C>(context, false);
        }

        /**
         * Do not visit the children of the current node.
         */
        @SuppressWarnings("unchecked")
        public static <C> Step<C> stop() {
            return (Step<C>) STOP;
        }

    }

    /**
     * Callback interface for patch().
     */
    public interface Patcher {

        /**
         * Return the expression that should replace expr.
         * Returning expr itself leaves the tree unchanged at this point.
         */
        Expression patch(Expression expr);

    }

    /**
     * Callback interface for applyTo().
     */
    public interface Action {

        void apply(Expression expr);

    }

    /**
     * Receives each child of a node and returns what the child field should
     * hold afterwards.
     */
    protected interface ChildVisitor {

        Expression visit(Expression child);

    }

    private final Kind kind;

    protected Expression(Kind kind) {
        if (kind == null)
            throw new NullPointerException("Expression kind may not be null");
        this.kind = kind;
    }

    public abstract String toString();

    public abstract boolean equals(Object other);

    public abstract int hashCode();

    public Kind getKind() {
        return kind;
    }

    /**
     * Test whether this expression belongs to the given variant.
     */
    public boolean isA(Variant variant) {
        return variant.includes(kind);
    }

    /**
     * Pass each child of this node to v, in declaration order, and store
     * the value v returns in place of the child.
     */
    protected abstract void visitChildren(ChildVisitor v);

    /**
     * Whether the rendering of this node ends with a statement that would
     * absorb a following "||" or "next" when parsed again.
     */
    protected boolean isOpenEnded() {
        return false;
    }

    /**
     * Visit this node and (recursively) its descendants in depth-first
     * pre-order.
     * fn is invoked with this node and context. If it returns
     * Step.stop(), this node's children are not visited; otherwise, each
     * child is traversed with the context carried by the returned Step.
     * fn may modify the children of the node it receives, but the children
     * it installs are the ones that are visited subsequently.
     */
    public <C> void traverse(final Traverser<C> fn, C context) {
        Step<C> step = fn.visit(this, context);
        if (step == null)
            throw new NullPointerException("Traversal step may not be null");
        if (step.isStop()) return;
        final C childContext = step.getContext();
        visitChildren(new ChildVisitor() {
            public Expression visit(Expression child) {
                child.traverse(fn, childContext);
                return child;
            }
        });
    }

    /**
     * Invoke action on every node of this tree that belongs to any of the
     * given variants.
     */
    public void applyTo(final Collection<? extends Variant> variants,
                        final Action action) {
        traverse(new Traverser<Void>() {
            public Step<Void> visit(Expression expr, Void context) {
                for (Variant v : variants) {
                    if (expr.isA(v)) {
                        action.apply(expr);
                        break;
                    }
                }
                return Step.into(null);
            }
        }, null);
    }
    public void applyTo(Variant variant, Action action) {
        applyTo(Collections.singleton(variant), action);
    }

    /**
     * Rewrite this tree.
     * fn is invoked on this node first; then every child of the node fn
     * returned is patched in turn and replaced with the result. The node
     * returned by fn is returned. fn may return a node of a different kind;
     * the children of the replacement are patched as well (hence, fn must
     * not wrap its argument into a new node unconditionally).
     */
    public Expression patch(final Patcher fn) {
        Expression ret = fn.patch(this);
        if (ret == null)
            throw new NullPointerException("Patch result may not be null");
        ret.visitChildren(new ChildVisitor() {
            public Expression visit(Expression child) {
                return child.patch(fn);
            }
        });
        return ret;
    }

    protected static void visitEach(List<Expression> children,
                                    ChildVisitor v) {
        ListIterator<Expression> it = children.listIterator();
        while (it.hasNext()) it.set(v.visit(it.next()));
    }

    protected static String join(List<? extends Expression> items,
                                 String separator) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Expression e : items) {
            if (first) {
                first = false;
            } else {
                sb.append(separator);
            }
            sb.append(e);
        }
        return sb.toString();
    }

    /**
     * Render a statement that is parsed as the body of a keyword
     * instruction; sequences need parentheses there, as "next" binds less
     * tightly than such bodies.
     */
    protected static String renderBody(Expression body) {
        if (body.getKind() == Kind.SEQUENTIAL_EXECUTION)
            return "(" + body + ")";
        return body.toString();
    }

    protected static Expression checkChild(Expression child, String what) {
        if (child == null)
            throw new NullPointerException(what + " may not be null");
        return child;
    }

}

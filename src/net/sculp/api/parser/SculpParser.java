package net.sculp.api.parser;

import java.util.Collection;
import net.sculp.api.ast.Expression;
import net.sculp.api.ast.Variant;

/**
 * A holder for a parsed syntax tree.
 * This forwards the tree operations of Expression to the held root; patch()
 * additionally replaces the root with the patched one.
 * ParserFactory provides methods for creating instances.
 */
public class SculpParser {

    private Expression result;

    public SculpParser(Expression result) {
        if (result == null)
            throw new NullPointerException("Parse result may not be null");
        this.result = result;
    }

    /**
     * The canonical textual form of the held tree.
     */
    public String toString() {
        return result.toString();
    }

    /**
     * The root of the held tree.
     */
    public Expression getResult() {
        return result;
    }

    /**
     * Traverse the held tree.
     * See Expression.traverse() for details.
     */
    public <C> void traverse(Expression.Traverser<C> fn, C context) {
        result.traverse(fn, context);
    }

    /**
     * Apply action to every node of the held tree that is of one of the
     * given variants.
     */
    public void applyTo(Collection<? extends Variant> variants,
                        Expression.Action action) {
        result.applyTo(variants, action);
    }
    public void applyTo(Variant variant, Expression.Action action) {
        result.applyTo(variant, action);
    }

    /**
     * Rewrite the held tree and store the new root.
     * See Expression.patch() for details.
     */
    public void patch(Expression.Patcher fn) {
        result = result.patch(fn);
    }

}

package net.sculp.api.ast;

import net.sculp.api.NamedValue;

/**
 * A set of expression kinds.
 * Each Kind is a Variant containing only itself; each Family is a Variant
 * containing the kinds belonging to it (and to its subfamilies). Variants are
 * used to restrict which expressions a grammar position accepts and to type
 * the parameters of procedure signatures.
 */
public interface Variant extends NamedValue {

    /**
     * Test whether the given kind belongs to this variant.
     */
    boolean includes(Kind kind);

}

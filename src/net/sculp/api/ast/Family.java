package net.sculp.api.ast;

import java.util.Locale;

/**
 * Capability groups of expression kinds.
 */
public enum Family implements Variant {

    /** Expressions matching message content. */
    PATTERN("Pattern", null),
    /** Boolean conditions over messages. */
    CONSTRAINT("Constraint", null),
    /** Executable processes. */
    STATEMENT("Statement", null),
    /** Statements introduced by a keyword; a subset of STATEMENT. */
    INSTRUCTION("Instruction", STATEMENT);

    private final String name;
    private final Family parent;

    private Family(String name, Family parent) {
        this.name = name;
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    /**
     * The family this one is a subset of, or null.
     */
    public Family getParent() {
        return parent;
    }

    public boolean includes(Kind kind) {
        for (Family f = kind.getFamily(); f != null; f = f.getParent()) {
            if (f == this) return true;
        }
        return false;
    }

    /**
     * Look up a family by its (case-insensitive) name, or return null.
     */
    public static Family forName(String name) {
        for (Family f : values()) {
            if (f.getName().toLowerCase(Locale.ROOT).equals(
                    name.toLowerCase(Locale.ROOT)))
                return f;
        }
        return null;
    }

}

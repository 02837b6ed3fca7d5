package net.sculp.api.ast;

/**
 * The closed set of expression variants.
 * Every concrete Expression class reports exactly one of these; the name of
 * a kind is what diagnostics and signature tables refer to it by.
 */
public enum Kind implements Variant {

    WILDCARD("Wildcard", Family.PATTERN),
    STRING("String", Family.PATTERN, "StringLiteral"),
    PATTERN_CONCAT("PatternConcat", Family.PATTERN),
    PATTERN_AND("PatternAnd", Family.PATTERN),
    PATTERN_OR("PatternOr", Family.PATTERN),

    MATCH("Match", Family.CONSTRAINT),
    MATCH_LIST("MatchList", Family.CONSTRAINT),
    LOGICAL_AND("LogicalAnd", Family.CONSTRAINT),
    LOGICAL_OR("LogicalOr", Family.CONSTRAINT),

    SKIP("Skip", Family.STATEMENT),
    PROCEDURE("Procedure", Family.STATEMENT),
    PARALLEL_EXECUTION("ParallelExecution", Family.STATEMENT),
    SEQUENTIAL_EXECUTION("SequentialExecution", Family.STATEMENT),

    ENTER("Enter", Family.INSTRUCTION),
    EXIT("Exit", Family.INSTRUCTION),
    DEFINE("Define", Family.INSTRUCTION),
    IF("If", Family.INSTRUCTION),
    WHEN("When", Family.INSTRUCTION),
    WHENEVER("Whenever", Family.INSTRUCTION),
    WHILE("While", Family.INSTRUCTION),
    UNTIL("Until", Family.INSTRUCTION),
    UNLESS("Unless", Family.INSTRUCTION),
    REPEAT("Repeat", Family.INSTRUCTION),

    SPACE_PATH("SpacePath", null),
    IDENTIFIER("Identifier", null),
    NUMBER("Number", null);

    private final String name;
    private final Family family;
    private final String[] aliases;

    private Kind(String name, Family family, String... aliases) {
        this.name = name;
        this.family = family;
        this.aliases = aliases;
    }

    public String getName() {
        return name;
    }

    /**
     * The innermost family this kind belongs to, or null for leaf helpers.
     */
    public Family getFamily() {
        return family;
    }

    public boolean includes(Kind kind) {
        return kind == this;
    }

    private boolean isCalled(String name) {
        if (this.name.equalsIgnoreCase(name)) return true;
        for (String a : aliases) {
            if (a.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    /**
     * Look up a kind by its (case-insensitive) name or one of its aliases
     * (such as StringLiteral for String), or return null.
     */
    public static Kind forName(String name) {
        for (Kind k : values()) {
            if (k.isCalled(name)) return k;
        }
        return null;
    }

}

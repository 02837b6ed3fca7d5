package net.sculp.api.parser;

/**
 * Exception thrown when an argument of a procedure call is not of the kind
 * the procedure's signature requires at its position.
 */
public class ParameterTypeException extends LocatedParserException {

    private final String procedure;
    private final int position;

    public ParameterTypeException(TextLocation pos, String procedure,
                                  int position, String message) {
        super(pos, message);
        this.procedure = procedure;
        this.position = position;
    }

    /**
     * The name of the procedure whose call was rejected.
     */
    public String getProcedure() {
        return procedure;
    }

    /**
     * The 1-based position of the offending argument.
     */
    public int getPosition() {
        return position;
    }

}

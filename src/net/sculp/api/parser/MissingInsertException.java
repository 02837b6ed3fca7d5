package net.sculp.api.parser;

/**
 * Exception thrown when a template placeholder has no corresponding entry in
 * the insert table.
 */
public class MissingInsertException extends LocatedParserException {

    private final String placeholder;

    public MissingInsertException(TextLocation pos, String placeholder) {
        super(pos, "Insert for placeholder '" + placeholder +
              "' not found.");
        this.placeholder = placeholder;
    }

    public String getPlaceholder() {
        return placeholder;
    }

}

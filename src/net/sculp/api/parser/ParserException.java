package net.sculp.api.parser;

/**
 * Generic superclass for checked exceptions of the SCULP front end.
 * Parsing is all-or-nothing: whenever one of these is thrown, no partial
 * syntax tree is produced.
 */
public class ParserException extends Exception {

    public ParserException() {
        super();
    }
    public ParserException(String message) {
        super(message);
    }
    public ParserException(Throwable cause) {
        super(cause);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}

package net.sculp.api.parser;

/**
 * Exception thrown when a signature table definition is malformed.
 */
public class InvalidSignatureException extends ParserException {

    public InvalidSignatureException() {
        super();
    }
    public InvalidSignatureException(String message) {
        super(message);
    }
    public InvalidSignatureException(Throwable cause) {
        super(cause);
    }
    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }

}

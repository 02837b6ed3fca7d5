package net.sculp.api.parser;

/**
 * Exception thrown on a malformed token sequence.
 * This covers unknown tokens, tokens appearing where they cannot start or
 * continue an expression, missing mandatory keywords or closers,
 * unterminated string literals, calls of unknown procedures or with the wrong
 * amount of arguments, and expressions of an unacceptable kind.
 */
public class SyntaxException extends LocatedParserException {

    public SyntaxException(TextLocation pos) {
        super(pos);
    }
    public SyntaxException(TextLocation pos, String message) {
        super(pos, message);
    }
    public SyntaxException(TextLocation pos, Throwable cause) {
        super(pos, cause);
    }
    public SyntaxException(TextLocation pos, String message,
                           Throwable cause) {
        super(pos, message, cause);
    }

}

package net.sculp.api.parser;

import java.io.Reader;
import java.util.Map;
import net.sculp.api.ast.Expression;

/**
 * Entry-point interface for the SCULP front end.
 */
public interface ParserFactory {

    /**
     * The signature table bundled with the front end.
     */
    SignatureTable getDefaultSignatures();

    /**
     * The signature table named by the "sculp.signatures" configuration
     * key (a JSON file), or the default table if that key is not set.
     */
    SignatureTable getConfiguredSignatures()
        throws InvalidSignatureException;

    /**
     * Read a signature table from the given JSON document.
     * The document is an object mapping procedure names to arrays of
     * variant names, e.g. {"post": ["String"], "close-poll": []}.
     */
    SignatureTable loadSignatures(Reader input)
        throws InvalidSignatureException;

    /**
     * Parse the given source text into a statement.
     */
    Expression parse(String source, SignatureTable signatures)
        throws ParserException;

    /**
     * Parse the given template source text, resolving placeholders against
     * inserts.
     * Unlike the two-argument form, the result may be an expression of any
     * kind. Inserts are spliced by reference, not copied.
     */
    Expression parse(String source, SignatureTable signatures,
                     Map<String, Expression> inserts)
        throws ParserException;

    /**
     * Parse the given source text and wrap the result into a SculpParser.
     */
    SculpParser createParser(String source, SignatureTable signatures)
        throws ParserException;

    /**
     * Parse the given template source text and wrap the result into a
     * SculpParser.
     */
    SculpParser createParser(String source, SignatureTable signatures,
                             Map<String, Expression> inserts)
        throws ParserException;

}

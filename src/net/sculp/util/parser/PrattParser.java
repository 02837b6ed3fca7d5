package net.sculp.util.parser;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.sculp.api.ast.Expression;
import net.sculp.api.ast.Family;
import net.sculp.api.ast.Variant;
import net.sculp.api.parser.MissingInsertException;
import net.sculp.api.parser.ParserException;
import net.sculp.api.parser.SignatureTable;
import net.sculp.api.parser.SyntaxException;
import net.sculp.api.parser.TextLocation;

/**
 * A top-down operator precedence parser for SCULP source text.
 * Instances are single-use: parse() runs the parser once and memoizes the
 * outcome (be it a result or an exception).
 */
public class PrattParser {

    private static final Logger LOGGER = Logger.getLogger("PrattParser");

    private final String source;
    private final SignatureValidator validator;
    private final Map<String, Expression> inserts;
    private final Lexer lexer;
    private Token token;
    private Expression result;
    private ParserException failure;

    /**
     * Create a parser for source.
     * If inserts is non-null, the parser runs in template mode: "$name"
     * placeholders are replaced with the corresponding inserts, and the
     * result may be an expression of any kind.
     */
    public PrattParser(String source, SignatureTable signatures,
                       Map<String, Expression> inserts) {
        if (source == null)
            throw new NullPointerException("Source may not be null");
        this.source = source;
        this.validator = new SignatureValidator(signatures);
        this.inserts = inserts;
        this.lexer = new Lexer(this, source);
    }
    public PrattParser(String source, SignatureTable signatures) {
        this(source, signatures, null);
    }

    public boolean isTemplate() {
        return (inserts != null);
    }

    public SignatureValidator getValidator() {
        return validator;
    }

    /**
     * The token about to be consumed.
     */
    public Token getToken() {
        return token;
    }

    /**
     * Consume the current token and return it.
     * The end-of-input token is never consumed.
     */
    public Token nextToken() throws ParserException {
        Token ret = token;
        if (! (ret instanceof Tokens.End)) token = lexer.next();
        return ret;
    }

    /**
     * Consume the current token, which must be of the given class.
     */
    public Token skipToken(Class<? extends Token> expected)
            throws ParserException {
        if (! expected.isInstance(token))
            throw new SyntaxException(token.getLocation(), "Unexpected " +
                token.getName() + " token, expecting " +
                expected.getSimpleName() + ".");
        return nextToken();
    }

    /**
     * Consume a name token and return its text.
     * what describes the role of the name for diagnostics.
     */
    public String takeName(String what) throws ParserException {
        if (! (token instanceof Tokens.Name))
            throw new SyntaxException(token.getLocation(), "Expecting " +
                what + " name but found " + token.getSymbol() + ".");
        return nextToken().getSymbol();
    }

    /**
     * Parse an expression whose operators all have a binding power of at
     * least minBindingPower.
     * If accepted is not empty, the result must belong to one of the given
     * variants.
     */
    public Expression parseNext(int minBindingPower, Variant... accepted)
            throws ParserException {
        Token first = nextToken();
        Expression ret = first.nud();
        while (minBindingPower <= token.getBindingPower()) {
            ret = nextToken().led(ret);
        }
        expect(ret, first.getLocation(), accepted);
        return ret;
    }

    /**
     * Ensure that expr belongs to one of the accepted variants.
     * Does nothing if accepted is empty.
     */
    public void expect(Expression expr, TextLocation location,
                       Variant... accepted) throws SyntaxException {
        if (accepted.length == 0) return;
        for (Variant v : accepted) {
            if (expr.isA(v)) return;
        }
        StringBuilder sb = new StringBuilder("Expecting ");
        for (int i = 0; i < accepted.length; i++) {
            if (i != 0) sb.append(" or ");
            sb.append(accepted[i].getName());
        }
        sb.append(" but found ").append(expr.getKind().getName())
          .append('.');
        throw new SyntaxException(location, sb.toString());
    }

    /**
     * Look up the insert for the given placeholder.
     */
    public Expression resolveInsert(String name, TextLocation location)
            throws MissingInsertException {
        Expression ret = (inserts == null) ? null : inserts.get(name);
        if (ret == null)
            throw new MissingInsertException(location, name);
        return ret;
    }

    /**
     * Run the parser and return the root of the resulting tree.
     * Outside template mode, the root is a Statement.
     */
    public Expression parse() throws ParserException {
        if (result != null) return result;
        if (failure != null) throw failure;
        try {
            token = lexer.next();
            TextLocation start = token.getLocation();
            Expression ret = parseNext(Tokens.BP_NONE);
            if (! isTemplate()) expect(ret, start, Family.STATEMENT);
            result = ret;
            LOGGER.log(Level.FINE, "Parsed {0} node from {1} characters",
                       new Object[] { ret.getKind().getName(),
                                      source.length() });
            return ret;
        } catch (ParserException exc) {
            failure = exc;
            LOGGER.log(Level.FINER, "Rejected input: " + exc.getMessage(),
                       exc);
            throw exc;
        }
    }

}

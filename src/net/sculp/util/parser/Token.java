package net.sculp.util.parser;

import net.sculp.api.NamedValue;
import net.sculp.api.ast.Expression;
import net.sculp.api.parser.ParserException;
import net.sculp.api.parser.SyntaxException;
import net.sculp.api.parser.TextLocation;

/**
 * A single lexical token, bound to the parser consuming it.
 * Subclasses override nud() if the token can start an expression and led()
 * if it can continue one; the defaults reject the token.
 */
public abstract class Token implements NamedValue {

    private final PrattParser parser;
    private final TextLocation location;
    private final int bindingPower;
    private final String symbol;

    protected Token(PrattParser parser, TextLocation location,
                    int bindingPower, String symbol) {
        if (location == null)
            throw new NullPointerException(
                "Token location may not be null");
        this.parser = parser;
        this.location = location;
        this.bindingPower = bindingPower;
        this.symbol = symbol;
    }

    public String toString() {
        return String.format("%s (%s) at %s", getSymbol(), getName(),
                             getLocation());
    }

    /**
     * The name of this token's class, as used in diagnostics.
     */
    public String getName() {
        return getClass().getSimpleName();
    }

    protected PrattParser getParser() {
        return parser;
    }

    public TextLocation getLocation() {
        return location;
    }

    public int getBindingPower() {
        return bindingPower;
    }

    public String getSymbol() {
        return symbol;
    }

    public Expression nud() throws ParserException {
        throw unexpected();
    }

    public Expression led(Expression left) throws ParserException {
        throw unexpected();
    }

    protected SyntaxException unexpected() {
        return new SyntaxException(getLocation(),
            "Unexpected token " + getSymbol() + ".");
    }

}

package net.sculp.util.parser;

import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sculp.api.parser.SyntaxException;
import net.sculp.api.parser.TextLocation;
import net.sculp.util.Locations;

/**
 * Splits SCULP source text into Tokens.
 * Tokens are produced on demand; after the End token has been returned,
 * the lexer is exhausted.
 */
public class Lexer {

    private static final Pattern TOKEN = Pattern.compile(
        "\\|\\||[\\w-]+|[^\\w\\s]");
    private static final Pattern WORD = Pattern.compile("[\\w-]+");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final PrattParser parser;
    private final String input;
    private final Matcher matcher;
    private final Locations.LocationTracker tracker;
    private int index;
    private boolean expectName;
    private boolean done;

    public Lexer(PrattParser parser, String input) {
        this.parser = parser;
        this.input = input;
        this.matcher = TOKEN.matcher(input);
        this.tracker = new Locations.LocationTracker();
        this.index = 0;
        this.expectName = false;
        this.done = false;
    }

    public Token next() throws SyntaxException {
        if (done)
            throw new NoSuchElementException("Lexer is exhausted");
        boolean nameHere = expectName;
        expectName = false;
        skipWhitespace();
        TextLocation location = tracker.snapshot();
        if (index == input.length()) {
            done = true;
            return new Tokens.End(parser, location);
        }
        if (input.charAt(index) == '"')
            return scanString(location);
        matcher.region(index, input.length());
        if (! matcher.lookingAt())
            throw new SyntaxException(location,
                "Unknown token " + input.charAt(index) + ".");
        String text = matcher.group();
        advance(matcher.end());
        if (WORD.matcher(text).matches() &&
                (nameHere || followedByColon()))
            return new Tokens.Name(parser, location, text);
        String symbol = text.toLowerCase(Locale.ROOT);
        if (parser.isTemplate() && symbol.equals("$")) {
            expectName = true;
            return new Tokens.Placeholder(parser, location);
        }
        Token ret = Tokens.create(symbol, parser, location);
        if (ret != null) {
            if (ret instanceof Tokens.Def) expectName = true;
            return ret;
        }
        if (DIGITS.matcher(symbol).matches()) {
            try {
                return new Tokens.NumberLiteral(parser, location,
                                                Long.parseLong(symbol));
            } catch (NumberFormatException exc) {
                throw new SyntaxException(location,
                    "Number " + symbol + " is out of range.", exc);
            }
        }
        if (parser.getValidator().isProcedure(symbol))
            return new Tokens.Name(parser, location, symbol);
        throw new SyntaxException(location, "Unknown token " + text + ".");
    }

    private Token scanString(TextLocation location) throws SyntaxException {
        int start = index + 1;
        int i = start;
        for (;;) {
            if (i >= input.length())
                throw new SyntaxException(location,
                                          "Unexpected end of input.");
            char ch = input.charAt(i);
            if (ch == '"') break;
            i += (ch == '\\') ? 2 : 1;
        }
        String value = input.substring(start, i);
        advance(i + 1);
        return new Tokens.StringLiteral(parser, location, value);
    }

    private void skipWhitespace() {
        int i = index;
        while (i < input.length() &&
               Character.isWhitespace(input.charAt(i))) i++;
        advance(i);
    }

    private boolean followedByColon() {
        int i = index;
        while (i < input.length() &&
               Character.isWhitespace(input.charAt(i))) i++;
        return (i < input.length() && input.charAt(i) == ':');
    }

    private void advance(int to) {
        tracker.advance(input, index, to);
        index = to;
    }

}

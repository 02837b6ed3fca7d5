package net.sculp.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import net.sculp.api.ast.Expression;
import net.sculp.api.parser.SignatureTable;
import net.sculp.api.parser.SyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LexerTest {

    private static final SignatureTable TABLE = SignatureTables.getDefault();

    private static Lexer lexer(String source, boolean template) {
        PrattParser parser = (template) ?
            new PrattParser(source, TABLE,
                            Collections.<String, Expression>emptyMap()) :
            new PrattParser(source, TABLE);
        return new Lexer(parser, source);
    }

    private static List<String> describe(String source, boolean template)
            throws SyntaxException {
        Lexer lx = lexer(source, template);
        List<String> ret = new ArrayList<String>();
        for (;;) {
            Token tok = lx.next();
            ret.add(tok.getName() + " " + tok.getSymbol());
            if (tok instanceof Tokens.End) break;
        }
        return ret;
    }

    private static List<String> list(String... items) {
        List<String> ret = new ArrayList<String>();
        Collections.addAll(ret, items);
        return ret;
    }

    @Test
    public void operatorsAndKeywords() throws SyntaxException {
        assertEquals(list("Skip skip", "Parallel ||", "Next next",
                          "Enter enter", "At @", "Star *", "Dot .",
                          "Or v", "And &", "Do do", "End EOF"),
                     describe("skip||NEXT enter @*.v& do", false));
    }

    @Test
    public void procedureNamesAndNumbers() throws SyntaxException {
        assertEquals(list("Name close-poll", "LeftParen (",
                          "NumberLiteral 12", "Comma ,", "RightParen )",
                          "End EOF"),
                     describe("Close-Poll(12,)", false));
    }

    @Test
    public void fieldAndDefinitionNamesKeepSpelling()
            throws SyntaxException {
        assertEquals(list("LeftBrace {", "Name Usr", "Colon :",
                          "Star *", "Comma ,", "Name v", "Colon :",
                          "Star *", "RightBrace }", "End EOF"),
                     describe("{Usr: *, v :*}", false));
        assertEquals(list("Def def", "Name Skip", "As as", "Skip skip",
                          "End EOF"),
                     describe("def Skip as skip", false));
    }

    @Test
    public void stringsKeepEscapes() throws SyntaxException {
        Lexer lx = lexer("\"say \\\"hi\\\"\" \"\"", false);
        Token first = lx.next();
        assertTrue(first instanceof Tokens.StringLiteral);
        assertEquals("say \\\"hi\\\"",
                     ((Tokens.StringLiteral) first).getValue());
        assertEquals("", ((Tokens.StringLiteral) lx.next()).getValue());
        assertTrue(lx.next() instanceof Tokens.End);
    }

    @Test
    public void unterminatedString() {
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> describe("post(\"abc\\\")", false));
        assertEquals("Unexpected end of input.", exc.getMessage());
        assertEquals(5, exc.getLocation().getCharacterIndex());
    }

    @Test
    public void placeholders() throws SyntaxException {
        assertEquals(list("Placeholder $", "Name Message", "End EOF"),
                     describe("$Message", true));
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> describe("$Message", false));
        assertEquals("Unknown token $.", exc.getMessage());
    }

    @Test
    public void unknownWords() {
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> describe("skip || Frobnicate", false));
        assertEquals("Unknown token Frobnicate.", exc.getMessage());
        assertEquals(9, exc.getLocation().getColumn());
        SyntaxException big = assertThrows(SyntaxException.class,
            () -> describe("99999999999999999999", false));
        assertTrue(big.getMessage().startsWith("Number"));
    }

    @Test
    public void locationsFollowLineBreaks() throws SyntaxException {
        Lexer lx = lexer("skip\r\n  ||\rskip", false);
        assertEquals(1, lx.next().getLocation().getLine());
        Token par = lx.next();
        assertEquals(2, par.getLocation().getLine());
        assertEquals(3, par.getLocation().getColumn());
        Token last = lx.next();
        assertEquals(3, last.getLocation().getLine());
        assertEquals(1, last.getLocation().getColumn());
    }

    @Test
    public void exhaustedAfterEnd() throws SyntaxException {
        Lexer lx = lexer("  ", false);
        assertTrue(lx.next() instanceof Tokens.End);
        assertThrows(NoSuchElementException.class, lx::next);
    }

}

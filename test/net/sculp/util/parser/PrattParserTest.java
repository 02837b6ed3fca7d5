package net.sculp.util.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import net.sculp.api.ast.Expression;
import net.sculp.api.ast.Family;
import net.sculp.api.ast.Instructions;
import net.sculp.api.ast.Kind;
import net.sculp.api.ast.NaryExpression;
import net.sculp.api.ast.Patterns;
import net.sculp.api.ast.Statements;
import net.sculp.api.ast.Terms;
import net.sculp.api.parser.MissingInsertException;
import net.sculp.api.parser.ParameterTypeException;
import net.sculp.api.parser.ParserException;
import net.sculp.api.parser.SignatureTable;
import net.sculp.api.parser.SyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrattParserTest {

    private static final SignatureTable TABLE = SignatureTables.getDefault();

    private static Expression parse(String source) throws ParserException {
        return new PrattParser(source, TABLE).parse();
    }

    private static String render(String source) throws ParserException {
        return parse(source).toString();
    }

    private static Expression parseTemplate(String source,
            Map<String, Expression> inserts) throws ParserException {
        return new PrattParser(source, TABLE, inserts).parse();
    }

    @Test
    public void parallelGroupIsFlat() throws ParserException {
        Expression e = parse("skip || skip || skip");
        assertEquals(Kind.PARALLEL_EXECUTION, e.getKind());
        assertEquals(3, ((NaryExpression) e).getMembers().size());
        assertEquals("(skip || skip || skip)", e.toString());
    }

    @Test
    public void prefixNextStartsWithSkip() throws ParserException {
        assertEquals("skip next skip", render("next skip"));
    }

    @Test
    public void infixNextChainIsFlat() throws ParserException {
        Expression e = parse("signal(\"a\") next signal(\"b\") next skip");
        assertEquals(Kind.SEQUENTIAL_EXECUTION, e.getKind());
        assertEquals(3, ((NaryExpression) e).getMembers().size());
        assertEquals("signal(\"a\") next signal(\"b\") next skip",
                     e.toString());
    }

    @Test
    public void nullaryProcedureNeedsNoParentheses() throws ParserException {
        assertEquals("abort", render("abort"));
        assertEquals("close-poll", render("close-poll()"));
    }

    @Test
    public void keywordsAreCaseInsensitive() throws ParserException {
        assertEquals("(skip || post(\"x\"))", render("SKIP || Post(\"x\")"));
    }

    @Test
    public void scopes() throws ParserException {
        assertEquals("enter @ \"clock\" do signal(\"tick\")",
                     render("enter @ \"clock\" do signal(\"tick\")"));
        assertEquals("exit @ \"clock\" do skip",
                     render("exit @ \"clock\" do skip"));
        assertEquals("enter @ \"room\" . * do skip",
                     render("enter @\"room\".* do skip"));
    }

    @Test
    public void matchListConstraint() throws ParserException {
        assertEquals("when { usr: \"frank\", body: * . \"?\" } do " +
                     "post(\"Hi Frank! I will answer your question asap.\")",
                     render("when {usr:\"frank\", body:*.\"?\"} do " +
                            "post(\"Hi Frank! I will answer your question " +
                            "asap.\")"));
        assertEquals("when { usr: \"frank\" } do rm(*, \"frank\", *)",
                     render("when {usr: \"frank\"} do rm(*,\"frank\",*)"));
        assertEquals("when {} do skip", render("when {} do skip"));
    }

    @Test
    public void matchListLastFieldWins() throws ParserException {
        assertEquals("when { a: \"y\" } do skip",
                     render("when {a: \"x\", a: \"y\"} do skip"));
    }

    @Test
    public void untilConditionIsConcatenation() throws ParserException {
        Expression e = parse("do post(\"x\") until *.\"stop!\".* ");
        assertEquals(Kind.UNTIL, e.getKind());
        assertEquals("do post(\"x\") until * . \"stop!\" . *", e.toString());
        e.applyTo(Kind.PATTERN_CONCAT, new Expression.Action() {
            public void apply(Expression expr) {
                assertEquals(3, ((NaryExpression) expr).getMembers().size());
            }
        });
    }

    @Test
    public void conditionals() throws ParserException {
        assertEquals("if { usr: \"a\" } & \"b\" then skip",
                     render("if {usr: \"a\"} & \"b\" then skip"));
        assertEquals("whenever \"a\" v \"b\" & \"c\" do skip",
                     render("whenever \"a\" v \"b\" & \"c\" do skip"));
        assertEquals("while (\"a\" v \"b\") & \"c\" do skip",
                     render("while (\"a\" v \"b\") & \"c\" do skip"));
        assertEquals("unless \"x\" next post(\"y\")",
                     render("unless \"x\" next post(\"y\")"));
    }

    @Test
    public void junctionsOfPatternsStayPatterns() throws ParserException {
        Expression e = parse("when \"a\" & \"b\" do skip");
        e.applyTo(Family.CONSTRAINT, new Expression.Action() {
            public void apply(Expression expr) {
                throw new AssertionError("Unexpected constraint " + expr);
            }
        });
        Expression c = parse("when {a: \"x\"} v \"b\" do skip");
        final int[] count = new int[1];
        c.applyTo(Kind.LOGICAL_OR, new Expression.Action() {
            public void apply(Expression expr) {
                count[0]++;
            }
        });
        assertEquals(1, count[0]);
    }

    @Test
    public void definitionsAndRepetitions() throws ParserException {
        assertEquals("def Greet as post(\"hi\")",
                     render("def Greet as post(\"hi\")"));
        assertEquals("repeat signal(\"tick\") next skip",
                     render("repeat signal(\"tick\") next skip"));
        assertEquals(Kind.REPEAT,
                     parse("repeat signal(\"tick\") next skip").getKind());
    }

    @Test
    public void instructionBodyBindsTighterThanParallel()
            throws ParserException {
        Expression e = parse("when \"a\" do skip || skip");
        assertEquals(Kind.PARALLEL_EXECUTION, e.getKind());
        assertEquals("(when \"a\" do skip || skip)", e.toString());
    }

    @Test
    public void roundTrip() throws ParserException {
        String[] sources = {
            "skip || skip || skip",
            "next skip",
            "(post(\"x\") || post(\"y\")) next post(\"z\")",
            "when {usr:\"frank\", body:*.\"?\"} do post(\"?\")",
            "enter @ \"a\" do (skip next skip)",
            "do (repeat skip) until \"x\"",
            "(def x as skip) next skip",
            "((repeat skip) || skip)",
            "when \"a\" v \"b\" & \"c\" do kill(\"a\" & (\"b\" v \"c\"))",
            "if {a: *} v {b: \"x\"} & \"y\" then abort",
            "unless \"x\" next (skip || vote(\"y\"))",
            "whenever \"a\" do when \"b\" do rm(*, *, \"c\")",
            "when \"a\" & (\"b\" & {f: \"x\"}) do skip",
            "when \"a\" v (\"b\" v {f: \"x\"}) do skip",
            "when {f: \"x\"} & (\"a\" & \"b\") do skip",
            "notify(\"New Message!\") next skip"
        };
        for (String s : sources) {
            Expression first = parse(s);
            String text = first.toString();
            Expression second = parse(text);
            assertEquals(first, second, s);
            assertEquals(text, second.toString(), s);
        }
    }

    @Test
    public void nestedConstraintGroupsKeepTheirShape()
            throws ParserException {
        Expression inner = parse("when \"a\" & (\"b\" & {f: \"x\"}) " +
                                 "do skip");
        assertEquals("when \"a\" & (\"b\" & { f: \"x\" }) do skip",
                     inner.toString());
        Expression lead = parse("when {f: \"x\"} & (\"a\" & \"b\") " +
                                "do skip");
        assertEquals("when { f: \"x\" } & (\"a\" & \"b\") do skip",
                     lead.toString());
        assertEquals("when \"b\" & { f: \"x\" } & \"a\" do skip",
                     parse("when (\"b\" & {f: \"x\"}) & \"a\" do skip")
                     .toString());
    }

    @Test
    public void openEndedMembersAreParenthesized() throws ParserException {
        Expression seq = new Statements.SequentialExecution(
            new Instructions.Repeat(new Statements.Skip()),
            new Statements.Skip());
        assertEquals("(repeat skip) next skip", seq.toString());
        assertEquals(seq, parse(seq.toString()));
    }

    @Test
    public void templateSubstitution() throws ParserException {
        Map<String, Expression> inserts = new HashMap<String, Expression>();
        Expression insert = new Patterns.StringLiteral("Hi!");
        inserts.put("m", insert);
        Expression e = parseTemplate("post($m)", inserts);
        assertEquals("post(\"Hi!\")", e.toString());
        assertSame(insert, ((Statements.Procedure) e).getParameters()
                   .get(0));
    }

    @Test
    public void templateMayYieldNonStatements() throws ParserException {
        Map<String, Expression> inserts = Collections.emptyMap();
        Expression e = parseTemplate("@ \"x\"", inserts);
        assertEquals(Kind.SPACE_PATH, e.getKind());
    }

    @Test
    public void placeholderNamesKeepSpelling() throws ParserException {
        Map<String, Expression> inserts = new HashMap<String, Expression>();
        inserts.put("Skip", new Terms.SpacePath(new Patterns.Wildcard()));
        assertEquals("enter @ * do skip",
                     parseTemplate("enter $Skip do skip", inserts)
                         .toString());
    }

    @Test
    public void missingInsert() {
        Map<String, Expression> inserts = new HashMap<String, Expression>();
        inserts.put("text", new Patterns.StringLiteral("Hi!"));
        MissingInsertException exc = assertThrows(
            MissingInsertException.class,
            () -> parseTemplate("post($message)", inserts));
        assertEquals("message", exc.getPlaceholder());
        assertEquals("Insert for placeholder 'message' not found.",
                     exc.getMessage());
    }

    @Test
    public void placeholderOutsideTemplate() {
        SyntaxException exc = assertThrows(SyntaxException.class,
                                           () -> parse("post($m)"));
        assertEquals("Unknown token $.", exc.getMessage());
    }

    @Test
    public void parameterTypeMismatch() {
        ParameterTypeException exc = assertThrows(
            ParameterTypeException.class, () -> parse("post(*)"));
        assertEquals("post", exc.getProcedure());
        assertEquals(1, exc.getPosition());
        assertEquals("Parameter at position 1 of post must be of type " +
                     "String instead of Wildcard.", exc.getMessage());
        ParameterTypeException exc2 = assertThrows(
            ParameterTypeException.class, () -> parse("rm(*, post, *)"));
        assertEquals(2, exc2.getPosition());
        assertEquals("Parameter at position 2 of rm must be of type " +
                     "Pattern instead of Identifier.", exc2.getMessage());
    }

    @Test
    public void arityMismatch() {
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> parse("post(\"a\", \"b\")"));
        assertEquals("Procedure post takes 1 parameter(s), got 2.",
                     exc.getMessage());
    }

    @Test
    public void statementRequired() {
        SyntaxException exc = assertThrows(SyntaxException.class,
                                           () -> parse("@ \"x\""));
        assertEquals("Expecting Statement but found SpacePath.",
                     exc.getMessage());
        SyntaxException exc2 = assertThrows(SyntaxException.class,
                                            () -> parse("post"));
        assertEquals("Expecting Statement but found Identifier.",
                     exc2.getMessage());
    }

    @Test
    public void missingSeparator() {
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> parse("enter @ \"x\" then skip"));
        assertEquals("Unexpected Then token, expecting Do.",
                     exc.getMessage());
    }

    @Test
    public void trailingTokens() {
        SyntaxException exc = assertThrows(SyntaxException.class,
                                           () -> parse("skip skip"));
        assertEquals("Unexpected token skip.", exc.getMessage());
        assertEquals(6, exc.getLocation().getColumn());
    }

    @Test
    public void wrongOperandFamily() {
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> parse("when skip do skip"));
        assertEquals("Expecting Pattern or Constraint but found Skip.",
                     exc.getMessage());
    }

    @Test
    public void errorLocation() {
        SyntaxException exc = assertThrows(SyntaxException.class,
                                           () -> parse("skip ||\n  foo"));
        assertEquals("Unknown token foo.", exc.getMessage());
        assertEquals(2, exc.getLocation().getLine());
        assertEquals(3, exc.getLocation().getColumn());
        assertEquals(10, exc.getLocation().getCharacterIndex());
    }

    @Test
    public void outcomeIsMemoized() throws ParserException {
        PrattParser p = new PrattParser("skip", TABLE);
        assertSame(p.parse(), p.parse());
        final PrattParser bad = new PrattParser("skip ||", TABLE);
        ParserException first = assertThrows(ParserException.class,
                                             bad::parse);
        assertSame(first, assertThrows(ParserException.class, bad::parse));
        assertTrue(first instanceof SyntaxException);
    }

}

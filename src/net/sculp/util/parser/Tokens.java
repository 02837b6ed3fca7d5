package net.sculp.util.parser;

import java.util.ArrayList;
import java.util.List;
import net.sculp.api.ast.Constraints;
import net.sculp.api.ast.Expression;
import net.sculp.api.ast.Family;
import net.sculp.api.ast.Instructions;
import net.sculp.api.ast.Kind;
import net.sculp.api.ast.Patterns;
import net.sculp.api.ast.Statements;
import net.sculp.api.ast.Terms;
import net.sculp.api.ast.Variant;
import net.sculp.api.parser.ParserException;
import net.sculp.api.parser.SyntaxException;
import net.sculp.api.parser.TextLocation;

/**
 * The token classes of the language and the table mapping symbols to them.
 */
public final class Tokens {

    /* Binding powers; greater values bind tighter. */
    public static final int BP_END = -1;
    public static final int BP_NONE = 0;
    public static final int BP_BLOCK = 10;
    public static final int BP_UNTIL = 15;
    public static final int BP_NEXT = 18;
    public static final int BP_PARALLEL = 20;
    public static final int BP_AT = 25;
    public static final int BP_KEYWORD = 90;
    public static final int BP_OR = 95;
    public static final int BP_AND = 97;
    public static final int BP_CONCAT = 100;
    public static final int BP_CALL = 120;
    public static final int BP_PLACEHOLDER = 999;

    /* Minimal binding powers of nested parses. */
    public static final int MIN_GROUP = 1;
    public static final int MIN_BODY = 30;
    public static final int MIN_UNTIL_BODY = BP_UNTIL + 1;
    public static final int MIN_CONDITION = BP_KEYWORD;

    private static final Variant[] CONDITION = {
        Family.PATTERN, Family.CONSTRAINT
    };

    public static class End extends Token {

        public End(PrattParser parser, TextLocation location) {
            super(parser, location, BP_END, "EOF");
        }

    }

    /* Punctuation and separators */

    public static class Comma extends Token {

        public Comma(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, ",");
        }

    }

    public static class Colon extends Token {

        public Colon(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, ":");
        }

    }

    public static class RightParen extends Token {

        public RightParen(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, ")");
        }

    }

    public static class RightBrace extends Token {

        public RightBrace(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, "}");
        }

    }

    public static class Then extends Token {

        public Then(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, "then");
        }

    }

    public static class As extends Token {

        public As(PrattParser parser, TextLocation location) {
            super(parser, location, BP_BLOCK, "as");
        }

    }

    public static class Until extends Token {

        public Until(PrattParser parser, TextLocation location) {
            super(parser, location, BP_UNTIL, "until");
        }

    }

    /* Literals */

    public static class StringLiteral extends Token {

        private final String value;

        public StringLiteral(PrattParser parser, TextLocation location,
                             String value) {
            super(parser, location, BP_NONE, "\"" + value + "\"");
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public Expression nud() {
            return new Patterns.StringLiteral(value);
        }

    }

    public static class NumberLiteral extends Token {

        private final long value;

        public NumberLiteral(PrattParser parser, TextLocation location,
                             long value) {
            super(parser, location, BP_NONE, Long.toString(value));
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        public Expression nud() {
            return new Terms.Number(value);
        }

    }

    /**
     * A bare word: a procedure name, or a user-chosen name where the
     * grammar expects one (after "def" or "$", or before ":").
     */
    public static class Name extends Token {

        public Name(PrattParser parser, TextLocation location, String text) {
            super(parser, location, BP_NONE, text);
        }

        public Expression nud() throws ParserException {
            SignatureValidator v = getParser().getValidator();
            if (! v.isProcedure(getSymbol()))
                throw new SyntaxException(getLocation(),
                    "Unknown token " + getSymbol() + ".");
            if (v.isNullary(getSymbol()))
                return new Statements.Procedure(getSymbol());
            return new Terms.Identifier(getSymbol());
        }

    }

    /* Operators */

    public static class Star extends Token {

        public Star(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, "*");
        }

        public Expression nud() {
            return new Patterns.Wildcard();
        }

    }

    public static class Dot extends Token {

        public Dot(PrattParser parser, TextLocation location) {
            super(parser, location, BP_CONCAT, ".");
        }

        public Expression led(Expression left) throws ParserException {
            PrattParser p = getParser();
            p.expect(left, getLocation(), Family.PATTERN);
            Expression right = p.parseNext(BP_CONCAT + 1, Family.PATTERN);
            return new Patterns.Concat(left, right);
        }

    }

    /**
     * Common base of the "&" and "v" operators.
     * Two patterns combine into a pattern; anything involving a
     * constraint combines into a constraint.
     */
    protected abstract static class Junction extends Token {

        protected Junction(PrattParser parser, TextLocation location,
                           int bindingPower, String symbol) {
            super(parser, location, bindingPower, symbol);
        }

        protected abstract Expression combinePatterns(Expression left,
                                                      Expression right);

        protected abstract Expression combineConstraints(Expression left,
                                                         Expression right);

        public Expression led(Expression left) throws ParserException {
            PrattParser p = getParser();
            p.expect(left, getLocation(), CONDITION);
            Expression right = p.parseNext(getBindingPower() + 1,
                                           CONDITION);
            if (left.isA(Family.PATTERN) && right.isA(Family.PATTERN))
                return combinePatterns(left, right);
            return combineConstraints(left, right);
        }

    }

    public static class And extends Junction {

        public And(PrattParser parser, TextLocation location) {
            super(parser, location, BP_AND, "&");
        }

        protected Expression combinePatterns(Expression left,
                                             Expression right) {
            return new Patterns.And(left, right);
        }

        protected Expression combineConstraints(Expression left,
                                                Expression right) {
            return new Constraints.And(left, right);
        }

    }

    public static class Or extends Junction {

        public Or(PrattParser parser, TextLocation location) {
            super(parser, location, BP_OR, "v");
        }

        protected Expression combinePatterns(Expression left,
                                             Expression right) {
            return new Patterns.Or(left, right);
        }

        protected Expression combineConstraints(Expression left,
                                                Expression right) {
            return new Constraints.Or(left, right);
        }

    }

    public static class Parallel extends Token {

        public Parallel(PrattParser parser, TextLocation location) {
            super(parser, location, BP_PARALLEL, "||");
        }

        public Expression led(Expression left) throws ParserException {
            PrattParser p = getParser();
            p.expect(left, getLocation(), Family.STATEMENT);
            // Right-associative; the constructor absorbs the nested group.
            Expression right = p.parseNext(BP_PARALLEL, Family.STATEMENT);
            return new Statements.ParallelExecution(left, right);
        }

    }

    public static class At extends Token {

        public At(PrattParser parser, TextLocation location) {
            super(parser, location, BP_AT, "@");
        }

        public Expression nud() throws ParserException {
            return new Terms.SpacePath(
                getParser().parseNext(BP_AT, Family.PATTERN));
        }

    }

    public static class Placeholder extends Token {

        public Placeholder(PrattParser parser, TextLocation location) {
            super(parser, location, BP_PLACEHOLDER, "$");
        }

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            String name = p.takeName("placeholder");
            return p.resolveInsert(name, getLocation());
        }

    }

    /**
     * Either a parenthesized group (as a prefix) or the argument list of
     * a procedure call (as an infix).
     */
    public static class LeftParen extends Token {

        public LeftParen(PrattParser parser, TextLocation location) {
            super(parser, location, BP_CALL, "(");
        }

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            Expression ret = p.parseNext(MIN_GROUP);
            p.skipToken(RightParen.class);
            return ret;
        }

        public Expression led(Expression left) throws ParserException {
            String name;
            if (left instanceof Terms.Identifier) {
                name = ((Terms.Identifier) left).getName();
            } else if (left instanceof Statements.Procedure &&
                       ((Statements.Procedure) left).getParameters()
                           .isEmpty()) {
                name = ((Statements.Procedure) left).getName();
            } else {
                throw new SyntaxException(getLocation(), "Expecting " +
                    Kind.IDENTIFIER.getName() + " but found " +
                    left.getKind().getName() + ".");
            }
            PrattParser p = getParser();
            List<Expression> args = new ArrayList<Expression>();
            if (p.getToken() instanceof RightParen) {
                p.nextToken();
            } else {
                for (;;) {
                    args.add(p.parseNext(MIN_GROUP));
                    if (! (p.getToken() instanceof Comma)) break;
                    p.nextToken();
                }
                p.skipToken(RightParen.class);
            }
            return p.getValidator().createProcedure(name, args,
                                                    getLocation());
        }

    }

    public static class LeftBrace extends Token {

        public LeftBrace(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, "{");
        }

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            Constraints.MatchList ret = new Constraints.MatchList();
            if (p.getToken() instanceof RightBrace) {
                p.nextToken();
                return ret;
            }
            for (;;) {
                String field = p.takeName("field");
                p.skipToken(Colon.class);
                Expression pattern = p.parseNext(MIN_GROUP, Family.PATTERN);
                ret.put(new Constraints.Match(field, pattern));
                if (! (p.getToken() instanceof Comma)) break;
                p.nextToken();
            }
            p.skipToken(RightBrace.class);
            return ret;
        }

    }

    /* Statements and instructions */

    public static class Skip extends Token {

        public Skip(PrattParser parser, TextLocation location) {
            super(parser, location, BP_KEYWORD, "skip");
        }

        public Expression nud() {
            return new Statements.Skip();
        }

    }

    /**
     * "next s" as a prefix stands for "skip next s"; as an infix, it
     * chains statements into one flat sequence.
     */
    public static class Next extends Token {

        public Next(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NEXT, "next");
        }

        public Expression nud() throws ParserException {
            Expression body = getParser().parseNext(BP_NEXT,
                                                    Family.STATEMENT);
            return new Statements.SequentialExecution(
                new Statements.Skip(), body);
        }

        public Expression led(Expression left) throws ParserException {
            PrattParser p = getParser();
            p.expect(left, getLocation(), Family.STATEMENT);
            Expression right = p.parseNext(BP_NEXT, Family.STATEMENT);
            return new Statements.SequentialExecution(left, right);
        }

    }

    /**
     * "do s until c"; as a separator (after when, whenever, and while), it
     * is consumed by the respective instruction.
     */
    public static class Do extends Token {

        public Do(PrattParser parser, TextLocation location) {
            super(parser, location, BP_NONE, "do");
        }

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            Expression body = p.parseNext(MIN_UNTIL_BODY, Family.STATEMENT);
            p.skipToken(Until.class);
            Expression condition = p.parseNext(MIN_CONDITION, CONDITION);
            return new Instructions.Until(body, condition);
        }

    }

    protected abstract static class ScopeKeyword extends Token {

        protected ScopeKeyword(PrattParser parser, TextLocation location,
                               String symbol) {
            super(parser, location, BP_BLOCK, symbol);
        }

        protected abstract Expression build(Expression space,
                                            Expression body);

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            Expression space = p.parseNext(BP_BLOCK, Kind.SPACE_PATH);
            p.skipToken(Do.class);
            Expression body = p.parseNext(MIN_BODY, Family.STATEMENT);
            return build(space, body);
        }

    }

    public static class Enter extends ScopeKeyword {

        public Enter(PrattParser parser, TextLocation location) {
            super(parser, location, "enter");
        }

        protected Expression build(Expression space, Expression body) {
            return new Instructions.Enter(space, body);
        }

    }

    public static class Exit extends ScopeKeyword {

        public Exit(PrattParser parser, TextLocation location) {
            super(parser, location, "exit");
        }

        protected Expression build(Expression space, Expression body) {
            return new Instructions.Exit(space, body);
        }

    }

    protected abstract static class ConditionKeyword extends Token {

        protected ConditionKeyword(PrattParser parser, TextLocation location,
                                   String symbol) {
            super(parser, location, BP_KEYWORD, symbol);
        }

        protected abstract Class<? extends Token> getSeparator();

        protected abstract Expression build(Expression condition,
                                            Expression body);

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            Expression condition = p.parseNext(MIN_CONDITION, CONDITION);
            p.skipToken(getSeparator());
            Expression body = p.parseNext(MIN_BODY, Family.STATEMENT);
            return build(condition, body);
        }

    }

    public static class If extends ConditionKeyword {

        public If(PrattParser parser, TextLocation location) {
            super(parser, location, "if");
        }

        protected Class<? extends Token> getSeparator() {
            return Then.class;
        }

        protected Expression build(Expression condition, Expression body) {
            return new Instructions.If(condition, body);
        }

    }

    public static class When extends ConditionKeyword {

        public When(PrattParser parser, TextLocation location) {
            super(parser, location, "when");
        }

        protected Class<? extends Token> getSeparator() {
            return Do.class;
        }

        protected Expression build(Expression condition, Expression body) {
            return new Instructions.When(condition, body);
        }

    }

    public static class Whenever extends ConditionKeyword {

        public Whenever(PrattParser parser, TextLocation location) {
            super(parser, location, "whenever");
        }

        protected Class<? extends Token> getSeparator() {
            return Do.class;
        }

        protected Expression build(Expression condition, Expression body) {
            return new Instructions.Whenever(condition, body);
        }

    }

    public static class While extends ConditionKeyword {

        public While(PrattParser parser, TextLocation location) {
            super(parser, location, "while");
        }

        protected Class<? extends Token> getSeparator() {
            return Do.class;
        }

        protected Expression build(Expression condition, Expression body) {
            return new Instructions.While(condition, body);
        }

    }

    public static class Unless extends ConditionKeyword {

        public Unless(PrattParser parser, TextLocation location) {
            super(parser, location, "unless");
        }

        protected Class<? extends Token> getSeparator() {
            return Next.class;
        }

        protected Expression build(Expression condition, Expression body) {
            return new Instructions.Unless(condition, body);
        }

    }

    public static class Repeat extends Token {

        public Repeat(PrattParser parser, TextLocation location) {
            super(parser, location, BP_BLOCK, "repeat");
        }

        public Expression nud() throws ParserException {
            return new Instructions.Repeat(
                getParser().parseNext(BP_BLOCK, Family.STATEMENT));
        }

    }

    public static class Def extends Token {

        public Def(PrattParser parser, TextLocation location) {
            super(parser, location, BP_KEYWORD, "def");
        }

        public Expression nud() throws ParserException {
            PrattParser p = getParser();
            String name = p.takeName("definition");
            p.skipToken(As.class);
            Expression body = p.parseNext(BP_BLOCK, Family.STATEMENT);
            return new Instructions.Define(name, body);
        }

    }

    // Prevent construction.
    private Tokens() {}

    /**
     * Create the token registered for the given (case-folded) symbol, or
     * return null if there is none.
     * Literals, names, and placeholders are not covered; the Lexer creates
     * those itself.
     */
    public static Token create(String symbol, PrattParser parser,
                               TextLocation location) {
        switch (symbol) {
            /* Punctuation */
            case "(": return new LeftParen(parser, location);
            case ")": return new RightParen(parser, location);
            case "{": return new LeftBrace(parser, location);
            case "}": return new RightBrace(parser, location);
            case ",": return new Comma(parser, location);
            case ":": return new Colon(parser, location);
            /* Operators */
            case "@": return new At(parser, location);
            case "*": return new Star(parser, location);
            case ".": return new Dot(parser, location);
            case "&": return new And(parser, location);
            case "v": return new Or(parser, location);
            case "||": return new Parallel(parser, location);
            /* Keywords */
            case "as": return new As(parser, location);
            case "def": return new Def(parser, location);
            case "do": return new Do(parser, location);
            case "enter": return new Enter(parser, location);
            case "exit": return new Exit(parser, location);
            case "if": return new If(parser, location);
            case "next": return new Next(parser, location);
            case "repeat": return new Repeat(parser, location);
            case "skip": return new Skip(parser, location);
            case "then": return new Then(parser, location);
            case "unless": return new Unless(parser, location);
            case "until": return new Until(parser, location);
            case "when": return new When(parser, location);
            case "whenever": return new Whenever(parser, location);
            case "while": return new While(parser, location);
            default: return null;
        }
    }

}

package net.sculp.util.parser;

import java.util.List;
import net.sculp.api.ast.Expression;
import net.sculp.api.ast.Instructions;
import net.sculp.api.ast.Patterns;
import net.sculp.api.ast.Statements;
import net.sculp.api.ast.Terms;
import net.sculp.api.ast.Variant;
import net.sculp.api.parser.ParameterTypeException;
import net.sculp.api.parser.SignatureTable;
import net.sculp.api.parser.SyntaxException;
import net.sculp.api.parser.TextLocation;

/**
 * Checks procedure calls against a SignatureTable.
 */
public class SignatureValidator {

    /** Procedure posting its message to the inbox space. */
    public static final String NOTIFY = "notify";
    /** Space notifications are posted into. */
    public static final String INBOX = "inbox";
    /** Procedure a notification is expanded into. */
    public static final String POST = "post";

    private final SignatureTable signatures;

    public SignatureValidator(SignatureTable signatures) {
        if (signatures == null)
            throw new NullPointerException(
                "Signature table may not be null");
        this.signatures = signatures;
    }

    public boolean isProcedure(String name) {
        return signatures.contains(name);
    }

    /**
     * Test whether name denotes a procedure taking no arguments (which can
     * be invoked without parentheses).
     */
    public boolean isNullary(String name) {
        SignatureTable.Signature sig = signatures.getSignature(name);
        return (sig != null && sig.getArity() == 0);
    }

    /**
     * Construct a call of the given procedure, verifying the arity and the
     * types of args first.
     * A one-argument notify(m) is expanded into
     * enter @ "inbox" do post(m).
     */
    public Expression createProcedure(String name,
            List<Expression> args, TextLocation location)
            throws SyntaxException, ParameterTypeException {
        SignatureTable.Signature sig = signatures.getSignature(name);
        if (sig == null)
            throw new SyntaxException(location,
                "Unknown procedure " + name + ".");
        List<Variant> types = sig.getParameterTypes();
        if (types.size() != args.size())
            throw new SyntaxException(location, "Procedure " + name +
                " takes " + types.size() + " parameter(s), got " +
                args.size() + ".");
        for (int i = 0; i < types.size(); i++) {
            Variant expected = types.get(i);
            Expression actual = args.get(i);
            if (actual.isA(expected)) continue;
            throw new ParameterTypeException(location, name, i + 1,
                "Parameter at position " + (i + 1) + " of " + name +
                " must be of type " + expected.getName() + " instead of " +
                actual.getKind().getName() + ".");
        }
        if (name.equals(NOTIFY) && args.size() == 1)
            return new Instructions.Enter(
                new Terms.SpacePath(new Patterns.StringLiteral(INBOX)),
                new Statements.Procedure(POST, args));
        return new Statements.Procedure(name, args);
    }

}

package net.sculp.api.parser;

import java.util.List;
import java.util.Set;
import net.sculp.api.NamedValue;
import net.sculp.api.ast.Variant;

/**
 * The set of procedures a SCULP program may call.
 * Procedure names are not part of the grammar; the lexer consults this table
 * to recognize them, and the parser validates each call against the
 * procedure's Signature. Names are stored in lower case (source text is
 * case-folded before lookup).
 * Implementations are immutable and may be shared among parsers.
 */
public interface SignatureTable {

    /**
     * The shape of a single procedure.
     */
    interface Signature extends NamedValue {

        /**
         * The variants the arguments must have, in order.
         * An empty list denotes a procedure taking no arguments, which may
         * be invoked without parentheses.
         */
        List<Variant> getParameterTypes();

        /**
         * The amount of arguments the procedure takes.
         */
        int getArity();

    }

    /**
     * The names of all procedures in this table.
     */
    Set<String> getProcedureNames();

    /**
     * Test whether the given (lower-case) name denotes a procedure.
     */
    boolean contains(String name);

    /**
     * Retrieve the signature of the given procedure, or null if there is
     * none.
     */
    Signature getSignature(String name);

}

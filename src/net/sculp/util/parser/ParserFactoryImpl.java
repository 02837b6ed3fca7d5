package net.sculp.util.parser;

import java.io.Reader;
import java.util.Map;
import net.sculp.api.ast.Expression;
import net.sculp.api.parser.InvalidSignatureException;
import net.sculp.api.parser.ParserException;
import net.sculp.api.parser.ParserFactory;
import net.sculp.api.parser.SculpParser;
import net.sculp.api.parser.SignatureTable;
import net.sculp.util.config.Configuration;

public class ParserFactoryImpl implements ParserFactory {

    public static final ParserFactoryImpl INSTANCE =
        new ParserFactoryImpl(Configuration.DEFAULT);

    private final Configuration config;

    public ParserFactoryImpl(Configuration config) {
        this.config = config;
    }

    public SignatureTable getDefaultSignatures() {
        return SignatureTables.getDefault();
    }

    public SignatureTable getConfiguredSignatures()
            throws InvalidSignatureException {
        return SignatureTables.fromConfiguration(config);
    }

    public SignatureTable loadSignatures(Reader input)
            throws InvalidSignatureException {
        return SignatureTables.load(input);
    }

    public Expression parse(String source, SignatureTable signatures)
            throws ParserException {
        return new PrattParser(source, signatures).parse();
    }
    public Expression parse(String source, SignatureTable signatures,
                            Map<String, Expression> inserts)
            throws ParserException {
        if (inserts == null)
            throw new NullPointerException("Inserts may not be null");
        return new PrattParser(source, signatures, inserts).parse();
    }

    public SculpParser createParser(String source, SignatureTable signatures)
            throws ParserException {
        return new SculpParser(parse(source, signatures));
    }
    public SculpParser createParser(String source, SignatureTable signatures,
                                    Map<String, Expression> inserts)
            throws ParserException {
        return new SculpParser(parse(source, signatures, inserts));
    }

}

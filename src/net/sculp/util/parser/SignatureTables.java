package net.sculp.util.parser;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.sculp.api.ast.Family;
import net.sculp.api.ast.Kind;
import net.sculp.api.ast.Variant;
import net.sculp.api.parser.InvalidSignatureException;
import net.sculp.api.parser.SignatureTable;
import net.sculp.util.config.Configuration;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Construction and loading of SignatureTable instances.
 * Tables are stored as JSON objects mapping procedure names to arrays of
 * variant names, e.g. {"post": ["String"], "abort": []}.
 */
public final class SignatureTables {

    public static final String CONFIG_KEY = "sculp.signatures";

    public static final String DEFAULT_RESOURCE = "signatures.json";

    private static final Logger LOGGER = Logger.getLogger("SignatureTables");

    public static class SignatureImpl implements SignatureTable.Signature {

        private final String name;
        private final List<Variant> parameterTypes;

        public SignatureImpl(String name, List<Variant> parameterTypes) {
            if (name == null)
                throw new NullPointerException(
                    "Procedure name may not be null");
            for (Variant v : parameterTypes) {
                if (v == null)
                    throw new NullPointerException(
                        "Parameter types may not be null");
            }
            this.name = name.toLowerCase(Locale.ROOT);
            this.parameterTypes = Collections.unmodifiableList(
                new ArrayList<Variant>(parameterTypes));
        }

        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            boolean first = true;
            for (Variant v : parameterTypes) {
                if (first) {
                    first = false;
                } else {
                    sb.append(", ");
                }
                sb.append(v.getName());
            }
            return sb.append(')').toString();
        }

        public boolean equals(Object other) {
            if (! (other instanceof SignatureImpl)) return false;
            SignatureImpl so = (SignatureImpl) other;
            return (name.equals(so.name) &&
                    parameterTypes.equals(so.parameterTypes));
        }

        public int hashCode() {
            return name.hashCode() ^ parameterTypes.hashCode();
        }

        public String getName() {
            return name;
        }

        public List<Variant> getParameterTypes() {
            return parameterTypes;
        }

        public int getArity() {
            return parameterTypes.size();
        }

    }

    public static class TableImpl implements SignatureTable {

        private final Map<String, SignatureTable.Signature> signatures;

        public TableImpl(Map<String, SignatureTable.Signature> signatures) {
            this.signatures = Collections.unmodifiableMap(
                new LinkedHashMap<String, SignatureTable.Signature>(
                    signatures));
        }

        public String toString() {
            return getClass().getSimpleName() + signatures.values();
        }

        public boolean equals(Object other) {
            if (! (other instanceof TableImpl)) return false;
            return signatures.equals(((TableImpl) other).signatures);
        }

        public int hashCode() {
            return signatures.hashCode();
        }

        public Set<String> getProcedureNames() {
            return signatures.keySet();
        }

        public boolean contains(String name) {
            return signatures.containsKey(name);
        }

        public SignatureTable.Signature getSignature(String name) {
            return signatures.get(name);
        }

    }

    public static class Builder {

        private final Map<String, SignatureTable.Signature> signatures;

        public Builder() {
            signatures = new LinkedHashMap<String, SignatureTable.Signature>();
        }

        /**
         * Register (or replace) the procedure with the given name.
         */
        public Builder add(String name, Variant... parameterTypes) {
            SignatureImpl sig = new SignatureImpl(name,
                Arrays.asList(parameterTypes));
            signatures.put(sig.getName(), sig);
            return this;
        }

        public SignatureTable build() {
            return new TableImpl(signatures);
        }

    }

    private static SignatureTable defaultTable;

    // Prevent construction.
    private SignatureTables() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the name of a Kind or a Family (in that order of
     * preference; case-insensitively).
     */
    public static Variant resolveVariant(String name)
            throws InvalidSignatureException {
        Variant ret = Kind.forName(name);
        if (ret == null) ret = Family.forName(name);
        if (ret == null)
            throw new InvalidSignatureException("Unknown variant " + name);
        return ret;
    }

    public static SignatureTable load(Reader input)
            throws InvalidSignatureException {
        JSONObject data;
        try {
            data = new JSONObject(new JSONTokener(input));
        } catch (JSONException exc) {
            throw new InvalidSignatureException(
                "Malformed signature table: " + exc.getMessage(), exc);
        }
        Builder ret = builder();
        for (String name : data.keySet()) {
            JSONArray types = data.optJSONArray(name);
            if (types == null)
                throw new InvalidSignatureException("Signature of " + name +
                    " is not an array");
            Variant[] variants = new Variant[types.length()];
            for (int i = 0; i < variants.length; i++) {
                Object item = types.get(i);
                if (! (item instanceof String))
                    throw new InvalidSignatureException("Parameter " +
                        (i + 1) + " of " + name + " is not a string");
                variants[i] = resolveVariant((String) item);
            }
            ret.add(name, variants);
        }
        return ret.build();
    }
    public static SignatureTable load(File path)
            throws InvalidSignatureException {
        try {
            InputStream in = new FileInputStream(path);
            try {
                return load(new InputStreamReader(in,
                                                  StandardCharsets.UTF_8));
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new InvalidSignatureException(
                "Cannot read signature table " + path, exc);
        }
    }

    /**
     * The table bundled with this package.
     */
    public static synchronized SignatureTable getDefault() {
        if (defaultTable == null) {
            InputStream in = SignatureTables.class.getResourceAsStream(
                DEFAULT_RESOURCE);
            if (in == null)
                throw new RuntimeException("Missing resource " +
                                           DEFAULT_RESOURCE);
            try {
                try {
                    defaultTable = load(new InputStreamReader(in,
                        StandardCharsets.UTF_8));
                } finally {
                    in.close();
                }
            } catch (IOException exc) {
                throw new RuntimeException(exc);
            } catch (InvalidSignatureException exc) {
                throw new RuntimeException(exc);
            }
            LOGGER.log(Level.CONFIG, "Loaded default signature table " +
                       "({0} procedures)",
                       defaultTable.getProcedureNames().size());
        }
        return defaultTable;
    }

    /**
     * The table named by the CONFIG_KEY configuration value, or the
     * default one if there is none.
     */
    public static SignatureTable fromConfiguration(Configuration config)
            throws InvalidSignatureException {
        String path = config.get(CONFIG_KEY);
        if (path == null || path.isEmpty()) return getDefault();
        SignatureTable ret = load(new File(path));
        LOGGER.log(Level.INFO, "Loaded signature table from {0} " +
                   "({1} procedures)",
                   new Object[] { path, ret.getProcedureNames().size() });
        return ret;
    }

}

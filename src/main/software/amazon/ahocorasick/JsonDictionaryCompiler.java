package software.amazon.ahocorasick;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a dictionary written as a JSON array of strings, e.g.
 * <pre>
 *   [ "abcd", "bcde", "cdef" ]
 * </pre>
 * Each string becomes one pattern, encoded as UTF-8; its position in the array is the pattern index the automaton
 * reports. Duplicates and empty strings are passed through as-is, it's up to the automaton's configuration whether
 * they are acceptable.
 */
public class JsonDictionaryCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonDictionaryCompiler() { }

    /**
     * Verify the syntax of a dictionary
     * @param source dictionary, as a String
     * @return null if the dictionary is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a dictionary from its JSON form to the list of patterns the automaton builder accepts.
     *
     * @param source dictionary, as a String
     * @return the patterns, in array order
     * @throws IOException if the dictionary isn't syntactically valid
     */
    public static List<byte[]> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<byte[]> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<byte[]> compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<byte[]> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static List<byte[]> doCompile(final JsonParser parser) throws IOException {
        try (JsonParser p = parser) {
            if (p.nextToken() != JsonToken.START_ARRAY) {
                barf(p, "Dictionary is not an array");
            }
            final List<byte[]> patterns = new ArrayList<>();
            JsonToken token;
            while ((token = p.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.VALUE_STRING) {
                    barf(p, "Pattern at index " + patterns.size() + " must be a string");
                }
                patterns.add(p.getText().getBytes(StandardCharsets.UTF_8));
            }
            if (p.nextToken() != null) {
                barf(p, "Garbage after the dictionary array");
            }
            return patterns;
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}

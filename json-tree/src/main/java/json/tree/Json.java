package json.tree;

import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Static entry points for reading and writing {@link JsonValue} trees.
///
/// Reading pulls characters through a {@link JsonLexer} into a recursive
/// descent {@link JsonParser}. A document may hold several top-level values one
/// after another; {@link #parse(String)} returns the last of them (each later
/// value replaces the earlier one) and {@link #parseAll(String)} returns all of
/// them.
///
/// Writing defaults to the legacy layout (padded brackets, a separator after
/// every element, raw strings); {@link #toJson(JsonView)} writes RFC 8259 text.
///
/// ## Example Usage
/// ```java
/// JsonValue doc = Json.parse("{\"a\":1,\"b\":[true,null]}");
/// doc.keys();                 // [b, a]: members are prepended as they are read
/// Json.toText(doc);           // "{ b:[ true, null, ] , a:1, } "
/// Json.toJson(doc);           // "{\"b\":[true,null],\"a\":1}"
///
/// JsonValue appended = Json.parse("{\"a\":1,\"b\":2}",
///         JsonReadOptions.DEFAULT.withMemberOrder(JsonReadOptions.MemberOrder.APPEND));
/// appended.keys();            // [a, b]
/// ```
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    private Json() {
        throw new AssertionError("Json cannot be instantiated");
    }

    /// {@return the last top-level value in `in`, or a null value if there is none}
    /// @throws JsonLexException if a character cannot be lexed
    /// @throws JsonParseException if the tokens do not form valid values
    public static JsonValue parse(String in) {
        return parse(in, JsonReadOptions.DEFAULT);
    }

    /// As {@link #parse(String)}, reading with the given options.
    public static JsonValue parse(String in, JsonReadOptions options) {
        Objects.requireNonNull(in, "in must not be null");
        return parse(new StringReader(in), options);
    }

    /// As {@link #parse(String)}, reading from `in` until it is exhausted.
    /// The reader is not closed.
    /// @throws UncheckedIOException if the reader fails
    public static JsonValue parse(Reader in) {
        return parse(in, JsonReadOptions.DEFAULT);
    }

    /// As {@link #parse(Reader)}, reading with the given options.
    public static JsonValue parse(Reader in, JsonReadOptions options) {
        final var target = new JsonValue();
        read(in, target, options);
        return target;
    }

    /// {@return every top-level value in `in`, in source order}
    public static List<JsonValue> parseAll(String in) {
        return parseAll(in, JsonReadOptions.DEFAULT);
    }

    /// As {@link #parseAll(String)}, reading with the given options.
    public static List<JsonValue> parseAll(String in, JsonReadOptions options) {
        Objects.requireNonNull(in, "in must not be null");
        return parseAll(new StringReader(in), options);
    }

    /// As {@link #parseAll(String)}, reading from `in` until it is exhausted.
    public static List<JsonValue> parseAll(Reader in) {
        return parseAll(in, JsonReadOptions.DEFAULT);
    }

    /// As {@link #parseAll(Reader)}, reading with the given options.
    public static List<JsonValue> parseAll(Reader in, JsonReadOptions options) {
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Parsing all values with " + options);
        final var values = new JsonParser(new JsonLexer(in, options), options).parseDocument();
        LOG.fine(() -> "Parsed " + values.size() + " top-level value(s)");
        return List.copyOf(values);
    }

    /// Reads `in` to exhaustion, moving each completed top-level value into
    /// `target`. If nothing is read, `target` is left unchanged.
    ///
    /// If reading fails, `target` may hold an earlier top-level value or its
    /// original content; it must be treated as invalid.
    ///
    /// @return `target`
    public static JsonValue read(Reader in, JsonValue target, JsonReadOptions options) {
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Parsing with " + options);
        final int count = new JsonParser(new JsonLexer(in, options), options).parseDocumentInto(target);
        LOG.fine(() -> "Parsed " + count + " top-level value(s), result is " + target.kind());
        return target;
    }

    /// As {@link #read(Reader, JsonValue, JsonReadOptions)} with the default options.
    public static JsonValue read(Reader in, JsonValue target) {
        return read(in, target, JsonReadOptions.DEFAULT);
    }

    /// {@return `value` in the legacy layout}
    public static String toText(JsonView value) {
        return JsonWriter.LEGACY.toText(value);
    }

    /// {@return `value` as RFC 8259 JSON text}
    public static String toJson(JsonView value) {
        return JsonWriter.JSON.toText(value);
    }

    /// Writes `value` to `out` in the legacy layout.
    /// @throws UncheckedIOException if `out` fails
    public static void write(JsonView value, Appendable out) {
        JsonWriter.LEGACY.write(value, out);
    }
}

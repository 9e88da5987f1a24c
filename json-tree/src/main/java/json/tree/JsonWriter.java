package json.tree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders a {@link JsonValue} tree as text.
///
/// Two layouts are available:
///
/// | Value | {@link Style#LEGACY} | {@link Style#JSON} |
/// |-------|----------------------|--------------------|
/// | list `[1,2]` | `[ 1, 2, ] ` | `[1,2]` |
/// | object `{"a":1}` | `{ a:1, } ` | `{"a":1}` |
/// | string `x"y` | `x"y` | `"x\"y"` |
///
/// `LEGACY` keeps the separator after every element, pads the brackets and
/// writes strings and keys raw. `JSON` produces RFC 8259 text. Both walk
/// objects in their stored member order.
///
/// Numbers are written without an exponent so the lexer can read them back:
/// integral values drop the fraction (`1`), others use the shortest decimal
/// that identifies the `double` (`0.1`).
public final class JsonWriter {

    private static final Logger LOG = Logger.getLogger(JsonWriter.class.getName());

    /// Output layout.
    public enum Style {
        LEGACY,
        JSON
    }

    public static final JsonWriter LEGACY = new JsonWriter(Style.LEGACY);
    public static final JsonWriter JSON = new JsonWriter(Style.JSON);

    private final Style style;

    private JsonWriter(Style style) {
        this.style = style;
    }

    /// {@return the writer for the given style}
    public static JsonWriter of(Style style) {
        return Objects.requireNonNull(style, "style must not be null") == Style.LEGACY ? LEGACY : JSON;
    }

    /// {@return `value` rendered as a `String`}
    public String toText(JsonView value) {
        final var sb = new StringBuilder();
        render(value, sb);
        return sb.toString();
    }

    /// Writes `value` to `out`.
    /// @throws UncheckedIOException if `out` fails
    public void write(JsonView value, Appendable out) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(out, "out must not be null");
        LOG.fine(() -> "Writing " + value.kind() + " as " + style);
        if (out instanceof StringBuilder sb) {
            render(value, sb);
            return;
        }
        final var sb = new StringBuilder();
        render(value, sb);
        try {
            out.append(sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void render(JsonView value, StringBuilder out) {
        switch (value.kind()) {
            case NULL -> out.append("null");
            case BOOL -> out.append(value.getBool() ? "true" : "false");
            case NUMBER -> out.append(formatNumber(value.getNumber(), style));
            case STRING -> {
                if (style == Style.LEGACY) {
                    out.append(value.getString());
                } else {
                    quote(value.getString(), out);
                }
            }
            case LIST -> renderList(value, out);
            case OBJECT -> renderObject(value, out);
        }
    }

    private void renderList(JsonView list, StringBuilder out) {
        if (style == Style.LEGACY) {
            out.append("[ ");
            list.forEachElement(e -> {
                render(e, out);
                out.append(", ");
            });
            out.append("] ");
            return;
        }
        out.append('[');
        final boolean[] first = {true};
        list.forEachElement(e -> {
            if (!first[0]) {
                out.append(',');
            }
            first[0] = false;
            render(e, out);
        });
        out.append(']');
    }

    private void renderObject(JsonView object, StringBuilder out) {
        if (style == Style.LEGACY) {
            out.append("{ ");
            object.forEachMember((k, v) -> {
                out.append(k).append(':');
                render(v, out);
                out.append(", ");
            });
            out.append("} ");
            return;
        }
        out.append('{');
        final boolean[] first = {true};
        object.forEachMember((k, v) -> {
            if (!first[0]) {
                out.append(',');
            }
            first[0] = false;
            quote(k, out);
            out.append(':');
            render(v, out);
        });
        out.append('}');
    }

    /// {@return the text for `d` in the given style}
    static String formatNumber(double d, Style style) {
        if (Double.isNaN(d)) {
            return style == Style.LEGACY ? "nan" : "null";
        }
        if (Double.isInfinite(d)) {
            if (style == Style.JSON) {
                return "null";
            }
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return Double.doubleToRawLongBits(d) == 0L ? "0" : "-0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    private static void quote(String s, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}

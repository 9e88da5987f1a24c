package json.tree;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Options controlling how {@link Json} reads text.
///
/// {@link #DEFAULT} reproduces the legacy reader exactly: object members are
/// prepended, only space and newline are whitespace, and the three characters
/// after an `n` are skipped without checking that they spell `ull`.
///
/// @param memberOrder where a parsed member goes in its object
/// @param whitespace which characters separate tokens
/// @param strictNullLiteral if `true`, `n` must be followed by `ull`
public record JsonReadOptions(MemberOrder memberOrder, Whitespace whitespace, boolean strictNullLiteral) {

    private static final Logger LOG = Logger.getLogger(JsonReadOptions.class.getName());

    /// System property selecting {@link MemberOrder}: `prepend` or `append`.
    public static final String MEMBER_ORDER_PROPERTY = "json.tree.memberOrder";

    /// System property selecting {@link Whitespace}: `legacy` or `rfc8259`.
    public static final String WHITESPACE_PROPERTY = "json.tree.whitespace";

    /// System property enabling strict null literals: `true` or `false`.
    public static final String STRICT_NULL_PROPERTY = "json.tree.strictNull";

    public static final JsonReadOptions DEFAULT =
            new JsonReadOptions(MemberOrder.PREPEND, Whitespace.LEGACY, false);

    /// Placement of object members as they are parsed.
    public enum MemberOrder {
        /// Each member goes to the front; iteration order is the reverse of source order.
        PREPEND,
        /// Each member goes to the back; iteration order is source order.
        APPEND
    }

    /// Characters skipped between tokens.
    public enum Whitespace {
        /// Space and newline only. A tab or carriage return is a lex error.
        LEGACY,
        /// Space, newline, tab and carriage return.
        RFC8259;

        boolean isWhitespace(int c) {
            return c == ' ' || c == '\n' || (this == RFC8259 && (c == '\t' || c == '\r'));
        }
    }

    public JsonReadOptions {
        Objects.requireNonNull(memberOrder, "memberOrder must not be null");
        Objects.requireNonNull(whitespace, "whitespace must not be null");
    }

    public JsonReadOptions withMemberOrder(MemberOrder order) {
        return new JsonReadOptions(order, whitespace, strictNullLiteral);
    }

    public JsonReadOptions withWhitespace(Whitespace ws) {
        return new JsonReadOptions(memberOrder, ws, strictNullLiteral);
    }

    public JsonReadOptions withStrictNullLiteral(boolean strict) {
        return new JsonReadOptions(memberOrder, whitespace, strict);
    }

    /// {@return {@link #DEFAULT} overlaid with any of the `json.tree.*` system properties that are set}
    /// Unrecognised property values are logged at `WARNING` and ignored.
    public static JsonReadOptions fromSystemProperties() {
        var options = DEFAULT;

        final String order = System.getProperty(MEMBER_ORDER_PROPERTY);
        if (order != null) {
            switch (order.trim().toLowerCase(Locale.ROOT)) {
                case "prepend" -> options = options.withMemberOrder(MemberOrder.PREPEND);
                case "append" -> options = options.withMemberOrder(MemberOrder.APPEND);
                default -> LOG.warning(() -> "Invalid " + MEMBER_ORDER_PROPERTY + ": " + order
                        + ". Using default: " + DEFAULT.memberOrder());
            }
        }

        final String ws = System.getProperty(WHITESPACE_PROPERTY);
        if (ws != null) {
            switch (ws.trim().toLowerCase(Locale.ROOT)) {
                case "legacy" -> options = options.withWhitespace(Whitespace.LEGACY);
                case "rfc8259" -> options = options.withWhitespace(Whitespace.RFC8259);
                default -> LOG.warning(() -> "Invalid " + WHITESPACE_PROPERTY + ": " + ws
                        + ". Using default: " + DEFAULT.whitespace());
            }
        }

        final String strict = System.getProperty(STRICT_NULL_PROPERTY);
        if (strict != null) {
            switch (strict.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> options = options.withStrictNullLiteral(true);
                case "false" -> options = options.withStrictNullLiteral(false);
                default -> LOG.warning(() -> "Invalid " + STRICT_NULL_PROPERTY + ": " + strict
                        + ". Using default: " + DEFAULT.strictNullLiteral());
            }
        }

        final var resolved = options;
        LOG.fine(() -> "Resolved read options: " + resolved);
        return resolved;
    }
}

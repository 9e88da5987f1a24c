package json.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser over a {@link JsonLexer}.
///
/// One routine per nonterminal: {@link #parseValueFrom(Token)} dispatches,
/// {@link #parseObject()} and {@link #parseList()} each run their own separator
/// state machine until the closing bracket. Tokens are pulled one at a time;
/// there is no lookahead beyond the token in hand.
///
/// Separator rules shared by objects and lists:
/// - a comma is only legal after a complete member or element
/// - a doubled comma or a leading comma is an error
/// - a single trailing comma before the closing bracket is accepted
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private final JsonLexer lexer;
    private final JsonReadOptions options;

    JsonParser(JsonLexer lexer, JsonReadOptions options) {
        this.lexer = Objects.requireNonNull(lexer, "lexer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Reads top-level values until end of input.
    /// @return every top-level value in source order, possibly none
    List<JsonValue> parseDocument() {
        final var values = new ArrayList<JsonValue>();
        JsonValue value;
        while ((value = parseValueFrom(lexer.nextToken())) != null) {
            values.add(value);
        }
        LOG.finer(() -> "document held " + values.size() + " top-level value(s)");
        return values;
    }

    /// Reads top-level values until end of input, moving each into `target`
    /// as soon as it is complete. A later value replaces an earlier one.
    /// @return the number of top-level values read
    int parseDocumentInto(JsonValue target) {
        int count = 0;
        JsonValue value;
        while ((value = parseValueFrom(lexer.nextToken())) != null) {
            target.moveFrom(value);
            count++;
        }
        return count;
    }

    /// {@return the value that starts with `token`, or `null` at end of input}
    /// @throws JsonParseException if `token` cannot start a value
    JsonValue parseValueFrom(Token token) {
        return switch (token.kind()) {
            case OBJECT_OPEN -> parseObject();
            case LIST_OPEN -> parseList();
            case STRING_LIT, NUMBER_LIT, BOOL_LIT, NULL_LIT -> literal(token);
            case END_OF_INPUT -> null;
            default -> throw new JsonParseException("Invalid document: unexpected " + token.describe());
        };
    }

    /// Parses object members up to and including the closing `}`; the opening
    /// `{` has already been consumed.
    JsonValue parseObject() {
        final var object = JsonValue.newObject();
        String pendingKey = null;
        boolean colonSeen = false;
        boolean commaSeen = false;
        boolean firstMember = true;

        while (true) {
            final Token token = lexer.nextToken();
            switch (token.kind()) {
                case OBJECT_CLOSE -> {
                    if (pendingKey != null) {
                        throw new JsonParseException("Missing value for key \"" + pendingKey + "\" before '}'");
                    }
                    return object;
                }
                case END_OF_INPUT -> throw new JsonParseException("Unterminated object");
                case COLON -> {
                    if (pendingKey == null || colonSeen) {
                        throw new JsonParseException("Unexpected ':' in object");
                    }
                    colonSeen = true;
                }
                case COMMA -> {
                    if (pendingKey != null) {
                        throw new JsonParseException("Missing value for key \"" + pendingKey + "\" before ','");
                    }
                    if (firstMember) {
                        throw new JsonParseException("Leading ',' in object");
                    }
                    if (commaSeen) {
                        throw new JsonParseException("Doubled ',' in object");
                    }
                    commaSeen = true;
                }
                case LIST_CLOSE -> throw new JsonParseException("Unexpected ']' in object");
                default -> {
                    if (pendingKey == null) {
                        if (!token.kind().isLiteral()) {
                            throw new JsonParseException("Expected member key but found " + token.describe());
                        }
                        // any literal text is accepted as a key
                        pendingKey = token.text();
                        continue;
                    }
                    if (!colonSeen) {
                        throw new JsonParseException("Missing ':' after key \"" + pendingKey + "\"");
                    }
                    if (!firstMember && !commaSeen) {
                        throw new JsonParseException("Missing ',' before key \"" + pendingKey + "\"");
                    }
                    final JsonValue value = parseValueFrom(token);
                    object.adoptMember(pendingKey, value, options.memberOrder());
                    final String key = pendingKey;
                    LOG.finer(() -> "member " + key);
                    pendingKey = null;
                    colonSeen = false;
                    commaSeen = false;
                    firstMember = false;
                }
            }
        }
    }

    /// Parses list elements up to and including the closing `]`; the opening
    /// `[` has already been consumed. Elements keep source order.
    JsonValue parseList() {
        final var list = JsonValue.newList();
        boolean commaSeen = false;
        boolean firstElement = true;

        while (true) {
            final Token token = lexer.nextToken();
            switch (token.kind()) {
                case LIST_CLOSE -> {
                    return list;
                }
                case END_OF_INPUT -> throw new JsonParseException("Unterminated list");
                case COMMA -> {
                    if (firstElement) {
                        throw new JsonParseException("Leading ',' in list");
                    }
                    if (commaSeen) {
                        throw new JsonParseException("Doubled ',' in list");
                    }
                    commaSeen = true;
                }
                case COLON, OBJECT_CLOSE -> throw new JsonParseException("Unexpected " + token.describe() + " in list");
                default -> {
                    if (!firstElement && !commaSeen) {
                        throw new JsonParseException("Missing ',' before " + token.describe());
                    }
                    list.adoptBack(parseValueFrom(token));
                    commaSeen = false;
                    firstElement = false;
                }
            }
        }
    }

    private static JsonValue literal(Token token) {
        return switch (token.kind()) {
            case STRING_LIT -> JsonValue.of(token.text());
            case NUMBER_LIT -> number(token.text());
            case BOOL_LIT -> JsonValue.of(Token.TRUE.text().equals(token.text()));
            case NULL_LIT -> JsonValue.nullValue();
            default -> throw new IllegalStateException("Not a literal: " + token);
        };
    }

    /// Converts the whole token. Text whose magnitude does not fit a finite
    /// `double`, or that would round to zero although it has a non-zero digit,
    /// is rejected rather than stored as infinity or zero.
    private static JsonValue number(String text) {
        final double d;
        try {
            d = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new JsonParseException("Invalid number literal '" + text + "'", e);
        }
        if (!Double.isFinite(d)) {
            throw new JsonParseException("Invalid number literal '" + text + "': out of range");
        }
        if (d == 0.0 && hasNonZeroDigit(text)) {
            throw new JsonParseException("Invalid number literal '" + text + "': underflows to zero");
        }
        return JsonValue.of(d);
    }

    private static boolean hasNonZeroDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }
}

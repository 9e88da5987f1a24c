package json.tree;

import java.util.Objects;

/// A lexical unit produced by {@link JsonLexer}. Tokens carry no position.
///
/// `text` is the raw text of a literal: string content without the quotes,
/// the accumulated number characters, `true`/`false`, or `null`. Structural
/// tokens carry their single character.
record Token(Kind kind, String text) {

    enum Kind {
        OBJECT_OPEN,
        OBJECT_CLOSE,
        LIST_OPEN,
        LIST_CLOSE,
        COLON,
        COMMA,
        STRING_LIT,
        NUMBER_LIT,
        BOOL_LIT,
        NULL_LIT,
        END_OF_INPUT;

        boolean isLiteral() {
            return this == STRING_LIT || this == NUMBER_LIT || this == BOOL_LIT || this == NULL_LIT;
        }
    }

    static final Token OBJECT_OPEN = new Token(Kind.OBJECT_OPEN, "{");
    static final Token OBJECT_CLOSE = new Token(Kind.OBJECT_CLOSE, "}");
    static final Token LIST_OPEN = new Token(Kind.LIST_OPEN, "[");
    static final Token LIST_CLOSE = new Token(Kind.LIST_CLOSE, "]");
    static final Token COLON = new Token(Kind.COLON, ":");
    static final Token COMMA = new Token(Kind.COMMA, ",");
    static final Token TRUE = new Token(Kind.BOOL_LIT, "true");
    static final Token FALSE = new Token(Kind.BOOL_LIT, "false");
    static final Token NULL = new Token(Kind.NULL_LIT, "null");
    static final Token END = new Token(Kind.END_OF_INPUT, "");

    Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /// {@return a short description for error messages}
    String describe() {
        return switch (kind) {
            case END_OF_INPUT -> "end of input";
            case STRING_LIT -> "string \"" + text + "\"";
            case NUMBER_LIT -> "number " + text;
            default -> "'" + text + "'";
        };
    }
}

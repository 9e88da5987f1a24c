package json.tree;

/// Thrown when the input holds a character that cannot start a token, a
/// literal such as `true` or `false` is misspelled, or a string literal is
/// left unterminated.
public final class JsonLexException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final String offendingText;

    /// Creates an exception for a character that cannot start any token.
    public JsonLexException(char offending) {
        super("Unrecognized character '" + offending + "'");
        this.offendingText = String.valueOf(offending);
    }

    /// Creates an exception carrying the literal text that failed to lex.
    public JsonLexException(String message, String offendingText) {
        super(message + ": '" + offendingText + "'");
        this.offendingText = offendingText;
    }

    /// Returns the character or literal text that could not be lexed.
    public String offendingText() {
        return offendingText;
    }
}

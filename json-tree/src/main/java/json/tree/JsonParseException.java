package json.tree;

/// Thrown when a token sequence violates the object/list grammar, or a number
/// literal does not convert to a `double`.
///
/// No position is reported; the message names the offending token.
public final class JsonParseException extends JsonException {

    private static final long serialVersionUID = 1L;

    /// Creates a new parse exception with the given message.
    public JsonParseException(String message) {
        super(message);
    }

    /// Creates a new parse exception with a cause.
    public JsonParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

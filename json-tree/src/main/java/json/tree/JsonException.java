package json.tree;

/// Base of every failure raised while lexing, parsing or accessing a {@link JsonValue}.
///
/// All subclasses are unchecked: a failure aborts the current parse or accessor
/// call and there is no recovery. A value that was the target of a failed parse
/// must not be relied upon.
public abstract sealed class JsonException extends RuntimeException
        permits JsonLexException, JsonParseException, JsonTypeMismatchException, JsonNotFoundException {

    private static final long serialVersionUID = 1L;

    JsonException(String message) {
        super(message);
    }

    JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}

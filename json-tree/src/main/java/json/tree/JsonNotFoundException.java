package json.tree;

/// Thrown by read-only lookups when an object has no member with the requested
/// key, or a list index is out of bounds.
public final class JsonNotFoundException extends JsonException {

    private static final long serialVersionUID = 1L;

    public JsonNotFoundException(String message) {
        super(message);
    }

    /// {@return an exception for a missing object member}
    static JsonNotFoundException missingKey(String key) {
        return new JsonNotFoundException("Object member \"" + key + "\" does not exist");
    }

    /// {@return an exception for a list index outside `[0, length)`}
    static JsonNotFoundException indexOutOfBounds(int index, int length) {
        return new JsonNotFoundException("List index " + index + " out of bounds for length " + length);
    }
}

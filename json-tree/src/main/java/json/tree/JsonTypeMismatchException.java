package json.tree;

import java.util.Objects;

/// Thrown when an accessor or mutator is applied to a {@link JsonValue} whose
/// active variant is not the one the operation requires. No accessor coerces
/// between variants.
public final class JsonTypeMismatchException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final JsonKind expected;
    private final JsonKind actual;

    public JsonTypeMismatchException(JsonKind expected, JsonKind actual) {
        super("Expected " + Objects.requireNonNull(expected) + " but value is " + Objects.requireNonNull(actual));
        this.expected = expected;
        this.actual = actual;
    }

    /// Returns the variant the operation required.
    public JsonKind expected() {
        return expected;
    }

    /// Returns the variant the value actually held.
    public JsonKind actual() {
        return actual;
    }
}

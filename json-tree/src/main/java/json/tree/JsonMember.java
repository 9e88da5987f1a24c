package json.tree;

import java.util.Objects;

/// A key/value member of an object {@link JsonValue}.
///
/// The key is fixed; the value slot is live, so mutating `value()` mutates the
/// object that holds this member.
///
/// @param key the member key. Non-null, may be empty.
/// @param value the member value. Non-null.
public record JsonMember(String key, JsonValue value) {

    public JsonMember {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a member holding a deep copy of this member's value}
    public JsonMember copy() {
        return new JsonMember(key, value.copy());
    }

    @Override
    public String toString() {
        return key + ":" + value;
    }
}

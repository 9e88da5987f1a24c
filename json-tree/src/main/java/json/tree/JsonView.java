package json.tree;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/// The read-only face of a {@link JsonValue}.
///
/// Every `JsonValue` is a `JsonView`; {@link JsonValue#readOnly()} returns a
/// view that cannot be cast back to a mutable value, and whose children are
/// views too.
///
/// Keyed lookup through a view never creates members: {@link #get(String)}
/// throws {@link JsonNotFoundException} for an absent key, where
/// {@link JsonValue#member(String)} would append a fresh `null` member.
///
/// ## Example Usage
/// ```java
/// JsonView doc = Json.parse("{\"name\":\"Ada\",\"tags\":[1,2]}").readOnly();
/// String name = doc.get("name").getString();
/// doc.get("tags").forEachElement(tag -> System.out.println(tag.getNumber()));
/// ```
public interface JsonView {

    /// {@return the active variant}
    JsonKind kind();

    default boolean isNull() {
        return kind() == JsonKind.NULL;
    }

    default boolean isBool() {
        return kind() == JsonKind.BOOL;
    }

    default boolean isNumber() {
        return kind() == JsonKind.NUMBER;
    }

    default boolean isString() {
        return kind() == JsonKind.STRING;
    }

    default boolean isList() {
        return kind() == JsonKind.LIST;
    }

    default boolean isObject() {
        return kind() == JsonKind.OBJECT;
    }

    /// {@return the boolean payload}
    /// @throws JsonTypeMismatchException if this is not a bool
    boolean getBool();

    /// {@return the number payload}
    /// @throws JsonTypeMismatchException if this is not a number
    double getNumber();

    /// {@return the string payload}
    /// @throws JsonTypeMismatchException if this is not a string
    String getString();

    /// {@return the number of elements of a list or members of an object}
    /// @throws JsonTypeMismatchException if this is neither a list nor an object
    int size();

    /// {@return the list element at `index`}
    /// @throws JsonTypeMismatchException if this is not a list
    /// @throws JsonNotFoundException if `index` is out of bounds
    JsonView element(int index);

    /// {@return the value of the first member whose key equals `key`}
    /// @throws JsonTypeMismatchException if this is not an object
    /// @throws JsonNotFoundException if no member has that key
    JsonView get(String key);

    /// {@return `true` if an object has a member with the given key}
    /// @throws JsonTypeMismatchException if this is not an object
    boolean contains(String key);

    /// {@return the member keys of an object, in member order, duplicates included}
    /// @throws JsonTypeMismatchException if this is not an object
    List<String> keys();

    /// Passes each list element to `action`, in order.
    /// @throws JsonTypeMismatchException if this is not a list
    void forEachElement(Consumer<? super JsonView> action);

    /// Passes each object member to `action`, in member order.
    /// @throws JsonTypeMismatchException if this is not an object
    void forEachMember(BiConsumer<? super String, ? super JsonView> action);
}

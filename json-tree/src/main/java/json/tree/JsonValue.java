package json.tree;

import json.tree.sequence.OrderedSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/// A mutable JSON document node holding exactly one variant:
/// null, bool, number, string, list or object.
///
/// A default-constructed `JsonValue` is null. Every setter releases the
/// current payload before installing the new one, so no two variants are ever
/// populated at once. Setting a list or object installs an empty container.
///
/// `pushBack`, `pushFront` and `insert` store a deep copy of their argument, so
/// a node added through them has this value as its only owner. {@link #copy()}
/// produces a fully independent tree. {@link #moveFrom(JsonValue)} and
/// {@link #take()} transfer a payload and leave the source null. Elements added
/// directly to the sequences returned by {@link #getList()} and
/// {@link #getObject()} are stored as given and are not copied.
///
/// Object members are kept in an {@link OrderedSequence} of {@link JsonMember}.
/// {@link #insert(String, JsonValue)} places the new member at the front, so a
/// sequence of inserts iterates in reverse insertion order. Duplicate keys are
/// stored as given; lookups find the first match.
///
/// ## Example Usage
/// ```java
/// JsonValue doc = JsonValue.newObject();
/// doc.member("name").setString("Ada");      // auto-vivifies "name"
/// doc.member("langs").setList();
/// doc.member("langs").pushBack(JsonValue.of("en"));
/// double n = doc.get("name").getNumber();     // throws JsonTypeMismatchException
/// ```
///
/// Instances are not thread safe.
public final class JsonValue implements JsonView {

    private sealed interface Variant
            permits NullVariant, BoolVariant, NumberVariant, StringVariant, ListVariant, ObjectVariant {
        JsonKind kind();
    }

    private record NullVariant() implements Variant {
        public JsonKind kind() {
            return JsonKind.NULL;
        }
    }

    private record BoolVariant(boolean value) implements Variant {
        public JsonKind kind() {
            return JsonKind.BOOL;
        }
    }

    private record NumberVariant(double value) implements Variant {
        public JsonKind kind() {
            return JsonKind.NUMBER;
        }
    }

    private record StringVariant(String value) implements Variant {
        public JsonKind kind() {
            return JsonKind.STRING;
        }
    }

    private record ListVariant(OrderedSequence<JsonValue> elements) implements Variant {
        public JsonKind kind() {
            return JsonKind.LIST;
        }
    }

    private record ObjectVariant(OrderedSequence<JsonMember> members) implements Variant {
        public JsonKind kind() {
            return JsonKind.OBJECT;
        }
    }

    private static final NullVariant NULL = new NullVariant();

    private Variant variant;

    /// Creates a null value.
    public JsonValue() {
        this.variant = NULL;
    }

    private JsonValue(Variant variant) {
        this.variant = variant;
    }

    /// {@return a new null value}
    public static JsonValue nullValue() {
        return new JsonValue();
    }

    /// {@return a new bool value}
    public static JsonValue of(boolean value) {
        return new JsonValue(new BoolVariant(value));
    }

    /// {@return a new number value}
    public static JsonValue of(double value) {
        return new JsonValue(new NumberVariant(value));
    }

    /// {@return a new string value}
    /// @param value the text, stored verbatim. Non-null.
    public static JsonValue of(String value) {
        return new JsonValue(new StringVariant(Objects.requireNonNull(value, "value must not be null")));
    }

    /// {@return a new, empty list value}
    public static JsonValue newList() {
        return new JsonValue(new ListVariant(new OrderedSequence<>()));
    }

    /// {@return a new, empty object value}
    public static JsonValue newObject() {
        return new JsonValue(new ObjectVariant(new OrderedSequence<>()));
    }

    @Override
    public JsonKind kind() {
        return variant.kind();
    }

    // ---- typed getters

    @Override
    public boolean getBool() {
        return expect(BoolVariant.class, JsonKind.BOOL).value();
    }

    @Override
    public double getNumber() {
        return expect(NumberVariant.class, JsonKind.NUMBER).value();
    }

    @Override
    public String getString() {
        return expect(StringVariant.class, JsonKind.STRING).value();
    }

    /// {@return the live element sequence of a list} Changes made through the
    /// returned sequence are changes to this value. Elements pushed onto it are
    /// not copied: pushing a node that is already in the tree shares it, and
    /// pushing an ancestor creates a cycle that `equals` and `toString` cannot
    /// traverse. Use {@link #pushBack(JsonValue)} to add an owned copy.
    /// @throws JsonTypeMismatchException if this is not a list
    public OrderedSequence<JsonValue> getList() {
        return expect(ListVariant.class, JsonKind.LIST).elements();
    }

    /// {@return the live member sequence of an object} Changes made through the
    /// returned sequence are changes to this value. Members pushed onto it are
    /// not copied; use {@link #insert(JsonMember)} to add an owned copy.
    /// @throws JsonTypeMismatchException if this is not an object
    public OrderedSequence<JsonMember> getObject() {
        return expect(ObjectVariant.class, JsonKind.OBJECT).members();
    }

    // ---- typed setters

    public void setNull() {
        variant = NULL;
    }

    public void setBool(boolean value) {
        variant = new BoolVariant(value);
    }

    public void setNumber(double value) {
        variant = new NumberVariant(value);
    }

    public void setString(String value) {
        variant = new StringVariant(Objects.requireNonNull(value, "value must not be null"));
    }

    /// Replaces the payload with an empty list, even if this already is a list.
    public void setList() {
        variant = new ListVariant(new OrderedSequence<>());
    }

    /// Replaces the payload with an empty object, even if this already is an object.
    public void setObject() {
        variant = new ObjectVariant(new OrderedSequence<>());
    }

    // ---- list mutation

    /// Inserts a deep copy of `value` before the first element of a list.
    /// @throws JsonTypeMismatchException if this is not a list
    public void pushFront(JsonValue value) {
        Objects.requireNonNull(value, "value must not be null");
        getList().pushFront(value.copy());
    }

    /// Appends a deep copy of `value` after the last element of a list.
    /// @throws JsonTypeMismatchException if this is not a list
    public void pushBack(JsonValue value) {
        Objects.requireNonNull(value, "value must not be null");
        getList().pushBack(value.copy());
    }

    /// Appends `value` itself, without copying. Only for values nothing else owns.
    void adoptBack(JsonValue value) {
        getList().pushBack(value);
    }

    // ---- object mutation

    /// Inserts a member holding a deep copy of `value` at the front of an object.
    /// Existing members with the same key are kept; the new member shadows them
    /// for lookups.
    /// @throws JsonTypeMismatchException if this is not an object
    public void insert(String key, JsonValue value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        getObject().pushFront(new JsonMember(key, value.copy()));
    }

    /// Inserts a copy of `member` at the front of an object.
    /// @throws JsonTypeMismatchException if this is not an object
    public void insert(JsonMember member) {
        Objects.requireNonNull(member, "member must not be null");
        getObject().pushFront(member.copy());
    }

    /// Adds a member holding `value` itself, at the front or the back.
    void adoptMember(String key, JsonValue value, JsonReadOptions.MemberOrder order) {
        final var members = getObject();
        final var member = new JsonMember(key, value);
        if (order == JsonReadOptions.MemberOrder.APPEND) {
            members.pushBack(member);
        } else {
            members.pushFront(member);
        }
    }

    /// {@return the live value of the first member with the given key}
    /// If there is no such member, a null member is appended at the back and
    /// its value slot returned, so `doc.member("a").setNumber(1)` creates `a`.
    /// @throws JsonTypeMismatchException if this is not an object
    public JsonValue member(String key) {
        Objects.requireNonNull(key, "key must not be null");
        final var members = getObject();
        for (JsonMember m : members) {
            if (m.key().equals(key)) {
                return m.value();
            }
        }
        final var slot = new JsonValue();
        members.pushBack(new JsonMember(key, slot));
        return slot;
    }

    @Override
    public JsonValue get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        for (JsonMember m : getObject()) {
            if (m.key().equals(key)) {
                return m.value();
            }
        }
        throw JsonNotFoundException.missingKey(key);
    }

    @Override
    public boolean contains(String key) {
        Objects.requireNonNull(key, "key must not be null");
        for (JsonMember m : getObject()) {
            if (m.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> keys() {
        final var members = getObject();
        final var keys = new ArrayList<String>(members.size());
        for (JsonMember m : members) {
            keys.add(m.key());
        }
        return List.copyOf(keys);
    }

    @Override
    public JsonValue element(int index) {
        final var elements = getList();
        if (index < 0 || index >= elements.size()) {
            throw JsonNotFoundException.indexOutOfBounds(index, elements.size());
        }
        return elements.get(index);
    }

    @Override
    public int size() {
        if (variant instanceof ListVariant list) {
            return list.elements().size();
        }
        if (variant instanceof ObjectVariant object) {
            return object.members().size();
        }
        throw new JsonTypeMismatchException(JsonKind.LIST, kind());
    }

    @Override
    public void forEachElement(Consumer<? super JsonView> action) {
        Objects.requireNonNull(action, "action must not be null");
        for (JsonValue element : getList()) {
            action.accept(element);
        }
    }

    @Override
    public void forEachMember(BiConsumer<? super String, ? super JsonView> action) {
        Objects.requireNonNull(action, "action must not be null");
        for (JsonMember m : getObject()) {
            action.accept(m.key(), m.value());
        }
    }

    // ---- copy and move

    /// {@return a deep copy of this value} Nested lists and objects are cloned
    /// recursively; the copy shares nothing mutable with this value.
    public JsonValue copy() {
        return new JsonValue(copyOf(variant));
    }

    /// Replaces this payload with a deep copy of `other`'s payload.
    /// @return this value
    public JsonValue assign(JsonValue other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other != this) {
            variant = copyOf(other.variant);
        }
        return this;
    }

    /// Takes over `other`'s payload, leaving `other` null.
    /// @return this value
    /// @throws IllegalArgumentException if this value is nested inside `other`
    public JsonValue moveFrom(JsonValue other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other == this) {
            return this;
        }
        if (isDescendantOf(other)) {
            throw new IllegalArgumentException("Cannot move a value into one of its own descendants");
        }
        variant = other.variant;
        other.variant = NULL;
        return this;
    }

    /// {@return a new value owning this payload} This value is left null.
    public JsonValue take() {
        final var taken = new JsonValue(variant);
        variant = NULL;
        return taken;
    }

    /// {@return a read-only view of this value} The view reflects later changes
    /// made through this value.
    public JsonView readOnly() {
        return new ReadOnlyJsonView(this);
    }

    private static Variant copyOf(Variant variant) {
        if (variant instanceof ListVariant list) {
            return new ListVariant(OrderedSequence.copyOf(list.elements(), JsonValue::copy));
        }
        if (variant instanceof ObjectVariant object) {
            return new ObjectVariant(OrderedSequence.copyOf(object.members(), JsonMember::copy));
        }
        // the remaining variants are immutable records
        return variant;
    }

    private boolean isDescendantOf(JsonValue root) {
        if (root.variant instanceof ListVariant list) {
            for (JsonValue element : list.elements()) {
                if (element == this || isDescendantOf(element)) {
                    return true;
                }
            }
        } else if (root.variant instanceof ObjectVariant object) {
            for (JsonMember m : object.members()) {
                if (m.value() == this || isDescendantOf(m.value())) {
                    return true;
                }
            }
        }
        return false;
    }

    private <V extends Variant> V expect(Class<V> type, JsonKind expected) {
        if (!type.isInstance(variant)) {
            throw new JsonTypeMismatchException(expected, variant.kind());
        }
        return type.cast(variant);
    }

    /// {@return `true` if `obj` is a `JsonValue` with the same variant and an
    /// equal payload} Lists and objects compare element by element, in order.
    @Override
    public boolean equals(Object obj) {
        return this == obj || obj instanceof JsonValue other && variant.equals(other.variant);
    }

    @Override
    public int hashCode() {
        return variant.hashCode();
    }

    /// {@return this value rendered by {@link JsonWriter.Style#LEGACY}}
    @Override
    public String toString() {
        return JsonWriter.LEGACY.toText(this);
    }
}

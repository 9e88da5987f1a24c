package json.tree;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/// Read-only wrapper returned by {@link JsonValue#readOnly()}. Children are
/// wrapped on the way out, so no path leads back to a mutable node.
final class ReadOnlyJsonView implements JsonView {

    private final JsonValue target;

    ReadOnlyJsonView(JsonValue target) {
        this.target = Objects.requireNonNull(target);
    }

    @Override
    public JsonKind kind() {
        return target.kind();
    }

    @Override
    public boolean getBool() {
        return target.getBool();
    }

    @Override
    public double getNumber() {
        return target.getNumber();
    }

    @Override
    public String getString() {
        return target.getString();
    }

    @Override
    public int size() {
        return target.size();
    }

    @Override
    public JsonView element(int index) {
        return new ReadOnlyJsonView(target.element(index));
    }

    @Override
    public JsonView get(String key) {
        return new ReadOnlyJsonView(target.get(key));
    }

    @Override
    public boolean contains(String key) {
        return target.contains(key);
    }

    @Override
    public List<String> keys() {
        return target.keys();
    }

    @Override
    public void forEachElement(Consumer<? super JsonView> action) {
        Objects.requireNonNull(action, "action must not be null");
        target.forEachElement(e -> action.accept(new ReadOnlyJsonView((JsonValue) e)));
    }

    @Override
    public void forEachMember(BiConsumer<? super String, ? super JsonView> action) {
        Objects.requireNonNull(action, "action must not be null");
        target.forEachMember((k, v) -> action.accept(k, new ReadOnlyJsonView((JsonValue) v)));
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || obj instanceof ReadOnlyJsonView other && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return target.hashCode();
    }

    @Override
    public String toString() {
        return target.toString();
    }
}

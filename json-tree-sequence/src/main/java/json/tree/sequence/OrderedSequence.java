package json.tree.sequence;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// An ordered, mutable sequence backed by singly linked owned nodes.
///
/// The sequence keeps a pointer to its first and last node, so the cost model is:
/// - `pushFront`, `pushBack`, `popFront`: O(1)
/// - `popBack`, `get(int)`, `set(int, Object)`: O(n)
///
/// Iteration is forward-only. Iterators are fail-fast: a structural change made
/// through the sequence while an iterator is live makes the iterator throw
/// `ConcurrentModificationException` on its next step.
///
/// `null` elements are not permitted.
///
/// ## Example Usage
/// ```java
/// OrderedSequence<String> seq = OrderedSequence.of("b", "c");
/// seq.pushFront("a");
/// seq.pushBack("d");
/// // [a, b, c, d]
/// OrderedSequence<String> clone = OrderedSequence.copyOf(seq, UnaryOperator.identity());
/// ```
///
/// @param <T> the element type
public final class OrderedSequence<T> implements Iterable<T> {

    private static final Logger LOG = Logger.getLogger(OrderedSequence.class.getName());

    private static final class Node<T> {
        T value;
        Node<T> next;

        Node(T value) {
            this.value = value;
        }
    }

    private Node<T> head;
    private Node<T> tail;
    private int size;
    private int modCount;

    /// Creates an empty sequence.
    public OrderedSequence() {
    }

    /// Creates a sequence holding a single element.
    /// @param value the only element. Non-null.
    public OrderedSequence(T value) {
        pushBack(value);
    }

    /// {@return a sequence holding the given values in order}
    /// @param values the elements. Non-null, and no element may be null.
    @SafeVarargs
    public static <T> OrderedSequence<T> of(T... values) {
        Objects.requireNonNull(values, "values must not be null");
        final var seq = new OrderedSequence<T>();
        for (T value : values) {
            seq.pushBack(value);
        }
        return seq;
    }

    /// {@return an independent structural clone of `source`}
    /// Each element is passed through `elementCopier`, so a deep copy is obtained
    /// by supplying the element type's own copy operation.
    ///
    /// @param source the sequence to clone. Non-null.
    /// @param elementCopier produces the copy stored for each element. Non-null.
    public static <T> OrderedSequence<T> copyOf(OrderedSequence<? extends T> source,
                                                UnaryOperator<T> elementCopier) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(elementCopier, "elementCopier must not be null");
        final var copy = new OrderedSequence<T>();
        for (Node<? extends T> n = source.head; n != null; n = n.next) {
            copy.pushBack(elementCopier.apply(n.value));
        }
        return copy;
    }

    /// {@return a new sequence holding the elements of `left` followed by those of `right`}
    /// Neither operand is modified; elements are shared, not copied.
    public static <T> OrderedSequence<T> concat(OrderedSequence<? extends T> left, OrderedSequence<? extends T> right) {
        final OrderedSequence<T> result = copyOf(left, UnaryOperator.identity());
        result.appendAll(right);
        return result;
    }

    /// {@return a new sequence holding the elements of `left` followed by `value`}
    public static <T> OrderedSequence<T> withBack(OrderedSequence<? extends T> left, T value) {
        final OrderedSequence<T> result = copyOf(left, UnaryOperator.identity());
        result.pushBack(value);
        return result;
    }

    /// {@return a new sequence holding `value` followed by the elements of `right`}
    public static <T> OrderedSequence<T> withFront(T value, OrderedSequence<? extends T> right) {
        final OrderedSequence<T> result = copyOf(right, UnaryOperator.identity());
        result.pushFront(value);
        return result;
    }

    /// Inserts `value` before the first element.
    public void pushFront(T value) {
        final var node = new Node<>(Objects.requireNonNull(value, "value must not be null"));
        node.next = head;
        head = node;
        if (tail == null) {
            tail = node;
        }
        size++;
        modCount++;
    }

    /// Appends `value` after the last element.
    public void pushBack(T value) {
        final var node = new Node<>(Objects.requireNonNull(value, "value must not be null"));
        if (tail == null) {
            head = node;
        } else {
            tail.next = node;
        }
        tail = node;
        size++;
        modCount++;
    }

    /// Removes and returns the first element.
    /// @throws NoSuchElementException if the sequence is empty
    public T popFront() {
        if (head == null) {
            throw new NoSuchElementException("popFront on empty sequence");
        }
        final Node<T> removed = head;
        head = removed.next;
        if (head == null) {
            tail = null;
        }
        removed.next = null;
        size--;
        modCount++;
        return removed.value;
    }

    /// Removes and returns the last element. Walks the sequence to find the
    /// new last node.
    /// @throws NoSuchElementException if the sequence is empty
    public T popBack() {
        if (tail == null) {
            throw new NoSuchElementException("popBack on empty sequence");
        }
        final Node<T> removed = tail;
        if (head == removed) {
            head = null;
            tail = null;
        } else {
            Node<T> prev = head;
            while (prev.next != removed) {
                prev = prev.next;
            }
            prev.next = null;
            tail = prev;
        }
        size--;
        modCount++;
        return removed.value;
    }

    /// {@return the first element}
    /// @throws NoSuchElementException if the sequence is empty
    public T front() {
        if (head == null) {
            throw new NoSuchElementException("front of empty sequence");
        }
        return head.value;
    }

    /// {@return the last element}
    /// @throws NoSuchElementException if the sequence is empty
    public T back() {
        if (tail == null) {
            throw new NoSuchElementException("back of empty sequence");
        }
        return tail.value;
    }

    /// {@return the element at `index`}
    /// @throws IndexOutOfBoundsException if `index` is outside `[0, size())`
    public T get(int index) {
        return nodeAt(index).value;
    }

    /// Replaces the element at `index` and returns the previous one.
    /// @throws IndexOutOfBoundsException if `index` is outside `[0, size())`
    public T set(int index, T value) {
        Objects.requireNonNull(value, "value must not be null");
        final Node<T> node = nodeAt(index);
        final T previous = node.value;
        node.value = value;
        return previous;
    }

    /// {@return `true` if the sequence holds no elements}
    public boolean isEmpty() {
        return head == null;
    }

    /// {@return the number of elements}
    public int size() {
        return size;
    }

    /// Removes every element.
    public void clear() {
        // unlink so that a stray iterator cannot keep the whole chain alive
        Node<T> n = head;
        while (n != null) {
            final Node<T> next = n.next;
            n.next = null;
            n = next;
        }
        head = null;
        tail = null;
        size = 0;
        modCount++;
    }

    /// Appends every element of `other` in order. Appending a sequence to itself
    /// doubles it.
    /// @return this sequence
    public OrderedSequence<T> appendAll(OrderedSequence<? extends T> other) {
        Objects.requireNonNull(other, "other must not be null");
        final int count = other.size;
        Node<? extends T> n = other.head;
        for (int i = 0; i < count; i++) {
            pushBack(n.value);
            n = n.next;
        }
        return this;
    }

    /// Replaces the contents of this sequence with the nodes of `source`,
    /// leaving `source` empty. No element is copied.
    /// @return this sequence
    public OrderedSequence<T> moveFrom(OrderedSequence<T> source) {
        Objects.requireNonNull(source, "source must not be null");
        if (source == this) {
            return this;
        }
        clear();
        head = source.head;
        tail = source.tail;
        size = source.size;
        source.head = null;
        source.tail = null;
        source.size = 0;
        source.modCount++;
        LOG.finest(() -> "moved " + size + " nodes");
        return this;
    }

    /// {@return a new sequence owning this sequence's nodes} This sequence is left empty.
    public OrderedSequence<T> take() {
        return new OrderedSequence<T>().moveFrom(this);
    }

    /// {@return a sequential stream over the elements in order}
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public Iterator<T> iterator() {
        return new Itr();
    }

    private Node<T> nodeAt(int index) {
        Objects.checkIndex(index, size);
        Node<T> n = head;
        for (int i = 0; i < index; i++) {
            n = n.next;
        }
        return n;
    }

    /// {@return `true` if `obj` is an `OrderedSequence` with equal elements in the same order}
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OrderedSequence<?> other) || other.size != size) {
            return false;
        }
        Node<T> a = head;
        Node<?> b = other.head;
        while (a != null) {
            if (!a.value.equals(b.value)) {
                return false;
            }
            a = a.next;
            b = b.next;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Node<T> n = head; n != null; n = n.next) {
            h = 31 * h + n.value.hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("[");
        for (Node<T> n = head; n != null; n = n.next) {
            sb.append(n.value);
            if (n.next != null) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    private final class Itr implements Iterator<T> {
        private Node<T> next = head;
        private Node<T> lastReturned;
        private Node<T> beforeLastReturned;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            checkForComodification();
            if (next == null) {
                throw new NoSuchElementException();
            }
            if (lastReturned != null) {
                beforeLastReturned = lastReturned;
            }
            lastReturned = next;
            next = next.next;
            return lastReturned.value;
        }

        /// Unlinks the element last returned by `next()`. O(1), since the
        /// iterator tracks the predecessor node.
        @Override
        public void remove() {
            checkForComodification();
            if (lastReturned == null) {
                throw new IllegalStateException("next() has not been called since the last remove()");
            }
            if (beforeLastReturned == null) {
                head = lastReturned.next;
            } else {
                beforeLastReturned.next = lastReturned.next;
            }
            if (tail == lastReturned) {
                tail = beforeLastReturned;
            }
            lastReturned.next = null;
            lastReturned = null;
            size--;
            modCount++;
            expectedModCount = modCount;
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }
}

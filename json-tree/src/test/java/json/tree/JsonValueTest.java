package json.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for JsonValue - variants, accessors, lookups, copy and move
class JsonValueTest extends JsonTreeTestBase {

    // ========== Variants ==========

    @Test
    void testDefaultIsNull() {
        final var value = new JsonValue();
        assertThat(value.isNull()).isTrue();
        assertThat(value.kind()).isEqualTo(JsonKind.NULL);
        assertThat(value).isEqualTo(JsonValue.nullValue());
    }

    @Test
    void testExactlyOnePredicateHolds() {
        final var values = List.of(JsonValue.nullValue(), JsonValue.of(true), JsonValue.of(1.5),
                JsonValue.of("s"), JsonValue.newList(), JsonValue.newObject());
        for (JsonValue v : values) {
            final var flags = List.of(v.isNull(), v.isBool(), v.isNumber(), v.isString(), v.isList(), v.isObject());
            assertThat(flags.stream().filter(b -> b).count()).as(v.kind().name()).isEqualTo(1);
        }
    }

    @Test
    void testSettersSwitchVariant() {
        final var value = new JsonValue();
        value.setBool(true);
        assertThat(value.getBool()).isTrue();
        value.setNumber(2.5);
        assertThat(value.isBool()).isFalse();
        assertThat(value.getNumber()).isEqualTo(2.5);
        value.setString("x");
        assertThat(value.getString()).isEqualTo("x");
        value.setList();
        assertThat(value.getList().isEmpty()).isTrue();
        value.setObject();
        assertThat(value.getObject().isEmpty()).isTrue();
        value.setNull();
        assertThat(value.isNull()).isTrue();
    }

    @Test
    void testSetListReplacesExistingListWithEmptyOne() {
        final var value = JsonValue.newList();
        value.pushBack(JsonValue.of(1.0));
        value.setList();
        assertThat(value.getList().isEmpty()).isTrue();
    }

    @Test
    void testSetObjectReplacesExistingObjectWithEmptyOne() {
        final var value = JsonValue.newObject();
        value.insert("a", JsonValue.of(1.0));
        value.setObject();
        assertThat(value.size()).isZero();
    }

    // ========== Type mismatches ==========

    @Test
    void testStringGetterOnNumberIsTypeMismatch() {
        final var value = JsonValue.of(3.0);
        assertThatThrownBy(value::getString)
                .isInstanceOf(JsonTypeMismatchException.class)
                .satisfies(e -> {
                    final var ex = (JsonTypeMismatchException) e;
                    assertThat(ex.expected()).isEqualTo(JsonKind.STRING);
                    assertThat(ex.actual()).isEqualTo(JsonKind.NUMBER);
                });
    }

    @Test
    void testNoGetterCoerces() {
        assertThatThrownBy(() -> JsonValue.of("1").getNumber()).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.of(1.0).getBool()).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.of(true).getString()).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.nullValue().getList()).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.newList().getObject()).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.newObject().getList()).isInstanceOf(JsonTypeMismatchException.class);
    }

    @Test
    void testListOperationsOnNonListAreTypeMismatch() {
        final var object = JsonValue.newObject();
        assertThatThrownBy(() -> object.pushBack(JsonValue.of(1.0))).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> object.pushFront(JsonValue.of(1.0))).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> object.element(0)).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> JsonValue.of(1.0).size()).isInstanceOf(JsonTypeMismatchException.class);
    }

    @Test
    void testObjectOperationsOnNonObjectAreTypeMismatch() {
        final var list = JsonValue.newList();
        assertThatThrownBy(() -> list.insert("a", JsonValue.of(1.0))).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> list.member("a")).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> list.get("a")).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> list.readOnly().get("a")).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(() -> list.contains("a")).isInstanceOf(JsonTypeMismatchException.class);
        assertThatThrownBy(list::keys).isInstanceOf(JsonTypeMismatchException.class);
    }

    // ========== Lists ==========

    @Test
    void testPushFrontAndBack() {
        final var list = JsonValue.newList();
        list.pushBack(JsonValue.of(2.0));
        list.pushFront(JsonValue.of(1.0));
        list.pushBack(JsonValue.of(3.0));
        assertThat(list.getList().stream().map(JsonValue::getNumber).toList()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void testPushStoresACopy() {
        final var child = JsonValue.of("before");
        final var list = JsonValue.newList();
        list.pushBack(child);
        child.setString("after");
        assertThat(list.element(0).getString()).isEqualTo("before");
    }

    @Test
    void testPushThroughLiveSequenceDoesNotCopy() {
        final var child = JsonValue.of("before");
        final var list = JsonValue.newList();
        list.getList().pushBack(child);
        child.setString("after");
        assertThat(list.element(0)).isSameAs(child);
        assertThat(list.element(0).getString()).isEqualTo("after");

        final var object = JsonValue.newObject();
        final var member = new JsonMember("k", JsonValue.of(1.0));
        object.getObject().pushFront(member);
        assertThat(object.get("k")).isSameAs(member.value());
        object.insert(member);
        assertThat(object.getObject().front()).isNotSameAs(member);
    }

    @Test
    void testElementOutOfBoundsIsNotFound() {
        final var list = Json.parse("[1]");
        assertThatThrownBy(() -> list.element(1))
                .isInstanceOf(JsonNotFoundException.class)
                .hasMessageContaining("out of bounds for length 1");
        assertThatThrownBy(() -> list.element(-1)).isInstanceOf(JsonNotFoundException.class);
    }

    @Test
    void testLiveListReference() {
        final var list = JsonValue.newList();
        list.getList().pushBack(JsonValue.of(true));
        assertThat(list.size()).isEqualTo(1);
        list.element(0).setNumber(9.0);
        assertThat(list.element(0).getNumber()).isEqualTo(9.0);
    }

    // ========== Objects ==========

    @Test
    void testInsertPlacesMemberAtFront() {
        final var object = JsonValue.newObject();
        object.insert("a", JsonValue.of(1.0));
        object.insert("b", JsonValue.of(2.0));
        object.insert(new JsonMember("c", JsonValue.of(3.0)));
        assertThat(object.keys()).containsExactly("c", "b", "a");
    }

    @Test
    void testMutableLookupReturnsExistingMember() {
        final var object = Json.parse("{\"a\":1}");
        final var slot = object.member("a");
        assertThat(slot.getNumber()).isEqualTo(1.0);
        slot.setString("changed");
        assertThat(object.get("a").getString()).isEqualTo("changed");
        assertThat(object.size()).isEqualTo(1);
    }

    @Test
    void testMutableLookupAutoVivifiesAtBack() {
        final var object = Json.parse("{\"a\":1,\"b\":2}");
        final var slot = object.member("zz");
        assertThat(slot.isNull()).isTrue();
        assertThat(object.keys()).containsExactly("b", "a", "zz");
        slot.setBool(true);
        assertThat(object.get("zz").getBool()).isTrue();
    }

    @Test
    void testReadOnlyLookupOfMissingKeyIsNotFound() {
        final var object = Json.parse("{\"a\":1}");
        final JsonView view = object.readOnly();
        assertThat(view.get("a").getNumber()).isEqualTo(1.0);
        assertThatThrownBy(() -> view.get("missing"))
                .isInstanceOf(JsonNotFoundException.class)
                .hasMessageContaining("\"missing\"");
        assertThat(object.size()).isEqualTo(1);
    }

    @Test
    void testGetOnMutableValueDoesNotCreateMembers() {
        final var object = JsonValue.newObject();
        assertThatThrownBy(() -> object.get("x")).isInstanceOf(JsonNotFoundException.class);
        assertThat(object.contains("x")).isFalse();
        assertThat(object.size()).isZero();
    }

    @Test
    void testReadOnlyViewDoesNotExposeMutableChildren() {
        final var doc = Json.parse("{\"l\":[{\"k\":true}]}");
        final var view = doc.readOnly();
        assertThat(view).isNotInstanceOf(JsonValue.class);
        assertThat(view.get("l")).isNotInstanceOf(JsonValue.class);
        assertThat(view.get("l").element(0)).isNotInstanceOf(JsonValue.class);
        final var seen = new ArrayList<JsonView>();
        view.get("l").forEachElement(seen::add);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0)).isNotInstanceOf(JsonValue.class);
        assertThat(seen.get(0).get("k").getBool()).isTrue();
    }

    @Test
    void testReadOnlyViewReflectsLaterChanges() {
        final var doc = JsonValue.newObject();
        final var view = doc.readOnly();
        doc.member("n").setNumber(1.0);
        assertThat(view.keys()).containsExactly("n");
    }

    @Test
    void testForEachMemberVisitsInMemberOrder() {
        final var object = Json.parse("{\"a\":1,\"b\":2}");
        final var keys = new ArrayList<String>();
        final var numbers = new ArrayList<Double>();
        object.forEachMember((k, v) -> {
            keys.add(k);
            numbers.add(v.getNumber());
        });
        assertThat(keys).containsExactly("b", "a");
        assertThat(numbers).containsExactly(2.0, 1.0);
    }

    // ========== Copy and move ==========

    @Test
    void testDeepCopyIsIndependent() {
        final var original = Json.parse("{\"list\":[1,{\"x\":true}],\"s\":\"t\"}");
        final var copy = original.copy();
        assertThat(copy).isEqualTo(original);

        copy.get("list").element(1).member("x").setBool(false);
        copy.get("list").pushBack(JsonValue.of(2.0));
        assertThat(original.get("list").size()).isEqualTo(2);
        assertThat(original.get("list").element(1).get("x").getBool()).isTrue();

        original.member("s").setString("changed");
        assertThat(copy.get("s").getString()).isEqualTo("t");
        assertThat(copy).isNotEqualTo(original);
    }

    @Test
    void testAssignCopiesPayload() {
        final var source = Json.parse("[[1]]");
        final var target = JsonValue.of("x");
        target.assign(source);
        assertThat(target).isEqualTo(source);
        target.element(0).pushBack(JsonValue.of(2.0));
        assertThat(source.element(0).size()).isEqualTo(1);
    }

    @Test
    void testAssignToSelfIsNoOp() {
        final var value = Json.parse("[1]");
        value.assign(value);
        assertThat(value.size()).isEqualTo(1);
    }

    @Test
    void testMoveLeavesSourceNull() {
        final var source = Json.parse("{\"a\":[1,2]}");
        final var inner = source.get("a");
        final var target = new JsonValue();
        target.moveFrom(source);
        assertThat(source.isNull()).isTrue();
        assertThat(target.get("a")).isSameAs(inner);
    }

    @Test
    void testTakeLeavesValueNull() {
        final var value = Json.parse("[true]");
        final var taken = value.take();
        assertThat(value.isNull()).isTrue();
        assertThat(taken.element(0).getBool()).isTrue();
    }

    @Test
    void testMoveFromAncestorIsRejected() {
        final var root = Json.parse("[[1]]");
        final var child = root.element(0);
        assertThatThrownBy(() -> child.moveFrom(root)).isInstanceOf(IllegalArgumentException.class);
        assertThat(root.size()).isEqualTo(1);
    }

    @Test
    void testMoveFromDescendantReplacesTree() {
        final var root = Json.parse("[[1]]");
        root.moveFrom(root.element(0));
        assertThat(root.size()).isEqualTo(1);
        assertThat(root.element(0).getNumber()).isEqualTo(1.0);
    }

    // ========== Equality ==========

    @Test
    void testEqualityIsStructuralAndOrderSensitive() {
        assertThat(Json.parse("[1,[2]]")).isEqualTo(Json.parse("[ 1 , [ 2 ] ]"));
        assertThat(Json.parse("[1,[2]]").hashCode()).isEqualTo(Json.parse("[1,[2]]").hashCode());
        assertThat(Json.parse("[1,2]")).isNotEqualTo(Json.parse("[2,1]"));
        assertThat(Json.parse("{\"a\":1,\"b\":2}")).isNotEqualTo(Json.parse("{\"b\":2,\"a\":1}"));
        assertThat(JsonValue.of(1.0)).isNotEqualTo(JsonValue.of("1"));
    }

    @Test
    void testToStringUsesLegacyLayout() {
        assertThat(Json.parse("[1,\"a\"]").toString()).isEqualTo("[ 1, a, ] ");
    }
}

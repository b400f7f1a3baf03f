package json.codec;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// A JSON object.
///
/// Member names are unique and members are always iterated, and serialized, in
/// ascending lexicographic order of their names ({@link String#compareTo(String)}),
/// whatever order they were inserted in. Two objects built from the same pairs
/// therefore produce byte-identical output.
///
/// ## Example Usage
/// ```java
/// JsonObject obj = JsonObject.of(Map.of(
///     "name", JsonString.of("Alice"),
///     "age", JsonNumber.of(30),
///     "active", JsonBoolean.of(true)
/// ));
/// obj.dump(); // {"active":true,"age":30,"name":"Alice"}
/// ```
///
/// @param members the members. Non-null, without `null` names or values.
public record JsonObject(SortedMap<String, JsonValue> members) implements JsonValue {

    /// @throws NullPointerException if `members`, a name, or a value is `null`
    public JsonObject {
        // re-sort by natural order whatever comparator the caller's map carried
        final var sorted = new TreeMap<String, JsonValue>();
        members.forEach((name, value) -> sorted.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, "member value must not be null")));
        members = Collections.unmodifiableSortedMap(sorted);
    }

    /// {@return the `JsonObject` holding the given members}
    ///
    /// @param members the members. Non-null, without `null` names or values.
    /// @throws NullPointerException if `members`, a name, or a value is `null`
    public static JsonObject of(Map<String, ? extends JsonValue> members) {
        final var sorted = new TreeMap<String, JsonValue>();
        members.forEach((name, value) -> sorted.put(
                Objects.requireNonNull(name, "member name must not be null"), value));
        return new JsonObject(sorted);
    }

    @Override
    public String toString() {
        return dump();
    }
}

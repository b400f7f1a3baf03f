package json.codec;

import java.util.Arrays;
import java.util.List;

/// A JSON array.
///
/// Elements keep the order in which they were given. The list is an unmodifiable
/// copy, so later changes to the source list are not observed.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = JsonArray.of(JsonString.of("first"), JsonNumber.of(42), JsonBoolean.TRUE);
/// arr.dump(); // ["first",42,true]
/// ```
///
/// @param elements the elements. Non-null, without `null` entries.
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    /// @throws NullPointerException if `elements` or any element is `null`
    public JsonArray {
        elements = List.copyOf(elements);
    }

    /// {@return the `JsonArray` holding the given elements, in order}
    ///
    /// @param elements the elements. Non-null, without `null` entries.
    /// @throws NullPointerException if `elements` or any element is `null`
    public static JsonArray of(List<? extends JsonValue> elements) {
        return new JsonArray(List.copyOf(elements));
    }

    /// {@return the `JsonArray` holding the given elements, in order}
    ///
    /// @param elements the elements. Non-null, without `null` entries.
    /// @throws NullPointerException if `elements` or any element is `null`
    public static JsonArray of(JsonValue... elements) {
        return new JsonArray(Arrays.asList(elements));
    }

    @Override
    public String toString() {
        return dump();
    }
}

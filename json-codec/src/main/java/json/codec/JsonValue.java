package json.codec;

import json.codec.internal.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a JSON value.
///
/// `JsonValue` is a closed union of six variants: {@link JsonNull},
/// {@link JsonBoolean}, {@link JsonString}, {@link JsonNumber}, {@link JsonArray}
/// and {@link JsonObject}. Instances are immutable and thread safe; containers own
/// unmodifiable copies of their children, so a value tree never has cycles.
///
/// A `JsonValue` can be produced by {@link Json#parse(String)}, by the `of`
/// factories of each variant, or by {@link Json#fromUntyped(Object)}.
///
/// ## Example
/// ```java
/// JsonValue value = Json.parse("{\"b\":[1,2],\"a\":true}");
/// value.get("a").bool();          // true
/// value.get("b").element(1);      // JsonNumber[2.0]
/// value.dump();                   // {"a":true,"b":[1,2]}
/// ```
///
/// The typed accessors below throw a {@link JsonAssertionException} when called on
/// a variant that does not support them.
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonString, JsonNumber, JsonArray, JsonObject {

    /// {@return the compact JSON text of this value} Equivalent to {@link #dump()}.
    /// For a rendering that leaves scalars unquoted use
    /// {@link Json#toDisplayString(JsonValue)}.
    String toString();

    /// {@return the compact JSON text of this value}
    /// Object members are written in ascending key order and no whitespace is
    /// emitted outside string literals.
    ///
    /// @throws IllegalArgumentException if arrays and objects nest deeper than
    ///         `json.codec.maxDepth`
    default String dump() {
        final var generator = new JsonGenerator(true, 0);
        generator.write(this);
        return generator.output();
    }

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw Utils.composeTypeError(this, "JsonBoolean");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw Utils.composeTypeError(this, "JsonString");
    }

    /// {@return the `double` value represented by a `JsonNumber`}
    default double toDouble() {
        throw Utils.composeTypeError(this, "JsonNumber");
    }

    /// {@return the value of a `JsonNumber` as a `long`}
    /// The number must be integral and within the range of `long`.
    default long toLong() {
        throw Utils.composeTypeError(this, "JsonNumber");
    }

    /// {@return the elements of a `JsonArray`}
    default List<JsonValue> elements() {
        throw Utils.composeTypeError(this, "JsonArray");
    }

    /// {@return the members of a `JsonObject`, in ascending key order}
    default Map<String, JsonValue> members() {
        throw Utils.composeTypeError(this, "JsonObject");
    }

    /// {@return an `Optional` containing this value unless it is a `JsonNull`}
    default Optional<JsonValue> valueOrNull() {
        return this instanceof JsonNull ? Optional.empty() : Optional.of(this);
    }

    /// {@return the member of a `JsonObject` with the given name}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this is not a `JsonObject` or it has no
    ///         member with that name
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        final var value = members().get(name);
        if (value == null) {
            throw Utils.composeUndefinedError(this,
                    "JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return value;
    }

    /// {@return the member of a `JsonObject` with the given name, or an empty
    /// `Optional` if there is none}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this is not a `JsonObject`
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the element of a `JsonArray` at the given index}
    ///
    /// @param index the index of the element
    /// @throws JsonAssertionException if this is not a `JsonArray` or the index is
    ///         outside the bounds
    default JsonValue element(int index) {
        final List<JsonValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw Utils.composeUndefinedError(this,
                    "JsonArray index %d out of bounds for length %d.".formatted(index, elements.size()));
        }
        return elements.get(index);
    }
}

package json.codec;

import java.util.Objects;

/// A JSON string.
///
/// The value is held unescaped. It may contain any Unicode code point, including
/// supplementary characters parsed from a pair of surrogate escapes.
///
/// @param value the unescaped text. Non-null.
public record JsonString(String value) implements JsonValue {

    /// @throws NullPointerException if `value` is `null`
    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return the `JsonString` holding the given text}
    ///
    /// @param value the unescaped text. Non-null.
    /// @throws NullPointerException if `value` is `null`
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public String string() {
        return value;
    }

    /// {@return the quoted and escaped JSON text of this string}
    @Override
    public String toString() {
        return dump();
    }
}

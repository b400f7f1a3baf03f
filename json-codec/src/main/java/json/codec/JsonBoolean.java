package json.codec;

/// The JSON `true` and `false` literals.
///
/// @param value the boolean value
public record JsonBoolean(boolean value) implements JsonValue {

    /// The JSON `true` literal.
    public static final JsonBoolean TRUE = new JsonBoolean(true);

    /// The JSON `false` literal.
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    /// {@return the `JsonBoolean` for the given value}
    ///
    /// @param value the boolean value
    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean bool() {
        return value;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}

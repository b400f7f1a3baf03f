package json.codec;

/// The JSON `null` literal.
///
/// All instances are equal; {@link #of()} returns a shared one.
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    /// {@return the `JsonNull`}
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "null";
    }
}

package json.codec;

/// Signals that a {@link JsonValue} does not have the shape a caller asked for.
///
/// Raised by the typed accessors of `JsonValue`, never by the parser or the
/// generator. {@link #kind()} is {@link JsonErrorKind#INVALID_TYPE} when the value is
/// of the wrong variant and {@link JsonErrorKind#UNDEFINED_FIELD} when an object
/// member or array element is missing.
public class JsonAssertionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final JsonErrorKind kind;

    /// Creates a new assertion exception.
    ///
    /// @param kind either `INVALID_TYPE` or `UNDEFINED_FIELD`
    /// @param message the detail message
    /// @throws IllegalArgumentException if `kind` is a parse failure kind
    public JsonAssertionException(JsonErrorKind kind, String message) {
        super(message);
        if (kind != JsonErrorKind.INVALID_TYPE && kind != JsonErrorKind.UNDEFINED_FIELD) {
            throw new IllegalArgumentException("Not an assertion kind: " + kind);
        }
        this.kind = kind;
    }

    /// {@return the kind of failure}
    public JsonErrorKind kind() {
        return kind;
    }
}

package json.codec;

/// The kinds of failure reported by the codec.
///
/// The first five are raised by {@link Json#parse(String)} through a
/// {@link JsonParseException}. {@link #INVALID_TYPE} and {@link #UNDEFINED_FIELD}
/// are raised through a {@link JsonAssertionException} when a caller projects a
/// {@link JsonValue} onto a shape it does not have.
public enum JsonErrorKind {

    /// A token that is grammatically invalid at its position, including a malformed
    /// `true`, `false` or `null` literal and trailing content after the document.
    UNEXPECTED_TOKEN("Unexpected token"),

    /// The input ended while a token or value was still expected.
    UNEXPECTED_END_OF_JSON("Unexpected end of JSON"),

    /// A character that cannot begin any token or escape sequence.
    UNEXPECTED_CHARACTER("Unexpected character"),

    /// A number literal outside the JSON number grammar, or one that overflows a `double`.
    INVALID_NUMBER("Invalid number"),

    /// A lower-level decoding failure, such as malformed UTF-8 input or an unpaired
    /// surrogate escape.
    PARSING_FAILED("Parsing failed"),

    /// An accessor was called on the wrong kind of value.
    INVALID_TYPE("Invalid type"),

    /// An object member or array element that does not exist.
    UNDEFINED_FIELD("Undefined field");

    private final String text;

    JsonErrorKind(String text) {
        this.text = text;
    }

    /// {@return the human readable label used in exception messages}
    public String text() {
        return text;
    }
}

package json.codec;

import java.util.Objects;

/// Signals that a JSON document could not be parsed.
///
/// Parsing is fail-fast: the first error aborts the parse and no partial value is
/// returned. The {@link #kind()} classifies the failure, {@link #detail()} carries the
/// offending token description or character, and {@link #offset()}, {@link #line()}
/// and {@link #column()} locate it in the input.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final JsonErrorKind kind;
    private final String detail;
    private final int offset;
    private final int line;
    private final int column;

    /// Creates a new parse exception.
    ///
    /// @param kind the kind of failure. Non-null.
    /// @param detail what was found at the failure, may be empty. Non-null.
    /// @param offset the zero-based character offset of the failure
    /// @param line the one-based line of the failure
    /// @param column the one-based column of the failure
    public JsonParseException(JsonErrorKind kind, String detail, int offset, int line, int column) {
        super(formatMessage(Objects.requireNonNull(kind), Objects.requireNonNull(detail), line, column));
        this.kind = kind;
        this.detail = detail;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /// Creates a new parse exception for a failure that has no position in the
    /// document, such as undecodable input bytes.
    public JsonParseException(JsonErrorKind kind, String detail, Throwable cause) {
        super(kind.text() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.offset = -1;
        this.line = -1;
        this.column = -1;
    }

    /// {@return the kind of failure}
    public JsonErrorKind kind() {
        return kind;
    }

    /// {@return a description of what was found, empty when there is nothing to report}
    public String detail() {
        return detail;
    }

    /// {@return the zero-based character offset of the failure, or -1 if unknown}
    public int offset() {
        return offset;
    }

    /// {@return the one-based line of the failure, or -1 if unknown}
    public int line() {
        return line;
    }

    /// {@return the one-based column of the failure, or -1 if unknown}
    public int column() {
        return column;
    }

    private static String formatMessage(JsonErrorKind kind, String detail, int line, int column) {
        final var sb = new StringBuilder(kind.text());
        sb.append(" at line ").append(line).append(" column ").append(column);
        if (!detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}

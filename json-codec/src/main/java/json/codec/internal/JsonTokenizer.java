package json.codec.internal;

import json.codec.JsonErrorKind;
import json.codec.JsonParseException;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Lexical scanner over a JSON document.
///
/// Each call to {@link #next()} skips insignificant whitespace and returns exactly
/// one {@link JsonToken}. The tokenizer keeps no lookahead beyond the character
/// under the cursor. A single scratch buffer is cleared and reused for every
/// string and number lexeme.
///
/// Only U+0020, U+0009, U+000A and U+000D are whitespace. Keywords must match
/// `true`, `false` and `null` exactly. Strings understand the escapes `\"`, `\\`,
/// `\/`, `\b`, `\f`, `\n`, `\r`, `\t` and four hex digit unicode escapes, where a
/// high surrogate escape must be followed by a low surrogate escape. Numbers follow
/// the RFC 8259 grammar.
///
/// Instances are not thread safe; a tokenizer belongs to one parse.
public final class JsonTokenizer {

    private static final Logger LOG = Logger.getLogger(JsonTokenizer.class.getName());

    private static final Pattern NUMBER_GRAMMAR =
            Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");

    private final char[] doc;
    private final StringBuilder scratch = new StringBuilder();
    private int offset;

    /// Creates a tokenizer positioned at the start of the given document.
    ///
    /// @param doc the document. Non-null. Not copied, so the caller must not change it.
    public JsonTokenizer(char[] doc) {
        this.doc = Objects.requireNonNull(doc);
        this.offset = 0;
    }

    /// Skips whitespace and reports whether any input is left.
    ///
    /// @return `true` if a further token (or an invalid character) follows
    public boolean hasMore() {
        skipWhitespace();
        return offset < doc.length;
    }

    /// Reads the next token.
    ///
    /// @return the next token
    /// @throws JsonParseException with `UNEXPECTED_END_OF_JSON` when no input is
    ///         left, `UNEXPECTED_CHARACTER` when a character cannot start a token,
    ///         or any failure raised while reading a keyword, string or number
    public JsonToken next() {
        skipWhitespace();
        if (offset >= doc.length) {
            throw failure(JsonErrorKind.UNEXPECTED_END_OF_JSON, "", offset);
        }
        final int start = offset;
        final char c = doc[offset++];
        final JsonToken token = switch (c) {
            case ',' -> new JsonToken.Punctuation(JsonToken.Kind.COMMA, start);
            case ':' -> new JsonToken.Punctuation(JsonToken.Kind.COLON, start);
            case '[' -> new JsonToken.Punctuation(JsonToken.Kind.BRACKET_ON, start);
            case ']' -> new JsonToken.Punctuation(JsonToken.Kind.BRACKET_OFF, start);
            case '{' -> new JsonToken.Punctuation(JsonToken.Kind.BRACE_ON, start);
            case '}' -> new JsonToken.Punctuation(JsonToken.Kind.BRACE_OFF, start);
            case 't' -> readKeyword(start, "true", new JsonToken.BooleanToken(true, start));
            case 'f' -> readKeyword(start, "false", new JsonToken.BooleanToken(false, start));
            case 'n' -> readKeyword(start, "null", new JsonToken.NullToken(start));
            case '"' -> readString(start);
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> readNumber(start);
            default -> throw failure(JsonErrorKind.UNEXPECTED_CHARACTER, describe(c), start);
        };
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("Token at " + start + ": " + token.describe());
        }
        return token;
    }

    /// {@return a parse exception of the given kind located at `at`}
    /// The line and column are derived from the document.
    ///
    /// @param kind the kind of failure
    /// @param detail what was found, may be empty
    /// @param at the offset of the failure
    public JsonParseException failure(JsonErrorKind kind, String detail, int at) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < at && i < doc.length; i++) {
            if (doc[i] == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        final var ex = new JsonParseException(kind, detail, at, line, column);
        LOG.fine(() -> "Parse failure: " + ex.getMessage());
        return ex;
    }

    private void skipWhitespace() {
        while (offset < doc.length) {
            final char c = doc[offset];
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            offset++;
        }
    }

    private char nextChar() {
        if (offset >= doc.length) {
            throw failure(JsonErrorKind.UNEXPECTED_END_OF_JSON, "", offset);
        }
        return doc[offset++];
    }

    private JsonToken readKeyword(int start, String keyword, JsonToken token) {
        for (int i = 1; i < keyword.length(); i++) {
            if (nextChar() != keyword.charAt(i)) {
                throw failure(JsonErrorKind.UNEXPECTED_TOKEN, new String(doc, start, offset - start), start);
            }
        }
        return token;
    }

    private JsonToken readString(int start) {
        scratch.setLength(0);
        while (true) {
            final char c = nextChar();
            if (c == '"') {
                return new JsonToken.StringToken(scratch.toString(), start);
            } else if (c == '\\') {
                readEscape();
            } else {
                scratch.append(c);
            }
        }
    }

    private void readEscape() {
        final char c = nextChar();
        switch (c) {
            case '"', '\\', '/' -> scratch.append(c);
            case 'b' -> scratch.append('\b');
            case 'f' -> scratch.append('\f');
            case 'n' -> scratch.append('\n');
            case 'r' -> scratch.append('\r');
            case 't' -> scratch.append('\t');
            case 'u' -> readUnicodeEscape(offset - 2);
            default -> throw failure(JsonErrorKind.UNEXPECTED_CHARACTER, describe(c), offset - 1);
        }
    }

    // Called with the cursor just past the escape letter; escapeStart is the offset of the backslash.
    private void readUnicodeEscape(int escapeStart) {
        final char unit = readHex4();
        if (Character.isHighSurrogate(unit)) {
            if (offset >= doc.length || (doc[offset] == '\\' && offset + 1 >= doc.length)) {
                throw failure(JsonErrorKind.UNEXPECTED_END_OF_JSON, "", doc.length);
            }
            if (doc[offset] != '\\' || doc[offset + 1] != 'u') {
                throw failure(JsonErrorKind.PARSING_FAILED,
                        "unpaired high surrogate \\u%04X".formatted((int) unit), escapeStart);
            }
            offset += 2;
            final char low = readHex4();
            if (!Character.isLowSurrogate(low)) {
                throw failure(JsonErrorKind.PARSING_FAILED,
                        "high surrogate \\u%04X followed by \\u%04X".formatted((int) unit, (int) low), escapeStart);
            }
            scratch.append(unit).append(low);
        } else if (Character.isLowSurrogate(unit)) {
            throw failure(JsonErrorKind.PARSING_FAILED,
                    "unpaired low surrogate \\u%04X".formatted((int) unit), escapeStart);
        } else {
            scratch.append(unit);
        }
    }

    private char readHex4() {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            final char c = nextChar();
            final int digit = hexValue(c);
            if (digit < 0) {
                throw failure(JsonErrorKind.UNEXPECTED_CHARACTER, describe(c), offset - 1);
            }
            value = (value << 4) | digit;
        }
        return (char) value;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private JsonToken readNumber(int start) {
        scratch.setLength(0);
        scratch.append(doc[start]);
        boolean seenDecimalPoint = false;
        boolean seenExponent = false;
        while (offset < doc.length) {
            final char c = doc[offset];
            if (c == '.') {
                if (seenDecimalPoint) {
                    throw failure(JsonErrorKind.INVALID_NUMBER, scratch.append(c).toString(), start);
                }
                seenDecimalPoint = true;
            } else if (c == 'e' || c == 'E') {
                if (seenExponent) {
                    throw failure(JsonErrorKind.INVALID_NUMBER, scratch.append(c).toString(), start);
                }
                seenExponent = true;
            } else if ((c < '0' || c > '9') && c != '+' && c != '-') {
                break;
            }
            scratch.append(c);
            offset++;
        }

        final var lexeme = scratch.toString();
        if (!NUMBER_GRAMMAR.matcher(lexeme).matches()) {
            throw failure(JsonErrorKind.INVALID_NUMBER, lexeme, start);
        }
        final double value;
        try {
            value = Double.parseDouble(lexeme);
        } catch (NumberFormatException ex) {
            final var invalid = failure(JsonErrorKind.INVALID_NUMBER, lexeme, start);
            invalid.initCause(ex);
            throw invalid;
        }
        if (Double.isInfinite(value)) {
            throw failure(JsonErrorKind.INVALID_NUMBER, lexeme + " is out of range", start);
        }
        return new JsonToken.NumberToken(value, start);
    }

    private static String describe(char c) {
        return "'%c' (U+%04X)".formatted(c, (int) c);
    }
}

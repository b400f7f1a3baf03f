package json.codec.internal;

import json.codec.JsonArray;
import json.codec.JsonBoolean;
import json.codec.JsonErrorKind;
import json.codec.JsonNull;
import json.codec.JsonNumber;
import json.codec.JsonObject;
import json.codec.JsonParseException;
import json.codec.JsonString;
import json.codec.JsonValue;

import java.util.ArrayList;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Recursive-descent parser that builds a {@link JsonValue} tree from the tokens of
/// a {@link JsonTokenizer}.
///
/// The whole document must be exactly one JSON value surrounded by optional
/// whitespace. When an object repeats a member name the later value replaces the
/// earlier one. Nesting deeper than the configured maximum is rejected with
/// {@link JsonErrorKind#PARSING_FAILED} before the call stack is exhausted.
///
/// A parser is used for one document and is not thread safe.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private final char[] doc;
    private final JsonTokenizer tokenizer;
    private final int maxDepth;
    private int depth;

    /// Creates a parser for the given document with the configured maximum depth.
    ///
    /// @param doc the document. Non-null. Not copied.
    public JsonParser(char[] doc) {
        this(doc, JsonCodecProperties.maxDepth());
    }

    /// Creates a parser for the given document.
    ///
    /// @param doc the document. Non-null. Not copied.
    /// @param maxDepth the deepest array/object nesting accepted. Positive.
    public JsonParser(char[] doc, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.doc = doc;
        this.tokenizer = new JsonTokenizer(doc);
        this.maxDepth = maxDepth;
    }

    /// Parses the document.
    ///
    /// @return the value of the document
    /// @throws JsonParseException if the document is not a single valid JSON value
    public JsonValue parseRoot() {
        LOG.fine(() -> "Parsing JSON document of " + doc.length + " chars");
        final var value = parseValue(tokenizer.next());
        if (tokenizer.hasMore()) {
            final var trailing = tokenizer.next();
            throw tokenizer.failure(JsonErrorKind.UNEXPECTED_TOKEN,
                    "trailing " + trailing.describe() + " after the document", trailing.offset());
        }
        return value;
    }

    private JsonValue parseValue(JsonToken token) {
        if (token instanceof JsonToken.StringToken s) {
            return JsonString.of(s.value());
        } else if (token instanceof JsonToken.NumberToken n) {
            return JsonNumber.of(n.value());
        } else if (token instanceof JsonToken.BooleanToken b) {
            return JsonBoolean.of(b.value());
        } else if (token instanceof JsonToken.NullToken) {
            return JsonNull.of();
        }
        return switch (token.kind()) {
            case BRACE_ON -> parseObject(token);
            case BRACKET_ON -> parseArray(token);
            default -> throw unexpected(token);
        };
    }

    private JsonObject parseObject(JsonToken open) {
        enter(open);
        final var members = new TreeMap<String, JsonValue>();
        var token = tokenizer.next();
        if (token.kind() != JsonToken.Kind.BRACE_OFF) {
            while (true) {
                if (!(token instanceof JsonToken.StringToken key)) {
                    throw unexpected(token);
                }
                final var colon = tokenizer.next();
                if (colon.kind() != JsonToken.Kind.COLON) {
                    throw unexpected(colon);
                }
                final var previous = members.put(key.value(), parseValue(tokenizer.next()));
                if (previous != null) {
                    LOG.finer(() -> "Duplicate member \"" + key.value() + "\" at " + key.offset() + " replaces earlier value");
                }

                token = tokenizer.next();
                if (token.kind() == JsonToken.Kind.BRACE_OFF) {
                    break;
                }
                if (token.kind() != JsonToken.Kind.COMMA) {
                    throw unexpected(token);
                }
                token = tokenizer.next();
            }
        }
        leave(open, members.size());
        return new JsonObject(members);
    }

    private JsonArray parseArray(JsonToken open) {
        enter(open);
        final var elements = new ArrayList<JsonValue>();
        var token = tokenizer.next();
        if (token.kind() != JsonToken.Kind.BRACKET_OFF) {
            while (true) {
                elements.add(parseValue(token));

                token = tokenizer.next();
                if (token.kind() == JsonToken.Kind.BRACKET_OFF) {
                    break;
                }
                if (token.kind() != JsonToken.Kind.COMMA) {
                    throw unexpected(token);
                }
                token = tokenizer.next();
            }
        }
        leave(open, elements.size());
        return new JsonArray(elements);
    }

    private void enter(JsonToken open) {
        if (++depth > maxDepth) {
            throw tokenizer.failure(JsonErrorKind.PARSING_FAILED,
                    "nesting depth exceeds " + maxDepth, open.offset());
        }
        LOG.finer(() -> "Enter " + open.describe() + " at " + open.offset() + ", depth " + depth);
    }

    private void leave(JsonToken open, int size) {
        LOG.finer(() -> "Leave " + open.describe() + " at " + open.offset() + " with " + size + " entries");
        depth--;
    }

    private JsonParseException unexpected(JsonToken token) {
        return tokenizer.failure(JsonErrorKind.UNEXPECTED_TOKEN, token.describe(), token.offset());
    }
}

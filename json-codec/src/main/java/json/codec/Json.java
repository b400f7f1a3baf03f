package json.codec;

import json.codec.internal.JsonCodecProperties;
import json.codec.internal.JsonParser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/// This class provides static methods for producing and writing a {@link JsonValue}.
///
/// {@link #parse(String)}, {@link #parse(char[])} and {@link #parse(byte[])} produce
/// a `JsonValue` from a JSON document. {@link #stringify(Object)} writes compact
/// text and {@link #prettyPrint(JsonValue, int)} writes indented text.
/// {@link #toDisplayString(JsonValue)} renders scalars without quotes.
/// {@link #fromUntyped(Object)} and {@link #toUntyped(JsonValue)} convert between
/// `JsonValue` and plain Java objects.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// Json.stringify(json);                    // {"age":30,"name":"John"}
/// Json.stringify(Map.of("ok", true));      // {"ok":true}
/// Json.toDisplayString(json.get("name"));  // John
/// ```
///
/// All methods are stateless and may be called concurrently.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /// Parses a JSON document.
    ///
    /// The document must hold exactly one JSON value, optionally surrounded by
    /// whitespace; anything after that value is rejected. When an object repeats a
    /// member name the last occurrence wins.
    ///
    /// @param in the JSON document. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the document is not valid JSON
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in);
        return new JsonParser(in.toCharArray()).parseRoot();
    }

    /// Parses a JSON document held in a `char[]`.
    ///
    /// @param in the JSON document. Non-null. It is copied before parsing.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the document is not valid JSON
    /// @throws NullPointerException if `in` is `null`
    /// @see #parse(String)
    public static JsonValue parse(char[] in) {
        Objects.requireNonNull(in);
        return new JsonParser(Arrays.copyOf(in, in.length)).parseRoot();
    }

    /// Parses a JSON document encoded as UTF-8.
    ///
    /// @param utf8 the UTF-8 bytes of the document. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException with {@link JsonErrorKind#PARSING_FAILED} if the
    ///         bytes are not well-formed UTF-8, or any parse failure of the text
    /// @throws NullPointerException if `utf8` is `null`
    /// @see #parse(String)
    public static JsonValue parse(byte[] utf8) {
        Objects.requireNonNull(utf8);
        final var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        final char[] chars;
        try {
            final var buffer = decoder.decode(ByteBuffer.wrap(utf8));
            chars = new char[buffer.remaining()];
            buffer.get(chars);
        } catch (CharacterCodingException ex) {
            LOG.fine(() -> "Rejecting " + utf8.length + " bytes of invalid UTF-8: " + ex);
            throw new JsonParseException(JsonErrorKind.PARSING_FAILED, "invalid UTF-8 input", ex);
        }
        return new JsonParser(chars).parseRoot();
    }

    /// {@return the compact JSON text of the given value}
    /// `src` may be a `JsonValue` or anything {@link #fromUntyped(Object)} accepts.
    /// The output contains no whitespace outside string literals and object members
    /// appear in ascending key order.
    ///
    /// ## Example
    /// ```java
    /// Json.stringify(List.of(1, "a", Map.of("b", false))); // [1,"a",{"b":false}]
    /// ```
    ///
    /// @param src the value to write. May be null, which writes `null`.
    /// @throws IllegalArgumentException if `src` cannot be converted to a `JsonValue`
    public static String stringify(Object src) {
        return fromUntyped(src).dump();
    }

    /// {@return the indented JSON text of the given value, using the configured
    /// default indent width}
    ///
    /// @param value the value to write. Non-null.
    /// @throws NullPointerException if `value` is `null`
    public static String prettyPrint(JsonValue value) {
        return prettyPrint(value, JsonCodecProperties.indent());
    }

    /// {@return the indented JSON text of the given value}
    /// Empty arrays and objects are written as `[]` and `{}` without line breaks.
    ///
    /// ## Example
    /// ```java
    /// Json.prettyPrint(Json.parse("{\"a\":\"abc\",\"more\":{\"phone\":null}}"), 4);
    /// // {
    /// //     "a": "abc",
    /// //     "more": {
    /// //         "phone": null
    /// //     }
    /// // }
    /// ```
    ///
    /// @param value the value to write. Non-null.
    /// @param indent the number of spaces per nesting level. Zero or positive.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `indent` is negative
    public static String prettyPrint(JsonValue value, int indent) {
        Objects.requireNonNull(value);
        return new JsonGenerator(false, indent).write(value).output();
    }

    /// {@return the text of the given value suitable for display}
    /// Strings render as their bare text without quotes or escapes; numbers,
    /// booleans and `null` render as their JSON literal; arrays and objects render
    /// as their compact JSON text.
    ///
    /// @param value the value to render. Non-null.
    /// @throws NullPointerException if `value` is `null`
    public static String toDisplayString(JsonValue value) {
        Objects.requireNonNull(value);
        if (value instanceof JsonString s) {
            return s.value();
        }
        return value.dump();
    }

    /// {@return a `JsonValue` created from the given `src` object}
    /// The mapping follows the table below.
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|-----------|
    /// | `null` | `JsonNull` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `Byte`, `Short`, `Integer`, `Long` | `JsonNumber` |
    /// | `Float`, `Double`, `BigInteger`, `BigDecimal` | `JsonNumber` (via `doubleValue()`) |
    /// | `CharSequence`, `Character` | `JsonString` |
    /// | `List<Object>` | `JsonArray` |
    /// | `Map<String, Object>` | `JsonObject` |
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src`, or anything nested in it, cannot
    ///         be converted, including a non-finite floating point number or a map
    ///         key that is not a `String`
    /// @see #toUntyped(JsonValue)
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        } else if (src instanceof JsonValue jv) {
            return jv;
        } else if (src instanceof Boolean b) {
            return JsonBoolean.of(b);
        } else if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        } else if (src instanceof Float || src instanceof Double
                || src instanceof BigInteger || src instanceof BigDecimal) {
            return JsonNumber.of(((Number) src).doubleValue());
        } else if (src instanceof CharSequence || src instanceof Character) {
            return JsonString.of(src.toString());
        } else if (src instanceof List<?> list) {
            final List<JsonValue> elements = new ArrayList<>(list.size());
            for (Object o : list) {
                elements.add(fromUntyped(o));
            }
            return new JsonArray(elements);
        } else if (src instanceof Map<?, ?> map) {
            final var members = new TreeMap<String, JsonValue>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                members.put(key, fromUntyped(entry.getValue()));
            }
            return new JsonObject(members);
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `JsonValue`}
    /// The mapping follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` (unmodifiable) |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonNumber` | `Double` |
    /// | `JsonObject` | `Map<String, Object>` (unmodifiable, sorted by key) |
    /// | `JsonString` | `String` |
    ///
    /// @param src the `JsonValue` to convert. Non-null.
    /// @throws NullPointerException if `src` is `null`
    /// @see #fromUntyped(Object)
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src instanceof JsonObject jo) {
            // TreeMap rather than Collectors.toMap, which rejects null values
            final var map = new TreeMap<String, Object>();
            jo.members().forEach((name, value) -> map.put(name, toUntyped(value)));
            return Collections.unmodifiableSortedMap(map);
        } else if (src instanceof JsonArray ja) {
            final var list = new ArrayList<Object>(ja.elements().size());
            ja.elements().forEach(value -> list.add(toUntyped(value)));
            return Collections.unmodifiableList(list);
        } else if (src instanceof JsonBoolean jb) {
            return jb.value();
        } else if (src instanceof JsonNumber jn) {
            return jn.value();
        } else if (src instanceof JsonString js) {
            return js.value();
        }
        return null;
    }

    // no instantiation is allowed for this class
    private Json() {}
}

package json.codec;

import json.codec.internal.JsonCodecProperties;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Writes {@link JsonValue} trees as JSON text.
///
/// A generator is either minified, emitting no whitespace outside string
/// literals, or pretty, breaking lines and indenting nested arrays and objects by
/// `indentWidth` spaces per level. Object members are written in the ascending key
/// order the {@link JsonObject} guarantees, so output is deterministic.
///
/// ## Example
/// ```java
/// var generator = new JsonGenerator(false, 4);
/// generator.write(Json.parse("{\"b\":[1,2],\"a\":{}}"));
/// generator.output();
/// // {
/// //     "a": {},
/// //     "b": [
/// //         1,
/// //         2
/// //     ]
/// // }
/// ```
///
/// Array elements after the first are preceded by `", "` in pretty mode, so a
/// pretty array line ends with a space before the line break.
///
/// Arrays and objects nested deeper than `json.codec.maxDepth` (512 unless set) are
/// rejected, the same bound the parser applies, so everything a generator writes
/// parses back. Writing never fails for a value tree within that bound.
///
/// Instances accumulate output and are not thread safe.
public final class JsonGenerator {

    private static final Logger LOG = Logger.getLogger(JsonGenerator.class.getName());

    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    /// Moves between nesting levels when a line is broken.
    private enum Tab {
        /// one level deeper
        RIGHT,
        /// one level shallower
        LEFT,
        /// same level
        STAY
    }

    private final StringBuilder out = new StringBuilder();
    private final boolean minify;
    private final int indentWidth;
    private final int maxDepth = JsonCodecProperties.maxDepth();
    private int depth;
    private int nesting;

    /// Creates a generator.
    ///
    /// @param minify `true` for compact output, `false` for indented output
    /// @param indentWidth the spaces per nesting level in indented output. Zero or positive.
    /// @throws IllegalArgumentException if `indentWidth` is negative
    public JsonGenerator(boolean minify, int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth is negative");
        }
        this.minify = minify;
        this.indentWidth = indentWidth;
        LOG.finest(() -> "JsonGenerator minify=" + minify + " indentWidth=" + indentWidth);
    }

    /// Creates a pretty generator with the configured default indent width
    /// (`json.codec.indent`, 4 unless set).
    public JsonGenerator() {
        this(false, JsonCodecProperties.indent());
    }

    /// {@return `true` if this generator writes compact output}
    public boolean minify() {
        return minify;
    }

    /// {@return the spaces written per nesting level in indented output}
    public int indentWidth() {
        return indentWidth;
    }

    /// Appends the text of the given value to the output.
    ///
    /// @param value the value to write. Non-null.
    /// @return this generator
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if arrays and objects in `value` nest deeper
    ///         than `json.codec.maxDepth`; the output then holds a partial document
    public JsonGenerator write(JsonValue value) {
        if (value instanceof JsonNull) {
            write("null");
        } else if (value instanceof JsonBoolean b) {
            write(b.value() ? "true" : "false");
        } else if (value instanceof JsonNumber n) {
            write(formatNumber(n.value()));
        } else if (value instanceof JsonString s) {
            writeString(s.value());
        } else if (value instanceof JsonArray a) {
            writeArray(a.elements());
        } else if (value instanceof JsonObject o) {
            writeObject(o.members());
        } else {
            throw new NullPointerException("value must not be null");
        }
        return this;
    }

    /// {@return the text written so far}
    public String output() {
        return out.toString();
    }

    /// Discards the text written so far so the generator can be reused.
    public void reset() {
        out.setLength(0);
        depth = 0;
        nesting = 0;
    }

    /// {@return the text written so far}
    @Override
    public String toString() {
        return output();
    }

    /// {@return the canonical text of a finite `double`}
    /// The digits are the fewest significant digits that read back as the same
    /// `double`, written in plain notation: `200`, `0.000123`, `1e23` as
    /// `100000000000000000000000`. Exponent notation is never used. Negative zero
    /// prints as `-0`.
    ///
    /// @param value a finite value
    static String formatNumber(double value) {
        if (value == 0) {
            return Math.copySign(1.0, value) < 0 ? "-0" : "0";
        }
        return shortestDecimal(value).stripTrailingZeros().toPlainString();
    }

    // Double.toString may emit more digits than needed before JDK 19
    private static BigDecimal shortestDecimal(double value) {
        final var exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            final var rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == value) {
                return rounded;
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN));
    }

    private void write(String s) {
        out.append(s);
    }

    private void newLine(Tab tab) {
        switch (tab) {
            case RIGHT -> depth++;
            case LEFT -> {
                if (depth > 0) {
                    depth--;
                }
            }
            case STAY -> { }
        }
        if (!minify) {
            out.append('\n');
            out.append(" ".repeat(depth * indentWidth));
        }
    }

    private void writeString(String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\f' -> out.append("\\f");
                case '\b' -> out.append("\\b");
                default -> out.append(c);
            }
        }
        out.append('"');
    }

    private void writeArray(List<JsonValue> elements) {
        enter();
        write("[");
        if (elements.isEmpty()) {
            write("]");
            nesting--;
            return;
        }
        boolean first = true;
        for (JsonValue element : elements) {
            if (first) {
                first = false;
                newLine(Tab.RIGHT);
            } else {
                write(",");
                if (!minify) {
                    write(" ");
                }
                newLine(Tab.STAY);
            }
            write(element);
        }
        newLine(Tab.LEFT);
        write("]");
        nesting--;
    }

    private void writeObject(Map<String, JsonValue> members) {
        enter();
        write("{");
        if (members.isEmpty()) {
            write("}");
            nesting--;
            return;
        }
        boolean first = true;
        for (Map.Entry<String, JsonValue> member : members.entrySet()) {
            if (first) {
                first = false;
                newLine(Tab.RIGHT);
            } else {
                write(",");
                newLine(Tab.STAY);
            }
            writeString(member.getKey());
            write(":");
            if (!minify) {
                write(" ");
            }
            write(member.getValue());
        }
        newLine(Tab.LEFT);
        write("}");
        nesting--;
    }

    private void enter() {
        if (++nesting > maxDepth) {
            throw new IllegalArgumentException("value nesting depth exceeds " + maxDepth);
        }
    }
}

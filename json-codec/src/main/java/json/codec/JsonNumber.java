package json.codec;

/// A JSON number.
///
/// Every JSON number, integral or not, is held as a finite IEEE-754 `double`.
/// Digits beyond the precision of a `double` are lost when a document is parsed,
/// and `long` values beyond 2^53 lose their low-order bits in {@link #of(long)}.
///
/// Equality follows {@link Double#compare(double, double)}, so `0.0` and `-0.0`
/// are different numbers.
///
/// @param value the numeric value. Finite.
public record JsonNumber(double value) implements JsonValue {

    private static final double LONG_RANGE_LIMIT = 0x1p63;

    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public JsonNumber {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
    }

    /// {@return the `JsonNumber` for the given `double`}
    ///
    /// @param value the numeric value
    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public static JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    /// {@return the `JsonNumber` for the given `long`}
    ///
    /// @param value the numeric value
    public static JsonNumber of(long value) {
        return new JsonNumber((double) value);
    }

    @Override
    public double toDouble() {
        return value;
    }

    /// @throws JsonAssertionException if this number is not integral or lies
    ///         outside the range of `long`
    @Override
    public long toLong() {
        if (value != Math.rint(value) || value < -LONG_RANGE_LIMIT || value >= LONG_RANGE_LIMIT) {
            throw new JsonAssertionException(JsonErrorKind.INVALID_TYPE,
                    "JsonNumber %s cannot be represented as a long.".formatted(this));
        }
        return (long) value;
    }

    @Override
    public String toString() {
        return dump();
    }
}

package json.codec.internal;

import json.codec.JsonAssertionException;
import json.codec.JsonErrorKind;
import json.codec.JsonValue;

/// Shared helpers for composing the errors raised by the typed accessors.
public final class Utils {

    private static final int MAX_SNIPPET = 40;

    // no instantiation is allowed for this class
    private Utils() {}

    /// {@return an `INVALID_TYPE` error for an accessor of `expected` called on `jv`}
    public static JsonAssertionException composeTypeError(JsonValue jv, String expected) {
        return new JsonAssertionException(JsonErrorKind.INVALID_TYPE,
                "%s is not a %s: %s".formatted(jv.getClass().getSimpleName(), expected, abbreviate(jv)));
    }

    /// {@return an `UNDEFINED_FIELD` error raised on `jv` with the given message}
    public static JsonAssertionException composeUndefinedError(JsonValue jv, String message) {
        return new JsonAssertionException(JsonErrorKind.UNDEFINED_FIELD, message + " Value: " + abbreviate(jv));
    }

    private static String abbreviate(JsonValue jv) {
        final var text = jv.dump();
        return text.length() <= MAX_SNIPPET ? text : text.substring(0, MAX_SNIPPET) + "...";
    }
}

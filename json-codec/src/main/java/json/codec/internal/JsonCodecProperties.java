package json.codec.internal;

import java.util.logging.Logger;

/// Codec settings read once from system properties.
///
/// | Property               | Meaning                                | Default |
/// |------------------------|----------------------------------------|---------|
/// | `json.codec.maxDepth`  | deepest array/object nesting accepted  | 512     |
/// | `json.codec.indent`    | default pretty-print indent width      | 4       |
///
/// A value that is not an integer in range is logged at `WARNING` and the default
/// is used instead.
public final class JsonCodecProperties {

    private static final Logger LOG = Logger.getLogger(JsonCodecProperties.class.getName());

    /// System property bounding the nesting depth accepted by the parser
    public static final String MAX_DEPTH_PROPERTY = "json.codec.maxDepth";

    /// System property holding the default pretty-print indent width
    public static final String INDENT_PROPERTY = "json.codec.indent";

    /// Nesting depth used when {@value #MAX_DEPTH_PROPERTY} is not set
    public static final int DEFAULT_MAX_DEPTH = 512;

    /// Indent width used when {@value #INDENT_PROPERTY} is not set
    public static final int DEFAULT_INDENT = 4;

    private static final int MAX_DEPTH;
    private static final int INDENT;

    static {
        MAX_DEPTH = intProperty(MAX_DEPTH_PROPERTY, System.getProperty(MAX_DEPTH_PROPERTY), 1, DEFAULT_MAX_DEPTH);
        INDENT = intProperty(INDENT_PROPERTY, System.getProperty(INDENT_PROPERTY), 0, DEFAULT_INDENT);
    }

    // no instantiation is allowed for this class
    private JsonCodecProperties() {}

    /// {@return the configured maximum nesting depth}
    public static int maxDepth() {
        return MAX_DEPTH;
    }

    /// {@return the configured default indent width}
    public static int indent() {
        return INDENT;
    }

    /// Interprets a property value as an integer no smaller than `min`.
    ///
    /// @param name the property name, for the log message
    /// @param value the raw value, `null` when the property is unset
    /// @param min the smallest accepted value
    /// @param defaultValue the value used when `value` is unset or invalid
    /// @return the interpreted value
    static int intProperty(String name, String value, int min, int defaultValue) {
        if (value == null) {
            LOG.fine(() -> name + " not specified, using default: " + defaultValue);
            return defaultValue;
        }
        try {
            final int parsed = Integer.parseInt(value.trim());
            if (parsed >= min) {
                LOG.fine(() -> name + " set to " + parsed + " via system property");
                return parsed;
            }
        } catch (NumberFormatException ex) {
            LOG.warning(() -> "Invalid " + name + ": " + value + " (" + ex.getMessage() + ")."
                    + " Using default: " + defaultValue);
            return defaultValue;
        }
        LOG.warning(() -> "Invalid " + name + ": " + value + " is below " + min + ". Using default: " + defaultValue);
        return defaultValue;
    }
}

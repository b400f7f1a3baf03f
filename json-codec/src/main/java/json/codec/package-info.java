/// A self-contained JSON codec: text to an immutable value tree and back.
///
/// {@link json.codec.Json#parse(String)} runs the tokenizer and the
/// recursive-descent parser over a document and returns a
/// {@link json.codec.JsonValue}. {@link json.codec.Json#stringify(Object)} and
/// {@link json.codec.JsonGenerator} write a value back as compact or indented text.
///
/// ## Value model
/// `JsonValue` is a sealed interface over six records:
/// - {@link json.codec.JsonNull}
/// - {@link json.codec.JsonBoolean}
/// - {@link json.codec.JsonString}
/// - {@link json.codec.JsonNumber}, always a finite `double`
/// - {@link json.codec.JsonArray}, ordered
/// - {@link json.codec.JsonObject}, members sorted by name
///
/// Because object members are kept sorted, serializing a value is deterministic:
/// `Json.stringify(Json.parse(Json.stringify(v)))` equals `Json.stringify(v)`.
///
/// ## Errors
/// Parsing is fail-fast. A malformed document raises a
/// {@link json.codec.JsonParseException} whose {@link json.codec.JsonErrorKind}
/// tells what went wrong and whose line and column tell where. Typed accessors such
/// as {@link json.codec.JsonValue#get(String)} raise a
/// {@link json.codec.JsonAssertionException}. Writing never fails.
///
/// ## Configuration
/// The system properties `json.codec.maxDepth` (default 512) and
/// `json.codec.indent` (default 4) are read once when the codec is first used.
///
/// ## Logging
/// The codec logs through `java.util.logging` under the `json.codec` logger
/// hierarchy, at `FINE` and below except for rejected configuration values.
package json.codec;

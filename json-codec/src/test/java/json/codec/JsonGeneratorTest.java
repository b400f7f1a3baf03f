package json.codec;

import json.codec.internal.JsonCodecProperties;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for JsonGenerator - compact and indented output
class JsonGeneratorTest extends JsonCodecLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonGeneratorTest.class.getName());

    private static String minified(JsonValue value) {
        return new JsonGenerator(true, 4).write(value).output();
    }

    private static String pretty(JsonValue value, int indent) {
        return new JsonGenerator(false, indent).write(value).output();
    }

    private static JsonObject contact() {
        final var more = new LinkedHashMap<String, JsonValue>();
        more.put("phone", JsonNull.of());
        final var members = new LinkedHashMap<String, JsonValue>();
        members.put("more", JsonObject.of(more));
        members.put("b", JsonNumber.of(123));
        members.put("a", JsonString.of("abc"));
        return JsonObject.of(members);
    }

    // ========== Compact output ==========

    @Test
    void testMinifiedScalars() {
        LOG.info(() -> "TEST: testMinifiedScalars");
        assertThat(minified(JsonNull.of())).isEqualTo("null");
        assertThat(minified(JsonBoolean.TRUE)).isEqualTo("true");
        assertThat(minified(JsonBoolean.FALSE)).isEqualTo("false");
        assertThat(minified(JsonNumber.of(200))).isEqualTo("200");
        assertThat(minified(JsonString.of("abc"))).isEqualTo("\"abc\"");
    }

    @Test
    void testMinifiedObjectHasSortedKeysAndNoWhitespace() {
        LOG.info(() -> "TEST: testMinifiedObjectHasSortedKeysAndNoWhitespace");
        final var features = JsonArray.of(
                JsonString.of("awesfome   fasfaf  "), JsonString.of("easyAPI  "), JsonString.of("lowLearningCurve"));
        final var members = new LinkedHashMap<String, JsonValue>();
        members.put("code", JsonNumber.of(200));
        members.put("success", JsonBoolean.TRUE);
        members.put("payload", JsonObject.of(Map.of("features", features)));

        assertThat(minified(JsonObject.of(members))).isEqualTo(
                "{\"code\":200,\"payload\":{\"features\":[\"awesfome   fasfaf  \",\"easyAPI  \",\"lowLearningCurve\"]},\"success\":true}");
    }

    @Test
    void testMinifiedIgnoresIndentWidth() {
        LOG.info(() -> "TEST: testMinifiedIgnoresIndentWidth");
        assertThat(new JsonGenerator(true, 0).write(contact()).output())
                .isEqualTo(new JsonGenerator(true, 8).write(contact()).output())
                .isEqualTo("{\"a\":\"abc\",\"b\":123,\"more\":{\"phone\":null}}");
    }

    // ========== Indented output ==========

    @Test
    void testPrettyObject() {
        LOG.info(() -> "TEST: testPrettyObject");
        final var expected = """
                {
                    "a": "abc",
                    "b": 123,
                    "more": {
                        "phone": null
                    }
                }""";
        assertThat(pretty(contact(), 4)).isEqualTo(expected);
    }

    @Test
    void testPrettyArraySeparatesElementsWithCommaSpace() {
        LOG.info(() -> "TEST: testPrettyArraySeparatesElementsWithCommaSpace");
        final var value = Json.parse("[ 1, 2, 3, \"a\", [ \"b\", \"c\" ] ]");
        assertThat(pretty(value, 4)).isEqualTo(
                "[\n    1, \n    2, \n    3, \n    \"a\", \n    [\n        \"b\", \n        \"c\"\n    ]\n]");
    }

    @Test
    void testPrettyEmptyContainersStayOnOneLine() {
        LOG.info(() -> "TEST: testPrettyEmptyContainersStayOnOneLine");
        assertThat(pretty(JsonArray.of(), 4)).isEqualTo("[]");
        assertThat(pretty(JsonObject.of(Map.of()), 4)).isEqualTo("{}");
        assertThat(pretty(Json.parse("{\"b\":{},\"a\":[]}"), 2)).isEqualTo("{\n  \"a\": [],\n  \"b\": {}\n}");
    }

    @Test
    void testPrettyWithZeroIndentStillBreaksLines() {
        LOG.info(() -> "TEST: testPrettyWithZeroIndentStillBreaksLines");
        assertThat(pretty(Json.parse("[1,{\"k\":2}]"), 0)).isEqualTo("[\n1, \n{\n\"k\": 2\n}\n]");
    }

    @Test
    void testPrettyObjectInsideArray() {
        LOG.info(() -> "TEST: testPrettyObjectInsideArray");
        assertThat(pretty(Json.parse("[{\"x\":true,\"y\":false}]"), 2)).isEqualTo(
                "[\n  {\n    \"x\": true,\n    \"y\": false\n  }\n]");
    }

    // ========== Strings ==========

    @Test
    void testShortEscapesOnOutput() {
        LOG.info(() -> "TEST: testShortEscapesOnOutput");
        assertThat(minified(JsonString.of("\r\n\t\b\f\\\""))).isEqualTo("\"\\r\\n\\t\\b\\f\\\\\\\"\"");
    }

    @Test
    void testOtherCharactersAreWrittenVerbatim() {
        LOG.info(() -> "TEST: testOtherCharactersAreWrittenVerbatim");
        final var text = "/ é 查 𝄞 \u0001 \u007F  ";
        assertThat(minified(JsonString.of(text))).isEqualTo("\"" + text + "\"");
    }

    @Test
    void testKeysAreEscapedLikeStrings() {
        LOG.info(() -> "TEST: testKeysAreEscapedLikeStrings");
        assertThat(minified(JsonObject.of(Map.of("a\"b\\c\n", JsonNull.of()))))
                .isEqualTo("{\"a\\\"b\\\\c\\n\":null}");
    }

    // ========== Numbers ==========

    @Test
    void testIntegralNumbersHaveNoFraction() {
        LOG.info(() -> "TEST: testIntegralNumbersHaveNoFraction");
        assertThat(JsonGenerator.formatNumber(200.0)).isEqualTo("200");
        assertThat(JsonGenerator.formatNumber(-12300.0)).isEqualTo("-12300");
        assertThat(JsonGenerator.formatNumber(0.0)).isEqualTo("0");
        assertThat(JsonGenerator.formatNumber(-0.0)).isEqualTo("-0");
        assertThat(JsonGenerator.formatNumber(1e21)).isEqualTo("1000000000000000000000");
        assertThat(JsonGenerator.formatNumber(9007199254740993.0)).isEqualTo("9007199254740992");
    }

    @Test
    void testFractionalNumbersUsePlainNotation() {
        LOG.info(() -> "TEST: testFractionalNumbersUsePlainNotation");
        assertThat(JsonGenerator.formatNumber(0.000123)).isEqualTo("0.000123");
        assertThat(JsonGenerator.formatNumber(-1.5)).isEqualTo("-1.5");
        assertThat(JsonGenerator.formatNumber(0.1)).isEqualTo("0.1");
        assertThat(JsonGenerator.formatNumber(1e-7)).isEqualTo("0.0000001");
        assertThat(JsonGenerator.formatNumber(123456789.25)).isEqualTo("123456789.25");
    }

    @Test
    void testFormattedNumbersParseBackExactly() {
        LOG.info(() -> "TEST: testFormattedNumbersParseBackExactly");
        for (double d : List.of(Math.PI, -Math.E, Double.MIN_VALUE, Double.MAX_VALUE, 1.0 / 3, 5e-324, 4.35)) {
            assertThat(Double.parseDouble(JsonGenerator.formatNumber(d))).isEqualTo(d);
        }
    }

    @Test
    void testNumbersUseTheFewestDigitsThatReadBack() {
        LOG.info(() -> "TEST: testNumbersUseTheFewestDigitsThatReadBack");
        assertThat(JsonGenerator.formatNumber(1e23)).isEqualTo("100000000000000000000000");
        assertThat(JsonGenerator.formatNumber(2.82879384806159E17)).isEqualTo("282879384806159000");
        assertThat(JsonGenerator.formatNumber(-1e23)).isEqualTo("-100000000000000000000000");
        assertThat(JsonGenerator.formatNumber(2e-3)).isEqualTo("0.002");
        assertThat(JsonGenerator.formatNumber(5e-324)).isEqualTo("0." + "0".repeat(323) + "5");
        assertThat(minified(Json.parse("[1e23,2.82879384806159E17]")))
                .isEqualTo("[100000000000000000000000,282879384806159000]");
    }

    // ========== Nesting ==========

    private static JsonValue nestedArrays(int levels) {
        JsonValue value = JsonArray.of();
        for (int i = 1; i < levels; i++) {
            value = JsonArray.of(value);
        }
        return value;
    }

    @Test
    void testNestingUpToTheLimitIsWrittenAndParsesBack() {
        LOG.info(() -> "TEST: testNestingUpToTheLimitIsWrittenAndParsesBack");
        final int limit = JsonCodecProperties.maxDepth();
        final var value = nestedArrays(limit);
        final var text = value.dump();
        assertThat(text).isEqualTo("[".repeat(limit) + "]".repeat(limit));
        assertThat(Json.parse(text)).isEqualTo(value);
    }

    @Test
    void testNestingBeyondTheLimitIsRejectedWithoutStackOverflow() {
        LOG.info(() -> "TEST: testNestingBeyondTheLimitIsRejectedWithoutStackOverflow");
        final int limit = JsonCodecProperties.maxDepth();
        assertThatThrownBy(() -> nestedArrays(limit + 1).dump())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nesting depth exceeds " + limit);
        assertThatThrownBy(() -> Json.prettyPrint(nestedArrays(200_000), 2))
                .isInstanceOf(IllegalArgumentException.class);
        final var deepObject = JsonObject.of(Map.of("k", nestedArrays(limit)));
        assertThatThrownBy(deepObject::dump).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testResetClearsNesting() {
        LOG.info(() -> "TEST: testResetClearsNesting");
        final int limit = JsonCodecProperties.maxDepth();
        final var generator = new JsonGenerator(true, 0);
        assertThatThrownBy(() -> generator.write(nestedArrays(limit + 1)))
                .isInstanceOf(IllegalArgumentException.class);
        generator.reset();
        assertThat(generator.write(nestedArrays(limit)).output()).hasSize(2 * limit);
    }

    // ========== Lifecycle ==========

    @Test
    void testResetAllowsReuse() {
        LOG.info(() -> "TEST: testResetAllowsReuse");
        final var generator = new JsonGenerator(false, 2);
        generator.write(Json.parse("[1]"));
        assertThat(generator.toString()).isEqualTo("[\n  1\n]");
        generator.reset();
        assertThat(generator.output()).isEmpty();
        generator.write(JsonBoolean.TRUE);
        assertThat(generator.output()).isEqualTo("true");
    }

    @Test
    void testDefaultGeneratorIsPretty() {
        LOG.info(() -> "TEST: testDefaultGeneratorIsPretty");
        final var generator = new JsonGenerator();
        assertThat(generator.minify()).isFalse();
        if (System.getProperty("json.codec.indent") == null) {
            assertThat(generator.indentWidth()).isEqualTo(4);
        }
    }

    @Test
    void testRejectsNegativeIndentAndNullValue() {
        LOG.info(() -> "TEST: testRejectsNegativeIndentAndNullValue");
        assertThatThrownBy(() -> new JsonGenerator(false, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JsonGenerator(true, 0).write((JsonValue) null))
                .isInstanceOf(NullPointerException.class);
    }
}

package com.strataconf.core.schema;

import com.strataconf.core.model.FieldError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonSchemaCoercer}.
 */
class JsonSchemaCoercerTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "web", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "port", Map.of("type", "integer", "minimum", 1),
                                    "ratio", Map.of("type", "number"),
                                    "secure", Map.of("type", "boolean"),
                                    "name", Map.of("type", "string")),
                            "required", List.of("port")),
                    "ports", Map.of("type", "array", "items", Map.of("type", "integer")),
                    "limits", Map.of("type", "object", "additionalProperties", Map.of("type", "integer"))));

    private final JsonSchemaCoercer coercer = new JsonSchemaCoercer();

    @Test
    @DisplayName("Should coerce numeric and boolean strings")
    void coercesStrings() {
        CoercionResult result = coercer.coerce(Map.of("web", Map.of(
                "port", "7777",
                "ratio", "0.75",
                "secure", "TRUE",
                "name", "123")), SCHEMA);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo(Map.of("web", Map.of(
                "port", 7777,
                "ratio", 0.75,
                "secure", true,
                "name", "123")));
    }

    @Test
    @DisplayName("Should follow items and additionalProperties")
    void coercesNested() {
        CoercionResult result = coercer.coerce(Map.of(
                "web", Map.of("port", 1),
                "ports", List.of("80", 443),
                "limits", Map.of("connections", "100", "requests", "5000000000")), SCHEMA);

        assertThat(result.getValue())
                .containsEntry("ports", List.of(80, 443))
                .containsEntry("limits", Map.of("connections", 100, "requests", 5_000_000_000L));
    }

    @Test
    @DisplayName("Should leave already typed values alone")
    void keepsTypedValues() {
        CoercionResult result = coercer.coerce(Map.of("web", Map.of("port", 9090)), SCHEMA);

        assertThat(result.getValue()).isEqualTo(Map.of("web", Map.of("port", 9090)));
    }

    @Test
    @DisplayName("Should report every violation, not only the first")
    void reportsAllErrors() {
        CoercionResult result = coercer.coerce(Map.of(
                "web", Map.of("port", "not-a-number", "secure", "maybe"),
                "ports", List.of("x")), SCHEMA);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).extracting(FieldError::getPath)
                .contains("$.web.port", "$.web.secure", "$.ports[0]");
        assertThat(result.getErrors()).extracting(FieldError::getKeyword).containsOnly("type");
        assertThatThrownBy(result::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should enforce constraints after coercion")
    void constraintsAfterCoercion() {
        CoercionResult result = coercer.coerce(Map.of("web", Map.of("port", "0")), SCHEMA);

        assertThat(result.getErrors()).singleElement()
                .satisfies(error -> {
                    assertThat(error.getPath()).isEqualTo("$.web.port");
                    assertThat(error.getKeyword()).isEqualTo("minimum");
                });
    }

    @Test
    @DisplayName("Should report missing required fields")
    void requiredFields() {
        CoercionResult result = coercer.coerce(Map.of("web", Map.of()), SCHEMA);

        assertThat(result.getErrors()).extracting(FieldError::getKeyword).contains("required");
    }

    @Test
    @DisplayName("Empty schema accepts anything unchanged")
    void emptySchema() {
        Map<String, Object> configuration = Map.of("anything", List.of("goes", 1));

        assertThat(coercer.coerce(configuration, Map.of()).getValue()).isEqualTo(configuration);
    }

    @Test
    @DisplayName("Should not modify its input")
    void inputUntouched() {
        Map<String, Object> configuration = Map.of("web", Map.of("port", "80"));

        coercer.coerce(configuration, SCHEMA);

        assertThat(configuration).isEqualTo(Map.of("web", Map.of("port", "80")));
    }

    @Test
    @DisplayName("Should follow local $ref pointers into $defs")
    void followsReferences() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "$defs", Map.of(
                        "port", Map.of("type", "integer", "maximum", 65535),
                        "server", Map.of("type", "object",
                                "properties", Map.of("port", Map.of("$ref", "#/$defs/port")))),
                "properties", Map.of(
                        "port", Map.of("$ref", "#/$defs/port"),
                        "admin", Map.of("$ref", "#/$defs/server")));

        CoercionResult result = coercer.coerce(
                Map.of("port", "7777", "admin", Map.of("port", "9090")), schema);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue())
                .containsEntry("port", 7777)
                .containsEntry("admin", Map.of("port", 9090));
    }

    @Test
    @DisplayName("Should coerce through allOf, anyOf and oneOf branches")
    void followsCombinators() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "allOf", List.of(Map.of("properties", Map.of("port", Map.of("type", "integer")))),
                "properties", Map.of(
                        "ratio", Map.of("anyOf", List.of(Map.of("type", "number"), Map.of("type", "null"))),
                        "flag", Map.of("oneOf", List.of(Map.of("type", "boolean"), Map.of("type", "integer")))));

        CoercionResult result = coercer.coerce(Map.of("port", "7777", "ratio", "0.5", "flag", "false"), schema);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue())
                .containsEntry("port", 7777)
                .containsEntry("ratio", 0.5)
                .containsEntry("flag", false);
    }

    @Test
    @DisplayName("A branch accepting strings keeps the raw text")
    void stringBranchWins() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("id", Map.of("anyOf", List.of(
                        Map.of("type", "integer"), Map.of("type", "string")))));

        assertThat(coercer.coerce(Map.of("id", "0042"), schema).getValue()).containsEntry("id", "0042");
    }

    @Test
    @DisplayName("Self-referencing schemas coerce nested values without looping")
    void recursiveReference() {
        Map<String, Object> schema = Map.of(
                "$ref", "#/$defs/node",
                "$defs", Map.of("node", Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "weight", Map.of("type", "integer"),
                                "child", Map.of("$ref", "#/$defs/node")))));

        CoercionResult result = coercer.coerce(
                Map.of("weight", "1", "child", Map.of("weight", "2")), schema);

        assertThat(result.getValue())
                .containsEntry("weight", 1)
                .containsEntry("child", Map.of("weight", 2));
    }

    @Test
    @DisplayName("Pointers resolve escaped segments and ignore remote references")
    void resolvesPointers() {
        Map<String, Object> root = Map.of("$defs", Map.of("a/b", Map.of("type", "integer")),
                "list", List.of(Map.of("type", "boolean")));

        assertThat(JsonSchemaCoercer.resolveReference("#/$defs/a~1b", root)).isEqualTo(Map.of("type", "integer"));
        assertThat(JsonSchemaCoercer.resolveReference("#/list/0", root)).isEqualTo(Map.of("type", "boolean"));
        assertThat(JsonSchemaCoercer.resolveReference("#", root)).isSameAs(root);
        assertThat(JsonSchemaCoercer.resolveReference("#/missing", root)).isNull();
        assertThat(JsonSchemaCoercer.resolveReference("other.json#/a", root)).isNull();
    }
}

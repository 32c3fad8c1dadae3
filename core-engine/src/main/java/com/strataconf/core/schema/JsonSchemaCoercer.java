package com.strataconf.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.strataconf.core.error.ConfigurationException;
import com.strataconf.core.model.FieldError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default {@link ConfigurationCoercer}: JSON Schema (draft 2020-12).
 *
 * <h3>Coercion</h3>
 * <p>
 * Before validation, string values are converted where the schema asks for
 * another type:
 * </p>
 * <ul>
 * <li>{@code integer}: {@code "42"} becomes {@link Integer} (or
 * {@link Long} / {@link BigInteger} when it does not fit)</li>
 * <li>{@code number}: {@code "1.5"} becomes {@link Double}</li>
 * <li>{@code boolean}: {@code "true"} / {@code "false"}, any case</li>
 * </ul>
 * <p>
 * The schema is followed through {@code properties},
 * {@code additionalProperties} and {@code items} when they are schemas, and
 * through local {@code $ref} pointers and the branches of {@code allOf},
 * {@code anyOf} and {@code oneOf}. A string is left as is when any applicable
 * branch accepts strings.
 * Strings that do not parse are left alone so validation reports them.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * The coerced tree is validated with the networknt validator; every
 * violation is reported, sorted by location.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonSchemaCoercer implements ConfigurationCoercer {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSchemaCoercer.class);

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final List<String> COMBINATORS = List.of("allOf", "anyOf", "oneOf");
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public CoercionResult coerce(Map<String, Object> configuration, Map<String, Object> schema) {
        Objects.requireNonNull(configuration, "Configuration must not be null");
        Objects.requireNonNull(schema, "Schema must not be null");

        Map<String, Object> coerced = coerceMap(configuration, flatten(List.<Object>of(schema), schema), schema);

        JsonSchema jsonSchema;
        try {
            jsonSchema = SCHEMA_FACTORY.getSchema(mapper.valueToTree(schema));
        } catch (RuntimeException e) {
            throw new ConfigurationException("The configuration schema is not a valid JSON Schema", e);
        }

        JsonNode instance = mapper.valueToTree(coerced);
        Set<ValidationMessage> messages = jsonSchema.validate(instance);
        if (messages.isEmpty()) {
            return CoercionResult.success(coerced);
        }

        List<FieldError> errors = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            errors.add(new FieldError(String.valueOf(message.getInstanceLocation()),
                    message.getType(),
                    message.getMessage()));
        }
        errors.sort(Comparator.comparing(FieldError::getPath).thenComparing(FieldError::getMessage));
        LOG.debug("Configuration failed validation with {} error(s)", errors.size());
        return CoercionResult.failure(errors);
    }

    // ---------------------------------------------------------------
    // Coercion
    // ---------------------------------------------------------------

    static Map<String, Object> coerceMap(Map<?, ?> map, List<Map<?, ?>> schemas, Map<?, ?> root) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((rawKey, child) -> {
            String key = String.valueOf(rawKey);
            List<Object> childSchemas = new ArrayList<>();
            for (Map<?, ?> node : schemas) {
                Object properties = node.get("properties");
                if (properties instanceof Map<?, ?> props && props.containsKey(key)) {
                    childSchemas.add(props.get(key));
                } else if (node.get("additionalProperties") instanceof Map<?, ?> additional) {
                    childSchemas.add(additional);
                }
            }
            result.put(key, coerceValue(child, childSchemas, root));
        });
        return result;
    }

    private static Object coerceValue(Object value, List<Object> schemas, Map<?, ?> root) {
        List<Map<?, ?>> nodes = flatten(schemas, root);
        if (nodes.isEmpty()) {
            return value;
        }
        if (value instanceof String text) {
            Set<String> accepted = new LinkedHashSet<>();
            nodes.forEach(node -> accepted.addAll(types(node)));
            return coerceString(text, accepted);
        }
        if (value instanceof Map<?, ?> map) {
            return coerceMap(map, nodes, root);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>();
            for (Map<?, ?> node : nodes) {
                if (node.get("items") instanceof Map<?, ?> itemSchema) {
                    items.add(itemSchema);
                }
            }
            Collection<Object> result = value instanceof Set
                    ? new LinkedHashSet<>()
                    : new ArrayList<>(collection.size());
            collection.forEach(element -> result.add(coerceValue(element, items, root)));
            return result;
        }
        return value;
    }

    /**
     * Expand schemas into every node that applies to the same value: the
     * schema itself, local {@code $ref} targets and the branches of
     * {@code allOf}, {@code anyOf} and {@code oneOf}.
     */
    static List<Map<?, ?>> flatten(List<Object> schemas, Map<?, ?> root) {
        List<Map<?, ?>> nodes = new ArrayList<>();
        Set<Map<?, ?>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Object schema : schemas) {
            collect(schema, root, nodes, seen);
        }
        return nodes;
    }

    private static void collect(Object schema, Map<?, ?> root, List<Map<?, ?>> nodes, Set<Map<?, ?>> seen) {
        if (!(schema instanceof Map<?, ?> node) || !seen.add(node)) {
            return;
        }
        nodes.add(node);
        if (node.get("$ref") instanceof String ref) {
            collect(resolveReference(ref, root), root, nodes, seen);
        }
        for (String keyword : COMBINATORS) {
            if (node.get(keyword) instanceof Collection<?> branches) {
                branches.forEach(branch -> collect(branch, root, nodes, seen));
            }
        }
    }

    /**
     * Resolve a local JSON pointer reference such as {@code #/$defs/port}.
     * Remote references resolve to nothing; the validator reports them.
     */
    static Object resolveReference(String ref, Map<?, ?> root) {
        if (!ref.startsWith("#")) {
            return null;
        }
        String pointer = ref.substring(1);
        Object current = root;
        if (pointer.isEmpty()) {
            return current;
        }
        if (!pointer.startsWith("/")) {
            return null;
        }
        for (String token : pointer.substring(1).split("/", -1)) {
            String decoded = token.indexOf('%') >= 0 ? URLDecoder.decode(token, StandardCharsets.UTF_8) : token;
            String segment = decoded.replace("~1", "/").replace("~0", "~");
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && segment.matches("\\d{1,9}")
                    && Integer.parseInt(segment) < list.size()) {
                current = list.get(Integer.parseInt(segment));
            } else {
                return null;
            }
        }
        return current;
    }

    private static Object coerceString(String text, Set<String> types) {
        if (types.isEmpty() || types.contains("string")) {
            return text;
        }
        String trimmed = text.trim();
        if (types.contains("integer") && INTEGER.matcher(trimmed).matches()) {
            return narrow(new BigInteger(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed));
        }
        if (types.contains("number") && NUMBER.matcher(trimmed).matches()) {
            return Double.valueOf(trimmed);
        }
        if (types.contains("boolean")) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.equals("true") || lower.equals("false")) {
                return Boolean.valueOf(lower);
            }
        }
        return text;
    }

    private static Number narrow(BigInteger value) {
        if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0) {
            return value.intValue();
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    private static Set<String> types(Map<?, ?> node) {
        Object type = node.get("type");
        Set<String> types = new LinkedHashSet<>();
        if (type instanceof String single) {
            types.add(single);
        } else if (type instanceof Collection<?> many) {
            many.forEach(t -> types.add(String.valueOf(t)));
        }
        return types;
    }
}

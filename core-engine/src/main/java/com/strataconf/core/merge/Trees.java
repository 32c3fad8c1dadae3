package com.strataconf.core.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for copying and freezing configuration trees.
 *
 * <p>
 * Map keys are normalised to strings on every copy; parsers may hand back
 * integer or boolean keys (YAML allows both).
 * </p>
 *
 * @since 1.0.0
 */
public final class Trees {

    private Trees() {
        // utility class
    }

    /**
     * Deep, mutable copy of a configuration value.
     *
     * @param value a map, collection or scalar; may be {@code null}
     * @return a fresh tree sharing no containers with {@code value}
     */
    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof Set<?> set) {
            Set<Object> result = new LinkedHashSet<>();
            set.forEach(element -> result.add(copy(element)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(element -> result.add(copy(element)));
            return result;
        }
        return value;
    }

    /**
     * Deep, mutable copy of a map with every key converted to a string.
     *
     * @param map source map; must not be {@code null}
     * @return new insertion-ordered map
     */
    public static Map<String, Object> copyMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), copy(value)));
        return result;
    }

    /**
     * Deep, unmodifiable copy of a map. Null values are preserved.
     *
     * @param map source map; must not be {@code null}
     * @return unmodifiable tree
     */
    public static Map<String, Object> freeze(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), freezeValue(value)));
        return Collections.unmodifiableMap(result);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze(map);
        }
        if (value instanceof Set<?> set) {
            Set<Object> result = new LinkedHashSet<>();
            set.forEach(element -> result.add(freezeValue(element)));
            return Collections.unmodifiableSet(result);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(element -> result.add(freezeValue(element)));
            return Collections.unmodifiableList(result);
        }
        return value;
    }

    /**
     * Short name for the shape of a value, used in error messages.
     *
     * @param value any configuration value
     * @return {@code "map"}, {@code "collection"}, {@code "null"} or the
     *         simple class name of a scalar
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "map";
        }
        if (value instanceof Collection) {
            return "collection";
        }
        return value.getClass().getSimpleName();
    }
}

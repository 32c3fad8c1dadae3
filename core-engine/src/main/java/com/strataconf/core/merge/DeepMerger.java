package com.strataconf.core.merge;

import com.strataconf.core.error.MergeConflictException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recursively merges configuration trees.
 *
 * <h3>Rules</h3>
 * <p>
 * The shape of the <em>existing</em> value decides what happens:
 * </p>
 * <ol>
 * <li>a {@link Map} is merged key by key; keys present on both sides are
 * merged recursively, keys present on one side pass through</li>
 * <li>any other {@link Collection} accumulates: the existing elements
 * followed by the incoming ones (sets stay sets)</li>
 * <li>anything else is replaced by the incoming value</li>
 * </ol>
 *
 * <p>
 * A map or collection meeting a non-null value of another shape raises
 * {@link MergeConflictException}. A {@code null} incoming value leaves an
 * existing map or collection untouched.
 * </p>
 *
 * <p>
 * Inputs are never modified; every call returns freshly allocated containers.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeepMerger {

    private DeepMerger() {
        // utility class
    }

    /**
     * Left-fold {@link #merge(Map, Map)} over a sequence of layers. Later
     * layers take precedence.
     *
     * @param layers layers in ascending precedence; must not be {@code null}
     * @return merged tree (empty if {@code layers} is empty)
     */
    public static Map<String, Object> mergeAll(List<? extends Map<String, ?>> layers) {
        Objects.requireNonNull(layers, "Layers must not be null");
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map<String, ?> layer : layers) {
            result = merge(result, layer);
        }
        return result;
    }

    /**
     * Merge {@code incoming} onto {@code existing}.
     *
     * @param existing lower-precedence tree; must not be {@code null}
     * @param incoming higher-precedence tree; {@code null} is treated as empty
     * @return new merged tree
     * @throws MergeConflictException if the two trees disagree on the shape of
     *                                a shared key
     */
    public static Map<String, Object> merge(Map<String, ?> existing, Map<String, ?> incoming) {
        Objects.requireNonNull(existing, "Existing tree must not be null");
        return mergeMaps(new ArrayList<>(), existing, incoming);
    }

    private static Object mergeValue(List<String> path, Object existing, Object incoming) {
        if (existing instanceof Map<?, ?> existingMap) {
            if (incoming == null) {
                return Trees.copy(existingMap);
            }
            if (!(incoming instanceof Map<?, ?> incomingMap)) {
                throw new MergeConflictException(path, Trees.describe(existing), Trees.describe(incoming));
            }
            return mergeMaps(path, existingMap, incomingMap);
        }

        if (existing instanceof Collection<?> existingCollection) {
            if (incoming == null) {
                return Trees.copy(existingCollection);
            }
            if (!(incoming instanceof Collection<?> incomingCollection)) {
                throw new MergeConflictException(path, Trees.describe(existing), Trees.describe(incoming));
            }
            return concat(existingCollection, incomingCollection);
        }

        return Trees.copy(incoming);
    }

    private static Map<String, Object> mergeMaps(List<String> path, Map<?, ?> existing, Map<?, ?> incoming) {
        Map<String, Object> result = Trees.copyMap(existing);
        if (incoming == null) {
            return result;
        }
        incoming.forEach((rawKey, value) -> {
            String key = String.valueOf(rawKey);
            if (result.containsKey(key)) {
                path.add(key);
                result.put(key, mergeValue(path, result.get(key), value));
                path.remove(path.size() - 1);
            } else {
                result.put(key, Trees.copy(value));
            }
        });
        return result;
    }

    private static Collection<Object> concat(Collection<?> existing, Collection<?> incoming) {
        Collection<Object> result = existing instanceof Set
                ? new LinkedHashSet<>()
                : new ArrayList<>(existing.size() + incoming.size());
        existing.forEach(element -> result.add(Trees.copy(element)));
        incoming.forEach(element -> result.add(Trees.copy(element)));
        return result;
    }
}

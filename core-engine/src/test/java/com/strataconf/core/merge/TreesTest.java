package com.strataconf.core.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Trees}.
 */
class TreesTest {

    @Test
    @DisplayName("Frozen trees reject modification at every level")
    void freezeIsDeep() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("list", new ArrayList<>(List.of(1)));
        Map<String, Object> root = new HashMap<>();
        root.put("inner", inner);

        Map<String, Object> frozen = Trees.freeze(root);
        @SuppressWarnings("unchecked")
        Map<String, Object> frozenInner = (Map<String, Object>) frozen.get("inner");
        @SuppressWarnings("unchecked")
        List<Object> frozenList = (List<Object>) frozenInner.get("list");

        assertThatThrownBy(() -> frozen.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frozenInner.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frozenList.add(2)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Keys are converted to strings and nulls survive")
    void keysAndNulls() {
        Map<Object, Object> source = new HashMap<>();
        source.put(8080, "port");
        source.put("empty", null);

        Map<String, Object> copy = Trees.copyMap(source);

        assertThat(copy).containsEntry("8080", "port").containsEntry("empty", null);
    }

    @Test
    @DisplayName("Describe names the shape of a value")
    void describe() {
        assertThat(Trees.describe(Map.of())).isEqualTo("map");
        assertThat(Trees.describe(List.of())).isEqualTo("collection");
        assertThat(Trees.describe(null)).isEqualTo("null");
        assertThat(Trees.describe(42)).isEqualTo("Integer");
    }
}

package com.strataconf.core.property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, sorted view of every property available for expansion.
 *
 * <p>
 * Precedence, lowest to highest: environment variables, JVM system
 * properties, explicit properties. Keys are compared exactly; there is no
 * case folding. Explicit property keys are converted with
 * {@link String#valueOf(Object)}; entries with a {@code null} value are
 * ignored.
 * </p>
 *
 * <p>
 * Tests construct snapshots with {@link #of(Map, Map, Map)} so that no
 * process-wide state is involved.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvironmentSnapshot {

    private final SortedMap<String, String> values;

    private EnvironmentSnapshot(SortedMap<String, String> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    /**
     * Capture the current process environment and system properties, layered
     * under {@code explicitProperties}.
     *
     * @param explicitProperties highest-precedence properties; may be
     *                           {@code null}
     * @return a new snapshot
     */
    public static EnvironmentSnapshot capture(Map<?, ?> explicitProperties) {
        return of(System.getenv(), System.getProperties(), explicitProperties);
    }

    /**
     * Build a snapshot from explicit tables.
     *
     * @param environment        lowest precedence; may be {@code null}
     * @param systemProperties   middle precedence; may be {@code null}
     * @param explicitProperties highest precedence; may be {@code null}
     * @return a new snapshot
     */
    public static EnvironmentSnapshot of(Map<String, String> environment,
            Map<?, ?> systemProperties,
            Map<?, ?> explicitProperties) {
        SortedMap<String, String> values = new TreeMap<>();
        putAll(values, environment);
        putAll(values, systemProperties);
        putAll(values, explicitProperties);
        return new EnvironmentSnapshot(values);
    }

    /**
     * Snapshot holding only the given properties.
     *
     * @param properties property table; must not be {@code null}
     * @return a new snapshot
     */
    public static EnvironmentSnapshot ofProperties(Map<?, ?> properties) {
        Objects.requireNonNull(properties, "Properties must not be null");
        return of(null, null, properties);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @return every key in sorted order
     */
    public List<String> keys() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    public SortedMap<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    private static void putAll(SortedMap<String, String> target, Map<?, ?> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                target.put(String.valueOf(key), String.valueOf(value));
            }
        });
    }

    @Override
    public String toString() {
        // values may hold secrets
        return "EnvironmentSnapshot{keys=" + values.size() + '}';
    }
}

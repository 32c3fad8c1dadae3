package com.strataconf.core.property;

import com.strataconf.core.error.UnresolvedPropertyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EnvironmentSnapshot} and {@link PropertyResolver}.
 */
class EnvironmentSnapshotTest {

    @Test
    @DisplayName("Explicit properties shadow system properties, which shadow the environment")
    void precedence() {
        Properties system = new Properties();
        system.setProperty("shared", "system");
        system.setProperty("sysOnly", "system");

        EnvironmentSnapshot snapshot = EnvironmentSnapshot.of(
                Map.of("shared", "env", "ENV_ONLY", "env"),
                system,
                Map.of("shared", "explicit"));

        assertThat(snapshot.get("shared")).contains("explicit");
        assertThat(snapshot.get("sysOnly")).contains("system");
        assertThat(snapshot.get("ENV_ONLY")).contains("env");
    }

    @Test
    @DisplayName("Keys are exact: no case folding")
    void caseSensitive() {
        EnvironmentSnapshot snapshot = EnvironmentSnapshot.ofProperties(Map.of("HOME", "/root"));

        assertThat(snapshot.contains("HOME")).isTrue();
        assertThat(snapshot.contains("home")).isFalse();
    }

    @Test
    @DisplayName("Explicit keys and values are converted to strings; nulls are ignored")
    void conversions() {
        Map<Object, Object> explicit = new HashMap<>();
        explicit.put(42, 7);
        explicit.put("unset", null);

        EnvironmentSnapshot snapshot = EnvironmentSnapshot.ofProperties(explicit);

        assertThat(snapshot.get("42")).contains("7");
        assertThat(snapshot.contains("unset")).isFalse();
        assertThat(snapshot.keys()).containsExactly("42");
    }

    @Test
    @DisplayName("Captured snapshot includes JVM system properties")
    void captureReadsSystemProperties() {
        EnvironmentSnapshot snapshot = EnvironmentSnapshot.capture(Map.of("java.version", "overridden"));

        assertThat(snapshot.contains("user.dir")).isTrue();
        assertThat(snapshot.get("java.version")).contains("overridden");
    }

    @Test
    @DisplayName("Resolver fails only when there is neither value nor default")
    void resolver() {
        PropertyResolver resolver = new PropertyResolver(EnvironmentSnapshot.ofProperties(Map.of("a", "1")));

        assertThat(resolver.resolve("a", null)).isEqualTo("1");
        assertThat(resolver.resolve("b", "")).isEmpty();
        assertThatThrownBy(() -> resolver.resolve("b", null))
                .isInstanceOf(UnresolvedPropertyException.class)
                .hasMessageContaining("`b'");
    }
}

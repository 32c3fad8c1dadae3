package com.strataconf.core.assembly;

import com.strataconf.core.error.ConfigurationInvalidException;
import com.strataconf.core.property.EnvironmentSnapshot;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SystemConfigurer}.
 */
class SystemConfigurerTest {

    private static final AssemblyOptions CLI_OPTIONS = AssemblyOptions.builder("cli")
            .environment(EnvironmentSnapshot.ofProperties(Map.of()))
            .build();

    /** Component that records the configuration it receives. */
    static class PortListener implements Configurable {
        private final Map<String, Object> schema;
        private Map<String, Object> received;

        PortListener(Map<String, Object> schema) {
            this.schema = schema;
        }

        @Override
        public Map<String, Object> configurationSchema() {
            return schema;
        }

        @Override
        public void configure(Map<String, Object> configuration) {
            this.received = configuration;
        }
    }

    @Test
    @DisplayName("Schemas come from configurable components only, in order")
    void extractSchemas() {
        Map<String, Object> first = Map.of("type", "object");
        Map<String, Object> second = Map.of("required", List.of("port"));

        List<Map<String, Object>> schemas = SystemConfigurer.extractSchemas(List.of(
                new PortListener(first), "plain component", new PortListener(Map.of()), new PortListener(second)));

        assertThat(schemas).containsExactly(first, second);
    }

    @Test
    @DisplayName("Every configurable component receives the coerced configuration")
    void configuresComponents() {
        PortListener listener = new PortListener(Map.of("type", "object",
                "properties", Map.of("port", Map.of("type", "integer"))));
        Map<String, Object> system = new LinkedHashMap<>();
        system.put("listener", listener);
        system.put("clock", "not configurable");

        Map<String, Object> extended = SystemConfigurer.extendSystem(system,
                CLI_OPTIONS.toBuilder().args("port=7000").build());

        assertThat(listener.received).containsEntry("port", 7000);
        assertThat(extended)
                .containsEntry("listener", listener)
                .containsEntry("clock", "not configurable")
                .containsEntry(SystemConfigurer.DEFAULT_CONFIGURATION_KEY, listener.received);
        assertThat(system).doesNotContainKey(SystemConfigurer.DEFAULT_CONFIGURATION_KEY);
    }

    @Test
    @DisplayName("A custom configuration key is honoured")
    void customKey() {
        Map<String, Object> extended = SystemConfigurer.extendSystem(Map.of(), CLI_OPTIONS, "settings");

        assertThat(extended).containsOnlyKeys("settings");
        assertThat(extended.get("settings")).asInstanceOf(InstanceOfAssertFactories.MAP).containsEntry("port", 8080);
    }

    @Test
    @DisplayName("An existing component under the configuration key is rejected")
    void keyCollision() {
        assertThatThrownBy(() -> SystemConfigurer.extendSystem(
                Map.of(SystemConfigurer.DEFAULT_CONFIGURATION_KEY, "taken"), CLI_OPTIONS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("configuration");
    }

    @Test
    @DisplayName("Component schemas are enforced and no component is configured on failure")
    void componentSchemaEnforced() {
        PortListener listener = new PortListener(Map.of("type", "object", "required", List.of("host")));

        assertThatThrownBy(() -> SystemConfigurer.extendSystem(Map.of("listener", listener), CLI_OPTIONS))
                .isInstanceOf(ConfigurationInvalidException.class);
        assertThat(listener.received).isNull();
    }
}

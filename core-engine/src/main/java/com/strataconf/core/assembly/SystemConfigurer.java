package com.strataconf.core.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles the configuration for a system of named components.
 *
 * <p>
 * Schemas are collected from every {@link Configurable} component, the
 * configuration is assembled, handed to each {@link Configurable}, and
 * added to the system under a configuration key so other components can
 * have it injected.
 * </p>
 *
 * @since 1.0.0
 */
public final class SystemConfigurer {

    private static final Logger LOG = LoggerFactory.getLogger(SystemConfigurer.class);

    /** Key under which the configuration is added to the system. */
    public static final String DEFAULT_CONFIGURATION_KEY = "configuration";

    private SystemConfigurer() {
        // utility class
    }

    /**
     * Collect the schema fragments of every {@link Configurable} in
     * {@code components}, in iteration order. Other components are ignored.
     *
     * @param components system components; must not be {@code null}
     * @return unmodifiable list of schema fragments
     */
    public static List<Map<String, Object>> extractSchemas(Collection<?> components) {
        Objects.requireNonNull(components, "Components must not be null");
        List<Map<String, Object>> schemas = new ArrayList<>();
        for (Object component : components) {
            if (component instanceof Configurable configurable) {
                Map<String, Object> schema = configurable.configurationSchema();
                if (schema != null && !schema.isEmpty()) {
                    schemas.add(schema);
                }
            }
        }
        return Collections.unmodifiableList(schemas);
    }

    /**
     * @see #extendSystem(Map, AssemblyOptions, String)
     */
    public static Map<String, Object> extendSystem(Map<String, ?> system, AssemblyOptions options) {
        return extendSystem(system, options, DEFAULT_CONFIGURATION_KEY);
    }

    /**
     * Assemble the configuration for {@code system} and return a new system
     * map that also contains it.
     *
     * @param system           named components; must not be {@code null}
     * @param options          assembly options; component schemas are added
     *                         after any schemas already present
     * @param configurationKey key for the configuration entry
     * @return unmodifiable copy of {@code system} plus the configuration
     * @throws IllegalArgumentException if {@code configurationKey} already
     *                                  names a component
     */
    public static Map<String, Object> extendSystem(Map<String, ?> system,
            AssemblyOptions options,
            String configurationKey) {
        Objects.requireNonNull(system, "System must not be null");
        Objects.requireNonNull(options, "Assembly options must not be null");
        Objects.requireNonNull(configurationKey, "Configuration key must not be null");
        if (system.containsKey(configurationKey)) {
            throw new IllegalArgumentException("System already contains a component named `"
                    + configurationKey + "'");
        }

        List<Map<String, Object>> schemas = new ArrayList<>(options.getSchemas());
        schemas.addAll(extractSchemas(system.values()));

        LOG.info("Reading configuration for {} component(s)", system.size());
        Map<String, Object> configuration = ConfigurationAssembler.assemble(
                options.toBuilder().schemas(schemas).build());

        system.forEach((name, component) -> {
            if (component instanceof Configurable configurable) {
                LOG.debug("Configuring component `{}'", name);
                configurable.configure(configuration);
            }
        });

        Map<String, Object> extended = new LinkedHashMap<>(system);
        extended.put(configurationKey, configuration);
        return Collections.unmodifiableMap(extended);
    }
}

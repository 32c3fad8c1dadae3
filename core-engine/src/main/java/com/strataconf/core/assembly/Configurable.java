package com.strataconf.core.assembly;

import java.util.Map;

/**
 * Capability of a component that declares part of the configuration schema
 * and receives the assembled configuration.
 *
 * <p>
 * The assembler never depends on concrete component types, only on this
 * interface.
 * </p>
 *
 * @since 1.0.0
 */
public interface Configurable {

    /**
     * JSON Schema fragment describing the configuration this component reads.
     * Fragments of all components are deep-merged into one schema.
     *
     * @return schema fragment; empty by default
     */
    default Map<String, Object> configurationSchema() {
        return Map.of();
    }

    /**
     * Receive the assembled, coerced configuration.
     *
     * @param configuration unmodifiable configuration
     */
    void configure(Map<String, Object> configuration);
}

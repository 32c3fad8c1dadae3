package com.strataconf.core.error;

import com.strataconf.core.model.FieldError;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when the merged configuration fails schema validation or coercion.
 *
 * <p>
 * Carries the effective schema, the merged configuration as it was before
 * coercion, and every violated field, not only the first.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationInvalidException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final transient Map<String, Object> schema;
    private final transient Map<String, Object> configuration;
    private final List<FieldError> errors;

    public ConfigurationInvalidException(Map<String, Object> schema,
            Map<String, Object> configuration,
            List<FieldError> errors) {
        super("The configuration is not valid:\n  - " + errors.stream()
                .map(FieldError::toString)
                .collect(Collectors.joining("\n  - ")));
        this.schema = schema;
        this.configuration = configuration;
        this.errors = List.copyOf(errors);
    }

    public Map<String, Object> getSchema() {
        return Collections.unmodifiableMap(schema);
    }

    /**
     * @return the merged configuration before any coercion was attempted
     */
    public Map<String, Object> getConfiguration() {
        return Collections.unmodifiableMap(configuration);
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}

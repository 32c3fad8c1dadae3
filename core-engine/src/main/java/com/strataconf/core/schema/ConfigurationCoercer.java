package com.strataconf.core.schema;

import java.util.Map;

/**
 * Strategy that validates a merged configuration against a schema and
 * converts it to its typed form.
 *
 * <p>
 * Implementations must be all-or-nothing: either every field is coerced and
 * valid, or a failure listing every violation is returned.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConfigurationCoercer {

    /**
     * @param configuration merged configuration; not modified
     * @param schema        effective schema
     * @return the coerced configuration or the list of violations
     */
    CoercionResult coerce(Map<String, Object> configuration, Map<String, Object> schema);
}

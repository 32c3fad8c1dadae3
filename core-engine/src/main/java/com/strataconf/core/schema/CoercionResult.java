package com.strataconf.core.schema;

import com.strataconf.core.model.FieldError;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link ConfigurationCoercer#coerce(Map, Map)}: a coerced
 * configuration, or a non-empty list of field errors.
 *
 * @since 1.0.0
 */
public final class CoercionResult {

    private final Map<String, Object> value;
    private final List<FieldError> errors;

    private CoercionResult(Map<String, Object> value, List<FieldError> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static CoercionResult success(Map<String, Object> value) {
        return new CoercionResult(Objects.requireNonNull(value, "Coerced value must not be null"), List.of());
    }

    /**
     * @param errors violations; must not be empty
     * @return a failed result
     */
    public static CoercionResult failure(List<FieldError> errors) {
        Objects.requireNonNull(errors, "Errors must not be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed coercion must report at least one error");
        }
        return new CoercionResult(null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return value != null;
    }

    /**
     * @return the coerced configuration
     * @throws IllegalStateException if this result is a failure
     */
    public Map<String, Object> getValue() {
        if (value == null) {
            throw new IllegalStateException("Coercion failed: " + errors);
        }
        return value;
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CoercionResult{success}" : "CoercionResult{errors=" + errors + '}';
    }
}

/**
 * Schema validation and coercion of the merged configuration.
 *
 * <p>
 * The assembler depends only on
 * {@link com.strataconf.core.schema.ConfigurationCoercer}.
 * {@link com.strataconf.core.schema.JsonSchemaCoercer} is the default
 * strategy: it converts strings to the numbers and booleans a JSON Schema
 * asks for, then validates the result with the networknt validator.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.schema;

/**
 * Property lookup and {@code ${NAME}} expansion.
 *
 * <p>
 * An {@link com.strataconf.core.property.EnvironmentSnapshot} is captured
 * once per assembly and combines, from lowest to highest precedence,
 * environment variables, JVM system properties and explicit properties.
 * {@link com.strataconf.core.property.PropertyExpander} substitutes
 * references in raw document text through a
 * {@link com.strataconf.core.property.PropertyResolver} before the text is
 * parsed.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.property;

/**
 * Exception hierarchy for configuration assembly.
 *
 * <p>
 * Every failure raised while assembling a configuration is a subclass of
 * {@link com.strataconf.core.error.ConfigurationException}. All of them are
 * fatal: an assembly either returns a complete, validated configuration or
 * throws. Each subtype carries the structured context (property name, source
 * identity, offending token, schema and raw merged map) needed to diagnose
 * the problem without re-running.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.error;

/**
 * Assembly of the final configuration.
 *
 * <p>
 * {@link com.strataconf.core.assembly.ConfigurationAssembler} runs the whole
 * pipeline described by an
 * {@link com.strataconf.core.assembly.AssemblyOptions}:
 * </p>
 * <ol>
 * <li>enumerate and load bundled resources (profile, variant, extension)</li>
 * <li>load additional files, then files named by {@code --load}</li>
 * <li>merge explicit overrides, then command-line overrides</li>
 * <li>validate and coerce against the merged schema</li>
 * </ol>
 * <p>
 * {@link com.strataconf.core.assembly.SystemConfigurer} ties the result to a
 * set of {@link com.strataconf.core.assembly.Configurable} components.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.assembly;

/**
 * Command-line launcher for the configuration assembler.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.strataconf.launcher.StrataLauncher}: main entry point</li>
 * <li>{@link com.strataconf.launcher.LauncherConfig}: environment-driven
 * settings</li>
 * <li>{@link com.strataconf.launcher.ConfigurationWriter}: JSON / YAML
 * rendering</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.strataconf.launcher;

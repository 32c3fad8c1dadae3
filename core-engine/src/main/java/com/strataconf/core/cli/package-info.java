/**
 * Command-line override parsing.
 *
 * <p>
 * Two token forms are understood: {@code --load <path>}, which adds a file to
 * load after the bundled resources, and {@code a/b/c=value}, which sets a
 * nested value as a raw string. Anything else is rejected.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.cli;

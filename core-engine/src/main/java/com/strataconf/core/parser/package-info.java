/**
 * Parsers that turn expanded document text into configuration trees.
 *
 * <p>
 * Parsers are registered by file extension.
 * {@link com.strataconf.core.parser.DocumentParsers#defaults()} provides
 * {@code yaml} (SnakeYAML) and {@code json} (Jackson); callers may register
 * more.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.parser;

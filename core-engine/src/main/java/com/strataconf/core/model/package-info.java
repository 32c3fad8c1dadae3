/**
 * Value types shared across the assembly pipeline.
 *
 * <ul>
 * <li>{@link com.strataconf.core.model.ResourceCoordinate}: one
 * (profile, variant, extension) entry and its logical resource name</li>
 * <li>{@link com.strataconf.core.model.ParsedDocument}: an immutable parsed
 * configuration layer</li>
 * <li>{@link com.strataconf.core.model.FieldError}: a single schema
 * violation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.strataconf.core.model;

/**
 * Locating and loading configuration documents.
 *
 * <p>
 * {@link com.strataconf.core.resource.ResourceEnumerator} computes the ordered
 * list of logical resource names from profiles, variants and extensions.
 * {@link com.strataconf.core.resource.DocumentLoader} resolves each name
 * through a {@link com.strataconf.core.resource.ResourceLocator}, expands
 * property references and parses the result. A logical name with no matching
 * resource is not an error.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.resource;

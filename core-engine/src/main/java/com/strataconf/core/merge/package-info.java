/**
 * Deep merging of configuration trees.
 *
 * <p>
 * A configuration tree is made of {@link java.util.Map} nodes with string
 * keys, {@link java.util.Collection} nodes and scalar leaves.
 * {@link com.strataconf.core.merge.DeepMerger} combines trees layer by layer:
 * maps merge key-wise, collections accumulate, scalars are replaced.
 * </p>
 *
 * @since 1.0.0
 */
package com.strataconf.core.merge;

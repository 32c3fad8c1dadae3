package com.strataconf.core.resource;

import java.io.IOException;
import java.util.List;

/**
 * Resolves a logical resource name to the raw documents that carry it.
 *
 * <p>
 * A name may match no document (not an error), one, or several; the
 * classpath, for example, may hold the same name in more than one archive.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceLocator {

    /**
     * @param logicalName resource name to look up
     * @return every matching source; empty if there is none
     * @throws IOException if the lookup itself fails
     */
    List<DocumentSource> locate(String logicalName) throws IOException;
}

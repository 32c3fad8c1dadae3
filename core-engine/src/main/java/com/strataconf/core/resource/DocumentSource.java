package com.strataconf.core.resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * One raw document: where it came from and how to read it.
 *
 * @since 1.0.0
 */
public interface DocumentSource {

    /**
     * @return URL or path, used in log messages and errors
     */
    String identity();

    /**
     * Open the document for reading. The caller closes the stream.
     *
     * @return a fresh stream over the document bytes
     * @throws IOException if the document cannot be opened
     */
    InputStream open() throws IOException;
}

package com.strataconf.core.resource;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;

/**
 * Finds every resource with a given name on a class loader.
 *
 * <p>
 * Duplicates across archives are all returned. Their order is not defined by
 * the class loader; this locator sorts them by URL so repeated runs see the
 * same order.
 * </p>
 *
 * @since 1.0.0
 */
public class ClasspathResourceLocator implements ResourceLocator {

    private final ClassLoader classLoader;

    /**
     * Locator over the current thread's context class loader, falling back to
     * the loader of this class.
     */
    public ClasspathResourceLocator() {
        this(defaultClassLoader());
    }

    public ClasspathResourceLocator(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "Class loader must not be null");
    }

    @Override
    public List<DocumentSource> locate(String logicalName) throws IOException {
        Objects.requireNonNull(logicalName, "Logical name must not be null");
        Enumeration<URL> urls = classLoader.getResources(logicalName);
        List<URL> found = Collections.list(urls);
        found.sort(Comparator.comparing(URL::toExternalForm));

        List<DocumentSource> sources = new ArrayList<>(found.size());
        for (URL url : found) {
            sources.add(new UrlSource(url));
        }
        return sources;
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : ClasspathResourceLocator.class.getClassLoader();
    }

    private static final class UrlSource implements DocumentSource {

        private final URL url;

        private UrlSource(URL url) {
            this.url = url;
        }

        @Override
        public String identity() {
            return url.toExternalForm();
        }

        @Override
        public InputStream open() throws IOException {
            return url.openStream();
        }
    }
}

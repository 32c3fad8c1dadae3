package com.strataconf.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One schema violation: where it happened, which schema keyword failed, and
 * a human-readable explanation.
 *
 * @since 1.0.0
 */
public final class FieldError implements Serializable {

    private static final long serialVersionUID = 1L;

    /** JSON-pointer style location inside the configuration, e.g. {@code $.web.port}. */
    private final String path;

    /** Schema keyword that rejected the value, e.g. {@code type} or {@code minimum}. */
    private final String keyword;

    private final String message;

    public FieldError(String path, String keyword, String message) {
        this.path = Objects.requireNonNull(path, "Path must not be null");
        this.keyword = keyword;
        this.message = Objects.requireNonNull(message, "Message must not be null");
    }

    public String getPath() {
        return path;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldError that))
            return false;
        return path.equals(that.path)
                && Objects.equals(keyword, that.keyword)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, keyword, message);
    }

    @Override
    public String toString() {
        return path + " (" + keyword + "): " + message;
    }
}

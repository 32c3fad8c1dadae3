package com.strataconf.core.error;

import java.util.List;

/**
 * Thrown when two layers disagree on the shape of a value: a map or a
 * collection in an earlier layer meets a value of a different kind in a
 * later one.
 *
 * @since 1.0.0
 */
public class MergeConflictException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final List<String> path;
    private final String existingType;
    private final String incomingType;

    public MergeConflictException(List<String> path, String existingType, String incomingType) {
        super(String.format("Cannot merge %s into %s at `%s'.",
                incomingType, existingType, String.join("/", path)));
        this.path = List.copyOf(path);
        this.existingType = existingType;
        this.incomingType = incomingType;
    }

    /**
     * @return key path from the document root to the conflicting value
     */
    public List<String> getPath() {
        return path;
    }

    public String getExistingType() {
        return existingType;
    }

    public String getIncomingType() {
        return incomingType;
    }
}

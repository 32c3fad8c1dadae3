package com.strataconf.core.error;

/**
 * Thrown when a document cannot be parsed after property expansion.
 *
 * @since 1.0.0
 */
public class DocumentParseException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String logicalName;
    private final String sourceIdentity;

    public DocumentParseException(String logicalName, String sourceIdentity, Throwable cause) {
        super(String.format("Unable to parse configuration `%s' read from %s: %s",
                logicalName, sourceIdentity, cause.getMessage()), cause);
        this.logicalName = logicalName;
        this.sourceIdentity = sourceIdentity;
    }

    public DocumentParseException(String logicalName, String sourceIdentity, String reason) {
        super(String.format("Unable to parse configuration `%s' read from %s: %s",
                logicalName, sourceIdentity, reason));
        this.logicalName = logicalName;
        this.sourceIdentity = sourceIdentity;
    }

    public String getLogicalName() {
        return logicalName;
    }

    public String getSourceIdentity() {
        return sourceIdentity;
    }
}

package com.rpgtools.prereq.requirement;

/**
 * A requirement tree is malformed: missing bounds, wrong field types, an unknown variant.
 * Raised while building or deserializing a tree, never while evaluating one.
 */
public class InvalidRequirementException extends RuntimeException {
    private final String path;
    private final String reason;

    public InvalidRequirementException(String reason) {
        this(null, reason, null);
    }

    public InvalidRequirementException(String path, String reason) {
        this(path, reason, null);
    }

    public InvalidRequirementException(String path, String reason, Throwable cause) {
        super(path == null || path.isEmpty() ? reason : reason + " at " + path, cause);
        this.path = path;
        this.reason = reason;
    }

    /** Location of the offending node in the stored document, e.g. {@code all[1].trait}; null when unknown. */
    public String path() {
        return path;
    }

    /** The message without the location. */
    public String reason() {
        return reason;
    }

    /** Same problem located at {@code newPath}. An already known path is kept. */
    public InvalidRequirementException atPath(String newPath) {
        if (path != null) return this;
        return new InvalidRequirementException(newPath, reason, this);
    }
}

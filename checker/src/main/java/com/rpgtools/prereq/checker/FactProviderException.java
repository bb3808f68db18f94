package com.rpgtools.prereq.checker;

/**
 * The source behind a {@link FactProvider} failed while answering a query. Not retried by the engine.
 */
public class FactProviderException extends RuntimeException {
    private final String query;

    public FactProviderException(String query, String message) {
        this(query, message, null);
    }

    public FactProviderException(String query, String message, Throwable cause) {
        super("Fact provider failed on " + query + ": " + message, cause);
        this.query = query;
    }

    /** The query that failed, e.g. {@code getTrait(strength)}. */
    public String query() {
        return query;
    }
}

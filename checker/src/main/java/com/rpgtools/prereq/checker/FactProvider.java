package com.rpgtools.prereq.checker;

import com.rpgtools.prereq.requirement.PossessionFilter;

import java.util.OptionalInt;

/**
 * Read-only view of one character's facts, as seen by the checking engine.
 *
 * <p>Implementations sit in front of whatever store holds the character. They must not be mutated while
 * an evaluation is in flight; apart from that the engine may call them from any thread. A data-source
 * failure should be reported as a {@link FactProviderException}; any other runtime exception is wrapped
 * into one by the engine.
 */
public interface FactProvider {

    /** The trait's current value, or empty when the character has no such trait. */
    OptionalInt getTrait(String name);

    /** Does at least one object in {@code collection} satisfy {@code filter}? Unknown collections have none. */
    boolean hasMatch(String collection, PossessionFilter filter);

    /** Number of objects in {@code collection} carrying {@code tag}. */
    int countTagged(String collection, String tag);

    /** Who these facts belong to, for audit records and logs. */
    default String identity() {
        return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
    }
}

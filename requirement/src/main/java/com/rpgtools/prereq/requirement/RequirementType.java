package com.rpgtools.prereq.requirement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The variant tags of a {@link Requirement}. The key is the top-level key used in the stored JSON form.
 */
public enum RequirementType {
    TRAIT("trait", "Trait Check", "Check character trait values"),
    POSSESSION("has", "Has Item/Feature", "Check if character has something"),
    ANY_OF("any", "Any Of", "At least one condition must be met"),
    ALL_OF("all", "All Of", "All conditions must be met"),
    TAG_COUNT("count_tag", "Count with Tag", "Count items with specific tags");

    private final String key;
    private final String label;
    private final String description;

    RequirementType(String key, String label, String description) {
        this.key = key;
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public static Optional<RequirementType> fromKey(String key) {
        for (RequirementType t : values()) {
            if (t.key.equals(key)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Strict lookup used when reading stored results. */
    @JsonCreator
    public static RequirementType ofKey(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown requirement type: " + key));
    }
}

package com.rpgtools.prereq.requirement.prerequisite;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Opaque reference to the game object a prerequisite gates: a type tag plus an identifier.
 * Resolved by the caller; the engine never dereferences it.
 */
public record ContentRef(String type, long id) {
    @JsonCreator
    public ContentRef(@JsonProperty(value = "type", required = true) String type,
                      @JsonProperty(value = "id", required = true) long id) {
        Objects.requireNonNull(type, "type is required");
        if (type.isBlank()) throw new IllegalArgumentException("Content type cannot be empty");
        if (id <= 0) throw new IllegalArgumentException("Content id must be positive, was " + id);
        this.type = type.trim();
        this.id = id;
    }

    @Override
    public String toString() {
        return type + "#" + id;
    }
}

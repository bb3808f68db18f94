package com.rpgtools.prereq.requirement.prerequisite;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rpgtools.prereq.requirement.Requirement;

import java.util.Objects;
import java.util.Optional;

/**
 * A described requirement, optionally attached to the content it gates (a spell, an item, a campaign step).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Prerequisite(String description,
                           @JsonProperty("requirements") Requirement requirement,
                           ContentRef attachedTo) {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    @JsonCreator
    public Prerequisite(@JsonProperty(value = "description", required = true) String description,
                        @JsonProperty(value = "requirements", required = true) Requirement requirement,
                        @JsonProperty("attachedTo") ContentRef attachedTo) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description cannot be empty or whitespace-only.");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        this.description = description;
        this.requirement = Objects.requireNonNull(requirement, "requirements is required");
        this.attachedTo = attachedTo;
    }

    public Prerequisite(String description, Requirement requirement) {
        this(description, requirement, null);
    }

    public Optional<ContentRef> attachment() {
        return Optional.ofNullable(attachedTo);
    }

    public boolean isAttachedTo(ContentRef ref) {
        return ref != null && ref.equals(attachedTo);
    }

    /** Shortened description for listings. */
    @Override
    public String toString() {
        return description.length() > 100 ? description.substring(0, 100) + "..." : description;
    }
}

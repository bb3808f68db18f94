package com.rpgtools.prereq.requirement;

import java.util.Map;

import static com.rpgtools.prereq.requirement.Validation.requireText;

/**
 * At least one object in the named collection matches the id, name and extra attributes given.
 * One of {@code id} or {@code name} is required.
 */
public record Possession(String collectionField, Integer id, String name, Map<String, Object> attributes) implements Requirement {

    public Possession {
        collectionField = requireText(collectionField, RequirementType.POSSESSION, "field");
        if (id == null && name == null) {
            throw new InvalidRequirementException("has requirement must specify either 'id' or 'name'");
        }
        if (name != null) name = requireText(name, RequirementType.POSSESSION, "name");
        if (id != null && id <= 0) {
            throw new InvalidRequirementException("has requirement 'id' must be positive");
        }
        attributes = PossessionFilter.copyAttributes(attributes);
    }

    public Possession(String collectionField, Integer id, String name) {
        this(collectionField, id, name, Map.of());
    }

    /** The match criteria handed to the fact provider. */
    public PossessionFilter filter() {
        return new PossessionFilter(id, name, attributes);
    }

    @Override
    public RequirementType type() {
        return RequirementType.POSSESSION;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitPossession(this);
    }
}

package com.rpgtools.prereq.requirement;

import static com.rpgtools.prereq.requirement.Validation.*;

/** Number of objects in a collection carrying a tag, compared against inclusive bounds. */
public record TagCount(String collectionField, String tag, Integer minimum, Integer maximum) implements Requirement {

    public TagCount {
        collectionField = requireText(collectionField, RequirementType.TAG_COUNT, "model");
        tag = requireText(tag, RequirementType.TAG_COUNT, "tag");
        if (minimum == null && maximum == null) {
            throw new InvalidRequirementException("count_tag requirement must have at least one constraint (minimum or maximum)");
        }
        requireNonNegative(minimum, RequirementType.TAG_COUNT, "minimum");
        requireNonNegative(maximum, RequirementType.TAG_COUNT, "maximum");
        requireOrdered(minimum, maximum, RequirementType.TAG_COUNT, "minimum", "maximum");
    }

    @Override
    public RequirementType type() {
        return RequirementType.TAG_COUNT;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitTagCount(this);
    }
}

package com.rpgtools.prereq.requirement;

import static com.rpgtools.prereq.requirement.Validation.*;

/**
 * A named numeric trait compared against inclusive bounds or an exact value.
 * At least one bound is required; {@code exact} excludes {@code minimum} and {@code maximum}.
 */
public record Trait(String name, Integer minimum, Integer maximum, Integer exact) implements Requirement {

    public Trait {
        name = requireText(name, RequirementType.TRAIT, "name");
        if (minimum == null && maximum == null && exact == null) {
            throw new InvalidRequirementException("trait requirement must have at least one constraint (min, max, or exact)");
        }
        requireNonNegative(minimum, RequirementType.TRAIT, "min");
        requireNonNegative(maximum, RequirementType.TRAIT, "max");
        requireNonNegative(exact, RequirementType.TRAIT, "exact");
        requireOrdered(minimum, maximum, RequirementType.TRAIT, "min", "max");
        if (exact != null && (minimum != null || maximum != null)) {
            throw new InvalidRequirementException("trait requirement 'exact' cannot be used with 'min' or 'max'");
        }
    }

    @Override
    public RequirementType type() {
        return RequirementType.TRAIT;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitTrait(this);
    }
}

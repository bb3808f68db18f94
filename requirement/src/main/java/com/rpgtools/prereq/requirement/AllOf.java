package com.rpgtools.prereq.requirement;

import java.util.List;

/** Logical AND. Children keep their order; an empty list is satisfied. */
public record AllOf(List<Requirement> children) implements Requirement {

    public AllOf {
        children = Children.copy(children, RequirementType.ALL_OF);
    }

    @Override
    public RequirementType type() {
        return RequirementType.ALL_OF;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitAllOf(this);
    }
}

package com.rpgtools.prereq.requirement;

import java.util.List;

/** Logical OR. Children keep their order; an empty list is never satisfied. */
public record AnyOf(List<Requirement> children) implements Requirement {

    public AnyOf {
        children = Children.copy(children, RequirementType.ANY_OF);
    }

    @Override
    public RequirementType type() {
        return RequirementType.ANY_OF;
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.visitAnyOf(this);
    }
}

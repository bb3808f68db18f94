package com.rpgtools.prereq.requirement;

/** Exhaustive dispatch over the {@link Requirement} variants. */
public interface RequirementVisitor<R> {
    R visitTrait(Trait trait);

    R visitPossession(Possession possession);

    R visitTagCount(TagCount tagCount);

    R visitAllOf(AllOf allOf);

    R visitAnyOf(AnyOf anyOf);
}

package com.rpgtools.prereq.requirement;

/**
 * One node of a prerequisite expression tree.
 *
 * <p>Trees are built bottom-up from immutable records, so they are acyclic and can be shared between
 * threads and reused across evaluations. Every variant validates itself on construction and throws
 * {@link InvalidRequirementException} when malformed.
 *
 * <p>Code that must handle every variant goes through {@link #accept(RequirementVisitor)}; adding a
 * variant breaks every visitor at compile time.
 */
public sealed interface Requirement permits Trait, Possession, TagCount, AllOf, AnyOf {

    RequirementType type();

    <R> R accept(RequirementVisitor<R> visitor);
}

package com.rpgtools.prereq.requirement.walker;

import com.rpgtools.prereq.requirement.AllOf;
import com.rpgtools.prereq.requirement.AnyOf;
import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;

/**
 * Callbacks for {@link RequirementWalker}. The walker always invokes the general
 * {@link #onRequirement} hook first, then the hook for the concrete variant.
 *
 * <p>{@code path} uses the stored-document notation ({@code all[0].trait}); {@code depth} is 1 at the root.
 */
public interface RequirementNodeVisitor {
    default void onRequirement(String path, int depth, Requirement requirement) {}

    default void onTrait(String path, Trait trait) {}

    default void onPossession(String path, Possession possession) {}

    default void onTagCount(String path, TagCount tagCount) {}

    default void onAllOf(String path, AllOf allOf) {}

    default void onAnyOf(String path, AnyOf anyOf) {}
}

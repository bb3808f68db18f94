package com.rpgtools.prereq.requirement.walker;

import com.rpgtools.prereq.requirement.AllOf;
import com.rpgtools.prereq.requirement.AnyOf;
import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.RequirementVisitor;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;

import java.util.List;
import java.util.Objects;

/**
 * Depth-first, pre-order walk over a requirement tree, children left to right.
 */
public final class RequirementWalker {

    private RequirementWalker() {
    }

    public static void walk(Requirement requirement, RequirementNodeVisitor visitor) {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(visitor, "visitor");
        walk(requirement, visitor, "", 1);
    }

    /** Number of nodes on the longest root-to-leaf path. */
    public static int depth(Requirement requirement) {
        int[] max = {0};
        walk(requirement, new RequirementNodeVisitor() {
            @Override
            public void onRequirement(String path, int depth, Requirement r) {
                max[0] = Math.max(max[0], depth);
            }
        });
        return max[0];
    }

    /** Total number of nodes in the tree. */
    public static int size(Requirement requirement) {
        int[] count = {0};
        walk(requirement, new RequirementNodeVisitor() {
            @Override
            public void onRequirement(String path, int depth, Requirement r) {
                count[0]++;
            }
        });
        return count[0];
    }

    private static void walk(Requirement requirement, RequirementNodeVisitor visitor, String parentPath, int depth) {
        String path = parentPath.isEmpty() ? requirement.type().key() : parentPath + "." + requirement.type().key();
        visitor.onRequirement(path, depth, requirement);
        requirement.accept(new RequirementVisitor<Void>() {
            @Override
            public Void visitTrait(Trait trait) {
                visitor.onTrait(path, trait);
                return null;
            }

            @Override
            public Void visitPossession(Possession possession) {
                visitor.onPossession(path, possession);
                return null;
            }

            @Override
            public Void visitTagCount(TagCount tagCount) {
                visitor.onTagCount(path, tagCount);
                return null;
            }

            @Override
            public Void visitAllOf(AllOf allOf) {
                visitor.onAllOf(path, allOf);
                children(allOf.children());
                return null;
            }

            @Override
            public Void visitAnyOf(AnyOf anyOf) {
                visitor.onAnyOf(path, anyOf);
                children(anyOf.children());
                return null;
            }

            private void children(List<Requirement> children) {
                for (int i = 0; i < children.size(); i++) {
                    walk(children.get(i), visitor, path + "[" + i + "]", depth + 1);
                }
            }
        });
    }
}

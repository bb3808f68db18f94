package com.rpgtools.prereq.requirement.walker;

import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The facts a tree will ask for: trait names, collections searched for possessions, and
 * the collection and tag pairs that get counted. Lets a fact provider prefetch in one round trip.
 * Sets keep first-seen order.
 */
public record ReferencedFacts(Set<String> traits, Set<String> possessionCollections, Set<TagRef> taggedCollections) {

    public ReferencedFacts {
        traits = Collections.unmodifiableSet(new LinkedHashSet<>(traits));
        possessionCollections = Collections.unmodifiableSet(new LinkedHashSet<>(possessionCollections));
        taggedCollections = Collections.unmodifiableSet(new LinkedHashSet<>(taggedCollections));
    }

    public static ReferencedFacts of(Requirement requirement) {
        Set<String> traits = new LinkedHashSet<>();
        Set<String> collections = new LinkedHashSet<>();
        Set<TagRef> tagged = new LinkedHashSet<>();
        RequirementWalker.walk(requirement, new RequirementNodeVisitor() {
            @Override
            public void onTrait(String path, Trait trait) {
                traits.add(trait.name());
            }

            @Override
            public void onPossession(String path, Possession possession) {
                collections.add(possession.collectionField());
            }

            @Override
            public void onTagCount(String path, TagCount tagCount) {
                tagged.add(new TagRef(tagCount.collectionField(), tagCount.tag()));
            }
        });
        return new ReferencedFacts(traits, collections, tagged);
    }
}

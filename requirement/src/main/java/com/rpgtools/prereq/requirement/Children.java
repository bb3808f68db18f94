package com.rpgtools.prereq.requirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Children {

    private Children() {
    }

    static List<Requirement> copy(List<Requirement> children, RequirementType type) {
        if (children == null) {
            throw new InvalidRequirementException(type.key() + " requirement must be a list");
        }
        List<Requirement> copy = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Requirement child = children.get(i);
            if (child == null) {
                throw new InvalidRequirementException(type.key() + " requirement child " + i + " must not be null");
            }
            copy.add(child);
        }
        return Collections.unmodifiableList(copy);
    }
}

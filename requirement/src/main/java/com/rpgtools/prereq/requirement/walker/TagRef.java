package com.rpgtools.prereq.requirement.walker;

import java.util.Objects;

/** A tag counted within a collection, as referenced by a {@code count_tag} requirement. */
public record TagRef(String collection, String tag) {
    public TagRef {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(tag, "tag");
    }

    @Override
    public String toString() {
        return collection + "[" + tag + "]";
    }
}

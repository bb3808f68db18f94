package com.rpgtools.prereq.checker.facts;

import com.rpgtools.prereq.checker.FactProvider;
import com.rpgtools.prereq.requirement.PossessionFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable character snapshot: a map of traits plus named collections of objects, each object an
 * attribute map. Built once and then only read, so it can be shared by concurrent evaluations.
 *
 * <p>An object carries a tag when its {@code tag}, {@code category} or {@code type} attribute equals the
 * tag, or its {@code tags} attribute is a collection containing it.
 */
public final class InMemoryFactProvider implements FactProvider {

    static final List<String> TAG_ATTRIBUTES = List.of("tag", "category", "type");
    static final String TAGS_ATTRIBUTE = "tags";

    private final String identity;
    private final Map<String, Integer> traits;
    private final Map<String, List<Map<String, Object>>> collections;

    private InMemoryFactProvider(Builder builder) {
        this.identity = builder.identity;
        this.traits = Collections.unmodifiableMap(new LinkedHashMap<>(builder.traits));
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        builder.collections.forEach((name, objects) -> copy.put(name, List.copyOf(objects)));
        this.collections = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String identity) {
        return new Builder(identity);
    }

    @Override
    public OptionalInt getTrait(String name) {
        Integer value = traits.get(name);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public boolean hasMatch(String collection, PossessionFilter filter) {
        Objects.requireNonNull(filter, "filter");
        for (Map<String, Object> object : objects(collection)) {
            if (filter.matches(object)) return true;
        }
        return false;
    }

    @Override
    public int countTagged(String collection, String tag) {
        int n = 0;
        for (Map<String, Object> object : objects(collection)) {
            if (carriesTag(object, tag)) n++;
        }
        return n;
    }

    @Override
    public String identity() {
        return identity;
    }

    public List<Map<String, Object>> objects(String collection) {
        return collections.getOrDefault(collection, List.of());
    }

    static boolean carriesTag(Map<String, Object> object, String tag) {
        for (String attribute : TAG_ATTRIBUTES) {
            if (tag.equals(object.get(attribute))) return true;
        }
        return object.get(TAGS_ATTRIBUTE) instanceof Collection<?> tags && tags.contains(tag);
    }

    @Override
    public String toString() {
        return "InMemoryFactProvider[" + identity + ", traits=" + traits.keySet() + ", collections=" + collections.keySet() + "]";
    }

    public static final class Builder {
        private final String identity;
        private final Map<String, Integer> traits = new LinkedHashMap<>();
        private final Map<String, List<Map<String, Object>>> collections = new LinkedHashMap<>();

        private Builder(String identity) {
            this.identity = Objects.requireNonNull(identity, "identity");
        }

        public Builder trait(String name, int value) {
            traits.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder traits(Map<String, Integer> values) {
            values.forEach(this::trait);
            return this;
        }

        /** Adds one object; the attribute map is copied. */
        public Builder object(String collection, Map<String, ?> attributes) {
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(attributes, "attributes");
            collections.computeIfAbsent(collection, k -> new ArrayList<>())
                    .add(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
            return this;
        }

        /** Declares a collection even when it stays empty. */
        public Builder collection(String collection) {
            collections.computeIfAbsent(Objects.requireNonNull(collection, "collection"), k -> new ArrayList<>());
            return this;
        }

        public InMemoryFactProvider build() {
            return new InMemoryFactProvider(this);
        }
    }
}

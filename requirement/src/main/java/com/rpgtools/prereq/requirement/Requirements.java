package com.rpgtools.prereq.requirement;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builder helpers. Each returns a validated node or throws {@link InvalidRequirementException}.
 *
 * <pre>{@code
 * Requirement mage = allOf(
 *         traitMin("arete", 3),
 *         hasNamed("foci", "Crystal Orb"),
 *         countTagAtLeast("spheres", "elemental", 2));
 * }</pre>
 */
public final class Requirements {

    private Requirements() {
    }

    public static Trait trait(String name, Integer minimum, Integer maximum, Integer exact) {
        return new Trait(name, minimum, maximum, exact);
    }

    public static Trait traitMin(String name, int minimum) {
        return new Trait(name, minimum, null, null);
    }

    public static Trait traitMax(String name, int maximum) {
        return new Trait(name, null, maximum, null);
    }

    public static Trait traitRange(String name, int minimum, int maximum) {
        return new Trait(name, minimum, maximum, null);
    }

    public static Trait traitExact(String name, int exact) {
        return new Trait(name, null, null, exact);
    }

    public static Possession has(String field, Integer id, String name, Map<String, Object> attributes) {
        return new Possession(field, id, name, attributes);
    }

    public static Possession hasNamed(String field, String name) {
        return new Possession(field, null, name);
    }

    public static Possession hasId(String field, int id) {
        return new Possession(field, id, null);
    }

    public static TagCount countTag(String collection, String tag, Integer minimum, Integer maximum) {
        return new TagCount(collection, tag, minimum, maximum);
    }

    public static TagCount countTagAtLeast(String collection, String tag, int minimum) {
        return new TagCount(collection, tag, minimum, null);
    }

    public static AllOf allOf(Requirement... children) {
        return new AllOf(asList(children, RequirementType.ALL_OF));
    }

    public static AllOf allOf(List<Requirement> children) {
        return new AllOf(children);
    }

    public static AnyOf anyOf(Requirement... children) {
        return new AnyOf(asList(children, RequirementType.ANY_OF));
    }

    public static AnyOf anyOf(List<Requirement> children) {
        return new AnyOf(children);
    }

    private static List<Requirement> asList(Requirement[] children, RequirementType type) {
        if (children == null) {
            throw new InvalidRequirementException(type.key() + " requirement must be a list");
        }
        return Arrays.asList(children);
    }
}

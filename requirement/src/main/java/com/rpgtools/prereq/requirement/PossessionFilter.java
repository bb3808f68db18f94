package com.rpgtools.prereq.requirement;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Criteria an object in a collection must meet to satisfy a {@link Possession}.
 * Null {@code id} or {@code name} means "any".
 */
public record PossessionFilter(Integer id, String name, Map<String, Object> attributes) {

    static final Set<String> RESERVED = Set.of("field", "id", "name");

    public PossessionFilter {
        attributes = copyAttributes(attributes);
    }

    /** All criteria in stored-document order: {@code id}, {@code name}, then the extra attributes. */
    public Map<String, Object> criteria() {
        Map<String, Object> all = new LinkedHashMap<>();
        if (id != null) all.put("id", id);
        if (name != null) all.put("name", name);
        all.putAll(attributes);
        return Collections.unmodifiableMap(all);
    }

    /** Does an object, given as its attribute map, satisfy every criterion? Numbers compare by value. */
    public boolean matches(Map<String, ?> object) {
        Objects.requireNonNull(object, "object");
        for (Map.Entry<String, Object> c : criteria().entrySet()) {
            if (!sameValue(c.getValue(), object.get(c.getKey()))) return false;
        }
        return true;
    }

    /** e.g. {@code id=123, name=Magic Sword} */
    public String describe() {
        return criteria().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    static boolean sameValue(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            if (!isFinite(e) || !isFinite(a)) return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
            return new BigDecimal(e.toString()).compareTo(new BigDecimal(a.toString())) == 0;
        }
        return Objects.equals(expected, actual);
    }

    /** NaN and the infinities have no decimal form. */
    private static boolean isFinite(Number n) {
        if (n instanceof Double d) return Double.isFinite(d);
        if (n instanceof Float f) return Float.isFinite(f);
        return true;
    }

    static Map<String, Object> copyAttributes(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((k, v) -> {
            if (k == null || k.isBlank()) {
                throw new InvalidRequirementException("has requirement attribute names cannot be empty");
            }
            if (RESERVED.contains(k)) {
                throw new InvalidRequirementException("has requirement attribute '" + k + "' is reserved");
            }
            if (v == null) {
                throw new InvalidRequirementException("has requirement attribute '" + k + "' must not be null");
            }
            copy.put(k, v);
        });
        return Collections.unmodifiableMap(copy);
    }
}

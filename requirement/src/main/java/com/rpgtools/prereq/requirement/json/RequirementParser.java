package com.rpgtools.prereq.requirement.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpgtools.prereq.requirement.AllOf;
import com.rpgtools.prereq.requirement.AnyOf;
import com.rpgtools.prereq.requirement.InvalidRequirementException;
import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.RequirementType;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the stored JSON form into a {@link Requirement} tree.
 *
 * <p>Every rejection is an {@link InvalidRequirementException} carrying the path of the offending node,
 * e.g. {@code all[1].trait}. Thread-safe.
 */
public final class RequirementParser {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private static final Set<String> TRAIT_FIELDS = Set.of("name", "min", "max", "exact");
    private static final Set<String> COUNT_TAG_FIELDS = Set.of("model", "tag", "minimum", "maximum");

    private static final ObjectMapper VALUES = new ObjectMapper();

    private final int maxDepth;

    public RequirementParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public RequirementParser(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, was " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Requirement parse(JsonNode node) {
        return parse(node, "", 1);
    }

    private Requirement parse(JsonNode node, String path, int depth) {
        if (depth > maxDepth) {
            throw new InvalidRequirementException(path, "requirement nesting exceeds maximum depth " + maxDepth);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidRequirementException(path, "requirement must be a JSON object, not null");
        }
        if (!node.isObject()) {
            throw new InvalidRequirementException(path, "requirement must be a JSON object, got " + kind(node));
        }
        if (node.size() == 0) {
            throw new InvalidRequirementException(path, "requirement cannot be empty");
        }
        if (node.size() != 1) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            throw new InvalidRequirementException(path,
                    "requirement must contain exactly one requirement type, got " + keys.size() + ": " + keys);
        }
        String key = node.fieldNames().next();
        RequirementType type = RequirementType.fromKey(key)
                .orElseThrow(() -> new InvalidRequirementException(path, "unknown requirement type: " + key));
        String here = path.isEmpty() ? key : path + "." + key;
        JsonNode body = node.get(key);
        try {
            return switch (type) {
                case TRAIT -> trait(body);
                case POSSESSION -> possession(body);
                case TAG_COUNT -> tagCount(body);
                case ALL_OF -> new AllOf(children(body, type, here, depth));
                case ANY_OF -> new AnyOf(children(body, type, here, depth));
            };
        } catch (InvalidRequirementException e) {
            throw e.atPath(here);
        }
    }

    private Trait trait(JsonNode body) {
        requireObject(body, RequirementType.TRAIT);
        rejectUnknownFields(body, RequirementType.TRAIT, TRAIT_FIELDS);
        return new Trait(
                requiredText(body, RequirementType.TRAIT, "name"),
                optionalInt(body, RequirementType.TRAIT, "min"),
                optionalInt(body, RequirementType.TRAIT, "max"),
                optionalInt(body, RequirementType.TRAIT, "exact"));
    }

    private Possession possession(JsonNode body) {
        requireObject(body, RequirementType.POSSESSION);
        String field = requiredText(body, RequirementType.POSSESSION, "field");
        Integer id = optionalInt(body, RequirementType.POSSESSION, "id");
        String name = optionalText(body, RequirementType.POSSESSION, "name");
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String k = f.getKey();
            if (k.equals("field") || k.equals("id") || k.equals("name")) continue;
            if (f.getValue().isNull()) {
                throw new InvalidRequirementException("has requirement attribute '" + k + "' must not be null");
            }
            attributes.put(k, VALUES.convertValue(f.getValue(), Object.class));
        }
        return new Possession(field, id, name, attributes);
    }

    private TagCount tagCount(JsonNode body) {
        requireObject(body, RequirementType.TAG_COUNT);
        rejectUnknownFields(body, RequirementType.TAG_COUNT, COUNT_TAG_FIELDS);
        return new TagCount(
                requiredText(body, RequirementType.TAG_COUNT, "model"),
                requiredText(body, RequirementType.TAG_COUNT, "tag"),
                optionalInt(body, RequirementType.TAG_COUNT, "minimum"),
                optionalInt(body, RequirementType.TAG_COUNT, "maximum"));
    }

    private List<Requirement> children(JsonNode body, RequirementType type, String path, int depth) {
        if (body == null || !body.isArray()) {
            throw new InvalidRequirementException(type.key() + " requirement must be a list");
        }
        List<Requirement> result = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            result.add(parse(body.get(i), path + "[" + i + "]", depth + 1));
        }
        return result;
    }

    private static void requireObject(JsonNode body, RequirementType type) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequirementException(type.key() + " requirement must be a dictionary");
        }
    }

    private static void rejectUnknownFields(JsonNode body, RequirementType type, Set<String> allowed) {
        Iterator<String> names = body.fieldNames();
        while (names.hasNext()) {
            String n = names.next();
            if (!allowed.contains(n)) {
                throw new InvalidRequirementException(type.key() + " requirement has unknown field '" + n + "'");
            }
        }
    }

    private static String requiredText(JsonNode body, RequirementType type, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull()) {
            throw new InvalidRequirementException(type.key() + " requirement missing required '" + field + "' field");
        }
        if (!v.isTextual()) {
            throw new InvalidRequirementException(type.key() + " requirement '" + field + "' must be a string");
        }
        return v.textValue();
    }

    private static String optionalText(JsonNode body, RequirementType type, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) {
            throw new InvalidRequirementException(type.key() + " requirement '" + field + "' must be a string");
        }
        return v.textValue();
    }

    private static Integer optionalInt(JsonNode body, RequirementType type, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new InvalidRequirementException(type.key() + " requirement '" + field + "' must be an integer");
        }
        return v.intValue();
    }

    private static String kind(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }
}

package com.rpgtools.prereq.requirement.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpgtools.prereq.common.errorsor.ErrorsOr;
import com.rpgtools.prereq.requirement.InvalidRequirementException;
import com.rpgtools.prereq.requirement.Requirement;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Entry points for the stored JSON form of a requirement tree.
 *
 * <pre>
 * {"trait": {"name": "strength", "min": 3}}
 * {"has": {"field": "weapons", "name": "Magic Sword"}}
 * {"all": [ ... ]}
 * {"any": [ ... ]}
 * {"count_tag": {"model": "spheres", "tag": "elemental", "minimum": 2}}
 * </pre>
 */
public interface RequirementJson {

    /* ------------ Cached Jackson instances (thread-safe) ------------ */
    ObjectMapper JSON = base(new ObjectMapper());
    RequirementParser PARSER = new RequirementParser();

    /* ---------------- Reading ---------------- */

    static Requirement fromJson(String json) {
        return PARSER.parse(readTree(json));
    }

    static Requirement fromJson(InputStream in) throws IOException {
        JsonNode tree;
        try {
            tree = JSON.readTree(in);
        } catch (JsonProcessingException e) {
            throw new InvalidRequirementException(null, "requirement is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return PARSER.parse(tree);
    }

    static Requirement fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static Requirement fromTree(JsonNode tree) {
        return PARSER.parse(tree);
    }

    /** For storage layers that keep the document as a generic map (a JSON column, a document store). */
    static Requirement fromMap(Map<String, ?> map) {
        if (map == null) throw new InvalidRequirementException("requirement must be a JSON object, not null");
        return PARSER.parse(JSON.valueToTree(map));
    }

    /** Non-throwing variant of {@link #fromJson(String)}. */
    static ErrorsOr<Requirement> validate(String json) {
        try {
            return ErrorsOr.lift(fromJson(json));
        } catch (InvalidRequirementException e) {
            return ErrorsOr.error(e.getMessage());
        }
    }

    /* ---------------- Writing ---------------- */

    static JsonNode toTree(Requirement requirement) {
        return RequirementWriter.INSTANCE.write(requirement);
    }

    static String toJson(Requirement requirement) {
        try {
            return JSON.writeValueAsString(toTree(requirement));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write requirement tree as JSON", e);
        }
    }

    static Map<String, Object> toMap(Requirement requirement) {
        return JSON.convertValue(toTree(requirement), new TypeReference<Map<String, Object>>() {
        });
    }

    /* --------------- Jackson setup --------------- */

    static JsonNode readTree(String json) {
        if (json == null) throw new InvalidRequirementException("requirement must be a JSON object, not null");
        try {
            return JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidRequirementException(null, "requirement is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static ObjectMapper base(ObjectMapper om) {
        return om
                // Keep property names case-sensitive
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)

                // Nice for human-authored JSON files
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }
}

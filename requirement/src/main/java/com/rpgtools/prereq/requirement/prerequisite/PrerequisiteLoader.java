package com.rpgtools.prereq.requirement.prerequisite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.rpgtools.prereq.requirement.InvalidRequirementException;
import com.rpgtools.prereq.requirement.json.RequirementJacksonModule;
import com.rpgtools.prereq.requirement.json.RequirementJson;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads {@link Prerequisite} documents:
 * <pre>
 * {"description": "Must have Arete 3", "requirements": {"trait": {"name": "arete", "min": 3}},
 *  "attachedTo": {"type": "spell", "id": 7}}
 * </pre>
 * A malformed requirement tree is rethrown as the underlying {@link InvalidRequirementException};
 * other problems stay Jackson exceptions.
 */
public interface PrerequisiteLoader {

    ObjectMapper JSON = RequirementJson.base(new ObjectMapper())
            .registerModule(new RequirementJacksonModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    ObjectReader READER = JSON.readerFor(Prerequisite.class);
    ObjectReader LIST_READER = JSON.readerFor(new TypeReference<List<Prerequisite>>() {
    });

    static Prerequisite fromJson(InputStream in) throws IOException {
        try {
            return READER.readValue(in);
        } catch (JsonProcessingException e) {
            throw unwrap(e);
        }
    }

    static Prerequisite fromJson(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        }
    }

    static Prerequisite fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static List<Prerequisite> listFromJson(InputStream in) throws IOException {
        try {
            return LIST_READER.readValue(in);
        } catch (JsonProcessingException e) {
            throw unwrap(e);
        }
    }

    static String toJson(Prerequisite prerequisite) throws JsonProcessingException {
        return JSON.writeValueAsString(prerequisite);
    }

    private static JsonProcessingException unwrap(JsonProcessingException e) {
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof InvalidRequirementException ire) throw ire;
        }
        return e;
    }
}

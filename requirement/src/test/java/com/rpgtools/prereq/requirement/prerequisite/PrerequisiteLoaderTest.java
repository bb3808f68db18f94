package com.rpgtools.prereq.requirement.prerequisite;

import com.rpgtools.prereq.requirement.InvalidRequirementException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static com.rpgtools.prereq.requirement.RequirementTestFixture.resourceStream;
import static com.rpgtools.prereq.requirement.Requirements.*;
import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteLoaderTest {

    @Test
    void loadsAnAttachedPrerequisite() throws IOException {
        try (var in = resourceStream("prerequisites/spell-prerequisite.json")) {
            Prerequisite p = PrerequisiteLoader.fromJson(in);
            assertEquals(new Prerequisite(
                    "Forces 3 and a focus to learn Lightning Bolt",
                    allOf(traitMin("forces", 3), hasNamed("foci", "Copper Wand")),
                    new ContentRef("spell", 42)), p);
            assertTrue(p.isAttachedTo(new ContentRef("spell", 42)));
        }
    }

    @Test
    void loadsACatalog() throws IOException {
        try (var in = resourceStream("prerequisites/catalog.json")) {
            List<Prerequisite> all = PrerequisiteLoader.listFromJson(in);
            assertEquals(2, all.size());
            assertEquals(Optional.empty(), all.get(0).attachment());
            assertEquals(countTagAtLeast("spheres", "elemental", 2), all.get(1).requirement());
            assertEquals("merit#9", all.get(1).attachedTo().toString());
        }
    }

    @Test
    void malformedRequirementSurfacesAsInvalidRequirement() throws IOException {
        try (var in = resourceStream("prerequisites/bad-requirement.json")) {
            var ex = assertThrows(InvalidRequirementException.class, () -> PrerequisiteLoader.fromJson(in));
            assertEquals("all[0].trait", ex.path());
            assertEquals("trait requirement 'min' must be non-negative", ex.reason());
        }
    }

    @Test
    void blankDescriptionIsAJacksonError() throws IOException {
        try (var in = resourceStream("prerequisites/bad-description.json")) {
            var ex = assertThrows(IOException.class, () -> PrerequisiteLoader.fromJson(in));
            assertTrue(ex.getMessage().contains("Description cannot be empty"));
        }
    }

    @Test
    void writesAndReadsBack() throws IOException {
        Prerequisite p = new Prerequisite("Paradox under control", traitMax("paradox", 3));
        String json = PrerequisiteLoader.toJson(p);
        assertEquals("{\"description\":\"Paradox under control\",\"requirements\":{\"trait\":{\"name\":\"paradox\",\"max\":3}}}", json);
        assertEquals(p, PrerequisiteLoader.fromJson(json));
    }

    @Test
    void constructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Prerequisite("x".repeat(501), traitMin("a", 1)));
        assertThrows(NullPointerException.class, () -> new Prerequisite("ok", null));
        assertThrows(IllegalArgumentException.class, () -> new ContentRef("spell", 0));
        assertThrows(IllegalArgumentException.class, () -> new ContentRef(" ", 1));
    }

    @Test
    void longDescriptionsAreShortenedInToString() {
        Prerequisite p = new Prerequisite("y".repeat(150), traitMin("a", 1));
        assertEquals("y".repeat(100) + "...", p.toString());
    }
}

package com.rpgtools.prereq.requirement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.rpgtools.prereq.requirement.Requirements.*;
import static org.junit.jupiter.api.Assertions.*;

class RequirementsTest {

    @Nested
    @DisplayName("trait")
    class TraitBuilders {
        @Test
        void shorthandsSetTheRightBound() {
            assertEquals(new Trait("strength", 3, null, null), traitMin("strength", 3));
            assertEquals(new Trait("paradox", null, 5, null), traitMax("paradox", 5));
            assertEquals(new Trait("dexterity", 2, 5, null), traitRange("dexterity", 2, 5));
            assertEquals(new Trait("arete", null, null, 3), traitExact("arete", 3));
        }

        @Test
        void nameIsTrimmed() {
            assertEquals("strength", traitMin("  strength ", 1).name());
        }

        @Test
        void noBoundIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class, () -> trait("strength", null, null, null));
            assertTrue(ex.getMessage().contains("at least one constraint"));
            assertNull(ex.path());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        void blankNameIsRejected(String name) {
            assertThrows(InvalidRequirementException.class, () -> traitMin(name, 1));
        }

        @Test
        void negativeBoundIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class, () -> traitMin("strength", -1));
            assertEquals("trait requirement 'min' must be non-negative", ex.getMessage());
        }

        @Test
        void maxBelowMinIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class, () -> traitRange("strength", 4, 2));
            assertEquals("trait requirement 'max' (2) cannot be less than 'min' (4)", ex.getMessage());
        }

        @Test
        void exactCannotBeCombinedWithRange() {
            assertThrows(InvalidRequirementException.class, () -> trait("arete", 1, null, 3));
            assertThrows(InvalidRequirementException.class, () -> trait("arete", null, 5, 3));
        }

        @Test
        void zeroBoundsAreAllowed() {
            assertEquals(0, traitExact("paradox", 0).exact());
        }
    }

    @Nested
    @DisplayName("has")
    class PossessionBuilders {
        @Test
        void byNameOrId() {
            assertEquals("Magic Sword", hasNamed("weapons", "Magic Sword").name());
            assertEquals(123, hasId("weapons", 123).id());
        }

        @Test
        void needsIdOrName() {
            var ex = assertThrows(InvalidRequirementException.class,
                    () -> has("weapons", null, null, Map.of("level", 2)));
            assertTrue(ex.getMessage().contains("either 'id' or 'name'"));
        }

        @Test
        void emptyFieldIsRejected() {
            assertThrows(InvalidRequirementException.class, () -> hasNamed(" ", "Magic Sword"));
            assertThrows(InvalidRequirementException.class, () -> hasNamed(null, "Magic Sword"));
        }

        @Test
        void blankNameIsRejectedAndNamesAreTrimmed() {
            var ex = assertThrows(InvalidRequirementException.class, () -> hasNamed("weapons", "  "));
            assertEquals("has requirement 'name' cannot be empty", ex.getMessage());
            assertEquals("Magic Sword", hasNamed("weapons", " Magic Sword ").name());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -4})
        void idMustBePositive(int id) {
            assertThrows(InvalidRequirementException.class, () -> hasId("weapons", id));
        }

        @Test
        void attributesKeepInsertionOrderAndAreImmutable() {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("level", 2);
            attrs.put("attuned", true);
            Possession p = has("weapons", null, "Magic Sword", attrs);
            attrs.put("later", "ignored");

            assertEquals(List.of("level", "attuned"), new ArrayList<>(p.attributes().keySet()));
            assertThrows(UnsupportedOperationException.class, () -> p.attributes().put("x", 1));
        }

        @Test
        void reservedOrNullAttributesAreRejected() {
            assertThrows(InvalidRequirementException.class,
                    () -> has("weapons", null, "Sword", Map.of("field", "armor")));
            Map<String, Object> withNull = new LinkedHashMap<>();
            withNull.put("level", null);
            assertThrows(InvalidRequirementException.class, () -> has("weapons", null, "Sword", withNull));
        }

        @Test
        void filterCarriesEveryCriterion() {
            Possession p = has("weapons", 123, "Magic Sword", Map.of("level", 2));
            assertEquals(Map.of("id", 123, "name", "Magic Sword", "level", 2), p.filter().criteria());
            assertEquals("id=123, name=Magic Sword, level=2", p.filter().describe());
        }
    }

    @Nested
    @DisplayName("count_tag")
    class TagCountBuilders {
        @Test
        void atLeast() {
            assertEquals(new TagCount("spheres", "elemental", 2, null), countTagAtLeast("spheres", "elemental", 2));
        }

        @Test
        void needsABound() {
            assertThrows(InvalidRequirementException.class, () -> countTag("spheres", "elemental", null, null));
        }

        @Test
        void needsTagAndCollection() {
            assertThrows(InvalidRequirementException.class, () -> countTagAtLeast("spheres", "", 1));
            assertThrows(InvalidRequirementException.class, () -> countTagAtLeast("", "elemental", 1));
        }

        @Test
        void maximumBelowMinimumIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class, () -> countTag("charms", "martial_arts", 5, 1));
            assertEquals("count_tag requirement 'maximum' (1) cannot be less than 'minimum' (5)", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("allOf / anyOf")
    class Composites {
        @Test
        void varargsAndListFormsAreEquivalent() {
            Requirement a = traitMin("strength", 3);
            Requirement b = hasNamed("foci", "Crystal Orb");
            assertEquals(allOf(a, b), allOf(List.of(a, b)));
            assertEquals(anyOf(a, b), anyOf(List.of(a, b)));
        }

        @Test
        void childOrderIsPreserved() {
            Requirement a = traitMin("strength", 3);
            Requirement b = traitMin("dexterity", 3);
            assertEquals(List.of(b, a), anyOf(b, a).children());
        }

        @Test
        void childListIsCopied() {
            List<Requirement> children = new ArrayList<>(List.of(traitMin("strength", 3)));
            AllOf all = allOf(children);
            children.add(traitMin("dexterity", 1));
            assertEquals(1, all.children().size());
            assertThrows(UnsupportedOperationException.class, () -> all.children().add(traitMin("wits", 1)));
        }

        @Test
        void emptySequencesAreAllowed() {
            assertTrue(allOf().children().isEmpty());
            assertTrue(anyOf(List.of()).children().isEmpty());
        }

        @Test
        void nonSequenceIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class, () -> allOf((List<Requirement>) null));
            assertEquals("all requirement must be a list", ex.getMessage());
            assertThrows(InvalidRequirementException.class, () -> anyOf((Requirement[]) null));
        }

        @Test
        void nullChildIsRejected() {
            var ex = assertThrows(InvalidRequirementException.class,
                    () -> anyOf(Arrays.asList(traitMin("strength", 1), null)));
            assertEquals("any requirement child 1 must not be null", ex.getMessage());
        }

        @Test
        void typeTagsMatchTheStoredKeys() {
            assertEquals("all", allOf().type().key());
            assertEquals("any", anyOf().type().key());
            assertEquals("trait", traitMin("strength", 1).type().key());
            assertEquals("has", hasId("weapons", 1).type().key());
            assertEquals("count_tag", countTagAtLeast("spheres", "elemental", 1).type().key());
        }
    }
}

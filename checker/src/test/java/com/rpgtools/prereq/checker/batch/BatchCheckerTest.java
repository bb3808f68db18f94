package com.rpgtools.prereq.checker.batch;

import com.rpgtools.prereq.checker.CheckResult;
import com.rpgtools.prereq.checker.CheckerConfig;
import com.rpgtools.prereq.checker.Characters;
import com.rpgtools.prereq.checker.FactProvider;
import com.rpgtools.prereq.checker.FactProviderException;
import com.rpgtools.prereq.checker.RequirementChecker;
import com.rpgtools.prereq.common.async.ExecutorServiceFactory;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.json.RequirementParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.rpgtools.prereq.requirement.Requirements.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchCheckerTest {

    private final RequirementChecker checker = new RequirementChecker();

    private static Map<String, Requirement> spells() {
        Map<String, Requirement> spells = new LinkedHashMap<>();
        spells.put("fireball", allOf(traitMin("arete", 3), countTagAtLeast("spheres", "elemental", 2)));
        spells.put("earthquake", traitMin("arete", 5));
        spells.put("blink", anyOf(traitMin("dexterity", 4), hasNamed("foci", "Copper Wand")));
        return spells;
    }

    @Nested
    class Inline {
        private final BatchChecker batch = new BatchChecker(checker);

        @Test
        void evaluateManyEqualsEvaluatingEachEntry() {
            FactProvider mage = Characters.mage();
            BatchResult<String> result = batch.evaluateMany(spells(), mage);

            assertEquals(List.of("fireball", "earthquake", "blink"), List.copyOf(result.results().keySet()));
            spells().forEach((k, r) -> assertEquals(checker.evaluate(r, mage), result.results().get(k)));
            assertEquals(List.of("fireball", "blink"), result.passedKeys());
            assertFalse(result.hasErrors());
            assertFalse(result.allPassed());
        }

        @Test
        void emptyBatch() {
            BatchResult<String> result = batch.evaluateMany(Map.of(), Characters.mage());
            assertEquals(0, result.size());
            assertTrue(result.allPassed());
        }

        @Test
        void evaluateAcrossIsKeyedByPosition() {
            BatchResult<Integer> result = batch.evaluateAcross(traitMin("strength", 3),
                    List.of(Characters.mage(), Characters.brute()));

            assertEquals(List.of(0, 1), List.copyOf(result.results().keySet()));
            assertFalse(result.result(0).orElseThrow().passed());
            assertTrue(result.result(1).orElseThrow().passed());
        }

        @Test
        void failingProviderOnlyFailsItsOwnEntry() {
            FactProvider broken = mock(FactProvider.class);
            when(broken.getTrait(anyString())).thenThrow(new IllegalStateException("db down"));

            BatchResult<Integer> result = batch.evaluateAcross(traitMin("strength", 3),
                    List.of(Characters.brute(), broken, Characters.mage()));

            assertEquals(List.of(0, 2), List.copyOf(result.results().keySet()));
            BatchError error = result.errors().get(1);
            assertEquals(1, error.position());
            assertTrue(error.isFactProviderFailure());
            assertEquals("FactProviderException", error.errorType());
            assertInstanceOf(FactProviderException.class, error.cause());
            assertEquals(3, result.size());
        }

        @Test
        void malformedStoredDocumentIsReportedPerKey() {
            Map<String, String> documents = new LinkedHashMap<>();
            documents.put("ok", "{\"trait\": {\"name\": \"arete\", \"min\": 3}}");
            documents.put("broken", "{\"all\": [{\"trait\": {\"name\": \"arete\"}}]}");
            documents.put("garbage", "{not json");

            BatchResult<String> result = batch.evaluateManyJson(documents, Characters.mage());

            assertTrue(result.result("ok").orElseThrow().passed());
            assertEquals(List.of("broken", "garbage"), List.copyOf(result.errors().keySet()));
            BatchError broken = result.errors().get("broken");
            assertTrue(broken.isInvalidRequirement());
            assertTrue(broken.message().endsWith("at all[0].trait"), broken.message());
            assertTrue(result.errors().get("garbage").isInvalidRequirement());
        }
    }

    @Nested
    class Pooled {
        private final ExecutorService pool = Executors.newFixedThreadPool(4);

        @AfterEach
        void shutdown() {
            pool.shutdownNow();
        }

        @Test
        void outputOrderFollowsInputOrder() {
            Map<Integer, Requirement> requirements = new LinkedHashMap<>();
            for (int i = 50; i > 0; i--) requirements.put(i, traitMin("arete", i % 5));
            BatchChecker batch = new BatchChecker(checker, pool, new RequirementParser());

            BatchResult<Integer> result = batch.evaluateMany(requirements, Characters.mage());

            assertEquals(List.copyOf(requirements.keySet()), List.copyOf(result.results().keySet()));
            result.results().forEach((i, r) -> assertEquals(i % 5 <= 3, r.passed(), "entry " + i));
        }

        @Test
        void closeLeavesCallerOwnedExecutorRunning() {
            new BatchChecker(checker, pool, new RequirementParser()).close();
            assertFalse(pool.isShutdown());
        }
    }

    @Test
    void fromConfigOwnsItsPoolAndUsesTheConfiguredDepth() {
        BatchChecker batch = BatchChecker.fromConfig(new CheckerConfig(2, 2, false), checker, ExecutorServiceFactory.fixed());
        try (batch) {
            BatchResult<String> result = batch.evaluateManyJson(Map.of(
                    "shallow", "{\"all\": [{\"trait\": {\"name\": \"arete\", \"min\": 1}}]}",
                    "deep", "{\"all\": [{\"any\": [{\"trait\": {\"name\": \"arete\", \"min\": 1}}]}]}"),
                    Characters.mage());

            assertTrue(result.result("shallow").orElseThrow().passed());
            assertTrue(result.errors().get("deep").message().startsWith("requirement nesting exceeds maximum depth 2"),
                    result.errors().get("deep").message());
        }
    }

    @Test
    void concurrentEntriesSeeTheSameFacts() {
        FactProvider facts = mock(FactProvider.class);
        when(facts.getTrait("strength")).thenReturn(OptionalInt.of(3));
        ExecutorService pool = ExecutorServiceFactory.fixed().create(3, "test-batch");
        try {
            BatchChecker batch = new BatchChecker(checker, pool, new RequirementParser());
            BatchResult<Integer> result = batch.evaluateAcross(traitMin("strength", 3), List.of(facts, facts, facts, facts));
            assertTrue(result.allPassed());
            assertEquals(4, result.results().size());
            result.results().values().forEach(r -> assertEquals(CheckResult.class, r.getClass()));
        } finally {
            pool.shutdown();
        }
    }
}

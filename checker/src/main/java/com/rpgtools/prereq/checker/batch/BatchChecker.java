package com.rpgtools.prereq.checker.batch;

import com.rpgtools.prereq.checker.CheckResult;
import com.rpgtools.prereq.checker.CheckerConfig;
import com.rpgtools.prereq.checker.FactProvider;
import com.rpgtools.prereq.checker.RequirementChecker;
import com.rpgtools.prereq.common.async.ExecutorServiceFactory;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.json.RequirementJson;
import com.rpgtools.prereq.requirement.json.RequirementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Evaluates many independent checks. Entries run on the executor when there is one, otherwise inline on
 * the calling thread. A failing entry is recorded in {@link BatchResult#errors()} and does not stop the
 * others.
 */
public final class BatchChecker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchChecker.class);

    private final RequirementChecker checker;
    private final RequirementParser parser;
    private final ExecutorService executor; // null = inline
    private final boolean ownsExecutor;

    /** Runs every entry inline. */
    public BatchChecker(RequirementChecker checker) {
        this(checker, null, new RequirementParser(), false);
    }

    /** Runs entries on a caller-owned executor; {@link #close()} leaves it running. */
    public BatchChecker(RequirementChecker checker, ExecutorService executor, RequirementParser parser) {
        this(checker, Objects.requireNonNull(executor, "executor"), parser, false);
    }

    private BatchChecker(RequirementChecker checker, ExecutorService executor, RequirementParser parser, boolean ownsExecutor) {
        this.checker = Objects.requireNonNull(checker, "checker");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /** Creates a pool of {@code config.batchThreads()} workers, shut down by {@link #close()}. */
    public static BatchChecker fromConfig(CheckerConfig config, RequirementChecker checker, ExecutorServiceFactory factory) {
        Objects.requireNonNull(config, "config");
        ExecutorService pool = factory.create(config.batchThreads(), "prereq-batch");
        log.info("Created BatchChecker factory={} threads={} maxDepth={}", factory.name(), config.batchThreads(), config.maxDepth());
        return new BatchChecker(checker, pool, config.parser(), true);
    }

    /** Many requirements against one character. */
    public <K> BatchResult<K> evaluateMany(Map<K, ? extends Requirement> requirements, FactProvider facts) {
        Objects.requireNonNull(requirements, "requirements");
        Objects.requireNonNull(facts, "facts");
        Map<K, Supplier<CheckResult>> tasks = new LinkedHashMap<>();
        requirements.forEach((key, requirement) -> tasks.put(key, () -> checker.evaluate(requirement, facts)));
        return run("evaluateMany", tasks);
    }

    /** One requirement against many characters, keyed by position in {@code providers}. */
    public BatchResult<Integer> evaluateAcross(Requirement requirement, List<? extends FactProvider> providers) {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(providers, "providers");
        Map<Integer, Supplier<CheckResult>> tasks = new LinkedHashMap<>();
        for (int i = 0; i < providers.size(); i++) {
            FactProvider facts = providers.get(i);
            tasks.put(i, () -> checker.evaluate(requirement, facts));
        }
        return run("evaluateAcross", tasks);
    }

    /** Like {@link #evaluateMany} but reads each requirement from stored JSON; a malformed document is that entry's error. */
    public <K> BatchResult<K> evaluateManyJson(Map<K, String> documents, FactProvider facts) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(facts, "facts");
        Map<K, Supplier<CheckResult>> tasks = new LinkedHashMap<>();
        documents.forEach((key, json) -> tasks.put(key,
                () -> checker.evaluate(parser.parse(RequirementJson.readTree(json)), facts)));
        return run("evaluateManyJson", tasks);
    }

    private <K> BatchResult<K> run(String operation, Map<K, Supplier<CheckResult>> tasks) {
        List<K> keys = new ArrayList<>(tasks.keySet());
        List<CompletableFuture<CheckResult>> futures = new ArrayList<>(keys.size());
        for (K key : keys) futures.add(submit(tasks.get(key)));

        Map<K, CheckResult> results = new LinkedHashMap<>();
        Map<K, BatchError> errors = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            K key = keys.get(i);
            try {
                results.put(key, futures.get(i).join());
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException r ? r : e;
                BatchError error = new BatchError(i, cause);
                log.warn("{} entry {} failed: {}", operation, key, error);
                errors.put(key, error);
            }
        }
        log.info("{} finished entries={} errors={} passed={}", operation, keys.size(), errors.size(),
                results.values().stream().filter(CheckResult::passed).count());
        return new BatchResult<>(results, errors);
    }

    private CompletableFuture<CheckResult> submit(Supplier<CheckResult> task) {
        if (executor != null) return CompletableFuture.supplyAsync(task, executor);
        try {
            return CompletableFuture.completedFuture(task.get());
        } catch (RuntimeException e) {
            CompletableFuture<CheckResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) executor.shutdown();
    }
}

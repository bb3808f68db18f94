package com.rpgtools.prereq.checker;

import com.rpgtools.prereq.common.IEnvGetter;
import com.rpgtools.prereq.requirement.json.RequirementParser;

/**
 * Runtime settings for the checker.
 *
 * @param batchThreads worker threads for {@link com.rpgtools.prereq.checker.batch.BatchChecker}
 * @param maxDepth     deepest requirement nesting accepted when reading stored JSON
 * @param auditEnabled whether evaluations are sent to the configured audit sink
 */
public record CheckerConfig(int batchThreads, int maxDepth, boolean auditEnabled) {

    public static final String BATCH_THREADS_ENV = "PREREQ_BATCH_THREADS";
    public static final String MAX_DEPTH_ENV = "PREREQ_MAX_DEPTH";
    public static final String AUDIT_ENABLED_ENV = "PREREQ_AUDIT_ENABLED";

    public static final int DEFAULT_BATCH_THREADS = 4;

    public CheckerConfig {
        if (batchThreads < 1) throw new IllegalArgumentException("batchThreads must be >= 1, got " + batchThreads);
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
    }

    public static CheckerConfig defaults() {
        return new CheckerConfig(DEFAULT_BATCH_THREADS, RequirementParser.DEFAULT_MAX_DEPTH, false);
    }

    public static CheckerConfig fromEnv(IEnvGetter env) {
        CheckerConfig d = defaults();
        return new CheckerConfig(
                env.intOr(BATCH_THREADS_ENV, d.batchThreads()),
                env.intOr(MAX_DEPTH_ENV, d.maxDepth()),
                env.booleanOr(AUDIT_ENABLED_ENV, d.auditEnabled()));
    }

    public RequirementParser parser() {
        return new RequirementParser(maxDepth);
    }
}

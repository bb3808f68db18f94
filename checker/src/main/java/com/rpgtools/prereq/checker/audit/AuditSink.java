package com.rpgtools.prereq.checker.audit;

/**
 * Receives a record of every top-level evaluation. Failures thrown from here are logged by the engine
 * and do not change the evaluation result.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditRecord record);

    AuditSink NONE = record -> {
    };
}

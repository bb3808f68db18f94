package com.rpgtools.prereq.checker.audit;

import com.rpgtools.prereq.checker.CheckResult;
import com.rpgtools.prereq.requirement.Requirement;

import java.time.Instant;
import java.util.Objects;

/** One top-level evaluation: what was asked, of whom, the answer, and when. */
public record AuditRecord(Requirement requirement, String factProviderIdentity, CheckResult result, Instant timestamp) {
    public AuditRecord {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(factProviderIdentity, "factProviderIdentity");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}

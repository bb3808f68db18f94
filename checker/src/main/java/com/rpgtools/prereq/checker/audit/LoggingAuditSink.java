package com.rpgtools.prereq.checker.audit;

import com.rpgtools.prereq.requirement.json.RequirementJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes audit records to the {@code com.rpgtools.prereq.checker.audit.LoggingAuditSink} logger. */
public final class LoggingAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

    @Override
    public void record(AuditRecord record) {
        if (!log.isInfoEnabled()) return;
        log.info("AUDIT provider={} passed={} at={} requirement={} message={}",
                record.factProviderIdentity(),
                record.result().passed(),
                record.timestamp(),
                RequirementJson.toJson(record.requirement()),
                record.result().message());
        if (!record.result().passed() && log.isDebugEnabled()) {
            log.debug("AUDIT provider={} failureReasons={}", record.factProviderIdentity(), record.result().getFailureReasons());
        }
    }
}

package com.rpgtools.prereq.checker;

import com.rpgtools.prereq.checker.audit.AuditRecord;
import com.rpgtools.prereq.checker.audit.AuditSink;
import com.rpgtools.prereq.common.ITimeService;
import com.rpgtools.prereq.requirement.AllOf;
import com.rpgtools.prereq.requirement.AnyOf;
import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.RequirementType;
import com.rpgtools.prereq.requirement.RequirementVisitor;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Evaluates requirement trees against a {@link FactProvider}.
 *
 * <p>Stateless between calls and safe to share across threads. Composites evaluate every child, so a
 * result always holds the full tree of sub-results.
 */
public final class RequirementChecker {
    private static final Logger log = LoggerFactory.getLogger(RequirementChecker.class);

    private final AuditSink auditSink;
    private final ITimeService time;

    public RequirementChecker() {
        this(AuditSink.NONE, ITimeService.real);
    }

    public RequirementChecker(AuditSink auditSink, ITimeService time) {
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.time = Objects.requireNonNull(time, "time");
    }

    /** Uses {@code auditSink} only when the config enables auditing. */
    public static RequirementChecker fromConfig(CheckerConfig config, AuditSink auditSink) {
        Objects.requireNonNull(config, "config");
        AuditSink sink = config.auditEnabled() ? auditSink : AuditSink.NONE;
        log.info("Created RequirementChecker auditEnabled={} sink={}", config.auditEnabled(), sink.getClass().getSimpleName());
        return new RequirementChecker(sink, ITimeService.real);
    }

    /**
     * @throws FactProviderException when the provider cannot answer a query
     */
    public CheckResult evaluate(Requirement requirement, FactProvider facts) {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(facts, "facts");
        CheckResult result = requirement.accept(new Evaluation(facts));
        audit(requirement, facts, result);
        return result;
    }

    private void audit(Requirement requirement, FactProvider facts, CheckResult result) {
        if (auditSink == AuditSink.NONE) return;
        String identity = null;
        try {
            identity = facts.identity();
            auditSink.record(new AuditRecord(requirement, identity, result, time.now()));
        } catch (RuntimeException e) {
            log.error("Audit sink {} failed for provider {}", auditSink.getClass().getName(), identity, e);
        }
    }

    private static <T> T query(String description, Supplier<T> q) {
        try {
            return q.get();
        } catch (FactProviderException e) {
            log.warn("{}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            FactProviderException wrapped = new FactProviderException(description, String.valueOf(e.getMessage()), e);
            log.warn("{}", wrapped.getMessage());
            throw wrapped;
        }
    }

    private static CheckResult traced(CheckResult result) {
        if (log.isDebugEnabled())
            log.debug("Evaluated {} passed={} message={}", result.requirementType().key(), result.passed(), result.message());
        return result;
    }

    private static final class Evaluation implements RequirementVisitor<CheckResult> {
        private final FactProvider facts;

        Evaluation(FactProvider facts) {
            this.facts = facts;
        }

        @Override
        public CheckResult visitTrait(Trait trait) {
            String name = trait.name();
            OptionalInt value = query("getTrait(" + name + ")", () -> facts.getTrait(name));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("trait_name", name);
            if (value.isPresent()) details.put("actual_value", value.getAsInt());
            if (trait.minimum() != null) details.put("required_minimum", trait.minimum());
            if (trait.maximum() != null) details.put("required_maximum", trait.maximum());
            if (trait.exact() != null) details.put("required_exact", trait.exact());

            if (value.isEmpty())
                return traced(CheckResult.leaf(false, "Trait '" + name + "' not found", RequirementType.TRAIT, details));
            int actual = value.getAsInt();
            if (trait.exact() != null && actual != trait.exact())
                return traced(CheckResult.leaf(false,
                        name + " must be exactly " + trait.exact() + ", got " + actual, RequirementType.TRAIT, details));
            if (trait.minimum() != null && actual < trait.minimum())
                return traced(CheckResult.leaf(false,
                        "Insufficient " + name + ": " + actual + " < " + trait.minimum(), RequirementType.TRAIT, details));
            if (trait.maximum() != null && actual > trait.maximum())
                return traced(CheckResult.leaf(false,
                        name + " exceeds maximum: " + actual + " > " + trait.maximum(), RequirementType.TRAIT, details));
            return traced(CheckResult.leaf(true,
                    "Meets " + name + " requirement (" + bounds(trait.minimum(), trait.maximum(), trait.exact()) + "): " + actual,
                    RequirementType.TRAIT, details));
        }

        @Override
        public CheckResult visitPossession(Possession possession) {
            String field = possession.collectionField();
            String criteria = possession.filter().describe();
            boolean found = query("hasMatch(" + field + ", " + criteria + ")", () -> facts.hasMatch(field, possession.filter()));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", field);
            details.putAll(possession.filter().criteria());
            String message = found
                    ? "Has required " + field + " entry (" + criteria + ")"
                    : "Does not have required " + field + " entry (" + criteria + ")";
            return traced(CheckResult.leaf(found, message, RequirementType.POSSESSION, details));
        }

        @Override
        public CheckResult visitTagCount(TagCount tagCount) {
            String model = tagCount.collectionField();
            String tag = tagCount.tag();
            String description = "countTagged(" + model + ", " + tag + ")";
            int count = query(description, () -> facts.countTagged(model, tag));
            if (count < 0) {
                FactProviderException e = new FactProviderException(description, "negative count " + count);
                log.warn("{}", e.getMessage());
                throw e;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("model", model);
            details.put("tag", tag);
            details.put("actual_count", count);
            if (tagCount.minimum() != null) details.put("required_minimum", tagCount.minimum());
            if (tagCount.maximum() != null) details.put("required_maximum", tagCount.maximum());

            String subject = model + " with tag '" + tag + "'";
            if (tagCount.minimum() != null && count < tagCount.minimum())
                return traced(CheckResult.leaf(false,
                        "Insufficient " + subject + ": " + count + " < " + tagCount.minimum(), RequirementType.TAG_COUNT, details));
            if (tagCount.maximum() != null && count > tagCount.maximum())
                return traced(CheckResult.leaf(false,
                        "Too many " + subject + ": " + count + " > " + tagCount.maximum(), RequirementType.TAG_COUNT, details));
            return traced(CheckResult.leaf(true,
                    "Has " + subject + " (" + bounds(tagCount.minimum(), tagCount.maximum(), null) + "): " + count,
                    RequirementType.TAG_COUNT, details));
        }

        @Override
        public CheckResult visitAllOf(AllOf allOf) {
            List<CheckResult> children = evaluateAll(allOf.children());
            int satisfied = satisfied(children);
            int total = children.size();
            boolean passed = satisfied == total;
            String message = (passed ? "All requirements satisfied" : "Not all requirements satisfied")
                    + " (" + satisfied + "/" + total + ")";
            return traced(new CheckResult(passed, message, RequirementType.ALL_OF, children, counts(satisfied, total)));
        }

        @Override
        public CheckResult visitAnyOf(AnyOf anyOf) {
            List<CheckResult> children = evaluateAll(anyOf.children());
            int satisfied = satisfied(children);
            int total = children.size();
            boolean passed = satisfied > 0;
            String message = (passed ? "At least one requirement satisfied" : "No requirements satisfied")
                    + " (" + satisfied + "/" + total + ")";
            return traced(new CheckResult(passed, message, RequirementType.ANY_OF, children, counts(satisfied, total)));
        }

        private List<CheckResult> evaluateAll(List<Requirement> requirements) {
            List<CheckResult> results = new ArrayList<>(requirements.size());
            for (Requirement child : requirements) results.add(child.accept(this));
            return results;
        }
    }

    private static int satisfied(List<CheckResult> children) {
        int n = 0;
        for (CheckResult c : children) if (c.passed()) n++;
        return n;
    }

    private static Map<String, Object> counts(int satisfied, int total) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("satisfied_count", satisfied);
        details.put("total_count", total);
        return details;
    }

    private static String bounds(Integer minimum, Integer maximum, Integer exact) {
        if (exact != null) return "exactly " + exact;
        if (minimum != null && maximum != null) return "minimum " + minimum + " and maximum " + maximum;
        if (minimum != null) return "minimum " + minimum;
        return "maximum " + maximum;
    }
}

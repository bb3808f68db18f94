package com.rpgtools.prereq.checker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rpgtools.prereq.common.codec.Codec;
import com.rpgtools.prereq.requirement.RequirementType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of checking one requirement node. Mirrors the requirement tree: composites carry one child
 * per sub-requirement in the same order, leaves carry none.
 *
 * @param details observed and required values, e.g. {@code actual_value}, {@code required_minimum}
 */
public record CheckResult(boolean passed,
                          String message,
                          RequirementType requirementType,
                          List<CheckResult> children,
                          Map<String, Object> details) {

    public CheckResult {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(requirementType, "requirementType");
        children = children == null ? List.of() : List.copyOf(children);
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** JSON codec for persisting results; derived fields such as failure reasons are not written. */
    public static Codec<CheckResult, String> codec() {
        return Codec.clazzCodec(CheckResult.class);
    }

    public static CheckResult leaf(boolean passed, String message, RequirementType type, Map<String, Object> details) {
        return new CheckResult(passed, message, type, List.of(), details);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Messages of the failing leaves under this node, depth-first, left to right.
     * Passing subtrees are skipped, so a satisfied {@code any} contributes nothing.
     */
    @JsonIgnore
    public List<String> getFailureReasons() {
        List<String> reasons = new ArrayList<>();
        collectFailures(this, reasons);
        return List.copyOf(reasons);
    }

    private static void collectFailures(CheckResult result, List<String> into) {
        if (result.passed) return;
        if (result.children.isEmpty()) {
            into.add(result.message);
            return;
        }
        for (CheckResult child : result.children) collectFailures(child, into);
    }

    @Override
    public String toString() {
        return (passed ? "SUCCESS" : "FAILED") + ": " + message;
    }
}

package com.rpgtools.prereq.checker.batch;

import com.rpgtools.prereq.checker.CheckResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of a batch, keyed as the input was. Every input key lands in exactly one of the two maps;
 * both iterate in input order.
 */
public record BatchResult<K>(Map<K, CheckResult> results, Map<K, BatchError> errors) {

    public BatchResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Optional<CheckResult> result(K key) {
        return Optional.ofNullable(results.get(key));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int size() {
        return results.size() + errors.size();
    }

    /** True when there were no errors and every result passed. */
    public boolean allPassed() {
        return errors.isEmpty() && results.values().stream().allMatch(CheckResult::passed);
    }

    public List<K> passedKeys() {
        List<K> keys = new ArrayList<>();
        results.forEach((k, r) -> {
            if (r.passed()) keys.add(k);
        });
        return keys;
    }
}

package com.rpgtools.prereq.requirement;

/** Shared argument checks for the requirement records. */
final class Validation {

    private Validation() {
    }

    static String requireText(String value, RequirementType type, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequirementException(type.key() + " requirement '" + field + "' cannot be empty");
        }
        return value.trim();
    }

    static Integer requireNonNegative(Integer value, RequirementType type, String field) {
        if (value != null && value < 0) {
            throw new InvalidRequirementException(type.key() + " requirement '" + field + "' must be non-negative");
        }
        return value;
    }

    static void requireOrdered(Integer min, Integer max, RequirementType type, String minField, String maxField) {
        if (min != null && max != null && min > max) {
            throw new InvalidRequirementException(type.key() + " requirement '" + maxField + "' (" + max
                    + ") cannot be less than '" + minField + "' (" + min + ")");
        }
    }
}

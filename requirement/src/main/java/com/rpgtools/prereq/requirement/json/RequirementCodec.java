package com.rpgtools.prereq.requirement.json;

import com.rpgtools.prereq.common.codec.Codec;
import com.rpgtools.prereq.common.errorsor.ErrorsOr;
import com.rpgtools.prereq.requirement.InvalidRequirementException;
import com.rpgtools.prereq.requirement.Requirement;

import java.util.Objects;

/** {@link Codec} view of the stored JSON form; failures come back as errors instead of exceptions. */
public final class RequirementCodec implements Codec<Requirement, String> {

    private final RequirementParser parser;

    public RequirementCodec() {
        this(RequirementJson.PARSER);
    }

    public RequirementCodec(RequirementParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public ErrorsOr<String> encode(Requirement requirement) {
        if (requirement == null) return ErrorsOr.error("Cannot encode a null requirement");
        return ErrorsOr.trying(() -> RequirementJson.toJson(requirement),
                e -> "Failed to encode requirement: " + e.getMessage());
    }

    @Override
    public ErrorsOr<Requirement> decode(String json) {
        try {
            return ErrorsOr.lift(parser.parse(RequirementJson.readTree(json)));
        } catch (InvalidRequirementException e) {
            return ErrorsOr.error(e.getMessage());
        }
    }
}

package com.rpgtools.prereq.requirement.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.rpgtools.prereq.requirement.InvalidRequirementException;
import com.rpgtools.prereq.requirement.Requirement;

import java.io.IOException;

/**
 * Lets a {@link Requirement} appear as a property of other Jackson-bound types, in its stored JSON form.
 * A malformed tree surfaces as a {@link JsonMappingException} whose cause is the
 * {@link InvalidRequirementException}.
 */
public final class RequirementJacksonModule extends SimpleModule {

    public RequirementJacksonModule() {
        this(new RequirementParser());
    }

    public RequirementJacksonModule(RequirementParser parser) {
        super("RequirementJacksonModule");
        addSerializer(Requirement.class, new Serializer());
        addDeserializer(Requirement.class, new Deserializer(parser));
    }

    static final class Serializer extends StdSerializer<Requirement> {
        Serializer() {
            super(Requirement.class);
        }

        @Override
        public void serialize(Requirement value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeTree(RequirementWriter.INSTANCE.write(value));
        }
    }

    static final class Deserializer extends StdDeserializer<Requirement> {
        private final RequirementParser parser;

        Deserializer(RequirementParser parser) {
            super(Requirement.class);
            this.parser = parser;
        }

        @Override
        public Requirement deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = ctxt.readTree(p);
            try {
                return parser.parse(tree);
            } catch (InvalidRequirementException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }
    }
}

package com.rpgtools.prereq.requirement.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpgtools.prereq.requirement.AllOf;
import com.rpgtools.prereq.requirement.AnyOf;
import com.rpgtools.prereq.requirement.Possession;
import com.rpgtools.prereq.requirement.Requirement;
import com.rpgtools.prereq.requirement.RequirementType;
import com.rpgtools.prereq.requirement.RequirementVisitor;
import com.rpgtools.prereq.requirement.TagCount;
import com.rpgtools.prereq.requirement.Trait;

import java.util.List;

/** Writes a tree in the stored JSON form with keys in canonical order. */
public final class RequirementWriter implements RequirementVisitor<ObjectNode> {

    private static final ObjectMapper VALUES = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final RequirementWriter INSTANCE = new RequirementWriter();

    private RequirementWriter() {
    }

    public ObjectNode write(Requirement requirement) {
        return requirement.accept(this);
    }

    @Override
    public ObjectNode visitTrait(Trait t) {
        ObjectNode body = NODES.objectNode().put("name", t.name());
        if (t.minimum() != null) body.put("min", t.minimum());
        if (t.maximum() != null) body.put("max", t.maximum());
        if (t.exact() != null) body.put("exact", t.exact());
        return wrap(RequirementType.TRAIT, body);
    }

    @Override
    public ObjectNode visitPossession(Possession p) {
        ObjectNode body = NODES.objectNode().put("field", p.collectionField());
        if (p.id() != null) body.put("id", p.id());
        if (p.name() != null) body.put("name", p.name());
        p.attributes().forEach((k, v) -> body.set(k, VALUES.valueToTree(v)));
        return wrap(RequirementType.POSSESSION, body);
    }

    @Override
    public ObjectNode visitTagCount(TagCount c) {
        ObjectNode body = NODES.objectNode()
                .put("model", c.collectionField())
                .put("tag", c.tag());
        if (c.minimum() != null) body.put("minimum", c.minimum());
        if (c.maximum() != null) body.put("maximum", c.maximum());
        return wrap(RequirementType.TAG_COUNT, body);
    }

    @Override
    public ObjectNode visitAllOf(AllOf allOf) {
        return wrap(RequirementType.ALL_OF, children(allOf.children()));
    }

    @Override
    public ObjectNode visitAnyOf(AnyOf anyOf) {
        return wrap(RequirementType.ANY_OF, children(anyOf.children()));
    }

    private ArrayNode children(List<Requirement> children) {
        ArrayNode array = NODES.arrayNode(children.size());
        for (Requirement child : children) array.add(child.accept(this));
        return array;
    }

    private static ObjectNode wrap(RequirementType type, JsonNode body) {
        ObjectNode root = NODES.objectNode();
        root.set(type.key(), body);
        return root;
    }
}

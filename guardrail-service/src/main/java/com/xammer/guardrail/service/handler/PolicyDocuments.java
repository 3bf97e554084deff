package com.xammer.guardrail.service.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;

/**
 * Helpers over IAM-style policy documents. A statement is over-permissive
 * when it allows any principal ({@code "*"} or {@code {"AWS": "*"}}) without
 * a Condition block.
 */
final class PolicyDocuments {

    private PolicyDocuments() {
    }

    static boolean hasOverpermissiveStatement(JsonNode policy) {
        for (JsonNode statement : statements(policy)) {
            if (isOverpermissive(statement)) {
                return true;
            }
        }
        return false;
    }

    /** Copy of the policy with every over-permissive statement removed. */
    static ObjectNode withoutOverpermissiveStatements(ObjectNode policy) {
        ObjectNode copy = policy.deepCopy();
        ArrayNode kept = copy.arrayNode();
        for (JsonNode statement : statements(policy)) {
            if (!isOverpermissive(statement)) {
                kept.add(statement.deepCopy());
            }
        }
        copy.set("Statement", kept);
        return copy;
    }

    static int statementCount(JsonNode policy) {
        return statements(policy).size();
    }

    static boolean isOverpermissive(JsonNode statement) {
        JsonNode condition = statement.get("Condition");
        boolean conditioned = condition != null && condition.isObject() && condition.size() > 0;
        return "Allow".equalsIgnoreCase(statement.path("Effect").asText())
                && isWildcardPrincipal(statement.get("Principal"))
                && !conditioned;
    }

    private static boolean isWildcardPrincipal(JsonNode principal) {
        if (principal == null) {
            return false;
        }
        if (principal.isTextual()) {
            return "*".equals(principal.asText());
        }
        if (principal.isObject()) {
            Iterator<JsonNode> values = principal.elements();
            while (values.hasNext()) {
                JsonNode value = values.next();
                if (value.isTextual() && "*".equals(value.asText())) {
                    return true;
                }
                if (value.isArray()) {
                    for (JsonNode item : value) {
                        if ("*".equals(item.asText())) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    private static ArrayNode statements(JsonNode policy) {
        JsonNode statement = policy.get("Statement");
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        if (statement == null || statement.isNull()) {
            return array;
        }
        if (statement.isArray()) {
            statement.forEach(array::add);
        } else {
            array.add(statement);
        }
        return array;
    }
}

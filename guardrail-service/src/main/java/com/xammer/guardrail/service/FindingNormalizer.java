package com.xammer.guardrail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.guardrail.domain.Finding;
import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.ResourceRef;
import com.xammer.guardrail.exception.MalformedFindingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an inbound finding event into a {@link Finding}.
 * <p>
 * Two shapes are understood: the direct shape ({@code id}, {@code type},
 * {@code resourceRef}, ...) with casing/naming variants, and the EventBridge
 * envelope emitted by IAM Access Analyzer ({@code source = aws.access-analyzer},
 * payload under {@code detail}). Fields the normalizer does not interpret are
 * kept in {@code rawAttributes}.
 * <p>
 * An Access Analyzer notification that carries only the finding id and the
 * analyzer ARN is completed from the analyzer before it is normalized.
 */
@Service
public class FindingNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FindingNormalizer.class);

    static final String ACCESS_ANALYZER_SOURCE = "aws.access-analyzer";

    private static final List<String> ID_FIELDS = List.of("id", "findingId", "finding_id", "Id", "FindingId");
    private static final List<String> TYPE_FIELDS = List.of("type", "findingType", "finding_type", "Type", "FindingType");
    private static final List<String> RESOURCE_FIELDS = List.of("resourceRef", "resource_ref", "ResourceRef",
            "resource", "resourceArn", "resource_arn", "Resource");
    private static final List<String> DETECTED_AT_FIELDS = List.of("detectedAt", "detected_at", "DetectedAt",
            "createdAt", "created_at");
    private static final List<String> ATTRIBUTE_FIELDS = List.of("rawAttributes", "raw_attributes", "attributes",
            "RawAttributes");

    private static final Set<String> PUBLIC_ISSUE_CODES = Set.of(
            "S3_BUCKET_PUBLIC_READ_ACCESS",
            "S3_BUCKET_PUBLIC_WRITE_ACCESS",
            "IAM_ROLE_ALLOWS_PUBLIC_ASSUMPTION",
            "IAM_POLICY_ALLOWS_PUBLIC_ACCESS");
    private static final Set<String> OVER_PERMISSIVE_ISSUE_CODES = Set.of("IAM_ROLE_OVERLY_PERMISSIVE");
    private static final Set<String> UNUSED_ACCESS_FINDING_TYPES = Set.of(
            "UnusedIAMRole",
            "UnusedIAMUserAccessKey",
            "UnusedIAMUserPassword",
            "UnusedPermission");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final List<String> AA_RESOURCE_FIELDS = List.of("resource", "resourceArn");
    private static final List<String> AA_TYPE_FIELDS = List.of("issueCode", "findingType", "type");

    private final ObjectMapper objectMapper;
    private final AccessAnalyzerFindingLoader findingLoader;

    public FindingNormalizer(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    @Autowired
    public FindingNormalizer(ObjectMapper objectMapper, AccessAnalyzerFindingLoader findingLoader) {
        this.objectMapper = objectMapper;
        this.findingLoader = findingLoader;
    }

    public Finding normalize(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedFindingException("Empty finding payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedFindingException("Payload is not valid JSON: " + e.getOriginalMessage(), null, e);
        }
        return normalize(root);
    }

    public Finding normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedFindingException("Finding payload is not a JSON object");
        }
        if (isAccessAnalyzerEvent(root)) {
            return fromAccessAnalyzerEvent(root);
        }
        return fromDirectShape(root);
    }

    private boolean isAccessAnalyzerEvent(JsonNode root) {
        return ACCESS_ANALYZER_SOURCE.equals(root.path("source").asText(null))
                || (root.path("detail").isObject() && root.has("detail-type"));
    }

    private Finding fromDirectShape(JsonNode root) {
        String id = firstText(root, ID_FIELDS)
                .orElseThrow(() -> new MalformedFindingException("Finding is missing an id"));
        String rawType = firstText(root, TYPE_FIELDS)
                .orElseThrow(() -> new MalformedFindingException("Finding " + id + " is missing a type", id, null));
        JsonNode resourceNode = firstPresent(root, RESOURCE_FIELDS)
                .orElseThrow(() -> new MalformedFindingException("Finding " + id + " is missing a resource reference", id, null));
        ResourceRef resourceRef = parseResource(id, resourceNode);

        Map<String, Object> attributes = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>(Arrays.asList(
                matchedName(root, ID_FIELDS), matchedName(root, TYPE_FIELDS),
                matchedName(root, RESOURCE_FIELDS), matchedName(root, DETECTED_AT_FIELDS),
                matchedName(root, ATTRIBUTE_FIELDS)));
        copyUnconsumed(root, consumed, attributes);
        firstPresent(root, ATTRIBUTE_FIELDS)
                .filter(JsonNode::isObject)
                .ifPresent(node -> attributes.putAll(objectMapper.convertValue(node, MAP_TYPE)));

        return Finding.builder()
                .id(id)
                .type(FindingType.fromLiteral(rawType).orElse(FindingType.UNRECOGNIZED))
                .rawType(rawType)
                .resourceRef(resourceRef)
                .detectedAt(parseInstant(id, firstText(root, DETECTED_AT_FIELDS).orElse(null)))
                .rawAttributes(attributes)
                .build();
    }

    private Finding fromAccessAnalyzerEvent(JsonNode root) {
        JsonNode detail = root.path("detail");
        if (!detail.isObject()) {
            throw new MalformedFindingException("Access Analyzer event has no detail object");
        }
        String id = firstText(detail, List.of("id", "findingId"))
                .orElseThrow(() -> new MalformedFindingException("Access Analyzer finding is missing an id"));
        if (isIncomplete(detail)) {
            detail = completeFromAnalyzer(id, (ObjectNode) detail);
        }
        JsonNode resource = firstPresent(detail, AA_RESOURCE_FIELDS)
                .orElseThrow(() -> new MalformedFindingException("Finding " + id + " is missing a resource reference", id, null));

        String findingType = detail.path("findingType").asText(null);
        String issueCode = detail.path("issueCode").asText(null);
        String explicitType = detail.path("type").asText(null);
        String rawType = issueCode != null ? issueCode : (findingType != null ? findingType : explicitType);
        if (rawType == null) {
            throw new MalformedFindingException("Finding " + id + " is missing a type", id, null);
        }

        ResourceRef resourceRef = parseResource(id, resource);
        if (resourceRef.getAccountId() == null) {
            String owner = firstText(detail, List.of("resourceOwnerAccount", "accountId"))
                    .orElse(root.path("account").asText(null));
            if (owner != null) {
                resourceRef = resourceRef.withAccountId(owner);
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        copyUnconsumed(detail, Set.of("id", "findingId", "resource", "resourceArn"), attributes);
        copyUnconsumed(root, Set.of("detail", "id"), attributes);
        if (root.hasNonNull("id")) {
            attributes.put("eventId", root.get("id").asText());
        }

        String detectedAt = firstText(detail, List.of("createdAt", "analyzedAt"))
                .orElse(root.path("time").asText(null));

        FindingType type = mapAccessAnalyzerType(explicitType, findingType, issueCode,
                detail.path("resourceType").asText(""), detail.path("isPublic").asBoolean(false));
        return Finding.builder()
                .id(id)
                .type(type)
                .rawType(rawType)
                .resourceRef(resourceRef)
                .detectedAt(parseInstant(id, detectedAt))
                .rawAttributes(attributes)
                .build();
    }

    private boolean isIncomplete(JsonNode detail) {
        return findingLoader != null
                && firstText(detail, List.of("analyzerArn")).isPresent()
                && (firstPresent(detail, AA_RESOURCE_FIELDS).isEmpty() || firstText(detail, AA_TYPE_FIELDS).isEmpty());
    }

    /** Fields from the analyzer fill in what the notification left out; the notification's own fields win. */
    private ObjectNode completeFromAnalyzer(String id, ObjectNode detail) {
        ObjectNode loaded = findingLoader.load(detail.get("analyzerArn").asText(), id);
        ObjectNode merged = detail.deepCopy();
        loaded.fields().forEachRemaining(field -> {
            if (!merged.hasNonNull(field.getKey())) {
                merged.set(field.getKey(), field.getValue());
            }
        });
        return merged;
    }

    static FindingType mapAccessAnalyzerType(String explicitType, String findingType, String issueCode,
                                             String resourceType, boolean isPublic) {
        Optional<FindingType> direct = FindingType.fromLiteral(explicitType);
        if (direct.isPresent()) {
            return direct.get();
        }
        if (issueCode != null) {
            if (PUBLIC_ISSUE_CODES.contains(issueCode)) {
                return FindingType.PUBLIC_RESOURCE_EXPOSURE;
            }
            if (OVER_PERMISSIVE_ISSUE_CODES.contains(issueCode)) {
                return FindingType.OVER_PERMISSIVE_POLICY;
            }
            if (issueCode.startsWith("KMS_")) {
                return FindingType.KEY_MISUSE;
            }
            if (issueCode.startsWith("IAM_USER_UNUSED")) {
                return FindingType.UNUSED_ACCESS;
            }
        }
        if (findingType != null) {
            if (UNUSED_ACCESS_FINDING_TYPES.contains(findingType)) {
                return FindingType.UNUSED_ACCESS;
            }
            if ("ExternalAccess".equals(findingType)) {
                if (isPublic) {
                    return FindingType.PUBLIC_RESOURCE_EXPOSURE;
                }
                return "AWS::KMS::Key".equals(resourceType) ? FindingType.KEY_MISUSE : FindingType.OVER_PERMISSIVE_POLICY;
            }
        }
        return FindingType.UNRECOGNIZED;
    }

    private ResourceRef parseResource(String findingId, JsonNode node) {
        try {
            if (node.isTextual()) {
                return ResourceRef.parse(node.asText());
            }
            if (node.isObject()) {
                String arn = firstText(node, List.of("arn", "resourceArn")).orElse(null);
                if (arn != null) {
                    ResourceRef parsed = ResourceRef.parse(arn);
                    String account = firstText(node, List.of("accountId", "account_id", "account")).orElse(null);
                    return parsed.getAccountId() == null && account != null ? parsed.withAccountId(account) : parsed;
                }
                return ResourceRef.builder()
                        .accountId(firstText(node, List.of("accountId", "account_id", "account")).orElse(null))
                        .service(firstText(node, List.of("service", "Service")).orElse(null))
                        .region(firstText(node, List.of("region", "Region")).orElse(null))
                        .resourceType(firstText(node, List.of("resourceType", "resource_type", "type")).orElse(null))
                        .resourceId(firstText(node, List.of("resourceId", "resource_id", "id", "name")).orElse(null))
                        .build();
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedFindingException("Finding " + findingId + " has an invalid resource reference: "
                    + e.getMessage(), findingId, e);
        }
        throw new MalformedFindingException("Finding " + findingId + " has an unsupported resource reference", findingId, null);
    }

    private Instant parseInstant(String findingId, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            logger.warn("Finding {} has an unparseable detection timestamp '{}', leaving it unset", findingId, value);
            return null;
        }
    }

    private void copyUnconsumed(JsonNode node, Set<String> consumed, Map<String, Object> target) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!consumed.contains(field.getKey()) && !target.containsKey(field.getKey())) {
                target.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
    }

    private static Optional<String> firstText(JsonNode node, List<String> names) {
        return firstPresent(node, names)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank());
    }

    private static Optional<JsonNode> firstPresent(JsonNode node, List<String> names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** Name of the first field from {@code names} present on the node, or an empty string. */
    private static String matchedName(JsonNode node, List<String> names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return name;
            }
        }
        return "";
    }
}

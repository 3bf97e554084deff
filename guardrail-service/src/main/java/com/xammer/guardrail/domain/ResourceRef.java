package com.xammer.guardrail.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;

/**
 * Fully-qualified reference to the resource a finding is about.
 * Accepts ARNs ({@code arn:aws:s3:::acme-public}) and the short
 * {@code type/id} form ({@code bucket/acme-public}).
 */
@Getter
@EqualsAndHashCode
public final class ResourceRef {

    private static final Map<String, String> SERVICE_BY_TYPE = Map.of(
            "bucket", "s3",
            "role", "iam",
            "user", "iam",
            "policy", "iam",
            "access-key", "iam",
            "key", "kms",
            "alias", "kms");

    private final String arn;
    private final String service;
    private final String region;
    private final String accountId;
    private final String resourceType;
    private final String resourceId;

    @Builder(toBuilder = true)
    private ResourceRef(String arn, String service, String region, String accountId,
                        String resourceType, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource reference has no resource id");
        }
        this.arn = arn;
        this.resourceType = resourceType == null ? null : resourceType.toLowerCase(Locale.ROOT);
        this.service = service != null ? service.toLowerCase(Locale.ROOT)
                : (this.resourceType == null ? null : SERVICE_BY_TYPE.get(this.resourceType));
        this.region = emptyToNull(region);
        this.accountId = emptyToNull(accountId);
        this.resourceId = resourceId;
    }

    public static ResourceRef parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resource reference is empty");
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("arn:")) {
            return parseArn(trimmed);
        }
        int slash = trimmed.indexOf('/');
        if (slash <= 0 || slash == trimmed.length() - 1) {
            throw new IllegalArgumentException("Unrecognized resource reference: " + value);
        }
        return ResourceRef.builder()
                .resourceType(trimmed.substring(0, slash))
                .resourceId(trimmed.substring(slash + 1))
                .build();
    }

    private static ResourceRef parseArn(String arn) {
        String[] parts = arn.split(":", 6);
        if (parts.length < 6 || parts[2].isEmpty() || parts[5].isEmpty()) {
            throw new IllegalArgumentException("Malformed ARN: " + arn);
        }
        String service = parts[2];
        String resource = parts[5];
        String type;
        String id;
        if ("s3".equals(service)) {
            // arn:aws:s3:::bucket or arn:aws:s3:::bucket/key
            type = resource.contains("/") ? "object" : "bucket";
            id = resource;
        } else {
            int sep = indexOfSeparator(resource);
            type = sep > 0 ? resource.substring(0, sep) : null;
            id = sep > 0 ? resource.substring(sep + 1) : resource;
        }
        return ResourceRef.builder()
                .arn(arn)
                .service(service)
                .region(parts[3])
                .accountId(parts[4])
                .resourceType(type)
                .resourceId(id)
                .build();
    }

    private static int indexOfSeparator(String resource) {
        int slash = resource.indexOf('/');
        int colon = resource.indexOf(':');
        if (slash < 0) {
            return colon;
        }
        return colon < 0 ? slash : Math.min(slash, colon);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public ResourceRef withAccountId(String newAccountId) {
        return toBuilder().accountId(newAccountId).build();
    }

    /** Last path segment of the resource id, e.g. the role name for {@code role/service/deployer}. */
    @JsonIgnore
    public String getName() {
        int slash = resourceId.lastIndexOf('/');
        return slash < 0 ? resourceId : resourceId.substring(slash + 1);
    }

    public boolean is(String expectedService, String expectedType) {
        return expectedService.equals(service) && expectedType.equals(resourceType);
    }

    @JsonValue
    @Override
    public String toString() {
        if (arn != null) {
            return arn;
        }
        return resourceType == null ? resourceId : resourceType + "/" + resourceId;
    }
}

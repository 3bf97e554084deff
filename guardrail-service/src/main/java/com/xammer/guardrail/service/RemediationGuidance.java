package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.ResourceRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable, non-binding remediation steps attached to every plan.
 */
@Component
public class RemediationGuidance {

    public List<String> forFinding(FindingType type, ResourceRef target) {
        List<String> steps = new ArrayList<>(specificSteps(type, target));
        steps.add(String.format("Verify the fix: locate %s%s, apply the change, then wait for the analyzer to re-evaluate the resource.",
                target, target.getAccountId() == null ? "" : " in account " + target.getAccountId()));
        return steps;
    }

    private List<String> specificSteps(FindingType type, ResourceRef target) {
        String service = target.getService() == null ? "" : target.getService();
        String resourceType = target.getResourceType() == null ? "" : target.getResourceType();
        switch (type) {
            case PUBLIC_RESOURCE_EXPOSURE:
                if ("s3".equals(service)) {
                    return List.of(
                            "Enable S3 Block Public Access settings on the bucket.",
                            "Remove public grants from the bucket policy and ACLs.",
                            "Serve public content through CloudFront with origin access control instead.");
                }
                if ("iam".equals(service) && "role".equals(resourceType)) {
                    return List.of(
                            "Remove the public principal from the role's trust policy.",
                            "Add conditions (aws:PrincipalOrgID, sts:ExternalId) to restrict who can assume the role.",
                            "Consider an SCP that denies public role assumption organization-wide.");
                }
                return List.of("Remove public principals from the resource policy.");
            case OVER_PERMISSIVE_POLICY:
                return List.of(
                        "Remove Allow statements that grant access to any principal without conditions.",
                        "Apply the principle of least privilege; use specific resource ARNs instead of wildcards.",
                        "Prefer AWS managed policies over broad custom policies where they fit.");
            case UNUSED_ACCESS:
                if ("user".equals(resourceType)) {
                    return List.of(
                            "Deactivate, then delete, unused access keys.",
                            "Enforce access key rotation for remaining keys.",
                            "Move human access to IAM Identity Center and workloads to IAM roles.");
                }
                return List.of(
                        "Remove unused roles, credentials and permissions.",
                        "Implement credential lifecycle management.");
            case KEY_MISUSE:
                return List.of(
                        "Review the KMS key policy and grants for principals outside the organization.",
                        "Enable automatic key rotation.",
                        "Review key usage patterns in CloudTrail before changing the key policy.");
            default:
                return List.of(
                        "Review the resource's access policies.",
                        "Apply the principle of least privilege.",
                        "Consider AWS Organizations SCPs for additional controls.");
        }
    }
}

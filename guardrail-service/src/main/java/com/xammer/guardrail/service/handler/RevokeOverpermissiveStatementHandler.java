package com.xammer.guardrail.service.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.guardrail.domain.GovernedAccount;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.domain.ResourceRef;
import com.xammer.guardrail.service.AwsClientProvider;
import com.xammer.guardrail.service.GovernedAccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.GetRoleRequest;
import software.amazon.awssdk.services.iam.model.UpdateAssumeRolePolicyRequest;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.GetBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Removes unconditioned Allow-to-anyone statements from an S3 bucket policy
 * or an IAM role trust policy.
 */
@Component
public class RevokeOverpermissiveStatementHandler implements RemediationHandler {

    private static final Logger logger = LoggerFactory.getLogger(RevokeOverpermissiveStatementHandler.class);

    private static final String NO_BUCKET_POLICY = "NoSuchBucketPolicy";

    private final AwsClientProvider awsClientProvider;
    private final GovernedAccountService governedAccountService;
    private final ObjectMapper objectMapper;

    public RevokeOverpermissiveStatementHandler(AwsClientProvider awsClientProvider,
                                                GovernedAccountService governedAccountService,
                                                ObjectMapper objectMapper) {
        this.awsClientProvider = awsClientProvider;
        this.governedAccountService = governedAccountService;
        this.objectMapper = objectMapper;
    }

    @Override
    public RemediationAction action() {
        return RemediationAction.REVOKE_OVERPERMISSIVE_STATEMENT;
    }

    @Override
    public boolean supports(RemediationPlan plan) {
        ResourceRef target = plan.getTargetRef();
        return target.is("s3", "bucket") || target.is("iam", "role");
    }

    @Override
    public boolean isSatisfied(RemediationPlan plan) {
        return currentPolicy(plan)
                .map(policy -> !PolicyDocuments.hasOverpermissiveStatement(policy))
                .orElse(true);
    }

    @Override
    public void apply(RemediationPlan plan) {
        ResourceRef target = plan.getTargetRef();
        JsonNode current = currentPolicy(plan)
                .orElseThrow(() -> new IllegalStateException("Policy for " + target + " disappeared during remediation"));
        if (!current.isObject()) {
            throw new IllegalStateException("Policy for " + target + " is not a JSON object");
        }
        ObjectNode revised = PolicyDocuments.withoutOverpermissiveStatements((ObjectNode) current);
        int removed = PolicyDocuments.statementCount(current) - PolicyDocuments.statementCount(revised);
        logger.info("Revoking {} over-permissive statement(s) on {} for finding {}", removed, target, plan.getFindingId());

        if (target.is("s3", "bucket")) {
            S3Client s3 = s3For(plan);
            if (PolicyDocuments.statementCount(revised) == 0) {
                s3.deleteBucketPolicy(DeleteBucketPolicyRequest.builder().bucket(target.getResourceId()).build());
            } else {
                s3.putBucketPolicy(PutBucketPolicyRequest.builder()
                        .bucket(target.getResourceId())
                        .policy(write(revised))
                        .build());
            }
        } else {
            if (PolicyDocuments.statementCount(revised) == 0) {
                // a trust policy needs at least one statement
                revised.set("Statement", objectMapper.createArrayNode().add(denyAllAssumption()));
            }
            iamFor(plan).updateAssumeRolePolicy(UpdateAssumeRolePolicyRequest.builder()
                    .roleName(target.getName())
                    .policyDocument(write(revised))
                    .build());
        }
    }

    private Optional<JsonNode> currentPolicy(RemediationPlan plan) {
        ResourceRef target = plan.getTargetRef();
        if (target.is("s3", "bucket")) {
            try {
                String policy = s3For(plan)
                        .getBucketPolicy(GetBucketPolicyRequest.builder().bucket(target.getResourceId()).build())
                        .policy();
                return Optional.ofNullable(policy).map(this::read);
            } catch (S3Exception e) {
                if (e.awsErrorDetails() != null && NO_BUCKET_POLICY.equals(e.awsErrorDetails().errorCode())) {
                    return Optional.empty();
                }
                throw e;
            }
        }
        String document = iamFor(plan)
                .getRole(GetRoleRequest.builder().roleName(target.getName()).build())
                .role()
                .assumeRolePolicyDocument();
        // IAM returns policy documents URL-encoded
        return Optional.ofNullable(document)
                .map(encoded -> URLDecoder.decode(encoded, StandardCharsets.UTF_8))
                .map(this::read);
    }

    private ObjectNode denyAllAssumption() {
        ObjectNode deny = objectMapper.createObjectNode();
        deny.put("Effect", "Deny");
        deny.putObject("Principal").put("AWS", "*");
        deny.put("Action", "sts:AssumeRole");
        return deny;
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unparseable policy document: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode policy) {
        try {
            return objectMapper.writeValueAsString(policy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize policy document", e);
        }
    }

    private S3Client s3For(RemediationPlan plan) {
        return awsClientProvider.getS3ClientForBucket(account(plan), plan.getTargetRef().getResourceId());
    }

    private IamClient iamFor(RemediationPlan plan) {
        return awsClientProvider.getIamClient(account(plan));
    }

    private GovernedAccount account(RemediationPlan plan) {
        return governedAccountService.resolve(plan.getTargetRef().getAccountId());
    }
}

package com.xammer.guardrail.service.handler;

import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.service.AwsClientProvider;
import com.xammer.guardrail.service.GovernedAccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AccessKeyMetadata;
import software.amazon.awssdk.services.iam.model.ListAccessKeysRequest;
import software.amazon.awssdk.services.iam.model.StatusType;
import software.amazon.awssdk.services.iam.model.UpdateAccessKeyRequest;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sets an IAM user's unused access keys to Inactive. When the finding names
 * specific keys only those are touched; otherwise every key of the user is.
 */
@Component
public class DisableUnusedCredentialHandler implements RemediationHandler {

    private static final Logger logger = LoggerFactory.getLogger(DisableUnusedCredentialHandler.class);

    private final AwsClientProvider awsClientProvider;
    private final GovernedAccountService governedAccountService;

    public DisableUnusedCredentialHandler(AwsClientProvider awsClientProvider,
                                          GovernedAccountService governedAccountService) {
        this.awsClientProvider = awsClientProvider;
        this.governedAccountService = governedAccountService;
    }

    @Override
    public RemediationAction action() {
        return RemediationAction.DISABLE_UNUSED_CREDENTIAL;
    }

    @Override
    public boolean supports(RemediationPlan plan) {
        return plan.getTargetRef().is("iam", "user");
    }

    @Override
    public boolean isSatisfied(RemediationPlan plan) {
        return targetKeys(plan).stream().noneMatch(key -> key.status() == StatusType.ACTIVE);
    }

    @Override
    public void apply(RemediationPlan plan) {
        String userName = plan.getTargetRef().getName();
        IamClient iam = iamFor(plan);
        for (AccessKeyMetadata key : targetKeys(plan)) {
            if (key.status() == StatusType.ACTIVE) {
                logger.info("Deactivating access key {} of user {} for finding {}",
                        key.accessKeyId(), userName, plan.getFindingId());
                iam.updateAccessKey(UpdateAccessKeyRequest.builder()
                        .userName(userName)
                        .accessKeyId(key.accessKeyId())
                        .status(StatusType.INACTIVE)
                        .build());
            }
        }
    }

    private List<AccessKeyMetadata> targetKeys(RemediationPlan plan) {
        Set<String> requested = requestedKeyIds(plan.getAttributes());
        List<AccessKeyMetadata> keys = iamFor(plan)
                .listAccessKeys(ListAccessKeysRequest.builder().userName(plan.getTargetRef().getName()).build())
                .accessKeyMetadata();
        if (requested.isEmpty()) {
            return keys;
        }
        return keys.stream()
                .filter(key -> requested.contains(key.accessKeyId()))
                .collect(Collectors.toList());
    }

    /**
     * Key ids named by the finding, either as a top-level {@code accessKeyId}
     * attribute or inside Access Analyzer's
     * {@code findingDetails[].unusedIamUserAccessKeyDetails}.
     */
    static Set<String> requestedKeyIds(Map<String, Object> attributes) {
        Set<String> ids = new LinkedHashSet<>();
        if (attributes == null) {
            return ids;
        }
        Object direct = attributes.get("accessKeyId");
        if (direct != null) {
            ids.add(direct.toString());
        }
        Object details = attributes.get("findingDetails");
        if (details instanceof Collection) {
            for (Object detail : (Collection<?>) details) {
                if (detail instanceof Map) {
                    Object keyDetails = ((Map<?, ?>) detail).get("unusedIamUserAccessKeyDetails");
                    if (keyDetails instanceof Map && ((Map<?, ?>) keyDetails).get("accessKeyId") != null) {
                        ids.add(((Map<?, ?>) keyDetails).get("accessKeyId").toString());
                    }
                }
            }
        }
        return ids;
    }

    private IamClient iamFor(RemediationPlan plan) {
        return awsClientProvider.getIamClient(governedAccountService.resolve(plan.getTargetRef().getAccountId()));
    }
}

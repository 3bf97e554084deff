package com.xammer.guardrail.service.credential;

import com.xammer.guardrail.domain.CredentialRecord;
import com.xammer.guardrail.domain.CredentialStatus;
import com.xammer.guardrail.domain.GovernedAccount;
import com.xammer.guardrail.service.AwsClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AccessKeyLastUsed;
import software.amazon.awssdk.services.iam.model.AccessKeyMetadata;
import software.amazon.awssdk.services.iam.model.GetAccessKeyLastUsedRequest;
import software.amazon.awssdk.services.iam.model.IamException;
import software.amazon.awssdk.services.iam.model.ListAccessKeysRequest;
import software.amazon.awssdk.services.iam.model.ListUsersRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.StatusType;
import software.amazon.awssdk.services.iam.model.UpdateAccessKeyRequest;
import software.amazon.awssdk.services.iam.model.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * IAM user access keys of a governed account.
 */
@Service
public class IamCredentialInventory implements CredentialInventory {

    private static final Logger logger = LoggerFactory.getLogger(IamCredentialInventory.class);

    private final AwsClientProvider awsClientProvider;

    public IamCredentialInventory(AwsClientProvider awsClientProvider) {
        this.awsClientProvider = awsClientProvider;
    }

    @Override
    public List<CredentialRecord> listCredentials(GovernedAccount account) {
        IamClient iam = awsClientProvider.getIamClient(account);
        List<CredentialRecord> credentials = new ArrayList<>();
        for (User user : iam.listUsersPaginator(ListUsersRequest.builder().build()).users()) {
            for (AccessKeyMetadata key : iam.listAccessKeysPaginator(
                    ListAccessKeysRequest.builder().userName(user.userName()).build()).accessKeyMetadata()) {
                credentials.add(CredentialRecord.builder()
                        .accountId(account.getAccountId())
                        .ownerId(user.userName())
                        .credentialId(key.accessKeyId())
                        .createdAt(key.createDate())
                        .lastUsedAt(lastUsed(iam, key.accessKeyId()))
                        .status(toStatus(key.status()))
                        .build());
            }
        }
        logger.info("Account {}: found {} access keys", account.getAccountId(), credentials.size());
        return credentials;
    }

    @Override
    public CredentialStatus currentStatus(GovernedAccount account, CredentialRecord credential) {
        try {
            return awsClientProvider.getIamClient(account)
                    .listAccessKeys(ListAccessKeysRequest.builder().userName(credential.getOwnerId()).build())
                    .accessKeyMetadata().stream()
                    .filter(key -> key.accessKeyId().equals(credential.getCredentialId()))
                    .findFirst()
                    .map(key -> toStatus(key.status()))
                    .orElse(CredentialStatus.DEACTIVATED);
        } catch (NoSuchEntityException e) {
            // owning user was deleted, so its keys are gone too
            logger.info("User {} no longer exists; treating key {} as deactivated",
                    credential.getOwnerId(), credential.qualifiedId());
            return CredentialStatus.DEACTIVATED;
        }
    }

    @Override
    public void deactivate(GovernedAccount account, CredentialRecord credential) {
        awsClientProvider.getIamClient(account).updateAccessKey(UpdateAccessKeyRequest.builder()
                .userName(credential.getOwnerId())
                .accessKeyId(credential.getCredentialId())
                .status(StatusType.INACTIVE)
                .build());
    }

    // informational only, staleness is measured from creation
    private Instant lastUsed(IamClient iam, String accessKeyId) {
        try {
            AccessKeyLastUsed lastUsed = iam.getAccessKeyLastUsed(
                    GetAccessKeyLastUsedRequest.builder().accessKeyId(accessKeyId).build()).accessKeyLastUsed();
            return lastUsed == null ? null : lastUsed.lastUsedDate();
        } catch (IamException e) {
            logger.debug("Could not read last use of access key {}: {}", accessKeyId, e.getMessage());
            return null;
        }
    }

    private static CredentialStatus toStatus(StatusType status) {
        return status == StatusType.ACTIVE ? CredentialStatus.ACTIVE : CredentialStatus.DEACTIVATED;
    }
}

package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.GovernedAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.accessanalyzer.AccessAnalyzerClient;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds AWS clients scoped to a governed account, assuming the account's
 * remediation role through STS when one is configured.
 */
@Service
public class AwsClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    private static final String GLOBAL_S3_REGION = "us-east-1";

    private final StsClient stsClient;
    private final Map<String, SdkClient> clients = new ConcurrentHashMap<>();

    public AwsClientProvider(StsClient stsClient) {
        this.stsClient = stsClient;
        logger.info("AwsClientProvider initialized");
    }

    public AwsCredentialsProvider getCredentialsProvider(GovernedAccount account) {
        if (!account.requiresRoleAssumption()) {
            return DefaultCredentialsProvider.create();
        }
        String roleSessionName = "guardrail-session-" + account.getAccountId();
        logger.debug("Creating credentials provider for account {} with roleArn={}",
                account.getAccountId(), account.getRoleArn());
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(stsClient)
                .refreshRequest(req -> req
                        .roleArn(account.getRoleArn())
                        .externalId(account.getExternalId())
                        .roleSessionName(roleSessionName))
                .build();
    }

    public IamClient getIamClient(GovernedAccount account) {
        return getClient(IamClient.class, IamClient.builder(), account, Region.AWS_GLOBAL.id());
    }

    public S3Client getS3Client(GovernedAccount account, String region) {
        return getClient(S3Client.class, S3Client.builder(), account, region);
    }

    /**
     * S3 client in the bucket's home region. The location lookup goes through
     * us-east-1, which answers for every bucket.
     */
    public S3Client getS3ClientForBucket(GovernedAccount account, String bucket) {
        S3Client global = getS3Client(account, GLOBAL_S3_REGION);
        String region;
        try {
            String constraint = global.getBucketLocation(GetBucketLocationRequest.builder().bucket(bucket).build())
                    .locationConstraintAsString();
            region = (constraint == null || constraint.isEmpty()) ? GLOBAL_S3_REGION : constraint;
        } catch (S3Exception e) {
            region = e.awsErrorDetails() == null ? null : e.awsErrorDetails().sdkHttpResponse()
                    .firstMatchingHeader("x-amz-bucket-region")
                    .orElse(null);
            if (region == null) {
                throw e;
            }
        }
        return GLOBAL_S3_REGION.equals(region) ? global : getS3Client(account, region);
    }

    public AccessAnalyzerClient getAccessAnalyzerClient(GovernedAccount account, String region) {
        return getClient(AccessAnalyzerClient.class, AccessAnalyzerClient.builder(), account, region);
    }

    private <BuilderT extends AwsClientBuilder<BuilderT, ClientT>, ClientT extends SdkClient> ClientT getClient(
            Class<ClientT> clientClass, BuilderT builder, GovernedAccount account, String region) {
        String key = clientClass.getSimpleName() + ":" + account.getAccountId() + ":" + region;
        return clientClass.cast(clients.computeIfAbsent(key, k -> {
            logger.debug("Creating {} for account {} in region {}",
                    clientClass.getSimpleName(), account.getAccountId(), region);
            return builder
                    .credentialsProvider(getCredentialsProvider(account))
                    .region(Region.of(region))
                    .build();
        }));
    }
}

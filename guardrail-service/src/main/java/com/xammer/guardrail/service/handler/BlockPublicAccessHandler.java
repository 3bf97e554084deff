package com.xammer.guardrail.service.handler;

import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.service.AwsClientProvider;
import com.xammer.guardrail.service.GovernedAccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.PutPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Turns on all four S3 Block Public Access flags for a bucket.
 */
@Component
public class BlockPublicAccessHandler implements RemediationHandler {

    private static final Logger logger = LoggerFactory.getLogger(BlockPublicAccessHandler.class);

    private static final String NO_CONFIGURATION = "NoSuchPublicAccessBlockConfiguration";

    private final AwsClientProvider awsClientProvider;
    private final GovernedAccountService governedAccountService;

    public BlockPublicAccessHandler(AwsClientProvider awsClientProvider, GovernedAccountService governedAccountService) {
        this.awsClientProvider = awsClientProvider;
        this.governedAccountService = governedAccountService;
    }

    @Override
    public RemediationAction action() {
        return RemediationAction.BLOCK_PUBLIC_ACCESS;
    }

    @Override
    public boolean supports(RemediationPlan plan) {
        return plan.getTargetRef().is("s3", "bucket");
    }

    @Override
    public boolean isSatisfied(RemediationPlan plan) {
        String bucket = plan.getTargetRef().getResourceId();
        try {
            PublicAccessBlockConfiguration pab = s3For(plan)
                    .getPublicAccessBlock(GetPublicAccessBlockRequest.builder().bucket(bucket).build())
                    .publicAccessBlockConfiguration();
            return pab != null
                    && Boolean.TRUE.equals(pab.blockPublicAcls())
                    && Boolean.TRUE.equals(pab.ignorePublicAcls())
                    && Boolean.TRUE.equals(pab.blockPublicPolicy())
                    && Boolean.TRUE.equals(pab.restrictPublicBuckets());
        } catch (S3Exception e) {
            if (e.awsErrorDetails() != null && NO_CONFIGURATION.equals(e.awsErrorDetails().errorCode())) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void apply(RemediationPlan plan) {
        String bucket = plan.getTargetRef().getResourceId();
        logger.info("Blocking public access on bucket {} for finding {}", bucket, plan.getFindingId());
        s3For(plan).putPublicAccessBlock(PutPublicAccessBlockRequest.builder()
                .bucket(bucket)
                .publicAccessBlockConfiguration(PublicAccessBlockConfiguration.builder()
                        .blockPublicAcls(true)
                        .ignorePublicAcls(true)
                        .blockPublicPolicy(true)
                        .restrictPublicBuckets(true)
                        .build())
                .build());
    }

    private S3Client s3For(RemediationPlan plan) {
        return awsClientProvider.getS3ClientForBucket(
                governedAccountService.resolve(plan.getTargetRef().getAccountId()),
                plan.getTargetRef().getResourceId());
    }
}

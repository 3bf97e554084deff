package com.xammer.guardrail.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.guardrail.domain.GovernedAccount;
import com.xammer.guardrail.domain.ResourceRef;
import com.xammer.guardrail.exception.MalformedFindingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.accessanalyzer.model.Finding;
import software.amazon.awssdk.services.accessanalyzer.model.GetFindingRequest;
import software.amazon.awssdk.services.accessanalyzer.model.ResourceNotFoundException;

/**
 * Fetches the full record of an Access Analyzer finding when the inbound
 * notification only names it ({@code detail.id} plus {@code detail.analyzerArn}).
 * The analyzer's account and region come from its ARN.
 */
@Service
public class AccessAnalyzerFindingLoader {

    private static final Logger logger = LoggerFactory.getLogger(AccessAnalyzerFindingLoader.class);

    /** GetFinding only returns external access findings. */
    static final String EXTERNAL_ACCESS = "ExternalAccess";

    private final AwsClientProvider awsClientProvider;
    private final GovernedAccountService governedAccountService;
    private final ObjectMapper objectMapper;

    public AccessAnalyzerFindingLoader(AwsClientProvider awsClientProvider,
                                       GovernedAccountService governedAccountService,
                                       ObjectMapper objectMapper) {
        this.awsClientProvider = awsClientProvider;
        this.governedAccountService = governedAccountService;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a finding as a {@code detail}-shaped node.
     *
     * @throws MalformedFindingException when the analyzer ARN is unusable or the
     *                                   finding cannot be retrieved
     */
    public ObjectNode load(String analyzerArn, String findingId) {
        ResourceRef analyzer;
        try {
            analyzer = ResourceRef.parse(analyzerArn);
        } catch (IllegalArgumentException e) {
            throw new MalformedFindingException("Finding " + findingId + " names an invalid analyzer: " + analyzerArn,
                    findingId, e);
        }
        if (analyzer.getRegion() == null || analyzer.getAccountId() == null) {
            throw new MalformedFindingException("Finding " + findingId + " names an analyzer without region or account: "
                    + analyzerArn, findingId, null);
        }

        GovernedAccount account = governedAccountService.resolve(analyzer.getAccountId());
        logger.info("Loading finding {} from analyzer {}", findingId, analyzerArn);
        try {
            Finding finding = awsClientProvider.getAccessAnalyzerClient(account, analyzer.getRegion())
                    .getFinding(GetFindingRequest.builder().analyzerArn(analyzerArn).id(findingId).build())
                    .finding();
            return toDetail(finding);
        } catch (ResourceNotFoundException e) {
            throw new MalformedFindingException("Finding " + findingId + " was not found in analyzer " + analyzerArn,
                    findingId, e);
        } catch (SdkException e) {
            logger.error("Could not load finding {} from analyzer {}", findingId, analyzerArn, e);
            throw new MalformedFindingException("Finding " + findingId + " could not be loaded: " + e.getMessage(),
                    findingId, e);
        }
    }

    private ObjectNode toDetail(Finding finding) {
        ObjectNode detail = objectMapper.createObjectNode();
        detail.put("id", finding.id());
        detail.put("findingType", EXTERNAL_ACCESS);
        detail.put("resource", finding.resource());
        detail.put("resourceType", finding.resourceTypeAsString());
        detail.put("resourceOwnerAccount", finding.resourceOwnerAccount());
        detail.put("status", finding.statusAsString());
        if (finding.isPublic() != null) {
            detail.put("isPublic", finding.isPublic());
        }
        if (finding.createdAt() != null) {
            detail.put("createdAt", finding.createdAt().toString());
        }
        if (finding.analyzedAt() != null) {
            detail.put("analyzedAt", finding.analyzedAt().toString());
        }
        if (finding.hasPrincipal()) {
            detail.set("principal", objectMapper.valueToTree(finding.principal()));
        }
        if (finding.hasAction()) {
            detail.set("action", objectMapper.valueToTree(finding.action()));
        }
        if (finding.hasCondition()) {
            detail.set("condition", objectMapper.valueToTree(finding.condition()));
        }
        return detail;
    }
}

package com.xammer.guardrail.service;

import com.xammer.guardrail.config.GuardrailProperties;
import com.xammer.guardrail.domain.GovernedAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.AccountStatus;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of accounts the service may act in: the configured list, plus the
 * active members of the organization when discovery is switched on.
 * Configured entries take precedence over discovered ones. With neither,
 * the service governs only the account its own credentials belong to.
 */
@Service
public class GovernedAccountService {

    private static final Logger logger = LoggerFactory.getLogger(GovernedAccountService.class);

    private final GuardrailProperties.Accounts config;
    private final ObjectProvider<OrganizationsClient> organizationsClient;
    private final StsClient stsClient;

    public GovernedAccountService(GuardrailProperties properties, ObjectProvider<OrganizationsClient> organizationsClient,
                                  StsClient stsClient) {
        this.config = properties.getAccounts();
        this.organizationsClient = organizationsClient;
        this.stsClient = stsClient;
    }

    public List<GovernedAccount> governedAccounts() {
        Map<String, GovernedAccount> accounts = new LinkedHashMap<>();
        for (GuardrailProperties.GovernedAccountEntry entry : config.getGoverned()) {
            accounts.put(entry.getAccountId(),
                    new GovernedAccount(entry.getAccountId(), entry.getRoleArn(), entry.getExternalId()));
        }
        if (config.getOrganizations().isDiscover()) {
            for (GovernedAccount discovered : discoverOrganizationAccounts()) {
                accounts.putIfAbsent(discovered.getAccountId(), discovered);
            }
        }
        if (accounts.isEmpty()) {
            GovernedAccount self = GovernedAccount.local(callerAccountId());
            logger.info("No governed accounts configured, using the service's own account {}", self.getAccountId());
            accounts.put(self.getAccountId(), self);
        }
        return new ArrayList<>(accounts.values());
    }

    /**
     * Account to act in for a finding. Unknown or missing account ids fall
     * back to the service's own credentials.
     */
    public GovernedAccount resolve(String accountId) {
        if (accountId != null) {
            for (GuardrailProperties.GovernedAccountEntry entry : config.getGoverned()) {
                if (accountId.equals(entry.getAccountId())) {
                    return new GovernedAccount(entry.getAccountId(), entry.getRoleArn(), entry.getExternalId());
                }
            }
            if (config.getOrganizations().isDiscover()) {
                return organizationRoleFor(accountId);
            }
        }
        return GovernedAccount.local(accountId);
    }

    private List<GovernedAccount> discoverOrganizationAccounts() {
        OrganizationsClient client = organizationsClient.getIfAvailable();
        if (client == null) {
            logger.warn("Organization discovery is enabled but no OrganizationsClient is configured");
            return List.of();
        }
        List<GovernedAccount> discovered = new ArrayList<>();
        client.listAccountsPaginator(ListAccountsRequest.builder().build()).accounts().forEach(account -> {
            if (account.status() == AccountStatus.ACTIVE) {
                discovered.add(organizationRoleFor(account.id()));
            }
        });
        logger.info("Discovered {} active organization accounts", discovered.size());
        return discovered;
    }

    private String callerAccountId() {
        return stsClient.getCallerIdentity(GetCallerIdentityRequest.builder().build()).account();
    }

    private GovernedAccount organizationRoleFor(String accountId) {
        GuardrailProperties.Organizations org = config.getOrganizations();
        return new GovernedAccount(accountId,
                String.format("arn:aws:iam::%s:role/%s", accountId, org.getRoleName()),
                org.getExternalId());
    }
}

package com.xammer.guardrail.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An AWS account the service may remediate in. A null roleArn means the
 * service's own credentials are used directly.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GovernedAccount {

    private String accountId;
    private String roleArn;
    private String externalId;

    public static GovernedAccount local(String accountId) {
        return new GovernedAccount(accountId, null, null);
    }

    public boolean requiresRoleAssumption() {
        return roleArn != null && !roleArn.isBlank();
    }
}

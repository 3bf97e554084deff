package com.xammer.guardrail.service.credential;

import com.xammer.guardrail.domain.CredentialRecord;
import com.xammer.guardrail.domain.CredentialStatus;
import com.xammer.guardrail.domain.GovernedAccount;

import java.util.List;

/**
 * Source and sink of long-lived credentials for the hygiene scan.
 */
public interface CredentialInventory {

    List<CredentialRecord> listCredentials(GovernedAccount account);

    /** Live status, read fresh from the account. A credential that no longer exists reports DEACTIVATED. */
    CredentialStatus currentStatus(GovernedAccount account, CredentialRecord credential);

    void deactivate(GovernedAccount account, CredentialRecord credential);
}

package com.flagship.asset_issuance.orchestration;

import com.flagship.asset_issuance.issuance.IssuanceResult;
import lombok.Value;

/**
 * Result of {@link OrchestrationFacade#ensureAccountsThenIssue}. The issuance
 * is null when setup failed, since no transaction was attempted.
 */
@Value
public class SetupAndIssueResult {
    SetupResult setup;
    IssuanceResult issuance;

    public boolean isSuccess() {
        return setup.isSuccess() && issuance != null && issuance.isSuccess();
    }
}

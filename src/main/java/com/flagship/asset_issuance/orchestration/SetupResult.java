package com.flagship.asset_issuance.orchestration;

import com.flagship.asset_issuance.account.FundingOutcome;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of provisioning both roles. Carries public keys only.
 */
@Value
@Builder
public class SetupResult {
    OperationStatus status;
    String message;
    ErrorKind errorKind;
    String issuerPublicKey;
    String distributorPublicKey;
    FundingOutcome issuerFunding;
    FundingOutcome distributorFunding;

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }
}

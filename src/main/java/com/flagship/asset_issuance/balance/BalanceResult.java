package com.flagship.asset_issuance.balance;

import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Holding of one asset by one account.
 *
 * A missing trustline is a success with a zero balance and a message; only a
 * failed account lookup is an error.
 */
@Value
@Builder
public class BalanceResult {

    public static final String ZERO_BALANCE = "0.0000000";

    OperationStatus status;
    String accountId;
    String assetCode;
    String assetIssuer;
    String balance;
    String message;
    ErrorKind errorKind;

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }

    public static BalanceResult error(String accountId, String assetCode, ErrorKind kind, String message) {
        return BalanceResult.builder()
            .status(OperationStatus.ERROR)
            .accountId(accountId)
            .assetCode(assetCode)
            .errorKind(kind)
            .message(message)
            .build();
    }
}

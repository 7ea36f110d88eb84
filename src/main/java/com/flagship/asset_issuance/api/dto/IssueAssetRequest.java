package com.flagship.asset_issuance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /issue-asset}.
 *
 * The amount stays a string so that its exact decimal form reaches the
 * ledger; numeric JSON values are coerced by Jackson.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueAssetRequest {

    @NotBlank(message = "Missing 'amount' in request body")
    @JsonProperty("amount")
    private String amount;
}

package com.flagship.asset_issuance.api;

import com.flagship.asset_issuance.api.dto.BalanceResponse;
import com.flagship.asset_issuance.api.dto.IssueAssetRequest;
import com.flagship.asset_issuance.api.dto.IssueAssetResponse;
import com.flagship.asset_issuance.api.dto.SetupAccountsResponse;
import com.flagship.asset_issuance.balance.BalanceResult;
import com.flagship.asset_issuance.issuance.IssuanceResult;
import com.flagship.asset_issuance.orchestration.OrchestrationFacade;
import com.flagship.asset_issuance.orchestration.SetupResult;
import com.flagship.asset_issuance.result.ErrorKind;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints for account setup, issuance and balance lookups.
 *
 * Status codes:
 * - 200 for successful operations, including a zero balance
 * - 400 for validation failures (bad amount, accounts or issuer not set up)
 * - 500 for setup, ledger and lookup failures
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class IssuanceController {

    private final OrchestrationFacade facade;

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/setup-accounts", "GET - Generates and funds (Testnet) Issuer and Distributor accounts.");
        endpoints.put("/issue-asset", "POST - {\"amount\": \"1000\"} - Issues the custom asset from Issuer to Distributor.");
        endpoints.put("/check-balance/{accountId}", "GET - Balance of the custom asset for the account.");
        endpoints.put("/check-xlm-balance/{accountId}", "GET - XLM balance for the account.");
        endpoints.put("/health", "GET - Horizon reachability.");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Stellar Asset Issuance API");
        response.put("endpoints", endpoints);
        response.put("notes", "Run /setup-accounts first if no account secrets are configured.");
        return response;
    }

    @GetMapping("/setup-accounts")
    public ResponseEntity<SetupAccountsResponse> setupAccounts() {
        log.info("Received account setup request");
        SetupResult result = facade.setupAccounts();
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(SetupAccountsResponse.from(result));
    }

    @PostMapping("/issue-asset")
    public ResponseEntity<IssueAssetResponse> issueAsset(@Valid @RequestBody IssueAssetRequest request) {
        log.info("Received issuance request: amount={}", request.getAmount());
        IssuanceResult result = facade.issue(request.getAmount());
        return ResponseEntity.status(statusFor(result.isSuccess(), result.getErrorKind()))
            .body(IssueAssetResponse.from(result));
    }

    @GetMapping("/check-balance/{accountId}")
    public ResponseEntity<BalanceResponse> checkBalance(@PathVariable("accountId") String accountId) {
        BalanceResult result = facade.checkBalance(accountId);
        return ResponseEntity.status(statusFor(result.isSuccess(), result.getErrorKind()))
            .body(BalanceResponse.from(result));
    }

    @GetMapping("/check-xlm-balance/{accountId}")
    public ResponseEntity<BalanceResponse> checkNativeBalance(@PathVariable("accountId") String accountId) {
        BalanceResult result = facade.checkNativeBalance(accountId);
        return ResponseEntity.status(statusFor(result.isSuccess(), result.getErrorKind()))
            .body(BalanceResponse.from(result));
    }

    private static HttpStatus statusFor(boolean success, ErrorKind kind) {
        if (success) {
            return HttpStatus.OK;
        }
        return kind == ErrorKind.VALIDATION ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}

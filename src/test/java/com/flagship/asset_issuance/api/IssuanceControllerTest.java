package com.flagship.asset_issuance.api;

import com.flagship.asset_issuance.account.FundingClient;
import com.flagship.asset_issuance.ledger.AccountNotFoundException;
import com.flagship.asset_issuance.ledger.AccountSnapshot;
import com.flagship.asset_issuance.ledger.BalanceEntry;
import com.flagship.asset_issuance.ledger.LedgerClient;
import com.flagship.asset_issuance.ledger.LedgerUnavailableException;
import com.flagship.asset_issuance.ledger.TransactionOutcome;
import com.flagship.asset_issuance.observability.CorrelationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.stellar.sdk.KeyPair;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface tests.
 *
 * These tests verify:
 * - Status codes: 200 on success, 400 on validation, 500 on ledger failures
 * - Responses carry public keys and hashes but never a secret seed
 * - The correlation ID is echoed on every response
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class IssuanceControllerTest {

    private static final Pattern SECRET_SEED = Pattern.compile("S[A-Z2-7]{55}");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerClient ledgerClient;

    @MockBean
    private FundingClient fundingClient;

    private final AtomicInteger hashes = new AtomicInteger();

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        when(ledgerClient.loadAccount(anyString())).thenAnswer(invocation -> new AccountSnapshot(
                invocation.getArgument(0), 1L, List.of(BalanceEntry.nativeBalance("10000.0000000"))));
        when(ledgerClient.fetchBaseFee()).thenReturn(100L);
        when(ledgerClient.submit(any())).thenAnswer(invocation ->
                TransactionOutcome.accepted("hash-" + hashes.incrementAndGet()));
    }

    @Test
    @DisplayName("GET / describes the endpoints")
    void testHome() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").exists())
            .andExpect(jsonPath("$.endpoints['/setup-accounts']").exists());
    }

    @Test
    @DisplayName("Setup returns public keys and funding outcomes, never a secret")
    void testSetupAccounts() throws Exception {
        printTestHeader("Setup Accounts");

        String body = mockMvc.perform(get("/setup-accounts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.issuer_public_key", startsWith("G")))
            .andExpect(jsonPath("$.distributor_public_key", startsWith("G")))
            .andExpect(jsonPath("$.issuer_funding_status", containsString("funded successfully")))
            .andExpect(jsonPath("$.distributor_funding_status", containsString("funded successfully")))
            .andReturn().getResponse().getContentAsString();
        printOutput("Response", body);

        assertFalse(SECRET_SEED.matcher(body).find());
        assertFalse(body.toLowerCase().contains("secret"));
        printSuccess("No secret seed in the response");
    }

    @Test
    @DisplayName("Issue before setup is rejected with 400")
    void testIssueBeforeSetup() throws Exception {
        mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": \"1000\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message", startsWith("Accounts not initialized")));

        verify(ledgerClient, never()).submit(any());
    }

    @Test
    @DisplayName("Setup then issue returns both transaction hashes")
    void testSetupThenIssue() throws Exception {
        printTestHeader("Setup Then Issue");

        mockMvc.perform(get("/setup-accounts")).andExpect(status().isOk());

        String body = mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": \"1000\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.trustline_tx").value("hash-1"))
            .andExpect(jsonPath("$.payment_tx").value("hash-2"))
            .andExpect(jsonPath("$.message", startsWith("Asset TESTTOKEN issued and 1000 sent to G")))
            .andReturn().getResponse().getContentAsString();
        printOutput("Response", body);

        assertFalse(SECRET_SEED.matcher(body).find());
        printSuccess("Issued with two transactions");
    }

    @Test
    @DisplayName("Numeric amount is accepted")
    void testNumericAmount() throws Exception {
        mockMvc.perform(get("/setup-accounts")).andExpect(status().isOk());

        mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 25}"))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Missing amount is rejected with 400")
    void testMissingAmount() throws Exception {
        mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Missing 'amount' in request body"));

        mockMvc.perform(post("/issue-asset").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Invalid amount is rejected with 400 before any submission")
    void testInvalidAmount() throws Exception {
        mockMvc.perform(get("/setup-accounts")).andExpect(status().isOk());

        mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": \"1.123456789\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.failure_stage").value("VALIDATION"));

        verify(ledgerClient, never()).submit(any());
    }

    @Test
    @DisplayName("Trustline rejection returns 500 with the failed stage")
    void testTrustlineRejected() throws Exception {
        mockMvc.perform(get("/setup-accounts")).andExpect(status().isOk());
        when(ledgerClient.submit(any())).thenReturn(TransactionOutcome.rejected("tx_failed [op_low_reserve]"));

        mockMvc.perform(post("/issue-asset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": \"1000\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.failure_stage").value("TRUSTLINE"))
            .andExpect(jsonPath("$.error_kind").value("SUBMISSION"))
            .andExpect(jsonPath("$.trustline_tx").doesNotExist())
            .andExpect(jsonPath("$.message").value("Error creating trustline: tx_failed [op_low_reserve]"));
    }

    @Test
    @DisplayName("Custom balance before setup is rejected with 400")
    void testCheckBalanceWithoutIssuer() throws Exception {
        mockMvc.perform(get("/check-balance/" + KeyPair.random().getAccountId()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", startsWith("Issuer public key not set")));
    }

    @Test
    @DisplayName("Custom balance without a trustline is zero")
    void testCheckBalanceZero() throws Exception {
        mockMvc.perform(get("/setup-accounts")).andExpect(status().isOk());
        String accountId = KeyPair.random().getAccountId();

        mockMvc.perform(get("/check-balance/" + accountId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.asset_code").value("TESTTOKEN"))
            .andExpect(jsonPath("$.balance").value("0.0000000"))
            .andExpect(jsonPath("$.message", containsString("not found or balance is zero")));
    }

    @Test
    @DisplayName("XLM balance is read from the native entry")
    void testCheckNativeBalance() throws Exception {
        mockMvc.perform(get("/check-xlm-balance/" + KeyPair.random().getAccountId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.asset_code").value("XLM"))
            .andExpect(jsonPath("$.balance").value("10000.0000000"));
    }

    @Test
    @DisplayName("Unknown account is a 500 lookup error")
    void testUnknownAccount() throws Exception {
        String accountId = KeyPair.random().getAccountId();
        when(ledgerClient.loadAccount(accountId)).thenThrow(new AccountNotFoundException(accountId));

        mockMvc.perform(get("/check-xlm-balance/" + accountId))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.error_kind").value("LOOKUP"))
            .andExpect(jsonPath("$.balance").doesNotExist());
    }

    @Test
    @DisplayName("Correlation ID is echoed back")
    void testCorrelationId() throws Exception {
        mockMvc.perform(get("/").header(CorrelationContext.CORRELATION_ID_HEADER, "req-42"))
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "req-42"));

        mockMvc.perform(get("/"))
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("Health reports Horizon reachability")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.horizon").value("UP"));

        when(ledgerClient.fetchBaseFee()).thenThrow(new LedgerUnavailableException("connection refused"));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"));
    }
}

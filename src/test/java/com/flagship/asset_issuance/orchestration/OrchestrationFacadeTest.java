package com.flagship.asset_issuance.orchestration;

import com.flagship.asset_issuance.account.AccountKeyStore;
import com.flagship.asset_issuance.account.FundingOutcome;
import com.flagship.asset_issuance.account.KeyProvisioner;
import com.flagship.asset_issuance.account.Role;
import com.flagship.asset_issuance.balance.BalanceInspector;
import com.flagship.asset_issuance.balance.BalanceResult;
import com.flagship.asset_issuance.config.StellarProperties;
import com.flagship.asset_issuance.issuance.AssetIssuanceWorkflow;
import com.flagship.asset_issuance.issuance.FailureStage;
import com.flagship.asset_issuance.issuance.IssuanceResult;
import com.flagship.asset_issuance.ledger.AssetPaymentOperation;
import com.flagship.asset_issuance.ledger.LedgerNetwork;
import com.flagship.asset_issuance.observability.IssuanceMetrics;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import com.flagship.asset_issuance.support.InMemoryLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.stellar.sdk.KeyPair;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end issuance scenarios against an in-memory ledger.
 *
 * ============================================================================
 * PURPOSE: Verify the whole setup → trustline → payment → balance flow
 * ============================================================================
 *
 * Scenarios:
 * A. Fresh test network run: both accounts funded, asset issued, balance visible
 * B. Distributor funding fails: setup stops, nothing is submitted
 * C. Payment fails after the trustline: the trustline hash is still reported
 *
 * Plus concurrent setups and concurrent issues against shared keys.
 */
class OrchestrationFacadeTest {

    private InMemoryLedger ledger;
    private AccountKeyStore keyStore;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        keyStore = new AccountKeyStore();
    }

    private OrchestrationFacade facade(LedgerNetwork network, String issuerSecret, String distributorSecret) {
        IssuanceMetrics metrics = new IssuanceMetrics(new SimpleMeterRegistry());
        StellarProperties properties = new StellarProperties(network.name(),
                "https://horizon-testnet.stellar.org", "https://horizon.stellar.org",
                "https://friendbot.stellar.org", "MYTOKEN", issuerSecret, distributorSecret, 180L,
                new StellarProperties.Http(Duration.ofSeconds(5), Duration.ofSeconds(60)));
        return new OrchestrationFacade(
                new KeyProvisioner(ledger),
                keyStore,
                new AssetIssuanceWorkflow(ledger, metrics),
                new BalanceInspector(ledger, metrics),
                network,
                properties,
                metrics);
    }

    private OrchestrationFacade testnetFacade() {
        return facade(LedgerNetwork.TESTNET, null, null);
    }

    @Nested
    @DisplayName("End-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("A. Fresh test network run issues 1000 MYTOKEN to the distributor")
        void testScenarioA() {
            printTestHeader("A. Fresh Testnet Run");
            OrchestrationFacade facade = testnetFacade();

            SetupResult setup = facade.setupAccounts();
            printOutput("Setup", setup);

            assertTrue(setup.isSuccess());
            assertEquals(FundingOutcome.Status.FUNDED, setup.getIssuerFunding().getStatus());
            assertEquals(FundingOutcome.Status.FUNDED, setup.getDistributorFunding().getStatus());
            assertNotEquals(setup.getIssuerPublicKey(), setup.getDistributorPublicKey());
            assertEquals(2, ledger.fundingCalls());

            IssuanceResult issuance = facade.issue("1000");
            printOutput("Issuance", issuance);

            assertTrue(issuance.isSuccess());
            assertNotNull(issuance.getTrustlineTxHash());
            assertNotNull(issuance.getPaymentTxHash());
            assertNotEquals(issuance.getTrustlineTxHash(), issuance.getPaymentTxHash());

            BalanceResult balance = facade.checkBalance(setup.getDistributorPublicKey());
            assertTrue(balance.isSuccess());
            assertEquals("1000.0000000", balance.getBalance());
            assertEquals(setup.getIssuerPublicKey(), balance.getAssetIssuer());

            BalanceResult xlm = facade.checkNativeBalance(setup.getDistributorPublicKey());
            assertEquals("10000.0000000", xlm.getBalance());
            printSuccess("Distributor holds 1000.0000000 MYTOKEN");
        }

        @Test
        @DisplayName("B. Distributor funding failure stops setup before any transaction")
        void testScenarioB() {
            printTestHeader("B. Distributor Funding Fails");
            ledger.failFundingAfter(1, "Friendbot request failed: status=500, body=unavailable");
            OrchestrationFacade facade = testnetFacade();

            SetupAndIssueResult result = facade.ensureAccountsThenIssue("1000");
            printOutput("Setup", result.getSetup());

            assertFalse(result.isSuccess());
            assertEquals(OperationStatus.ERROR, result.getSetup().getStatus());
            assertEquals(ErrorKind.ACCOUNT_STATE, result.getSetup().getErrorKind());
            assertTrue(result.getSetup().getMessage().startsWith("Failed to fund distributor: "));
            assertNull(result.getIssuance());
            assertEquals(0, ledger.submissionCount());
            assertFalse(keyStore.isBound(Role.DISTRIBUTOR));
            printSuccess("No trustline or payment attempted");
        }

        @Test
        @DisplayName("C. Payment failure after the trustline reports the trustline hash")
        void testScenarioC() {
            printTestHeader("C. Payment Fails After Trustline");
            OrchestrationFacade facade = testnetFacade();
            assertTrue(facade.setupAccounts().isSuccess());
            ledger.rejectNext(AssetPaymentOperation.class, "tx_insufficient_balance");

            IssuanceResult result = facade.issue("1000");
            printOutput("Issuance", result);

            assertFalse(result.isSuccess());
            assertEquals(FailureStage.PAYMENT, result.getFailureStage());
            assertNotNull(result.getTrustlineTxHash());
            assertNull(result.getPaymentTxHash());
            printSuccess("Trustline hash retained, payment hash absent");
        }
    }

    @Nested
    @DisplayName("Account setup")
    class Setup {

        @Test
        @DisplayName("Partial setup is left as-is and a rerun only provisions the missing role")
        void testRerunAfterPartialFailure() {
            ledger.failFundingAfter(1, "Friendbot request error: connection refused");
            OrchestrationFacade facade = testnetFacade();

            SetupResult failed = facade.setupAccounts();
            assertFalse(failed.isSuccess());
            String issuerKey = failed.getIssuerPublicKey();
            assertNotNull(issuerKey);

            ledger.failFundingAfter(0, null);
            SetupResult rerun = facade.setupAccounts();

            assertTrue(rerun.isSuccess());
            assertEquals(issuerKey, rerun.getIssuerPublicKey());
            assertEquals(FundingOutcome.Status.PRE_CONFIGURED, rerun.getIssuerFunding().getStatus());
            assertEquals(FundingOutcome.Status.FUNDED, rerun.getDistributorFunding().getStatus());
            assertEquals(3, ledger.fundingCalls());
        }

        @Test
        @DisplayName("Configured secrets are used and never funded")
        void testConfiguredSecrets() {
            KeyPair issuer = KeyPair.random();
            KeyPair distributor = KeyPair.random();
            ledger.createAccount(issuer.getAccountId(), "100");
            ledger.createAccount(distributor.getAccountId(), "100");
            OrchestrationFacade facade = facade(LedgerNetwork.TESTNET,
                    new String(issuer.getSecretSeed()), new String(distributor.getSecretSeed()));

            SetupResult setup = facade.setupAccounts();

            assertTrue(setup.isSuccess());
            assertEquals(issuer.getAccountId(), setup.getIssuerPublicKey());
            assertEquals(distributor.getAccountId(), setup.getDistributorPublicKey());
            assertEquals(FundingOutcome.Status.PRE_CONFIGURED, setup.getIssuerFunding().getStatus());
            assertEquals(0, ledger.fundingCalls());
        }

        @Test
        @DisplayName("Configured secrets allow issuing without an explicit setup")
        void testIssueWithConfiguredSecrets() {
            KeyPair issuer = KeyPair.random();
            KeyPair distributor = KeyPair.random();
            ledger.createAccount(issuer.getAccountId(), "100");
            ledger.createAccount(distributor.getAccountId(), "100");
            OrchestrationFacade facade = facade(LedgerNetwork.TESTNET,
                    new String(issuer.getSecretSeed()), new String(distributor.getSecretSeed()));

            IssuanceResult result = facade.issue("12.5");

            assertTrue(result.isSuccess());
            assertEquals(0, ledger.fundingCalls());
        }

        @Test
        @DisplayName("Malformed configured secret fails setup without funding")
        void testMalformedSecret() {
            OrchestrationFacade facade = facade(LedgerNetwork.TESTNET, "SNOTAVALIDSEED", null);

            SetupResult setup = facade.setupAccounts();

            assertFalse(setup.isSuccess());
            assertEquals(ErrorKind.VALIDATION, setup.getErrorKind());
            assertFalse(setup.getMessage().contains("SNOTAVALIDSEED"));
            assertEquals(0, ledger.fundingCalls());

            IssuanceResult issuance = facade.issue("10");
            assertEquals(ErrorKind.CONFIGURATION, issuance.getErrorKind());
            assertNull(issuance.getFailureStage());
        }

        @Test
        @DisplayName("Public network reports manual funding and never calls the faucet")
        void testPublicNetwork() {
            OrchestrationFacade facade = facade(LedgerNetwork.PUBLIC, null, null);

            SetupResult setup = facade.setupAccounts();

            assertTrue(setup.isSuccess());
            assertEquals(FundingOutcome.Status.MANUAL_FUNDING_REQUIRED, setup.getIssuerFunding().getStatus());
            assertEquals(FundingOutcome.Status.MANUAL_FUNDING_REQUIRED, setup.getDistributorFunding().getStatus());
            assertEquals(0, ledger.fundingCalls());
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class Preconditions {

        @Test
        @DisplayName("Issue before setup is a validation error")
        void testIssueBeforeSetup() {
            IssuanceResult result = testnetFacade().issue("1000");

            assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
            assertTrue(result.getMessage().startsWith("Accounts not initialized"));
            assertEquals(0, ledger.loadCalls());
        }

        @Test
        @DisplayName("Custom balance needs a known issuer")
        void testCheckBalanceWithoutIssuer() {
            BalanceResult result = testnetFacade().checkBalance(KeyPair.random().getAccountId());

            assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
            assertEquals(0, ledger.loadCalls());
        }

        @Test
        @DisplayName("Invalid amount after setup never reaches the ledger")
        void testInvalidAmount() {
            OrchestrationFacade facade = testnetFacade();
            facade.setupAccounts();

            IssuanceResult result = facade.issue("-1");

            assertEquals(FailureStage.VALIDATION, result.getFailureStage());
            assertEquals(0, ledger.submissionCount());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent setups bind a single keypair per role")
        void testConcurrentSetups() throws Exception {
            printTestHeader("Concurrent Setups");
            OrchestrationFacade facade = testnetFacade();
            int threads = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            List<Future<SetupResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return facade.setupAccounts();
                }));
            }
            start.countDown();

            List<SetupResult> results = new ArrayList<>();
            for (Future<SetupResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            executor.shutdown();

            Set<String> issuers = results.stream().map(SetupResult::getIssuerPublicKey).collect(Collectors.toSet());
            Set<String> distributors = results.stream().map(SetupResult::getDistributorPublicKey).collect(Collectors.toSet());
            assertTrue(results.stream().allMatch(SetupResult::isSuccess));
            assertEquals(1, issuers.size());
            assertEquals(1, distributors.size());
            assertEquals(2, ledger.fundingCalls());
            assertEquals(2, ledger.accountCount());
            printSuccess("One account per role despite " + threads + " concurrent setups");
        }

        @Test
        @DisplayName("Issue and balance lookups do not wait for a setup that is still funding")
        void testReadsDuringSlowSetup() throws Exception {
            printTestHeader("Reads During Slow Setup");
            OrchestrationFacade facade = testnetFacade();
            CountDownLatch distributorFunding = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ledger.onFund(publicKey -> {
                if (ledger.fundingCalls() == 2) {
                    distributorFunding.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            ExecutorService executor = Executors.newFixedThreadPool(2);
            Future<SetupResult> setup = executor.submit(facade::setupAccounts);
            assertTrue(distributorFunding.await(5, TimeUnit.SECONDS));

            String issuer = keyStore.find(Role.ISSUER).orElseThrow().getPublicKey();
            try {
                BalanceResult nativeBalance = executor.submit(() -> facade.checkNativeBalance(issuer))
                        .get(2, TimeUnit.SECONDS);
                BalanceResult customBalance = executor.submit(() -> facade.checkBalance(issuer))
                        .get(2, TimeUnit.SECONDS);
                IssuanceResult issuance = executor.submit(() -> facade.issue("1"))
                        .get(2, TimeUnit.SECONDS);
                printOutput("Native balance", nativeBalance);
                printOutput("Issuance", issuance);

                assertEquals(OperationStatus.SUCCESS, nativeBalance.getStatus());
                assertNotNull(customBalance.getStatus());
                assertEquals(ErrorKind.VALIDATION, issuance.getErrorKind());
                assertTrue(issuance.getMessage().startsWith("Accounts not initialized"));
                assertEquals(0, ledger.submissionCount());
            } finally {
                release.countDown();
            }

            assertTrue(setup.get(10, TimeUnit.SECONDS).isSuccess());
            executor.shutdown();
            printSuccess("Lookups completed while setup held the key store lock");
        }

        @Test
        @DisplayName("Concurrent issues race on the sequence number and the loser is not retried")
        void testConcurrentIssues() throws Exception {
            printTestHeader("Concurrent Issues");
            OrchestrationFacade facade = testnetFacade();
            SetupResult setup = facade.setupAccounts();
            String distributor = setup.getDistributorPublicKey();

            CountDownLatch bothLoaded = new CountDownLatch(2);
            ledger.onLoad(accountId -> {
                if (accountId.equals(distributor)) {
                    bothLoaded.countDown();
                    try {
                        bothLoaded.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            ExecutorService executor = Executors.newFixedThreadPool(2);
            Callable<IssuanceResult> issue = () -> facade.issue("10");
            Future<IssuanceResult> first = executor.submit(issue);
            Future<IssuanceResult> second = executor.submit(issue);
            List<IssuanceResult> results = List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));
            executor.shutdown();
            printOutput("Results", results);

            List<IssuanceResult> failures = results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
            assertEquals(1, results.stream().filter(IssuanceResult::isSuccess).count());
            assertEquals(1, failures.size());
            assertEquals(FailureStage.TRUSTLINE, failures.get(0).getFailureStage());
            assertTrue(failures.get(0).getMessage().contains("tx_bad_seq"));
            assertEquals(3, ledger.submissionCount());
            printSuccess("Exactly one sequence conflict, no retry");
        }
    }
}

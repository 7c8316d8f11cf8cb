package com.ias.distributor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ias.distributor.crypto.TestSigner;
import com.ias.distributor.dto.LedgerInfoDto;
import com.ias.distributor.dto.SettlementResult;
import com.ias.distributor.entity.AffiliateTotal;
import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.entity.SettlementEventType;
import com.ias.distributor.entity.SettlementPath;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import com.ias.distributor.gateway.AssetTransferGateway;
import com.ias.distributor.gateway.CustodyLedgerGateway;
import com.ias.distributor.gateway.TransferReceipt;
import com.ias.distributor.repository.*;
import com.ias.distributor.service.*;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
class DistributorIntegrationTest {

    private static final String LEDGER = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    private static final String OTHER_LEDGER = "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512";
    private static final String X = "0x1111111111111111111111111111111111111111";
    private static final String Y = "0x2222222222222222222222222222222222222222";
    private static final String REJECTING = "rejecting";

    private final TestSigner authority = new TestSigner(TestSigner.DEV_KEY_0);
    private final TestSigner successor = new TestSigner(TestSigner.DEV_KEY_1);

    @Autowired
    private LedgerStateService ledgerStateService;

    @Autowired
    private RewardClaimService rewardClaimService;

    @Autowired
    private BatchDistributionService batchDistributionService;

    @Autowired
    private DistributorAdminService adminService;

    @Autowired
    private CustodyLedgerGateway custody;

    @Autowired
    private DistributorStateRepository stateRepository;

    @Autowired
    private RewardClaimRepository claimRepository;

    @Autowired
    private AffiliateTotalRepository totalRepository;

    @Autowired
    private SettlementEventRepository eventRepository;

    @Autowired
    private CustodyAccountRepository custodyAccountRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @TestConfiguration
    static class RejectingGatewayConfig {

        /** Reports plenty of funds but refuses every transfer. */
        @Bean
        AssetTransferGateway rejectingGateway() {
            return new AssetTransferGateway() {
                @Override
                public String handle() {
                    return REJECTING;
                }

                @Override
                public TransferReceipt transfer(String from, String to, BigInteger amount) {
                    return TransferReceipt.failed(to, amount, "asset ledger unavailable");
                }

                @Override
                public TransferReceipt deposit(String account, BigInteger amount) {
                    return TransferReceipt.failed(account, amount, "funded on the asset ledger itself");
                }

                @Override
                public BigInteger balanceOf(String account) {
                    return BigInteger.valueOf(1_000_000);
                }
            };
        }
    }

    @BeforeEach
    void resetLedger() {
        eventRepository.deleteAll();
        claimRepository.deleteAll();
        totalRepository.deleteAll();
        custodyAccountRepository.deleteAll();

        DistributorState state = stateRepository.findById(DistributorState.SINGLETON_ID).orElseThrow();
        state.setLedgerAddress(LEDGER);
        state.setAuthorityAddress(authority.address());
        state.setAssetReference(CustodyLedgerGateway.HANDLE);
        state.setGlobalTotal(BigInteger.ZERO);
        stateRepository.save(state);
    }

    @Test
    void initializesLedgerFromConfiguration() {
        LedgerInfoDto info = ledgerStateService.ledgerInfo();

        assertThat(info.getLedgerAddress()).isEqualTo(LEDGER);
        assertThat(info.getAuthorityAddress()).isEqualTo(authority.address());
        assertThat(info.getAssetReference()).isEqualTo(CustodyLedgerGateway.HANDLE);
        assertThat(info.getAvailableAssetReferences()).contains(CustodyLedgerGateway.HANDLE, REJECTING);
    }

    @Test
    void signedClaimSettlesOnceAndReplayIsRejected() {
        fund(500);
        String signature = authority.signClaim(X, amount(100), 5, LEDGER);

        SettlementResult result = rewardClaimService.claim(X, amount(100), 5, signature);

        assertThat(result.getPath()).isEqualTo(SettlementPath.CLAIM);
        assertThat(ledgerStateService.hasClaimed(X, 5)).isTrue();
        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(amount(100));
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(400));
        assertThat(custody.balanceOf(X)).isEqualTo(amount(100));

        assertFailsWith(ErrorCode.ALREADY_CLAIMED, () -> rewardClaimService.claim(X, amount(100), 5, signature));

        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(400));
        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(amount(100));
        assertThat(eventRepository.findByType(SettlementEventType.REWARD_CLAIMED)).hasSize(1);
    }

    @Test
    void batchExceedingBalanceSettlesNobody() {
        fund(100);

        assertFailsWith(ErrorCode.INSUFFICIENT_BALANCE,
                () -> batchDistributionService.batchDistribute(authority.address(), List.of(X, Y),
                        List.of(amount(50), amount(70)), 1));

        assertThat(ledgerStateService.hasClaimed(X, 1)).isFalse();
        assertThat(ledgerStateService.hasClaimed(Y, 1)).isFalse();
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(100));
    }

    @Test
    void fundedBatchSettlesEveryEntry() {
        fund(200);

        batchDistributionService.batchDistribute(authority.address(), List.of(X, Y),
                List.of(amount(50), amount(70)), 1);

        assertThat(ledgerStateService.hasClaimed(X, 1)).isTrue();
        assertThat(ledgerStateService.hasClaimed(Y, 1)).isTrue();
        assertThat(ledgerStateService.globalTotal()).isEqualTo(amount(120));
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(80));
        assertThat(custody.balanceOf(X)).isEqualTo(amount(50));
        assertThat(custody.balanceOf(Y)).isEqualTo(amount(70));
        assertThat(eventRepository.findByType(SettlementEventType.REWARD_DISTRIBUTED)).hasSize(2);
        assertThat(eventRepository.findByType(SettlementEventType.BATCH_REWARD_DISTRIBUTED))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getRecipientCount()).isEqualTo(2);
                    assertThat(e.getAmount()).isEqualTo(amount(120));
                });
    }

    @Test
    void batchContainingClaimedPairIsRejectedInFull() {
        fund(500);
        rewardClaimService.claim(X, amount(100), 1, authority.signClaim(X, amount(100), 1, LEDGER));

        assertFailsWith(ErrorCode.ALREADY_CLAIMED,
                () -> batchDistributionService.batchDistribute(authority.address(), List.of(Y, X),
                        List.of(amount(70), amount(50)), 1));

        assertThat(ledgerStateService.hasClaimed(Y, 1)).isFalse();
        assertThat(ledgerStateService.affiliateTotal(Y)).isEqualTo(BigInteger.ZERO);
        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(amount(100));
        assertThat(ledgerStateService.globalTotal()).isEqualTo(amount(100));
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(400));
        assertThat(eventRepository.findByType(SettlementEventType.REWARD_DISTRIBUTED)).isEmpty();
    }

    @Test
    void duplicateAffiliateWithinBatchIsRejected() {
        fund(500);

        assertFailsWith(ErrorCode.ALREADY_CLAIMED,
                () -> batchDistributionService.batchDistribute(authority.address(), List.of(X, X),
                        List.of(amount(10), amount(20)), 2));

        assertThat(ledgerStateService.hasClaimed(X, 2)).isFalse();
        assertThat(ledgerStateService.globalTotal()).isEqualTo(BigInteger.ZERO);
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(500));
    }

    @Test
    void claimAfterBatchForSameEpochIsRejected() {
        fund(500);
        batchDistributionService.batchDistribute(authority.address(), List.of(X), List.of(amount(30)), 3);

        assertFailsWith(ErrorCode.ALREADY_CLAIMED, () -> rewardClaimService.claim(X, amount(30), 3,
                authority.signClaim(X, amount(30), 3, LEDGER)));

        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(amount(30));
    }

    @Test
    void globalTotalEqualsSumOfAffiliateTotals() {
        fund(1_000);
        batchDistributionService.batchDistribute(authority.address(), List.of(X, Y),
                List.of(amount(50), amount(70)), 1);
        rewardClaimService.claim(X, amount(25), 2, authority.signClaim(X, amount(25), 2, LEDGER));
        rewardClaimService.claim(Y, amount(40), 2, authority.signClaim(Y, amount(40), 2, LEDGER));

        BigInteger sum = totalRepository.findAll().stream()
                .map(AffiliateTotal::getTotalDistributed)
                .reduce(BigInteger.ZERO, BigInteger::add);

        assertThat(ledgerStateService.globalTotal()).isEqualTo(sum).isEqualTo(amount(185));
        assertThat(ledgerStateService.settlements(X)).hasSize(2);
    }

    @Test
    void signatureBoundToAnotherLedgerIsRejected() {
        fund(500);
        String foreign = authority.signClaim(X, amount(100), 5, OTHER_LEDGER);

        assertFailsWith(ErrorCode.INVALID_SIGNATURE, () -> rewardClaimService.claim(X, amount(100), 5, foreign));

        assertThat(ledgerStateService.hasClaimed(X, 5)).isFalse();
    }

    @Test
    void signatureForAnotherAmountIsRejected() {
        fund(500);
        String signature = authority.signClaim(X, amount(100), 5, LEDGER);

        assertFailsWith(ErrorCode.INVALID_SIGNATURE, () -> rewardClaimService.claim(X, amount(200), 5, signature));
        assertFailsWith(ErrorCode.INVALID_SIGNATURE, () -> rewardClaimService.claim(Y, amount(100), 5, signature));

        assertThat(ledgerStateService.hasClaimed(X, 5)).isFalse();
        assertThat(ledgerStateService.hasClaimed(Y, 5)).isFalse();
    }

    @Test
    void failedTransferRollsBackClaim() {
        adminService.updateAssetReference(authority.address(), REJECTING);

        assertFailsWith(ErrorCode.TRANSFER_FAILED, () -> rewardClaimService.claim(X, amount(100), 5,
                authority.signClaim(X, amount(100), 5, LEDGER)));

        assertThat(ledgerStateService.hasClaimed(X, 5)).isFalse();
        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(BigInteger.ZERO);
        assertThat(ledgerStateService.globalTotal()).isEqualTo(BigInteger.ZERO);
        assertThat(eventRepository.findByType(SettlementEventType.REWARD_CLAIMED)).isEmpty();
    }

    @Test
    void failedTransferRollsBackWholeBatch() {
        adminService.updateAssetReference(authority.address(), REJECTING);

        assertFailsWith(ErrorCode.TRANSFER_FAILED,
                () -> batchDistributionService.batchDistribute(authority.address(), List.of(X, Y),
                        List.of(amount(50), amount(70)), 1));

        assertThat(ledgerStateService.hasClaimed(X, 1)).isFalse();
        assertThat(ledgerStateService.hasClaimed(Y, 1)).isFalse();
        assertThat(ledgerStateService.globalTotal()).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void batchFromNonAuthorityIsUnauthorized() {
        fund(500);

        assertFailsWith(ErrorCode.UNAUTHORIZED,
                () -> batchDistributionService.batchDistribute(X, List.of(Y), List.of(amount(10)), 1));

        assertThat(ledgerStateService.hasClaimed(Y, 1)).isFalse();
    }

    @Test
    void emergencyWithdrawalBypassesBookkeeping() {
        fund(300);

        adminService.emergencyWithdraw(authority.address(), amount(120));

        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(180));
        assertThat(custody.balanceOf(authority.address())).isEqualTo(amount(120));
        assertThat(ledgerStateService.globalTotal()).isEqualTo(BigInteger.ZERO);
        assertThat(ledgerStateService.affiliateTotal(authority.address())).isEqualTo(BigInteger.ZERO);
        assertThat(eventRepository.findByType(SettlementEventType.EMERGENCY_WITHDRAWAL)).hasSize(1);
    }

    @Test
    void emergencyWithdrawalIsAuthorityOnlyAndBalanceChecked() {
        fund(100);

        assertFailsWith(ErrorCode.UNAUTHORIZED, () -> adminService.emergencyWithdraw(X, amount(10)));
        assertFailsWith(ErrorCode.INSUFFICIENT_BALANCE,
                () -> adminService.emergencyWithdraw(authority.address(), amount(101)));
        assertFailsWith(ErrorCode.INVALID_AMOUNT,
                () -> adminService.emergencyWithdraw(authority.address(), BigInteger.ZERO));

        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(100));
    }

    @Test
    void unknownAssetReferenceIsRejected() {
        assertFailsWith(ErrorCode.ASSET_UNAVAILABLE,
                () -> adminService.updateAssetReference(authority.address(), "missing"));
        assertFailsWith(ErrorCode.UNAUTHORIZED, () -> adminService.updateAssetReference(X, REJECTING));

        assertThat(ledgerStateService.ledgerInfo().getAssetReference()).isEqualTo(CustodyLedgerGateway.HANDLE);
    }

    @Test
    void rotatedAuthorityInvalidatesOutstandingSignatures() {
        fund(500);
        String stale = authority.signClaim(X, amount(100), 7, LEDGER);

        adminService.transferAuthority(authority.address(), successor.address());

        assertFailsWith(ErrorCode.INVALID_SIGNATURE, () -> rewardClaimService.claim(X, amount(100), 7, stale));
        rewardClaimService.claim(X, amount(100), 7, successor.signClaim(X, amount(100), 7, LEDGER));
        assertThat(ledgerStateService.hasClaimed(X, 7)).isTrue();
        assertFailsWith(ErrorCode.UNAUTHORIZED,
                () -> batchDistributionService.batchDistribute(authority.address(), List.of(Y),
                        List.of(amount(10)), 7));
    }

    @Test
    void settlementDebitsPersistedLedgerIdentity() {
        DistributorState state = stateRepository.findById(DistributorState.SINGLETON_ID).orElseThrow();
        state.setLedgerAddress(OTHER_LEDGER);
        stateRepository.save(state);
        fund(500);

        rewardClaimService.claim(X, amount(10), 4, authority.signClaim(X, amount(10), 4, OTHER_LEDGER));
        batchDistributionService.batchDistribute(authority.address(), List.of(Y), List.of(amount(20)), 4);
        adminService.emergencyWithdraw(authority.address(), amount(30));

        assertThat(custody.balanceOf(OTHER_LEDGER)).isEqualTo(amount(440));
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(BigInteger.ZERO);
        assertThat(custody.balanceOf(X)).isEqualTo(amount(10));
        assertThat(custody.balanceOf(Y)).isEqualTo(amount(20));
        assertThat(ledgerStateService.ledgerInfo().getCustodiedBalance()).isEqualTo(amount(440));
    }

    @Test
    void authorityFundsLedgerThroughActiveGateway() {
        adminService.depositToLedger(authority.address(), amount(250));

        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(250));
        assertThat(ledgerStateService.ledgerInfo().getCustodiedBalance()).isEqualTo(amount(250));
        assertThat(eventRepository.findByType(SettlementEventType.LEDGER_FUNDED))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getAffiliateAddress()).isEqualTo(LEDGER);
                    assertThat(e.getAmount()).isEqualTo(amount(250));
                });
    }

    @Test
    void ledgerFundingIsAuthorityOnlyAndGatewayChecked() {
        assertFailsWith(ErrorCode.UNAUTHORIZED, () -> adminService.depositToLedger(X, amount(10)));
        assertFailsWith(ErrorCode.INVALID_AMOUNT,
                () -> adminService.depositToLedger(authority.address(), BigInteger.ZERO));

        adminService.updateAssetReference(authority.address(), REJECTING);
        assertFailsWith(ErrorCode.TRANSFER_FAILED,
                () -> adminService.depositToLedger(authority.address(), amount(10)));

        assertThat(custody.balanceOf(LEDGER)).isEqualTo(BigInteger.ZERO);
        assertThat(eventRepository.findByType(SettlementEventType.LEDGER_FUNDED)).isEmpty();
    }

    @Test
    void walletBalanceReadsActiveGateway() {
        fund(500);
        rewardClaimService.claim(X, amount(100), 5, authority.signClaim(X, amount(100), 5, LEDGER));

        assertThat(ledgerStateService.walletBalance(X)).isEqualTo(amount(100));
        assertThat(ledgerStateService.walletBalance("0x5FbDB2315678afecb367f032d93F642f64180aa3"))
                .isEqualTo(amount(400));
        assertThat(ledgerStateService.walletBalance(Y)).isEqualTo(BigInteger.ZERO);
        assertFailsWith(ErrorCode.INVALID_ADDRESS, () -> ledgerStateService.walletBalance("0x1234"));

        adminService.updateAssetReference(authority.address(), REJECTING);
        assertThat(ledgerStateService.walletBalance(Y)).isEqualTo(amount(1_000_000));
    }

    @Test
    void racingClaimsAndBatchesSettleAPairOnce() throws Exception {
        fund(1_000);
        long epoch = 9;
        BigInteger reward = amount(40);
        String signature = authority.signClaim(X, reward, epoch, LEDGER);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ErrorCode>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                boolean viaClaim = i % 2 == 0;
                outcomes.add(pool.submit(() -> {
                    start.await();
                    try {
                        if (viaClaim) {
                            rewardClaimService.claim(X, reward, epoch, signature);
                        } else {
                            batchDistributionService.batchDistribute(authority.address(), List.of(X),
                                    List.of(reward), epoch);
                        }
                        return null;
                    } catch (DistributionException e) {
                        return e.getCode();
                    }
                }));
            }
            start.countDown();

            List<ErrorCode> failures = new ArrayList<>();
            int settled = 0;
            for (Future<ErrorCode> outcome : outcomes) {
                ErrorCode code = outcome.get(30, TimeUnit.SECONDS);
                if (code == null) {
                    settled++;
                } else {
                    failures.add(code);
                }
            }

            assertThat(settled).isEqualTo(1);
            assertThat(failures).hasSize(callers - 1).containsOnly(ErrorCode.ALREADY_CLAIMED);
        } finally {
            pool.shutdownNow();
        }

        assertThat(ledgerStateService.affiliateTotal(X)).isEqualTo(reward);
        assertThat(ledgerStateService.globalTotal()).isEqualTo(reward);
        assertThat(custody.balanceOf(X)).isEqualTo(reward);
        assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(960));
        assertThat(claimRepository.findByAffiliateAddressOrderBySettledAtDesc(X)).hasSize(1);
    }

    @Test
    void auditLogRecordsWithdrawalOnlyOnceCommitted() {
        fund(300);
        ListAppender<ILoggingEvent> auditLines = new ListAppender<>();
        Logger auditLogger = (Logger) LoggerFactory.getLogger("distributor.audit");
        auditLines.start();
        auditLogger.addAppender(auditLines);
        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                adminService.emergencyWithdraw(authority.address(), amount(100));
                status.setRollbackOnly();
            });

            assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(300));
            assertThat(auditLines.list).noneMatch(e -> e.getFormattedMessage().startsWith("EMERGENCY_WITHDRAWAL"));

            adminService.emergencyWithdraw(authority.address(), amount(100));

            assertThat(custody.balanceOf(LEDGER)).isEqualTo(amount(200));
            assertThat(auditLines.list)
                    .filteredOn(e -> e.getFormattedMessage().startsWith("EMERGENCY_WITHDRAWAL"))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getLevel()).isEqualTo(Level.WARN));
        } finally {
            auditLogger.detachAppender(auditLines);
        }
    }

    private void fund(long amount) {
        adminService.depositToLedger(authority.address(), amount(amount));
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    private static void assertFailsWith(ErrorCode code, ThrowingCallable call) {
        assertThatThrownBy(call).isInstanceOfSatisfying(DistributionException.class,
                e -> assertThat(e.getCode()).isEqualTo(code));
    }
}

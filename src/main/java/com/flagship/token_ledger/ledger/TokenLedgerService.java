package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.event.LedgerEventChannel;
import com.flagship.token_ledger.event.LedgerEventListener;
import com.flagship.token_ledger.event.LedgerEventNotifier;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.persistence.LedgerPersistenceAdapter;
import com.flagship.token_ledger.persistence.LedgerPersistenceAdapter.PersistedLedger;
import com.flagship.token_ledger.reward.Reward;
import com.flagship.token_ledger.reward.RewardCatalog;
import com.flagship.token_ledger.reward.RewardLifecycle;
import com.flagship.token_ledger.staking.InterestCalculator;
import com.flagship.token_ledger.staking.Stake;
import com.flagship.token_ledger.staking.StakingEngine;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import com.flagship.token_ledger.transaction.TransactionLog;
import com.flagship.token_ledger.transfer.Cause;
import com.flagship.token_ledger.transfer.CauseRegistry;
import com.flagship.token_ledger.transfer.Contribution;
import com.flagship.token_ledger.transfer.TransferEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * The token ledger of one account.
 *
 * Every mutating operation is queued on a single writer thread
 * ({@value #WRITER_THREAD_NAME}). A task waits out its simulated
 * confirmation delay, validates against the current snapshot and, on
 * success, applies the commit in this order:
 * 1. publish the new snapshot to readers
 * 2. append the transaction to the log
 * 3. persist snapshot and log (best effort)
 * 4. notify listeners
 *
 * Reads return the current immutable snapshot and never wait for the writer.
 *
 * Listeners run on the writer thread. They may call the synchronous
 * mutators, which then execute inline; they must not block on the future
 * of an asynchronous operation.
 */
@Service
@Slf4j
public class TokenLedgerService implements AutoCloseable {

    static final String WRITER_THREAD_NAME = "ledger-writer";

    private final LedgerSettings settings;
    private final ConfirmationDelay confirmationDelay;
    private final LedgerPersistenceAdapter persistence;
    private final RewardLifecycle rewardLifecycle;
    private final StakingEngine stakingEngine;
    private final TransferEngine transferEngine;
    private final LedgerEventNotifier notifier;
    private final LedgerMetrics metrics;
    private final RewardCatalog rewardCatalog;
    private final CauseRegistry causeRegistry;
    private final InterestCalculator interestCalculator;

    private final ExecutorService writer;
    private final TransactionLog transactionLog;
    private volatile Thread writerThread;
    private volatile LedgerState state;

    public TokenLedgerService(LedgerSettings settings,
                              ConfirmationDelay confirmationDelay,
                              LedgerPersistenceAdapter persistence,
                              RewardLifecycle rewardLifecycle,
                              StakingEngine stakingEngine,
                              TransferEngine transferEngine,
                              LedgerEventNotifier notifier,
                              LedgerMetrics metrics,
                              RewardCatalog rewardCatalog,
                              CauseRegistry causeRegistry,
                              InterestCalculator interestCalculator) {
        this.settings = settings;
        this.confirmationDelay = confirmationDelay;
        this.persistence = persistence;
        this.rewardLifecycle = rewardLifecycle;
        this.stakingEngine = stakingEngine;
        this.transferEngine = transferEngine;
        this.notifier = notifier;
        this.metrics = metrics;
        this.rewardCatalog = rewardCatalog;
        this.causeRegistry = causeRegistry;
        this.interestCalculator = interestCalculator;

        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, WRITER_THREAD_NAME);
            thread.setDaemon(true);
            writerThread = thread;
            return thread;
        });

        PersistedLedger loaded = persistence.load();
        this.transactionLog = new TransactionLog(loaded.getTransactions());
        Optional<LedgerState> seeded = rewardLifecycle.seedCatalogue(loaded.getState(), rewardCatalog);
        this.state = seeded.orElse(loaded.getState());
        seeded.ifPresent(persistence::save);

        metrics.registerBalanceGauge(() -> state.getBalance().getPrimary());
        metrics.registerTransactionCountGauge(transactionLog::size);
    }

    // ==================== Mutations ====================

    /**
     * Seeds the starting balance on first use. Later calls complete
     * without mutating or publishing anything.
     */
    public CompletableFuture<Void> initialize(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return CompletableFuture.failedFuture(
                new LedgerException(LedgerErrorKind.INVALID_ADDRESS, "Account id is required"));
        }
        return submit("initialize", settings.getInitializeDelay(), current -> {
            if (current.isInitialized()) {
                log.debug("Ledger already initialized for {}", current.getAccountId());
                return Optional.empty();
            }
            return Optional.of(transferEngine.grantStartingBalance(current, accountId));
        }).thenApply(commit -> {
            commit.ifPresent(c -> log.info("Ledger initialized: accountId={}, balance={}",
                accountId, c.getState().getBalance().getPrimary()));
            return null;
        });
    }

    /**
     * @return false if the reward is unknown or no longer LOCKED
     */
    public boolean unlockReward(String rewardId) {
        boolean unlocked = runSynchronously("unlock_reward",
            current -> rewardLifecycle.unlock(current, rewardId)).isPresent();
        if (unlocked) {
            log.info("Reward unlocked: rewardId={}", rewardId);
        }
        return unlocked;
    }

    /**
     * Unlocks every LOCKED reward whose unlock day is at most {@code currentDay}.
     *
     * @return ids unlocked by this call, in catalogue order
     */
    public List<String> recordChallengeProgress(int currentDay) {
        List<String> unlocked = new ArrayList<>();
        runSynchronously("challenge_progress", current -> {
            List<String> reached = rewardLifecycle.reachedBy(current, currentDay);
            unlocked.addAll(reached);
            return rewardLifecycle.unlockAll(current, reached);
        });
        if (!unlocked.isEmpty()) {
            log.info("Challenge day {} unlocked rewards {}", currentDay, unlocked);
        }
        return List.copyOf(unlocked);
    }

    public CompletableFuture<LedgerTransaction> claimReward(String rewardId) {
        return submitLogged("claim_reward", settings.getClaimDelay(),
            current -> rewardLifecycle.claim(current, rewardId));
    }

    public CompletableFuture<LedgerTransaction> contribute(String causeId, BigDecimal amount) {
        return submitLogged("contribute", settings.getContributeDelay(),
            current -> transferEngine.contribute(current, causeId, amount));
    }

    public CompletableFuture<LedgerTransaction> transferTokens(String toAddress, BigDecimal amount, String note) {
        return submitLogged("transfer", settings.getTransferDelay(),
            current -> transferEngine.transfer(current, toAddress, amount, note));
    }

    public LedgerTransaction recordReceive(String fromAddress, BigDecimal amount, String note) {
        return runSynchronously("receive",
            current -> Optional.of(transferEngine.receive(current, fromAddress, amount, note)))
            .map(LedgerCommit::getTransaction)
            .orElseThrow();
    }

    public CompletableFuture<LedgerTransaction> stakeTokens(BigDecimal amount) {
        return submitLogged("stake", settings.getStakeDelay(),
            current -> stakingEngine.stake(current, amount));
    }

    public CompletableFuture<LedgerTransaction> unstakeTokens(String stakeId) {
        return submitLogged("unstake", settings.getUnstakeDelay(),
            current -> stakingEngine.unstake(current, stakeId));
    }

    /**
     * Journals a check-in or validation without moving any balance.
     */
    public LedgerTransaction recordActivity(TransactionKind kind, BigDecimal amount, String description) {
        return runSynchronously("activity",
            current -> Optional.of(transferEngine.recordActivity(current, kind, amount, description)))
            .map(LedgerCommit::getTransaction)
            .orElseThrow();
    }

    /**
     * Wipes storage and the log and restores the default locked catalogue
     * with a zero balance.
     */
    public void reset() {
        runSynchronously("reset", current -> {
            persistence.clear();
            transactionLog.clear();
            LedgerState fresh = rewardLifecycle.seedCatalogue(LedgerState.empty(), rewardCatalog)
                .orElseGet(LedgerState::empty);
            return Optional.of(LedgerCommit.of(fresh, null).stateChanged());
        });
        log.info("Ledger reset to defaults");
    }

    // ==================== Events ====================

    public void on(LedgerEventChannel channel, LedgerEventListener listener) {
        notifier.on(channel, listener);
    }

    public void off(LedgerEventChannel channel, LedgerEventListener listener) {
        notifier.off(channel, listener);
    }

    // ==================== Reads ====================

    public LedgerState getState() {
        return state;
    }

    public Balance getBalance() {
        return state.getBalance();
    }

    public List<Reward> getClaimableRewards() {
        return state.claimableRewards();
    }

    public List<Reward> getAllRewards() {
        return state.getRewards();
    }

    public List<Stake> getActiveStakes() {
        return state.activeStakes();
    }

    public List<Stake> getAllStakes() {
        return state.getStakes();
    }

    public List<Contribution> getContributions() {
        return state.getContributions();
    }

    public List<Contribution> getContributionsByCause(String causeId) {
        return state.getContributions().stream()
            .filter(contribution -> contribution.getCauseId().equals(causeId))
            .toList();
    }

    public List<LedgerTransaction> getTransactions() {
        return transactionLog.entries();
    }

    public BigDecimal getTotalEarned() {
        return state.getTotals().getTotalEarned();
    }

    public BigDecimal getTotalContributed() {
        return state.getTotals().getTotalContributed();
    }

    public BigDecimal getTotalStaked() {
        return state.getTotals().getTotalStaked();
    }

    public BigDecimal getTotalStakingRewards() {
        return state.getTotals().getTotalStakingRewards();
    }

    public List<Cause> getCauses() {
        return causeRegistry.all();
    }

    public BigDecimal getCauseTotal(String causeId) {
        return getContributionsByCause(causeId).stream()
            .map(Contribution::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Annual percentage yield, e.g. 5.
     */
    public BigDecimal getStakingApy() {
        return interestCalculator.apyPercent();
    }

    public BigDecimal projectStakingRewards(BigDecimal amount, int days) {
        if (amount == null || amount.signum() < 0) {
            throw LedgerException.invalidAmount(amount);
        }
        if (days < 0) {
            throw new LedgerException(LedgerErrorKind.INVALID_AMOUNT, "Days cannot be negative: " + days);
        }
        return interestCalculator.project(amount, days);
    }

    // ==================== Writer ====================

    @PreDestroy
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Ledger writer did not drain within 5s, forcing shutdown");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<LedgerTransaction> submitLogged(String operation, Duration confirmation,
                                                              Function<LedgerState, LedgerCommit> step) {
        return submit(operation, confirmation, current -> Optional.of(step.apply(current)))
            .thenApply(commit -> commit.map(LedgerCommit::getTransaction).orElseThrow());
    }

    private CompletableFuture<Optional<LedgerCommit>> submit(String operation, Duration confirmation,
                                                             Function<LedgerState, Optional<LedgerCommit>> step) {
        CompletableFuture<Optional<LedgerCommit>> result = new CompletableFuture<>();
        String correlationId = CorrelationContext.currentCorrelationId();
        try {
            writer.execute(() -> {
                if (correlationId != null) {
                    CorrelationContext.setCorrelationId(correlationId);
                    MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
                }
                try {
                    result.complete(execute(operation, confirmation, step));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    CorrelationContext.clear();
                    MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Ledger is shut down", e));
        }
        return result;
    }

    /**
     * Runs a zero-delay operation on the writer and waits for it, or runs it
     * inline when already on the writer thread.
     */
    private Optional<LedgerCommit> runSynchronously(String operation,
                                                    Function<LedgerState, Optional<LedgerCommit>> step) {
        if (Thread.currentThread() == writerThread) {
            return execute(operation, Duration.ZERO, step);
        }
        try {
            return submit(operation, Duration.ZERO, step).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private Optional<LedgerCommit> execute(String operation, Duration confirmation,
                                           Function<LedgerState, Optional<LedgerCommit>> step) {
        String outerOperation = MDC.get(CorrelationContext.OPERATION_MDC_KEY);
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);
        long startTime = System.currentTimeMillis();
        boolean interrupted = false;
        try {
            interrupted = awaitConfirmation(operation, confirmation);
            Optional<LedgerCommit> commit = step.apply(state);
            commit.ifPresent(this::apply);
            metrics.recordOperation(operation, "success");
            commit.map(LedgerCommit::getTransaction).ifPresent(tx ->
                log.info("Committed {}: id={}, amount={}, balance={}",
                    tx.getKind().wireName(), tx.getId(), tx.getAmount(), state.getBalance().getPrimary()));
            return commit;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getKind().name().toLowerCase(Locale.ROOT));
            log.warn("Rejected {}: kind={}, message={}", operation, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Unexpected failure in {}", operation, e);
            throw e;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            metrics.recordOperationLatency(operation, System.currentTimeMillis() - startTime);
            if (outerOperation != null) {
                MDC.put(CorrelationContext.OPERATION_MDC_KEY, outerOperation);
            } else {
                MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            }
        }
    }

    /**
     * @return whether the wait was interrupted. The operation still commits;
     *         the caller restores the interrupt only once the commit and its
     *         persistence are done, and the executor clears it before the
     *         next task.
     */
    private boolean awaitConfirmation(String operation, Duration confirmation) {
        if (confirmation.isZero()) {
            return false;
        }
        try {
            confirmationDelay.await(confirmation);
            return false;
        } catch (InterruptedException e) {
            log.debug("Confirmation delay of {} interrupted", operation);
            return true;
        }
    }

    private void apply(LedgerCommit commit) {
        state = commit.getState();
        LedgerTransaction transaction = commit.getTransaction();
        if (transaction != null) {
            transactionLog.append(transaction);
        }

        persistence.save(state);
        if (transaction != null) {
            persistence.saveLog(transactionLog.entries());
        }

        for (LedgerCommit.Notification notification : commit.getNotifications()) {
            notifier.publish(notification.getChannel(), notification.getPayload());
        }
    }
}

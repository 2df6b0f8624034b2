package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.dto.AmountView;
import com.flagship.token_ledger.ledger.dto.BalanceResponse;
import com.flagship.token_ledger.ledger.dto.ContributionRequest;
import com.flagship.token_ledger.ledger.dto.InitializeRequest;
import com.flagship.token_ledger.ledger.dto.ProgressRequest;
import com.flagship.token_ledger.ledger.dto.ProjectionResponse;
import com.flagship.token_ledger.ledger.dto.ReceiptRequest;
import com.flagship.token_ledger.ledger.dto.StakeRequest;
import com.flagship.token_ledger.ledger.dto.TransactionResponse;
import com.flagship.token_ledger.ledger.dto.TransferRequest;
import com.flagship.token_ledger.reward.Reward;
import com.flagship.token_ledger.staking.Stake;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transfer.Cause;
import com.flagship.token_ledger.transfer.Contribution;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * REST adapter over {@link TokenLedgerService}.
 *
 * Asynchronous ledger operations are awaited, so a response is only sent
 * once the operation has committed or been rejected (including its
 * simulated confirmation delay).
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final TokenLedgerService ledger;

    @PostMapping("/initialize")
    public ResponseEntity<LedgerState> initialize(@Valid @RequestBody InitializeRequest request) {
        log.info("Received initialize request: accountId={}", request.getAccountId());
        await(ledger.initialize(request.getAccountId()));
        return ResponseEntity.ok(ledger.getState());
    }

    // ==================== Reads ====================

    @GetMapping("/state")
    public LedgerState getState() {
        return ledger.getState();
    }

    @GetMapping("/balance")
    public BalanceResponse getBalance() {
        return BalanceResponse.from(ledger.getBalance());
    }

    @GetMapping("/rewards")
    public List<Reward> getRewards() {
        return ledger.getAllRewards();
    }

    @GetMapping("/rewards/claimable")
    public List<Reward> getClaimableRewards() {
        return ledger.getClaimableRewards();
    }

    @GetMapping("/stakes")
    public List<Stake> getStakes(@RequestParam(name = "active", defaultValue = "false") boolean activeOnly) {
        return activeOnly ? ledger.getActiveStakes() : ledger.getAllStakes();
    }

    @GetMapping("/contributions")
    public List<Contribution> getContributions(@RequestParam(name = "causeId", required = false) String causeId) {
        return causeId == null ? ledger.getContributions() : ledger.getContributionsByCause(causeId);
    }

    @GetMapping("/transactions")
    public List<TransactionResponse> getTransactions() {
        return ledger.getTransactions().stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @GetMapping("/causes")
    public List<Cause> getCauses() {
        return ledger.getCauses();
    }

    @GetMapping("/staking/projection")
    public ProjectionResponse projectStakingRewards(@RequestParam("amount") BigDecimal amount,
                                                    @RequestParam("days") int days) {
        BigDecimal projected = ledger.projectStakingRewards(amount, days);
        return new ProjectionResponse(AmountView.of(amount), days, ledger.getStakingApy(), AmountView.of(projected));
    }

    // ==================== Rewards ====================

    @PostMapping("/rewards/{id}/unlock")
    public Map<String, Object> unlockReward(@PathVariable("id") String rewardId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("rewardId", rewardId);
        response.put("unlocked", ledger.unlockReward(rewardId));
        return response;
    }

    @PostMapping("/rewards/{id}/claim")
    public TransactionResponse claimReward(@PathVariable("id") String rewardId) {
        return TransactionResponse.from(await(ledger.claimReward(rewardId)));
    }

    @PostMapping("/progress")
    public Map<String, Object> recordProgress(@Valid @RequestBody ProgressRequest request) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("day", request.getDay());
        response.put("unlocked", ledger.recordChallengeProgress(request.getDay()));
        return response;
    }

    // ==================== Token movements ====================

    @PostMapping("/contributions")
    public ResponseEntity<TransactionResponse> contribute(@Valid @RequestBody ContributionRequest request) {
        log.info("Received contribution request: causeId={}, amount={}", request.getCauseId(), request.getAmount());
        return created(await(ledger.contribute(request.getCauseId(), request.getAmount())));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransactionResponse> transfer(@Valid @RequestBody TransferRequest request) {
        log.info("Received transfer request: toAddress={}, amount={}", request.getToAddress(), request.getAmount());
        return created(await(ledger.transferTokens(request.getToAddress(), request.getAmount(), request.getNote())));
    }

    @PostMapping("/receipts")
    public ResponseEntity<TransactionResponse> receive(@Valid @RequestBody ReceiptRequest request) {
        return created(ledger.recordReceive(request.getFromAddress(), request.getAmount(), request.getNote()));
    }

    @PostMapping("/stakes")
    public ResponseEntity<TransactionResponse> stake(@Valid @RequestBody StakeRequest request) {
        log.info("Received stake request: amount={}", request.getAmount());
        return created(await(ledger.stakeTokens(request.getAmount())));
    }

    @PostMapping("/stakes/{id}/unstake")
    public TransactionResponse unstake(@PathVariable("id") String stakeId) {
        return TransactionResponse.from(await(ledger.unstakeTokens(stakeId)));
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        log.info("Received reset request");
        ledger.reset();
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<TransactionResponse> created(LedgerTransaction transaction) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    /**
     * Waits for a ledger operation and rethrows its failure unwrapped, so
     * the exception handler sees the {@link LedgerException}.
     */
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}

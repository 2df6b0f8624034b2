package com.flagship.token_ledger.config;

import com.flagship.token_ledger.ledger.ConfirmationDelay;
import com.flagship.token_ledger.ledger.LedgerSettings;
import com.flagship.token_ledger.ledger.RandomReferenceGenerator;
import com.flagship.token_ledger.ledger.ReferenceGenerator;
import com.flagship.token_ledger.persistence.InMemoryKeyValueStore;
import com.flagship.token_ledger.persistence.KeyValueStore;
import com.flagship.token_ledger.persistence.LedgerPersistenceAdapter.StorageKeys;
import com.flagship.token_ledger.persistence.RedisKeyValueStore;
import com.flagship.token_ledger.reward.RewardCatalog;
import com.flagship.token_ledger.staking.InterestCalculator;
import com.flagship.token_ledger.transfer.CauseRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the ledger collaborators from {@code ledger.*} properties.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public LedgerSettings ledgerSettings(
            @Value("${ledger.starting-balance.primary:100}") BigDecimal startingPrimary,
            @Value("${ledger.starting-balance.secondary:0.5}") BigDecimal startingSecondary,
            @Value("${ledger.staking.annual-rate:0.05}") BigDecimal annualRate,
            @Value("${ledger.transfer.min-address-length:10}") int minAddressLength,
            @Value("${ledger.confirmation.initialize-ms:1000}") long initializeMs,
            @Value("${ledger.confirmation.claim-ms:2000}") long claimMs,
            @Value("${ledger.confirmation.contribute-ms:2000}") long contributeMs,
            @Value("${ledger.confirmation.transfer-ms:2000}") long transferMs,
            @Value("${ledger.confirmation.stake-ms:2000}") long stakeMs,
            @Value("${ledger.confirmation.unstake-ms:2000}") long unstakeMs) {
        return LedgerSettings.builder()
                .startingPrimary(startingPrimary)
                .startingSecondary(startingSecondary)
                .annualRate(annualRate)
                .minAddressLength(minAddressLength)
                .initializeDelay(Duration.ofMillis(initializeMs))
                .claimDelay(Duration.ofMillis(claimMs))
                .contributeDelay(Duration.ofMillis(contributeMs))
                .transferDelay(Duration.ofMillis(transferMs))
                .stakeDelay(Duration.ofMillis(stakeMs))
                .unstakeDelay(Duration.ofMillis(unstakeMs))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Disabled confirmation makes every operation commit immediately.
     */
    @Bean
    public ConfirmationDelay confirmationDelay(
            @Value("${ledger.confirmation.enabled:true}") boolean enabled) {
        if (!enabled) {
            log.info("Simulated confirmation delay disabled");
            return ConfirmationDelay.none();
        }
        return ConfirmationDelay.sleeping();
    }

    @Bean
    public ReferenceGenerator referenceGenerator() {
        return new RandomReferenceGenerator();
    }

    @Bean
    public RewardCatalog rewardCatalog() {
        return RewardCatalog.standard();
    }

    @Bean
    public CauseRegistry causeRegistry() {
        return CauseRegistry.standard();
    }

    @Bean
    public InterestCalculator interestCalculator(LedgerSettings settings) {
        return new InterestCalculator(settings.getAnnualRate());
    }

    @Bean
    public StorageKeys storageKeys(
            @Value("${ledger.persistence.state-key:token-ledger:state}") String stateKey,
            @Value("${ledger.persistence.transactions-key:token-ledger:transactions}") String transactionsKey) {
        return new StorageKeys(stateKey, transactionsKey);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.persistence.store", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.persistence.store", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        log.info("Using in-memory ledger store; state will not survive a restart");
        return new InMemoryKeyValueStore();
    }
}

package com.flagship.token_ledger.event;

import com.flagship.token_ledger.reward.Reward;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import lombok.Value;

@Value
public class RewardClaimedEvent {
    Reward reward;
    LedgerTransaction transaction;
}

package com.flagship.token_ledger.event;

import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transfer.Contribution;
import lombok.Value;

@Value
public class ContributionMadeEvent {
    Contribution contribution;
    LedgerTransaction transaction;
}

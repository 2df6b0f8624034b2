package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Balance;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("primary")
    AmountView primary;

    @JsonProperty("secondary")
    AmountView secondary;

    public static BalanceResponse from(Balance balance) {
        return new BalanceResponse(AmountView.of(balance.getPrimary()), AmountView.of(balance.getSecondary()));
    }
}

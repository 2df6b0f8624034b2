package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Projected staking rewards for a hypothetical stake.
 */
@Value
public class ProjectionResponse {

    @JsonProperty("amount")
    AmountView amount;

    @JsonProperty("days")
    int days;

    @JsonProperty("apy_percent")
    BigDecimal apyPercent;

    @JsonProperty("projected_rewards")
    AmountView projectedRewards;
}

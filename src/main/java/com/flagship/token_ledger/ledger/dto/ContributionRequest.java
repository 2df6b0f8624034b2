package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for a contribution. Amount rules are enforced by the ledger
 * so the error kind matches the Java surface.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributionRequest {

    @NotBlank(message = "Cause ID is required")
    @JsonProperty("cause_id")
    private String causeId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;
}

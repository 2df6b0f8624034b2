package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current day of the user's challenge, as reported by the progress tracker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRequest {

    @NotNull(message = "Day is required")
    @Min(value = 0, message = "Day cannot be negative")
    @JsonProperty("day")
    private Integer day;
}

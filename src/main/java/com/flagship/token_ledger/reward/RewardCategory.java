package com.flagship.token_ledger.reward;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RewardCategory {
    MILESTONE,
    DAILY,
    BONUS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.flagship.token_ledger.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money for presentation: the full-precision value plus a two-decimal
 * display string. Rounding happens here and nowhere else.
 */
@Value
public class AmountView {
    BigDecimal value;
    String display;

    public static AmountView of(BigDecimal value) {
        return new AmountView(value, value.setScale(2, RoundingMode.HALF_UP).toPlainString());
    }
}

package com.flagship.token_ledger.transfer;

import lombok.Value;

@Value
public class Cause {
    String id;
    String name;
    String description;
}

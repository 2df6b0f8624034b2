package com.flagship.token_ledger.ledger;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

public class RandomReferenceGenerator implements ReferenceGenerator {

    private final SecureRandom random = new SecureRandom();

    @Override
    public String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    @Override
    public String newHash() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return "0x" + HexFormat.of().formatHex(bytes);
    }
}

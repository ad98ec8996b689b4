package com.vtb.auditor.snapshot;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Состояние одного аккаунта в момент снимка.
 * Нативные лампорты лежат в balances под ключом SOL.
 */
@Value
@Builder
public class AccountStateSnapshot {

    public static final String NATIVE_BALANCE_KEY = "SOL";

    String address;
    boolean exists;
    long lamports;
    String owner;
    @Builder.Default
    Map<String, BigInteger> balances = new LinkedHashMap<>();
    /**
     * Декодированные поля: admin, owner, authority, totalSupply, mintAuthority, ...
     */
    @Builder.Default
    Map<String, String> decodedFields = new LinkedHashMap<>();
    int dataSize;
    String dataHash;
    String decodedAs;
    Instant capturedAt;

    public static AccountStateSnapshot missing(String address, Instant capturedAt) {
        return AccountStateSnapshot.builder()
            .address(address)
            .exists(false)
            .capturedAt(capturedAt)
            .build();
    }
}

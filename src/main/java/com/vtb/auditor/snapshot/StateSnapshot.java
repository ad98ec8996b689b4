package com.vtb.auditor.snapshot;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class StateSnapshot {
    String id;
    String description;
    Instant capturedAt;
    @Builder.Default
    Map<String, AccountStateSnapshot> accounts = new LinkedHashMap<>();

    public static StateSnapshot empty(String id, Instant capturedAt) {
        return StateSnapshot.builder()
            .id(id)
            .description("empty")
            .capturedAt(capturedAt)
            .build();
    }

    public AccountStateSnapshot account(String address) {
        return accounts.get(address);
    }

    /**
     * Аккаунт существовал в момент снимка
     */
    public boolean hasLiveAccount(String address) {
        AccountStateSnapshot account = accounts.get(address);
        return account != null && account.isExists();
    }
}

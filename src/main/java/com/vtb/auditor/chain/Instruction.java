package com.vtb.auditor.chain;

import lombok.Value;

import java.util.List;

/**
 * Одна инструкция транзакции: программа, аккаунты и сырые данные
 */
@Value
public class Instruction {
    String programId;
    List<AccountMeta> accounts;
    byte[] data;

    public Instruction(String programId, List<AccountMeta> accounts, byte[] data) {
        this.programId = programId;
        this.accounts = List.copyOf(accounts);
        this.data = data != null ? data.clone() : new byte[0];
    }

    public byte[] getData() {
        return data.clone();
    }
}

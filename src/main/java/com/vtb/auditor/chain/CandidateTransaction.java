package com.vtb.auditor.chain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Собранная сценарием транзакция-кандидат. Подписи ставятся только ключами из signers,
 * для остальных обязательных подписантов в сериализации остаются нулевые подписи.
 */
@Value
@Builder
public class CandidateTransaction {
    String feePayer;
    @Singular
    List<Instruction> instructions;
    @Singular
    List<SignerIdentity> signers;
    String label;

    public int instructionCount() {
        return instructions.size();
    }

    /**
     * Все адреса, помеченные writable хотя бы в одной инструкции, в порядке появления
     */
    public List<String> writableAccounts() {
        Set<String> writable = new LinkedHashSet<>();
        for (Instruction instruction : instructions) {
            for (AccountMeta meta : instruction.getAccounts()) {
                if (meta.isWritable()) {
                    writable.add(meta.getAddress());
                }
            }
        }
        return new ArrayList<>(writable);
    }

    public List<String> programIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Instruction instruction : instructions) {
            ids.add(instruction.getProgramId());
        }
        return new ArrayList<>(ids);
    }

    public SignerIdentity findSigner(String address) {
        for (SignerIdentity signer : signers) {
            if (signer.address().equals(address)) {
                return signer;
            }
        }
        return null;
    }
}

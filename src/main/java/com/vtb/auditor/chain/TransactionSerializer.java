package com.vtb.auditor.chain;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сериализация legacy-транзакции Solana: подписи + message.
 * Порядок ключей: fee payer, writable signers, readonly signers, writable, readonly.
 */
public final class TransactionSerializer {

    public static final int SIGNATURE_LENGTH = 64;
    private static final int MAX_ACCOUNT_KEYS = 256;
    private static final int MAX_PACKET_SIZE = 1232;

    private TransactionSerializer() {
    }

    public static byte[] serialize(CandidateTransaction transaction, byte[] recentBlockhash) {
        CompiledMessage message = compile(transaction, recentBlockhash);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeCompactU16(out, message.requiredSignatures());
        for (int i = 0; i < message.requiredSignatures(); i++) {
            SignerIdentity signer = transaction.findSigner(message.accountKeys().get(i));
            byte[] signature = signer != null ? signer.sign(message.bytes()) : new byte[SIGNATURE_LENGTH];
            out.writeBytes(signature);
        }
        out.writeBytes(message.bytes());
        return out.toByteArray();
    }

    /**
     * Размер больше лимита пакета - транзакция не пройдет через RPC
     */
    public static boolean exceedsPacketSize(byte[] serialized) {
        return serialized.length > MAX_PACKET_SIZE;
    }

    public static CompiledMessage compile(CandidateTransaction transaction, byte[] recentBlockhash) {
        if (transaction.getFeePayer() == null) {
            throw new InstructionBuildException("У транзакции не задан fee payer");
        }
        if (recentBlockhash == null || recentBlockhash.length != 32) {
            throw new InstructionBuildException("Blockhash должен содержать 32 байта");
        }

        Map<String, KeyFlags> keys = new LinkedHashMap<>();
        keys.put(transaction.getFeePayer(), new KeyFlags(true, true));
        for (Instruction instruction : transaction.getInstructions()) {
            for (AccountMeta meta : instruction.getAccounts()) {
                keys.merge(meta.getAddress(), new KeyFlags(meta.isSigner(), meta.isWritable()), KeyFlags::or);
            }
            keys.merge(instruction.getProgramId(), new KeyFlags(false, false), KeyFlags::or);
        }

        // fee payer уже первый, стабильная сортировка его не сдвигает
        List<Map.Entry<String, KeyFlags>> ordered = new ArrayList<>(keys.entrySet());
        ordered.sort(Comparator.comparingInt(entry -> entry.getValue().group()));
        if (ordered.size() > MAX_ACCOUNT_KEYS) {
            throw new InstructionBuildException("Слишком много аккаунтов в транзакции: " + ordered.size());
        }

        List<String> accountKeys = new ArrayList<>();
        int requiredSignatures = 0;
        int readonlySigned = 0;
        int readonlyUnsigned = 0;
        for (Map.Entry<String, KeyFlags> entry : ordered) {
            accountKeys.add(entry.getKey());
            KeyFlags flags = entry.getValue();
            if (flags.signer()) {
                requiredSignatures++;
                if (!flags.writable()) {
                    readonlySigned++;
                }
            } else if (!flags.writable()) {
                readonlyUnsigned++;
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(requiredSignatures);
        out.write(readonlySigned);
        out.write(readonlyUnsigned);
        writeCompactU16(out, accountKeys.size());
        for (String key : accountKeys) {
            out.writeBytes(decodeKey(key));
        }
        out.writeBytes(recentBlockhash);
        writeCompactU16(out, transaction.getInstructions().size());
        for (Instruction instruction : transaction.getInstructions()) {
            out.write(accountKeys.indexOf(instruction.getProgramId()));
            writeCompactU16(out, instruction.getAccounts().size());
            for (AccountMeta meta : instruction.getAccounts()) {
                out.write(accountKeys.indexOf(meta.getAddress()));
            }
            byte[] data = instruction.getData();
            writeCompactU16(out, data.length);
            out.writeBytes(data);
        }
        return new CompiledMessage(List.copyOf(accountKeys), requiredSignatures, out.toByteArray());
    }

    static void writeCompactU16(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new InstructionBuildException("compact-u16 вне диапазона: " + value);
        }
        int remaining = value;
        while (true) {
            int element = remaining & 0x7F;
            remaining >>>= 7;
            if (remaining == 0) {
                out.write(element);
                return;
            }
            out.write(element | 0x80);
        }
    }

    private static byte[] decodeKey(String key) {
        try {
            return PublicKeys.decode(key);
        } catch (IllegalArgumentException e) {
            throw new InstructionBuildException("Некорректный адрес в транзакции: " + key, e);
        }
    }

    public record CompiledMessage(List<String> accountKeys, int requiredSignatures, byte[] bytes) {
    }

    private record KeyFlags(boolean signer, boolean writable) {

        KeyFlags or(KeyFlags other) {
            return new KeyFlags(signer || other.signer, writable || other.writable);
        }

        int group() {
            if (signer) {
                return writable ? 0 : 1;
            }
            return writable ? 2 : 3;
        }
    }
}

package com.vtb.auditor.chain;

import org.bouncycastle.math.ec.rfc8032.Ed25519;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Program Derived Address: sha256(seeds || programId || "ProgramDerivedAddress"),
 * результат обязан лежать вне кривой ed25519.
 */
public record ProgramAddress(String address, int bump) {

    private static final int MAX_SEEDS = 16;
    private static final int MAX_SEED_LENGTH = 32;
    private static final byte[] PDA_MARKER = "ProgramDerivedAddress".getBytes(StandardCharsets.US_ASCII);

    public static ProgramAddress find(List<byte[]> seeds, String programId) {
        for (int bump = 255; bump >= 0; bump--) {
            List<byte[]> withBump = new ArrayList<>(seeds);
            withBump.add(new byte[]{(byte) bump});
            byte[] candidate = hash(withBump, programId);
            if (!isOnCurve(candidate)) {
                return new ProgramAddress(PublicKeys.encode(candidate), bump);
            }
        }
        throw new InstructionBuildException("Не удалось найти bump для PDA программы " + programId);
    }

    public static String create(List<byte[]> seeds, String programId) {
        byte[] candidate = hash(seeds, programId);
        if (isOnCurve(candidate)) {
            throw new InstructionBuildException("Адрес по seeds лежит на кривой ed25519");
        }
        return PublicKeys.encode(candidate);
    }

    private static byte[] hash(List<byte[]> seeds, String programId) {
        if (seeds.size() > MAX_SEEDS) {
            throw new InstructionBuildException("Слишком много seeds: " + seeds.size());
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (byte[] seed : seeds) {
                if (seed.length > MAX_SEED_LENGTH) {
                    throw new InstructionBuildException("Seed длиннее 32 байт");
                }
                digest.update(seed);
            }
            digest.update(PublicKeys.decode(programId));
            digest.update(PDA_MARKER);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Точка декомпрессируется в ed25519 (без проверки подгруппы, как в Solana runtime)
     */
    static boolean isOnCurve(byte[] compressed) {
        return Ed25519.validatePublicKeyPartial(compressed, 0);
    }
}

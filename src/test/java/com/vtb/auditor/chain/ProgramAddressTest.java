package com.vtb.auditor.chain;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgramAddressTest {

    private static final String SWAP_PROGRAM = "5ag9ncKTGrhDxdfvRxmSenP848kkgP6BMdaTFLfa2siT";

    @Test
    void testFindIsDeterministicAndOffCurve() {
        List<byte[]> seeds = List.of("config".getBytes(StandardCharsets.UTF_8));

        ProgramAddress first = ProgramAddress.find(seeds, SWAP_PROGRAM);
        ProgramAddress second = ProgramAddress.find(seeds, SWAP_PROGRAM);

        assertEquals(first, second);
        assertTrue(first.bump() >= 0 && first.bump() <= 255);
        assertFalse(ProgramAddress.isOnCurve(PublicKeys.decode(first.address())),
            "PDA не может лежать на кривой ed25519");
    }

    @Test
    void testCreateWithFoundBumpReturnsSameAddress() {
        List<byte[]> seeds = List.of("escrow".getBytes(StandardCharsets.UTF_8));
        ProgramAddress pda = ProgramAddress.find(seeds, SWAP_PROGRAM);

        List<byte[]> withBump = new ArrayList<>(seeds);
        withBump.add(new byte[]{(byte) pda.bump()});

        assertEquals(pda.address(), ProgramAddress.create(withBump, SWAP_PROGRAM));
    }

    @Test
    void testDifferentSeedsGiveDifferentAddresses() {
        String config = ProgramAddress.find(List.of("config".getBytes(StandardCharsets.UTF_8)), SWAP_PROGRAM).address();
        String escrow = ProgramAddress.find(List.of("escrow".getBytes(StandardCharsets.UTF_8)), SWAP_PROGRAM).address();

        assertNotEquals(config, escrow);
    }

    @Test
    void testRealPublicKeyIsOnCurve() {
        SignerIdentity signer = SignerIdentity.generate();

        assertTrue(ProgramAddress.isOnCurve(PublicKeys.decode(signer.address())));
    }

    @Test
    void testGeneratedKeysAreOnCurveAndPdasAreNot() {
        for (int i = 0; i < 64; i++) {
            SignerIdentity signer = SignerIdentity.generate();
            assertTrue(ProgramAddress.isOnCurve(PublicKeys.decode(signer.address())), signer.address());

            ProgramAddress pda = ProgramAddress.find(List.of(PublicKeys.decode(signer.address())), SWAP_PROGRAM);
            assertFalse(ProgramAddress.isOnCurve(PublicKeys.decode(pda.address())), pda.address());
        }
    }

    @Test
    void testSystemProgramKeyIsOnCurve() {
        // y = 0 декомпрессируется: x^2 = -1 имеет корень по модулю 2^255 - 19
        assertTrue(ProgramAddress.isOnCurve(PublicKeys.decode(PublicKeys.SYSTEM_PROGRAM)));
    }

    @Test
    void testSeedLongerThan32BytesIsRejected() {
        List<byte[]> seeds = List.of(new byte[33]);

        assertThrows(InstructionBuildException.class, () -> ProgramAddress.find(seeds, SWAP_PROGRAM));
    }
}

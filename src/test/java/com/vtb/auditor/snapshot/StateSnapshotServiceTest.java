package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.testsupport.FakeChainClient;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateSnapshotServiceTest {

    private FakeChainClient client;
    private StateSnapshotService service;

    @BeforeEach
    void setUp() {
        client = new FakeChainClient();
        service = new StateSnapshotService(client, StateSnapshotService.standardDecoders(), TestFixtures.clock());
    }

    @Test
    void testCaptureRecordsMissingAndDecodedAccounts() {
        client.withAccount(AccountDecodersTest.tokenAccount("vault", AccountDecodersTest.MINT,
            PublicKeys.SYSVAR_RENT, 10L));

        StateSnapshot snapshot = service.capture("pre", List.of("vault", "ghost", "vault"));

        assertEquals(2, snapshot.getAccounts().size(), "Дубликаты адресов схлопываются");
        assertTrue(snapshot.hasLiveAccount("vault"));
        assertFalse(snapshot.hasLiveAccount("ghost"));
        AccountStateSnapshot vault = snapshot.account("vault");
        assertEquals("spl-token-account", vault.getDecodedAs());
        assertEquals(BigInteger.TEN, vault.getBalances().get(AccountDecodersTest.MINT));
        assertEquals(BigInteger.valueOf(2_039_280L), vault.getBalances().get(AccountStateSnapshot.NATIVE_BALANCE_KEY));
        assertEquals(TestFixtures.NOW, snapshot.getCapturedAt());
    }

    @Test
    void testDiffReportsCreatedClosedAndModified() {
        client.withAccount(account("a", 100L, PublicKeys.SYSTEM_PROGRAM, new byte[]{1}));
        client.withAccount(account("b", 100L, PublicKeys.SYSTEM_PROGRAM, new byte[]{1}));
        StateSnapshot pre = service.capture("pre", List.of("a", "b", "c"));

        Map<String, AccountInfo> post = new LinkedHashMap<>();
        post.put("a", account("a", 2_000_000_000L, PublicKeys.TOKEN_PROGRAM, new byte[]{1}));
        post.put("b", null);
        post.put("c", account("c", 1L, PublicKeys.SYSTEM_PROGRAM, new byte[0]));
        StateSnapshot after = service.fromSimulation("post", List.of("a", "b", "c"), post);

        StateDiff diff = service.diff(pre, after);

        assertEquals(List.of("c"), diff.getCreated());
        assertEquals(List.of("b"), diff.getClosed());
        assertEquals(1, diff.getModified().size());
        StateDiff.AccountChange change = diff.getModified().get(0);
        assertEquals(1_999_999_900L, change.lamportsDelta());
        assertTrue(change.ownerChanged());
        assertTrue(diff.getSuspicious().stream().anyMatch(s -> s.severity() == Severity.CRITICAL),
            "Смена владельца критична");
        assertTrue(diff.getSuspicious().stream().anyMatch(s -> s.reason().startsWith("Large SOL transfer")));
    }

    @Test
    void testDataChangeWithoutBalanceIsSuspicious() {
        client.withAccount(account("a", 100L, PublicKeys.SYSTEM_PROGRAM, new byte[]{1}));
        StateSnapshot pre = service.capture("pre", List.of("a"));

        StateSnapshot post = service.fromSimulation("post", List.of("a"),
            Map.of("a", account("a", 100L, PublicKeys.SYSTEM_PROGRAM, new byte[]{2})));

        StateDiff diff = service.diff(pre, post);
        assertEquals(1, diff.getSuspicious().size());
        assertEquals(Severity.MEDIUM, diff.getSuspicious().get(0).severity());
    }

    @Test
    void testWithoutSimulatedStatePostSnapshotIsRecaptured() {
        client.withAccount(account("a", 100L, PublicKeys.SYSTEM_PROGRAM, new byte[]{1}));
        StateSnapshot pre = service.capture("pre", List.of("a"));

        StateSnapshot post = service.fromSimulation("post", List.of("a"), null);

        assertNotEquals(pre.getId(), post.getId());
        assertTrue(service.diff(pre, post).isEmpty());
    }

    @Test
    void testCaptureProgramCollectsOwnedAccounts() {
        client.withAccount(account("owned", 1L, AccountDecodersTest.STAKING, new byte[8]));
        client.withAccount(account("other", 1L, PublicKeys.SYSTEM_PROGRAM, new byte[8]));

        StateSnapshot snapshot = service.captureProgram("program", AccountDecodersTest.STAKING);

        assertEquals(List.of("owned"), List.copyOf(snapshot.getAccounts().keySet()));
    }

    private static AccountInfo account(String address, long lamports, String owner, byte[] data) {
        return AccountInfo.builder().address(address).lamports(lamports).owner(owner).data(data).build();
    }
}

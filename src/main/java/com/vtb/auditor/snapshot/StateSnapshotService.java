package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.models.Severity;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Снимки состояния аккаунтов до и после атаки и их сравнение
 */
@Slf4j
public class StateSnapshotService {

    static final long LARGE_TRANSFER_LAMPORTS = 1_000_000_000L;
    static final int SUSPICIOUS_GROWTH_BYTES = 10_000;

    private final ChainClient client;
    private final List<AccountDecoder> decoders;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public StateSnapshotService(ChainClient client, List<AccountDecoder> decoders, Clock clock) {
        this.client = client;
        this.decoders = List.copyOf(decoders);
        this.clock = clock;
    }

    public static List<AccountDecoder> standardDecoders() {
        List<AccountDecoder> decoders = new ArrayList<>();
        decoders.add(new SplTokenAccountDecoder());
        decoders.add(new SplMintDecoder());
        return decoders;
    }

    public StateSnapshot capture(String description, Collection<String> addresses) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(addresses));
        Map<String, AccountInfo> accounts = unique.isEmpty() ? Map.of() : client.getMultipleAccounts(unique);
        Instant capturedAt = clock.instant();
        StateSnapshot snapshot = build(description, unique, accounts, capturedAt);
        log.debug("Снимок {} ({}): {} аккаунтов", snapshot.getId(), description, unique.size());
        return snapshot;
    }

    /**
     * Снимок всех аккаунтов программы
     */
    public StateSnapshot captureProgram(String description, String programId) {
        Map<String, AccountInfo> accounts = new LinkedHashMap<>();
        for (AccountInfo account : client.getProgramAccounts(programId)) {
            accounts.put(account.getAddress(), account);
        }
        return build(description, new ArrayList<>(accounts.keySet()), accounts, clock.instant());
    }

    /**
     * Пост-состояние из результата симуляции. Без него состояние перечитывается из сети.
     */
    public StateSnapshot fromSimulation(String description, Collection<String> addresses,
                                        Map<String, AccountInfo> postAccounts) {
        if (postAccounts == null) {
            return capture(description, addresses);
        }
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(addresses));
        return build(description, unique, postAccounts, clock.instant());
    }

    public StateDiff diff(StateSnapshot pre, StateSnapshot post) {
        StateDiff.StateDiffBuilder diff = StateDiff.builder()
            .preSnapshotId(pre.getId())
            .postSnapshotId(post.getId());
        List<String> created = new ArrayList<>();
        List<String> closed = new ArrayList<>();
        List<StateDiff.AccountChange> modified = new ArrayList<>();
        List<StateDiff.SuspiciousChange> suspicious = new ArrayList<>();

        LinkedHashSet<String> addresses = new LinkedHashSet<>(pre.getAccounts().keySet());
        addresses.addAll(post.getAccounts().keySet());
        for (String address : addresses) {
            boolean before = pre.hasLiveAccount(address);
            boolean after = post.hasLiveAccount(address);
            if (!before && after) {
                created.add(address);
                continue;
            }
            if (before && !after) {
                closed.add(address);
                continue;
            }
            if (!before) {
                continue;
            }
            AccountStateSnapshot a = pre.account(address);
            AccountStateSnapshot b = post.account(address);
            long lamportsDelta = b.getLamports() - a.getLamports();
            boolean ownerChanged = !Objects.equals(a.getOwner(), b.getOwner());
            boolean dataChanged = !Objects.equals(a.getDataHash(), b.getDataHash());
            int sizeDelta = b.getDataSize() - a.getDataSize();
            if (lamportsDelta == 0 && !ownerChanged && !dataChanged && sizeDelta == 0) {
                continue;
            }
            modified.add(new StateDiff.AccountChange(address, lamportsDelta, ownerChanged, dataChanged, sizeDelta));

            if (Math.abs(lamportsDelta) > LARGE_TRANSFER_LAMPORTS) {
                suspicious.add(new StateDiff.SuspiciousChange(address,
                    "Large SOL transfer: " + lamportsDelta + " lamports", Severity.HIGH));
            }
            if (ownerChanged) {
                suspicious.add(new StateDiff.SuspiciousChange(address,
                    "Account owner changed: " + a.getOwner() + " -> " + b.getOwner(), Severity.CRITICAL));
            }
            if (dataChanged && lamportsDelta == 0) {
                suspicious.add(new StateDiff.SuspiciousChange(address,
                    "Account data modified without balance change", Severity.MEDIUM));
            }
            if (sizeDelta > SUSPICIOUS_GROWTH_BYTES) {
                suspicious.add(new StateDiff.SuspiciousChange(address,
                    "Account data grew by " + sizeDelta + " bytes", Severity.MEDIUM));
            }
        }
        return diff.created(created).closed(closed).modified(modified).suspicious(suspicious).build();
    }

    private StateSnapshot build(String description, List<String> addresses,
                                Map<String, AccountInfo> accounts, Instant capturedAt) {
        Map<String, AccountStateSnapshot> states = new LinkedHashMap<>();
        for (String address : addresses) {
            AccountInfo account = accounts.get(address);
            states.put(address, account == null
                ? AccountStateSnapshot.missing(address, capturedAt)
                : toState(address, account, capturedAt));
        }
        return StateSnapshot.builder()
            .id("snapshot-" + sequence.incrementAndGet() + "-" + capturedAt.toEpochMilli())
            .description(description)
            .capturedAt(capturedAt)
            .accounts(states)
            .build();
    }

    private AccountStateSnapshot toState(String address, AccountInfo account, Instant capturedAt) {
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        balances.put(AccountStateSnapshot.NATIVE_BALANCE_KEY, BigInteger.valueOf(account.getLamports()));
        Map<String, String> fields = new LinkedHashMap<>();
        String decodedAs = null;
        for (AccountDecoder decoder : decoders) {
            if (!decoder.supports(account)) {
                continue;
            }
            try {
                AccountDecoder.DecodedAccount decoded = decoder.decode(account);
                balances.putAll(decoded.balances());
                fields.putAll(decoded.fields());
                decodedAs = decoder.name();
                break;
            } catch (RuntimeException e) {
                log.warn("Декодер {} не смог разобрать аккаунт {}: {}", decoder.name(), address, e.getMessage());
            }
        }
        return AccountStateSnapshot.builder()
            .address(address)
            .exists(true)
            .lamports(account.getLamports())
            .owner(account.getOwner())
            .balances(balances)
            .decodedFields(fields)
            .dataSize(account.dataSize())
            .dataHash(sha256Hex(account.getData()))
            .decodedAs(decodedAs)
            .capturedAt(capturedAt)
            .build();
    }

    private static String sha256Hex(byte[] data) {
        try {
            return Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}

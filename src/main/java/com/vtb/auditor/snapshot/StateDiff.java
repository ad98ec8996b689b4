package com.vtb.auditor.snapshot;

import com.vtb.auditor.models.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Разница между двумя снимками состояния
 */
@Value
@Builder
public class StateDiff {
    String preSnapshotId;
    String postSnapshotId;
    @Builder.Default
    List<String> created = new ArrayList<>();
    @Builder.Default
    List<String> closed = new ArrayList<>();
    @Builder.Default
    List<AccountChange> modified = new ArrayList<>();
    @Builder.Default
    List<SuspiciousChange> suspicious = new ArrayList<>();

    public boolean isEmpty() {
        return created.isEmpty() && closed.isEmpty() && modified.isEmpty();
    }

    public String summary() {
        return "created=" + created.size() + ", closed=" + closed.size()
            + ", modified=" + modified.size() + ", suspicious=" + suspicious.size();
    }

    public record AccountChange(String address, long lamportsDelta, boolean ownerChanged,
                                boolean dataChanged, int dataSizeDelta) {
    }

    public record SuspiciousChange(String address, String reason, Severity severity) {
    }
}

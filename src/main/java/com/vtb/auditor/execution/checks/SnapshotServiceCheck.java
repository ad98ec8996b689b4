package com.vtb.auditor.execution.checks;

import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.execution.InfrastructureCheckOutcome;
import com.vtb.auditor.snapshot.StateDiff;
import com.vtb.auditor.snapshot.StateSnapshot;
import com.vtb.auditor.snapshot.StateSnapshotService;

import java.util.List;

/**
 * Два последовательных снимка неизменного аккаунта должны совпадать
 */
public class SnapshotServiceCheck implements InfrastructureCheck {

    private final StateSnapshotService snapshots;

    public SnapshotServiceCheck(StateSnapshotService snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    public String id() {
        return "infra-snapshot-service";
    }

    @Override
    public String name() {
        return "State Snapshot Service";
    }

    @Override
    public InfrastructureCheckOutcome run() {
        List<String> rentSysvar = List.of(PublicKeys.SYSVAR_RENT);
        StateSnapshot first = snapshots.capture("self-check 1", rentSysvar);
        StateSnapshot second = snapshots.capture("self-check 2", rentSysvar);
        if (!first.hasLiveAccount(PublicKeys.SYSVAR_RENT)) {
            return InfrastructureCheckOutcome.failed("Rent sysvar is not readable");
        }
        StateDiff diff = snapshots.diff(first, second);
        if (!diff.isEmpty()) {
            return InfrastructureCheckOutcome.failed("Unchanged account produced a diff: " + diff.summary());
        }
        return InfrastructureCheckOutcome.ok("Snapshots are consistent");
    }
}

package com.vtb.auditor.execution.checks;

import com.vtb.auditor.catalog.TargetCatalog;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.detection.DetectionEngine;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.snapshot.StateSnapshotService;

import java.util.ArrayList;
import java.util.List;

public final class StandardChecks {

    private StandardChecks() {
    }

    public static List<InfrastructureCheck> create(ChainClient client, TargetCatalog catalog,
                                                   StateSnapshotService snapshots, DetectionEngine engine,
                                                   String feePayer) {
        List<InfrastructureCheck> checks = new ArrayList<>();
        checks.add(new ClusterHealthCheck(client));
        checks.add(new FeePayerCheck(client, feePayer));
        for (TargetProgram target : catalog.all()) {
            checks.add(new TargetDeploymentCheck(client, target));
        }
        checks.add(new SnapshotServiceCheck(snapshots));
        checks.add(new DetectionEngineCheck(engine));
        return checks;
    }
}

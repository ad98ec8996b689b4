package com.vtb.auditor.execution.checks;

import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.execution.InfrastructureCheckOutcome;

public class ClusterHealthCheck implements InfrastructureCheck {

    private final ChainClient client;

    public ClusterHealthCheck(ChainClient client) {
        this.client = client;
    }

    @Override
    public String id() {
        return "infra-cluster-health";
    }

    @Override
    public String name() {
        return "Cluster Health";
    }

    @Override
    public InfrastructureCheckOutcome run() {
        if (!client.isHealthy()) {
            return InfrastructureCheckOutcome.failed("RPC node " + client.endpoint() + " reports unhealthy");
        }
        byte[] blockhash = client.getLatestBlockhash();
        if (blockhash == null || blockhash.length != 32) {
            return InfrastructureCheckOutcome.failed("RPC node " + client.endpoint() + " returned no recent blockhash");
        }
        return InfrastructureCheckOutcome.ok("RPC node " + client.endpoint() + " is healthy");
    }
}

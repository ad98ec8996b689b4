package com.vtb.auditor.execution.checks;

import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.execution.InfrastructureCheckOutcome;

/**
 * Программа-цель развернута: аккаунт существует и исполняемый
 */
public class TargetDeploymentCheck implements InfrastructureCheck {

    private final ChainClient client;
    private final TargetProgram target;

    public TargetDeploymentCheck(ChainClient client, TargetProgram target) {
        this.client = client;
        this.target = target;
    }

    @Override
    public String id() {
        return "infra-deployment-" + target.getName();
    }

    @Override
    public String name() {
        return "Program Deployment";
    }

    @Override
    public String targetProgram() {
        return target.getName();
    }

    @Override
    public InfrastructureCheckOutcome run() {
        AccountInfo account = client.getAccountInfo(target.getAddress());
        if (account == null) {
            return InfrastructureCheckOutcome.failed("Program account " + target.getAddress() + " not found");
        }
        if (!account.isExecutable()) {
            return InfrastructureCheckOutcome.failed("Account " + target.getAddress() + " is not executable");
        }
        return InfrastructureCheckOutcome.ok("Program deployed at " + target.getAddress()
            + " (owner " + account.getOwner() + ")");
    }
}

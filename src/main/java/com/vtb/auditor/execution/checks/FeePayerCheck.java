package com.vtb.auditor.execution.checks;

import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.execution.InfrastructureCheckOutcome;

/**
 * Аккаунт, оплачивающий комиссии, существует и имеет баланс.
 * Без него кластер отвечает AccountNotFound на каждую симуляцию.
 */
public class FeePayerCheck implements InfrastructureCheck {

    private final ChainClient client;
    private final String feePayer;

    public FeePayerCheck(ChainClient client, String feePayer) {
        this.client = client;
        this.feePayer = feePayer;
    }

    @Override
    public String id() {
        return "infra-fee-payer";
    }

    @Override
    public String name() {
        return "Fee Payer Funded";
    }

    @Override
    public InfrastructureCheckOutcome run() {
        AccountInfo account = client.getAccountInfo(feePayer);
        if (account == null) {
            return InfrastructureCheckOutcome.failed("Fee payer " + feePayer
                + " not found on cluster; configure simulator.feePayerKeypair with a funded keypair");
        }
        if (account.getLamports() <= 0) {
            return InfrastructureCheckOutcome.failed("Fee payer " + feePayer + " has zero balance");
        }
        return InfrastructureCheckOutcome.ok("Fee payer " + feePayer + " holds " + account.getLamports() + " lamports");
    }
}

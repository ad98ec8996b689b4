package com.vtb.auditor.chain;

import lombok.Value;

@Value
public class AccountMeta {
    String address;
    boolean signer;
    boolean writable;

    public static AccountMeta writable(String address, boolean signer) {
        return new AccountMeta(address, signer, true);
    }

    public static AccountMeta readonly(String address, boolean signer) {
        return new AccountMeta(address, signer, false);
    }
}

package com.vtb.auditor.chain;

import lombok.Builder;
import lombok.Value;

/**
 * Снимок аккаунта, прочитанный через RPC
 */
@Value
@Builder
public class AccountInfo {
    String address;
    long lamports;
    String owner;
    byte[] data;
    boolean executable;

    public byte[] getData() {
        return data != null ? data.clone() : new byte[0];
    }

    public int dataSize() {
        return data != null ? data.length : 0;
    }
}

package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.PublicKeys;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SPL Token account: mint [0..32), owner [32..64), amount u64 LE [64..72)
 */
public class SplTokenAccountDecoder implements AccountDecoder {

    static final int ACCOUNT_SIZE = 165;

    @Override
    public String name() {
        return "spl-token-account";
    }

    @Override
    public boolean supports(AccountInfo account) {
        return PublicKeys.TOKEN_PROGRAM.equals(account.getOwner()) && account.dataSize() == ACCOUNT_SIZE;
    }

    @Override
    public DecodedAccount decode(AccountInfo account) {
        byte[] data = account.getData();
        String mint = ByteReader.readPublicKey(data, 0);
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        balances.put(mint, ByteReader.readUnsigned(data, 64, 8));
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("mint", mint);
        fields.put("owner", ByteReader.readPublicKey(data, 32));
        return new DecodedAccount(balances, fields);
    }
}

package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.PublicKeys;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SPL Mint (82 байта): COption mintAuthority, supply, decimals, isInitialized, COption freezeAuthority
 */
public class SplMintDecoder implements AccountDecoder {

    static final int MINT_SIZE = 82;

    @Override
    public String name() {
        return "spl-mint";
    }

    @Override
    public boolean supports(AccountInfo account) {
        return PublicKeys.TOKEN_PROGRAM.equals(account.getOwner()) && account.dataSize() == MINT_SIZE;
    }

    @Override
    public DecodedAccount decode(AccountInfo account) {
        byte[] data = account.getData();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("mintAuthority", readOption(data, 0));
        fields.put("totalSupply", ByteReader.readUnsigned(data, 36, 8).toString());
        fields.put("decimals", String.valueOf(data[44] & 0xFF));
        fields.put("freezeAuthority", readOption(data, 46));
        return new DecodedAccount(new LinkedHashMap<>(), fields);
    }

    private static String readOption(byte[] data, int offset) {
        boolean present = ByteReader.readUnsigned(data, offset, 4).signum() != 0;
        return present ? ByteReader.readPublicKey(data, offset + 4) : "none";
    }
}

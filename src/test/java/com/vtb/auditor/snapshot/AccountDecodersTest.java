package com.vtb.auditor.snapshot;

import com.vtb.auditor.catalog.AnchorInstructionBuilder;
import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.config.AuditorConfig;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountDecodersTest {

    static final String STAKING = "DtTDbmQgghWJYp3F4vhaaJGyGoF86qRZh9t2kMtmPBbg";
    static final String MINT = "So11111111111111111111111111111111111111112";

    @Test
    void testSplTokenAccountBalanceKeyedByMint() {
        AccountInfo account = tokenAccount("ta", MINT, PublicKeys.SYSVAR_RENT, 1_500L);
        SplTokenAccountDecoder decoder = new SplTokenAccountDecoder();

        assertTrue(decoder.supports(account));
        AccountDecoder.DecodedAccount decoded = decoder.decode(account);
        assertEquals(BigInteger.valueOf(1_500L), decoded.balances().get(MINT));
        assertEquals(PublicKeys.SYSVAR_RENT, decoded.fields().get("owner"));
    }

    @Test
    void testSplMintExposesAuthorityAndSupply() {
        byte[] data = new byte[SplMintDecoder.MINT_SIZE];
        data[0] = 1;
        System.arraycopy(PublicKeys.decode(PublicKeys.SYSVAR_CLOCK), 0, data, 4, 32);
        writeU64(data, 36, 1_000_000L);
        data[44] = 9;
        AccountInfo mint = AccountInfo.builder().address(MINT).owner(PublicKeys.TOKEN_PROGRAM).data(data).build();

        AccountDecoder.DecodedAccount decoded = new SplMintDecoder().decode(mint);

        assertEquals(PublicKeys.SYSVAR_CLOCK, decoded.fields().get("mintAuthority"));
        assertEquals("1000000", decoded.fields().get("totalSupply"));
        assertEquals("9", decoded.fields().get("decimals"));
        assertEquals("none", decoded.fields().get("freezeAuthority"));
    }

    @Test
    void testLayoutDecoderMatchesDiscriminatorAndOwner() {
        LayoutAccountDecoder decoder = new LayoutAccountDecoder(STAKING, userStakeLayout());
        byte[] data = new byte[64];
        System.arraycopy(AnchorInstructionBuilder.discriminator("account", "UserStake"), 0, data, 0, 8);
        System.arraycopy(PublicKeys.decode(PublicKeys.SYSVAR_RENT), 0, data, 8, 32);
        writeU64(data, 40, 777L);
        writeU64(data, 48, -5L);
        AccountInfo account = AccountInfo.builder().address("stake").owner(STAKING).data(data).build();

        assertTrue(decoder.supports(account));
        AccountDecoder.DecodedAccount decoded = decoder.decode(account);
        assertEquals(PublicKeys.SYSVAR_RENT, decoded.fields().get("owner"));
        assertEquals(BigInteger.valueOf(777L), decoded.balances().get("staked_amount"));
        assertEquals("-5", decoded.fields().get("last_claim_time"));
        assertFalse(decoded.balances().containsKey("last_claim_time"));

        AccountInfo foreign = AccountInfo.builder().address("stake").owner(PublicKeys.SYSTEM_PROGRAM).data(data).build();
        assertFalse(decoder.supports(foreign), "Чужой владелец");
        AccountInfo other = AccountInfo.builder().address("stake").owner(STAKING).data(new byte[64]).build();
        assertFalse(decoder.supports(other), "Другой дискриминатор");
    }

    static AuditorConfig.AccountLayout userStakeLayout() {
        AuditorConfig.AccountLayout layout = new AuditorConfig.AccountLayout();
        layout.setName("UserStake");
        layout.setFields(List.of(
            field("owner", 8, "pubkey", false),
            field("staked_amount", 40, "u64", true),
            field("last_claim_time", 48, "i64", false),
            field("beyond_end", 200, "u64", true)));
        return layout;
    }

    static AuditorConfig.FieldLayout field(String name, int offset, String type, boolean balance) {
        AuditorConfig.FieldLayout field = new AuditorConfig.FieldLayout();
        field.setName(name);
        field.setOffset(offset);
        field.setType(type);
        field.setBalance(balance);
        return field;
    }

    static AccountInfo tokenAccount(String address, String mint, String owner, long amount) {
        byte[] data = new byte[SplTokenAccountDecoder.ACCOUNT_SIZE];
        System.arraycopy(PublicKeys.decode(mint), 0, data, 0, 32);
        System.arraycopy(PublicKeys.decode(owner), 0, data, 32, 32);
        writeU64(data, 64, amount);
        return AccountInfo.builder()
            .address(address)
            .owner(PublicKeys.TOKEN_PROGRAM)
            .lamports(2_039_280L)
            .data(data)
            .build();
    }

    static void writeU64(byte[] data, int offset, long value) {
        for (int i = 0; i < 8; i++) {
            data[offset + i] = (byte) (value >>> (8 * i));
        }
    }
}

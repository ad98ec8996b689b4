package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.AccountMeta;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.chain.ProgramAddress;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnchorInstructionBuilderTest {

    private TargetCatalog catalog;
    private TargetProgram swap;
    private SignerIdentity attacker;
    private BuildContext context;

    @BeforeEach
    void setUp() {
        catalog = TargetCatalogLoader.load(TestFixtures.config());
        swap = catalog.find("swap").orElseThrow();
        attacker = TestFixtures.attacker();
        context = new BuildContext(swap, attacker, Map.of("admin", PublicKeys.SYSVAR_RENT), catalog);
    }

    @Test
    void testSwapInstructionUsesAnchorDiscriminatorAndDefaultAmount() {
        Instruction instruction = swap.getCapabilities().require(Capability.SWAP)
            .build(context, InstructionArgs.none());

        byte[] data = instruction.getData();
        assertEquals(16, data.length);
        assertArrayEquals(AnchorInstructionBuilder.discriminator("global", "swap_tokens"), Arrays.copyOf(data, 8));
        assertArrayEquals(new byte[]{(byte) 0xe8, 0x03, 0, 0, 0, 0, 0, 0}, Arrays.copyOfRange(data, 8, 16),
            "Значение по умолчанию 1000 в little-endian");
        assertEquals(swap.getAddress(), instruction.getProgramId());
    }

    @Test
    void testAccountsResolvedFromRolesAndSeeds() {
        Instruction instruction = swap.getCapabilities().require(Capability.SWAP)
            .build(context, InstructionArgs.none());

        List<AccountMeta> accounts = instruction.getAccounts();
        assertEquals(new AccountMeta(attacker.address(), true, true), accounts.get(0));
        String config = ProgramAddress.find(List.of("config".getBytes(StandardCharsets.UTF_8)),
            swap.getAddress()).address();
        assertEquals(new AccountMeta(config, false, true), accounts.get(1));
        assertEquals(PublicKeys.TOKEN_PROGRAM, accounts.get(3).getAddress());
        assertFalse(accounts.get(3).isWritable());
    }

    @Test
    void testScenarioArgumentsAndOverridesWin() {
        InstructionArgs args = InstructionArgs.builder()
            .value("amount", 0L)
            .value("unused", 5L)
            .accountOverride("vault", PublicKeys.SYSVAR_CLOCK)
            .build();

        Instruction instruction = swap.getCapabilities().require(Capability.SWAP).build(context, args);

        assertArrayEquals(new byte[8], Arrays.copyOfRange(instruction.getData(), 8, 16));
        assertEquals(PublicKeys.SYSVAR_CLOCK, instruction.getAccounts().get(2).getAddress());
    }

    @Test
    void testPubkeyArgumentResolvesRole() {
        Instruction instruction = swap.getCapabilities().require(Capability.PRIVILEGED_OPERATION)
            .build(context, InstructionArgs.none());

        assertArrayEquals(PublicKeys.decode(attacker.address()),
            Arrays.copyOfRange(instruction.getData(), 8, 40));
    }

    @Test
    void testOptionArgumentsEncodeBorshTags() {
        AnchorInstructionBuilder builder = new AnchorInstructionBuilder(template("update_platform_settings",
            arg("new_platform_fee_bps", "option:u16", "none"),
            arg("new_treasury", "option:pubkey", "role:signer")));

        byte[] none = builder.build(context, InstructionArgs.none()).getData();
        assertEquals(8 + 1 + 1 + 32, none.length);
        assertEquals(0, none[8], "None кодируется одним нулевым байтом");
        assertEquals(1, none[9]);

        byte[] some = builder.build(context, InstructionArgs.builder().value("new_platform_fee_bps", 250).build())
            .getData();
        assertArrayEquals(new byte[]{1, (byte) 250, 0}, Arrays.copyOfRange(some, 8, 11));
    }

    @Test
    void testSignedAndStringArguments() {
        AnchorInstructionBuilder builder = new AnchorInstructionBuilder(template("update_prices",
            arg("timestamp", "i64", null),
            arg("label", "string", "ab")));

        byte[] data = builder.build(context, InstructionArgs.builder().value("timestamp", -1L).build()).getData();

        byte[] minusOne = new byte[8];
        Arrays.fill(minusOne, (byte) 0xff);
        assertArrayEquals(minusOne, Arrays.copyOfRange(data, 8, 16));
        assertArrayEquals(new byte[]{2, 0, 0, 0, 'a', 'b'}, Arrays.copyOfRange(data, 16, 22));
    }

    @Test
    void testMissingArgumentFailsBuild() {
        AnchorInstructionBuilder builder = new AnchorInstructionBuilder(template("stake_tokens",
            arg("amount", "u64", null)));

        assertThrows(InstructionBuildException.class, () -> builder.build(context, InstructionArgs.none()));
    }

    @Test
    void testOutOfRangeArgumentFailsBuild() {
        AnchorInstructionBuilder builder = new AnchorInstructionBuilder(template("set_fee",
            arg("fee", "u8", null)));

        assertThrows(InstructionBuildException.class,
            () -> builder.build(context, InstructionArgs.builder().value("fee", 256).build()));
        assertThrows(InstructionBuildException.class,
            () -> builder.build(context, InstructionArgs.builder().value("fee", "abc").build()));
    }

    @Test
    void testTemplateWithoutMethodIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new AnchorInstructionBuilder(new AuditorConfig.InstructionTemplate()));
    }

    private static AuditorConfig.InstructionTemplate template(String method, AuditorConfig.ArgTemplate... args) {
        AuditorConfig.InstructionTemplate template = new AuditorConfig.InstructionTemplate();
        template.setMethod(method);
        AuditorConfig.AccountTemplate signer = new AuditorConfig.AccountTemplate();
        signer.setName("authority");
        signer.setRole("signer");
        signer.setSigner(true);
        template.setAccounts(List.of(signer));
        template.setArgs(List.of(args));
        return template;
    }

    private static AuditorConfig.ArgTemplate arg(String name, String type, String defaultValue) {
        AuditorConfig.ArgTemplate arg = new AuditorConfig.ArgTemplate();
        arg.setName(name);
        arg.setType(type);
        arg.setDefaultValue(defaultValue);
        return arg;
    }
}

package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.chain.ProgramAddress;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuildContextTest {

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
    void testResolvesBuiltInRoles() {
        assertEquals(attacker.address(), context.resolveRole("signer"));
        assertEquals(attacker.address(), context.resolveRole("attacker"));
        assertEquals(swap.getAddress(), context.resolveRole("program"));
        assertEquals(PublicKeys.SYSTEM_PROGRAM, context.resolveRole("system_program"));
        assertEquals(PublicKeys.SYSVAR_CLOCK, context.resolveRole("sysvar_clock"));
        assertEquals(catalog.find("staking").orElseThrow().getAddress(), context.resolveRole("program:staking"));
        assertEquals(PublicKeys.SYSVAR_RENT, context.resolveRole("admin"));
    }

    @Test
    void testUnknownRoleFails() {
        assertThrows(InstructionBuildException.class, () -> context.resolveRole("treasury"));
        assertThrows(InstructionBuildException.class, () -> context.resolveRole("program:unknown"));
        assertThrows(InstructionBuildException.class, () -> context.resolveRole(" "));
    }

    @Test
    void testSeedsSupportRoleAndNumberPrefixes() {
        AuditorConfig.AccountTemplate template = new AuditorConfig.AccountTemplate();
        template.setName("user_stake");
        template.setSeeds(List.of("str:user-stake", "role:signer", "u64:1"));

        String address = context.resolve(template);

        byte[] one = new byte[8];
        one[0] = 1;
        String expected = ProgramAddress.find(List.of(
            "user-stake".getBytes(StandardCharsets.UTF_8),
            PublicKeys.decode(attacker.address()),
            one), swap.getAddress()).address();
        assertEquals(expected, address);
    }

    @Test
    void testSeedProgramSwitchesDerivationProgram() {
        AuditorConfig.AccountTemplate template = new AuditorConfig.AccountTemplate();
        template.setSeeds(List.of("program-state"));
        template.setSeedProgram("program:staking");

        String expected = ProgramAddress.find(List.of("program-state".getBytes(StandardCharsets.UTF_8)),
            catalog.find("staking").orElseThrow().getAddress()).address();
        assertEquals(expected, context.resolve(template));
    }

    @Test
    void testTemplateWithoutSourceFails() {
        AuditorConfig.AccountTemplate template = new AuditorConfig.AccountTemplate();
        template.setName("orphan");

        assertThrows(InstructionBuildException.class, () -> context.resolve(template));
    }

    @Test
    void testCapabilityKeysAreNormalized() {
        assertEquals(Capability.PRICE_UPDATE, Capability.fromKey("price-update"));
        assertEquals(Capability.PRIVILEGED_OPERATION, Capability.fromKey(" privileged_operation "));
        assertThrows(IllegalArgumentException.class, () -> Capability.fromKey("mint"));
    }
}

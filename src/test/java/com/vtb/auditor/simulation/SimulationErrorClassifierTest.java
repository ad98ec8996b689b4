package com.vtb.auditor.simulation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vtb.auditor.testsupport.FakeChainClient.json;
import static org.junit.jupiter.api.Assertions.*;

class SimulationErrorClassifierTest {

    @Test
    void testNoErrorMeansSuccess() {
        assertNull(SimulationErrorClassifier.classify(null, List.of()));
        assertNull(SimulationErrorClassifier.classify(json("null"), List.of()));
    }

    @Test
    void testAnchorErrorIsProgramRejection() {
        ErrorDescriptor error = SimulationErrorClassifier.classify(
            json("{\"InstructionError\":[0,{\"Custom\":6001}]}"),
            List.of("Program log: AnchorError occurred. Error Code: InvalidAmount. Error Number: 6001. "
                + "Error Message: Amount must be greater than zero."));

        assertEquals(ErrorDescriptor.Kind.PROGRAM_REJECTION, error.getKind());
        assertEquals(0, error.getInstructionIndex());
        assertEquals(6001L, error.getCustomCode());
        assertEquals("InvalidAmount", error.getErrorName());
        assertEquals("Amount must be greater than zero", error.getMessage());
    }

    @Test
    void testBuiltInInstructionErrorIsProgramRejection() {
        ErrorDescriptor error = SimulationErrorClassifier.classify(
            json("{\"InstructionError\":[1,\"MissingRequiredSignature\"]}"), List.of());

        assertTrue(error.isProgramRejection());
        assertEquals("MissingRequiredSignature", error.getErrorName());
        assertEquals("MissingRequiredSignature at instruction 1", error.describe());
    }

    @Test
    void testCustomErrorWithoutAnchorLogKeepsRawLine() {
        ErrorDescriptor error = SimulationErrorClassifier.classify(
            json("{\"InstructionError\":[0,{\"Custom\":1}]}"),
            List.of("Program Tokenkeg failed: custom program error: 0x1"));

        assertEquals("Custom", error.getErrorName());
        assertEquals(1L, error.getCustomCode());
        assertTrue(error.getMessage().contains("0x1"));
    }

    @Test
    void testLoadErrorsAreEnvironmentFailures() {
        assertEquals(ErrorDescriptor.Kind.ENVIRONMENT,
            SimulationErrorClassifier.classify(json("\"AccountNotFound\""), List.of()).getKind());
        assertEquals(ErrorDescriptor.Kind.ENVIRONMENT,
            SimulationErrorClassifier.classify(json("\"InsufficientFundsForFee\""), List.of()).getKind());
        assertEquals(ErrorDescriptor.Kind.ENVIRONMENT,
            SimulationErrorClassifier.classify(json("{\"ProgramAccountNotFound\":null}"), List.of()).getKind());
    }

    @Test
    void testOtherTransactionErrorsAreRejections() {
        ErrorDescriptor error = SimulationErrorClassifier.classify(
            json("{\"DuplicateInstruction\":0}"), List.of());

        assertTrue(error.isProgramRejection());
        assertEquals("DuplicateInstruction", error.getErrorName());
    }
}

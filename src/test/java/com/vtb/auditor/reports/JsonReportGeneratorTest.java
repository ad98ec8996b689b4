package com.vtb.auditor.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.TestStatus;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.testsupport.Results;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();

    @Test
    void testWireFormat() throws Exception {
        JsonNode json = new ObjectMapper().readTree(generator.toJson(sample()));

        assertEquals("2025-07-17T08:43:05Z", json.path("summary").path("testDate").asText(),
            "Время должно писаться в ISO-8601");
        JsonNode first = json.path("results").get(0);
        assertEquals("reentrancy", first.path("category").asText());
        assertEquals("failed", first.path("status").asText());
        assertEquals("high", first.path("severity").asText());
        assertTrue(json.path("categoryBreakdown").has("reentrancy"));
        assertTrue(json.has("securityScore"));
        assertFalse(first.has("errored"), "Вычисляемые признаки не сериализуются");
    }

    @Test
    void testReadBackPreservesReport() throws Exception {
        TestSuiteReport original = sample();

        TestSuiteReport restored = generator.fromJson(generator.toJson(original));

        assertEquals(original.getSummary(), restored.getSummary());
        assertEquals(original.getResults(), restored.getResults());
        assertEquals(original.getRecommendations(), restored.getRecommendations());
        assertEquals(TestStatus.ERROR, restored.getResults().get(1).getStatus());
    }

    @Test
    void testGenerateCreatesDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/report.json");

        generator.generate(sample(), target);

        assertTrue(Files.exists(target));
        assertEquals(sample().getSecurityScore(), generator.read(target).getSecurityScore());
    }

    @Test
    void testUnknownFieldsIgnored() throws Exception {
        TestSuiteReport report = generator.fromJson("{\"securityScore\": 42, \"producer\": \"legacy\"}");

        assertEquals(42, report.getSecurityScore());
        assertTrue(report.getResults().isEmpty());
    }

    static TestSuiteReport sample() {
        return new ReportAggregator(Map.of()).aggregate(List.of(
            Results.vulnerable("reentrancy-claim", AttackCategory.REENTRANCY, "staking", Severity.HIGH),
            Results.errored("dos-resource-exhaustion", AttackCategory.DOS, "swap")), TestFixtures.NOW, 250);
    }
}

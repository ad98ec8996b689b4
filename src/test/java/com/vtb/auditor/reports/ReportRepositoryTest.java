package com.vtb.auditor.reports;

import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.testsupport.Results;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-07-17T08:00:00Z");

    @Test
    void testEmptyDirectory(@TempDir Path dir) throws Exception {
        ReportRepository repository = new ReportRepository(dir.resolve("missing"));

        assertTrue(repository.list().isEmpty());
        assertTrue(repository.latest().isEmpty());
        assertTrue(repository.previous(dir.resolve("missing").resolve("audit-report-20250717-080000-000.json")).isEmpty());
    }

    @Test
    void testSaveNamesByRunDate(@TempDir Path dir) throws Exception {
        ReportRepository repository = new ReportRepository(dir);

        Path saved = repository.save(report(T0, 1));

        assertEquals("audit-report-20250717-080000-000.json", saved.getFileName().toString());
        assertEquals(List.of(saved), repository.list());
    }

    @Test
    void testLatestAndPrevious(@TempDir Path dir) throws Exception {
        ReportRepository repository = new ReportRepository(dir);
        Path middle = repository.save(report(T0.plusSeconds(60), 2));
        Path first = repository.save(report(T0, 1));
        Path last = repository.save(report(T0.plusSeconds(120), 3));
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        assertEquals(3, repository.list().size());
        assertEquals(3, repository.latest().orElseThrow().getSummary().getTotalTests());
        assertEquals(2, repository.previous(last).orElseThrow().getSummary().getTotalTests());
        assertEquals(1, repository.previous(middle).orElseThrow().getSummary().getTotalTests());
        assertTrue(repository.previous(first).isEmpty(), "У самого старого отчета нет предыдущего");
    }

    @Test
    void testCorruptPreviousReportIsSkipped(@TempDir Path dir) throws Exception {
        ReportRepository repository = new ReportRepository(dir);
        Files.writeString(dir.resolve("audit-report-20250717-075900-000.json"), "{\"summary\": [broken");
        Path current = repository.save(report(T0, 1));

        assertTrue(repository.previous(current).isEmpty());
        assertTrue(Files.exists(current));
    }

    @Test
    void testCleanupKeepsNewest(@TempDir Path dir) throws Exception {
        ReportRepository repository = new ReportRepository(dir);
        for (int i = 0; i < 5; i++) {
            repository.save(report(T0.plusSeconds(i), i + 1));
        }

        assertEquals(2, repository.cleanup(3));

        List<Path> remaining = repository.list();
        assertEquals(3, remaining.size());
        assertEquals(3, repository.load(remaining.get(0)).getSummary().getTotalTests());
        assertEquals(0, repository.cleanup(3));
    }

    private static TestSuiteReport report(Instant date, int tests) {
        List<TestResult> results = new ArrayList<>();
        for (int i = 0; i < tests; i++) {
            results.add(Results.passed("scenario-" + i, AttackCategory.LOGIC, "staking"));
        }
        return new ReportAggregator(Map.of()).aggregate(results, date, 5);
    }
}

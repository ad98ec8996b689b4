package com.vtb.auditor.reports;

import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Сохранение результатов прогона: JSON отчет, тренд к прошлому прогону,
 * executive summary и очистка старых отчетов.
 * Отчет текущего прогона пишется первым, до чтения истории.
 */
@Slf4j
public class ReportPublisher {

    public static final String EXECUTIVE_SUMMARY_FILE = "executive-summary.md";

    private final ReportRepository repository;
    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer();

    public ReportPublisher(ReportRepository repository) {
        this.repository = repository;
    }

    public Published publish(TestSuiteReport report, int keepLast) throws IOException {
        Path saved = repository.save(report);
        log.info("Отчет сохранен: {}", saved);

        ReportTrend trend = repository.previous(saved)
            .map(previous -> trendAnalyzer.compare(previous, report))
            .orElse(null);
        if (trend != null) {
            log.info("Изменение оценки относительно прошлого прогона: {}", trend.scoreDelta());
        }

        Path summary = repository.getDirectory().resolve(EXECUTIVE_SUMMARY_FILE);
        new ExecutiveSummaryGenerator(trend).generate(report, summary);
        repository.cleanup(keepLast);
        return new Published(saved, summary, trend);
    }

    /**
     * @param trend null, если прошлого читаемого отчета нет
     */
    public record Published(Path report, Path executiveSummary, ReportTrend trend) {
    }
}

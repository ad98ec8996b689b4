package com.vtb.auditor.reports;

import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Каталог сохраненных отчетов: audit-report-yyyyMMdd-HHmmss-SSS.json.
 * Имена сортируются по времени прогона.
 */
@Slf4j
public class ReportRepository {

    static final String PREFIX = "audit-report-";
    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final JsonReportGenerator json;

    public ReportRepository(Path directory) {
        this(directory, new JsonReportGenerator());
    }

    public ReportRepository(Path directory, JsonReportGenerator json) {
        this.directory = directory;
        this.json = json;
    }

    public Path save(TestSuiteReport report) throws IOException {
        Instant date = report.getSummary() != null && report.getSummary().getTestDate() != null
            ? report.getSummary().getTestDate()
            : Instant.now();
        Path target = directory.resolve(PREFIX + STAMP.format(date) + "." + json.getFileExtension());
        json.generate(report, target);
        return target;
    }

    /**
     * Сохраненные отчеты, от старых к новым
     */
    public List<Path> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.startsWith(PREFIX) && name.endsWith("." + json.getFileExtension());
                })
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }

    public TestSuiteReport load(Path path) throws IOException {
        return json.read(path);
    }

    public Optional<TestSuiteReport> latest() throws IOException {
        List<Path> reports = list();
        if (reports.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(load(reports.get(reports.size() - 1)));
    }

    /**
     * Последний отчет, сохраненный раньше current. Нечитаемый файл (битый JSON,
     * старая схема) пропускается с предупреждением: тренд не считается.
     */
    public Optional<TestSuiteReport> previous(Path current) throws IOException {
        String currentName = current.getFileName().toString();
        Path previous = null;
        for (Path path : list()) {
            if (path.getFileName().toString().compareTo(currentName) < 0) {
                previous = path;
            }
        }
        if (previous == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(load(previous));
        } catch (IOException e) {
            log.warn("Предыдущий отчет {} не читается, тренд пропущен: {}", previous, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Удалить все отчеты, кроме keepLast самых новых
     *
     * @return число удаленных файлов
     */
    public int cleanup(int keepLast) throws IOException {
        List<Path> reports = list();
        int excess = reports.size() - Math.max(0, keepLast);
        int removed = 0;
        for (int i = 0; i < excess; i++) {
            Files.deleteIfExists(reports.get(i));
            removed++;
        }
        if (removed > 0) {
            log.info("Удалено старых отчетов: {} (оставлено {})", removed, keepLast);
        }
        return removed;
    }

    public Path getDirectory() {
        return directory;
    }
}

package com.vtb.auditor.reports;

import com.vtb.auditor.models.TestSuiteReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param report отчет прогона
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(TestSuiteReport report, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}

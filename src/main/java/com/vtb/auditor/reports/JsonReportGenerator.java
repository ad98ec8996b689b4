package com.vtb.auditor.reports;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON. Время пишется в ISO-8601.
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void generate(TestSuiteReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        if (report == null) {
            throw new IllegalArgumentException("TestSuiteReport не может быть null");
        }
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, toJson(report));
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    public String toJson(TestSuiteReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    public TestSuiteReport fromJson(String json) throws IOException {
        return objectMapper.readValue(json, TestSuiteReport.class);
    }

    public TestSuiteReport read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}

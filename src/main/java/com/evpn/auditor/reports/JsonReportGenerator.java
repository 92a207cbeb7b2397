package com.evpn.auditor.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.evpn.auditor.models.FleetReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReportGenerator() {
        this(Clock.systemUTC());
    }

    JsonReportGenerator(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(FleetReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("FleetReport не может быть null");
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        String json = toJson(report);
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    String toJson(FleetReport report) throws IOException {
        return objectMapper.writeValueAsString(new Document(Instant.now(clock), report));
    }

    record Document(Instant generatedAt, FleetReport report) {}
}

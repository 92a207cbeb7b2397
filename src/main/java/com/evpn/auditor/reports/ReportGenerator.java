package com.evpn.auditor.reports;

import com.evpn.auditor.models.FleetReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Запись сводного отчёта в файл.
 */
public interface ReportGenerator {

    void generate(FleetReport report, Path outputPath) throws IOException;
}

package com.trelloreport.weekly.output;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.service.ReportWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes a generated report to the configured file output(s).
 * Supports CSV, HTML, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportOutputRouter {

    private final CsvReportWriter csvWriter;
    private final HtmlReportFormatter htmlFormatter;
    private final ReportWindowResolver windowResolver;
    private final WeeklyReportProperties properties;

    /**
     * @return the files written
     */
    public List<Path> write(WeeklyReport report) {
        WeeklyReportProperties.Output output = properties.getOutput();
        Path outputDir = Paths.get(output.getOutputDir());
        ensureDirectory(outputDir);

        List<Path> written = new ArrayList<>();
        switch (output.getMode()) {
            case CSV -> written.add(csvWriter.write(report, outputDir));
            case HTML -> written.add(writeHtml(report, outputDir));
            case BOTH -> {
                written.add(csvWriter.write(report, outputDir));
                written.add(writeHtml(report, outputDir));
            }
        }
        return written;
    }

    private Path writeHtml(WeeklyReport report, Path outputDir) {
        Path outputPath = outputDir.resolve(ReportFileNames.of(report, windowResolver.zone(), "html"));
        try {
            Files.writeString(outputPath, htmlFormatter.format(report), StandardCharsets.UTF_8);
            log.info("Written HTML report: {}", outputPath);
            return outputPath;
        } catch (IOException e) {
            log.error("Failed to write HTML file {}: {}", outputPath, e.getMessage(), e);
            throw new ReportOutputException("HTML write failed", e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ReportOutputException("Cannot create output directory: " + dir, e);
        }
    }
}

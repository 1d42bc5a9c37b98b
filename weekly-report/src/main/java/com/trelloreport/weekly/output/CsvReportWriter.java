package com.trelloreport.weekly.output;

import com.opencsv.CSVWriter;
import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.service.ReportWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Writes report records to a CSV file.
 *
 * Output path pattern: {outputDir}/weekly_report_{startDay}_{endDay}.csv
 * e.g. ./reports/weekly_report_2024-03-03_2024-03-09.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    private static final String[] HEADERS = {
            "task_name", "labels", "actor", "completion_date", "status", "event_instant_utc",
            "comment_count", "url"
    };

    private final WeeklyReportProperties properties;
    private final ReportWindowResolver windowResolver;

    public Path write(WeeklyReport report, Path outputDir) {
        Path outputPath = outputDir.resolve(ReportFileNames.of(report, windowResolver.zone(), "csv"));

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (TaskRecord r : report.getRecords()) {
                writer.writeNext(toRow(r, windowResolver.zone()));
            }

            log.info("Written {} records to CSV: {}", report.getRecords().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new ReportOutputException("CSV write failed", e);
        }
    }

    private String[] toRow(TaskRecord r, ZoneId zone) {
        return new String[]{
                str(r.getTitle()),
                HtmlReportFormatter.labelsOf(r),
                str(r.getActor()),
                HtmlReportFormatter.completionDate(r, zone),
                r.getStatus().getDisplayName(),
                str(r.getEventInstant()),
                String.valueOf(r.getComments().size()),
                str(r.getUrl())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}

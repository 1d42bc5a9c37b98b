package com.trelloreport.weekly.output;

import com.trelloreport.weekly.model.WeeklyReport;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

final class ReportFileNames {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private ReportFileNames() {
    }

    static String of(WeeklyReport report, ZoneId zone, String extension) {
        return String.format("weekly_report_%s_%s.%s",
                DAY.format(report.getWindow().startInstant().atZone(zone)),
                DAY.format(report.getWindow().endInstant().atZone(zone)),
                extension);
    }
}

package com.trelloreport.weekly.output;

import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.TaskStatus;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.service.ReportWindowResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders a report as an HTML document, suitable as an e-mail body.
 *
 * Instants are converted to the report timezone here and nowhere else.
 */
@Component
@RequiredArgsConstructor
public class HtmlReportFormatter {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    static final DateTimeFormatter COMPLETION_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd hh:mm a", Locale.US);

    private static final String HEAD = """
            <html>
            <head>
                <style>
                    table { width: 100%; border-collapse: collapse; }
                    th, td { border: 1px solid #dddddd; text-align: left; padding: 8px; }
                    th { background-color: #f2f2f2; }
                    tr:nth-child(even) { background-color: #f9f9f9; }
                </style>
            </head>
            <body>
            """;

    private final ReportWindowResolver windowResolver;

    public String format(WeeklyReport report) {
        ZoneId zone = windowResolver.zone();
        StringBuilder html = new StringBuilder(HEAD);

        html.append("    <h2>Weekly Trello Report</h2>\n");
        html.append(String.format("    <p><strong>Reporting Period:</strong> %s to %s</p>%n",
                DAY.format(report.getWindow().startInstant().atZone(zone)),
                DAY.format(report.getWindow().endInstant().atZone(zone))));
        html.append(String.format("    <p><strong>Total Tasks Completed:</strong> %d</p>%n",
                report.getRecords().size()));

        html.append("""
                    <table>
                        <tr>
                            <th>Task Name</th>
                            <th>Labels</th>
                            <th>Completed By</th>
                            <th>Completion Date</th>
                            <th>Status</th>
                            <th>URL</th>
                        </tr>
                """);

        for (TaskRecord record : report.getRecords()) {
            html.append("        <tr>\n");
            cell(html, record.getTitle());
            cell(html, labelsOf(record));
            cell(html, record.getActor());
            cell(html, completionDate(record, zone));
            cell(html, record.getStatus().getDisplayName());
            html.append("            <td><a href='")
                    .append(escape(record.getUrl()))
                    .append("'>Link</a></td>\n");
            html.append("        </tr>\n");
        }

        html.append("""
                    </table>
                </body>
                </html>
                """);
        return html.toString();
    }

    static String labelsOf(TaskRecord record) {
        return record.getLabels().isEmpty() ? "No Labels" : String.join(", ", record.getLabels());
    }

    /** Only completed tasks show a date; in-progress rows leave the column blank. */
    static String completionDate(TaskRecord record, ZoneId zone) {
        if (record.getStatus() != TaskStatus.COMPLETED) {
            return "";
        }
        return COMPLETION_TIME.format(record.getEventInstant().atZone(zone));
    }

    private void cell(StringBuilder html, String value) {
        html.append("            <td>").append(escape(value)).append("</td>\n");
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}

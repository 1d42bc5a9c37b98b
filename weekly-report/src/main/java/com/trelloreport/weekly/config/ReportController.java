package com.trelloreport.weekly.config;

import com.trelloreport.weekly.exception.AggregationCancelledException;
import com.trelloreport.weekly.exception.InvalidWindowException;
import com.trelloreport.weekly.exception.ListNotFoundException;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.output.HtmlReportFormatter;
import com.trelloreport.weekly.service.WeeklyReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;
import java.util.function.Function;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ReportController {

    private final WeeklyReportService reportService;
    private final HtmlReportFormatter htmlFormatter;

    // ── Report API ───────────────────────────────────────────────────────────

    /**
     * Get the report for a date range, or the current week when no dates are given.
     *
     * GET /report?start=2024-03-03&end=2024-03-09
     */
    @GetMapping("/report")
    public ResponseEntity<?> getReport(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return respond(start, end, report -> ResponseEntity.ok(report));
    }

    /**
     * Same report rendered as the HTML document used for e-mail.
     *
     * GET /report/html?start=2024-03-03&end=2024-03-09
     */
    @GetMapping("/report/html")
    public ResponseEntity<?> getReportHtml(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return respond(start, end, report -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(htmlFormatter.format(report)));
    }

    /**
     * Lists on the configured board, handy for checking list names.
     */
    @GetMapping("/report/lists")
    public ResponseEntity<?> getLists() {
        try {
            return ResponseEntity.ok(reportService.boardLists());
        } catch (TrelloTransportException e) {
            log.error("Fetching board lists failed: {}", e.getMessage(), e);
            return error(HttpStatus.BAD_GATEWAY, "Failed to fetch lists from Trello");
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> respond(LocalDate start, LocalDate end,
                                      Function<WeeklyReport, ResponseEntity<?>> render) {
        try {
            return render.apply(reportService.generateReport(start, end));
        } catch (InvalidWindowException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (ListNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (TrelloTransportException e) {
            log.error("Report failed, Trello unavailable: {}", e.getMessage(), e);
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        } catch (AggregationCancelledException e) {
            log.warn("Report generation cancelled: {}", e.getMessage());
            return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        } catch (Exception e) {
            log.error("Report failed for {} to {}: {}", start, end, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}

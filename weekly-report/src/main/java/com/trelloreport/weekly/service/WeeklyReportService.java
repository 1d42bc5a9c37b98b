package com.trelloreport.weekly.service;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.TrelloList;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.model.WindowSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Builds a report for the configured board.
 *
 * The window is resolved before any API call, so bad dates never cost a request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeeklyReportService {

    private final ReportWindowResolver windowResolver;
    private final BoardActivityAggregator aggregator;
    private final TrelloApiClient apiClient;
    private final WeeklyReportProperties properties;
    private final Clock clock;

    /**
     * @param start First report day, or null together with {@code end} for the current week
     * @param end   Last report day
     */
    public WeeklyReport generateReport(LocalDate start, LocalDate end) {
        WindowSpec window = windowResolver.resolveWindow(start, end);
        return generateReport(window);
    }

    public WeeklyReport generateReport(WindowSpec window) {
        WeeklyReportProperties.Board board = properties.getBoard();
        log.info("Generating report for board {} from {} to {}",
                board.getId(), window.startInstant(), window.endInstant());

        List<TaskRecord> records = aggregator.aggregate(
                board.getId(), board.getDoneListName(), board.getDoingListName(), window);

        return WeeklyReport.builder()
                .window(window)
                .records(records)
                .generatedAt(clock.instant())
                .build();
    }

    public List<TrelloList> boardLists() {
        return apiClient.boardLists(properties.getBoard().getId());
    }
}

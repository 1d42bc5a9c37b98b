package com.trelloreport.weekly.config;

import com.trelloreport.weekly.exception.AggregationCancelledException;
import com.trelloreport.weekly.exception.InvalidWindowException;
import com.trelloreport.weekly.exception.ListNotFoundException;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.TaskStatus;
import com.trelloreport.weekly.model.TrelloList;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.model.WindowSpec;
import com.trelloreport.weekly.output.HtmlReportFormatter;
import com.trelloreport.weekly.service.WeeklyReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ReportControllerTest {

    private WeeklyReportService reportService;
    private HtmlReportFormatter htmlFormatter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        reportService = mock(WeeklyReportService.class);
        htmlFormatter = mock(HtmlReportFormatter.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ReportController(reportService, htmlFormatter)).build();
    }

    private static WeeklyReport report(TaskRecord... records) {
        return WeeklyReport.builder()
                .window(new WindowSpec(
                        Instant.parse("2024-03-03T06:00:00Z"), Instant.parse("2024-03-10T05:59:59.999999Z")))
                .records(List.of(records))
                .generatedAt(Instant.parse("2024-03-10T14:00:00Z"))
                .build();
    }

    @Test
    void returnsReportForExplicitDates() throws Exception {
        var record = TaskRecord.builder()
                .cardId("d1").title("Ship it").status(TaskStatus.COMPLETED)
                .eventInstant(Instant.parse("2024-03-05T14:22:00Z")).build();
        when(reportService.generateReport(LocalDate.of(2024, 3, 3), LocalDate.of(2024, 3, 9)))
                .thenReturn(report(record));

        mockMvc.perform(get("/report").param("start", "2024-03-03").param("end", "2024-03-09"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].title").value("Ship it"))
                .andExpect(jsonPath("$.records[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.completedCount").value(1));
    }

    @Test
    void emptyReportIsStillOk() throws Exception {
        when(reportService.generateReport(null, null)).thenReturn(report());

        mockMvc.perform(get("/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records").isEmpty());
    }

    @Test
    void partialDatesAreBadRequest() throws Exception {
        when(reportService.generateReport(LocalDate.of(2024, 3, 3), null))
                .thenThrow(new InvalidWindowException("Both start and end dates are required"));

        mockMvc.perform(get("/report").param("start", "2024-03-03"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Both start and end dates are required"));
    }

    @Test
    void missingListIsNotFound() throws Exception {
        when(reportService.generateReport(null, null)).thenThrow(new ListNotFoundException("board1", "Doing"));

        mockMvc.perform(get("/report")).andExpect(status().isNotFound());
    }

    @Test
    void trelloOutageIsBadGateway() throws Exception {
        when(reportService.generateReport(null, null))
                .thenThrow(new TrelloTransportException("Failed to fetch data from Trello", new RuntimeException()));

        mockMvc.perform(get("/report")).andExpect(status().isBadGateway());
    }

    @Test
    void cancelledAggregationIsServiceUnavailable() throws Exception {
        when(reportService.generateReport(null, null))
                .thenThrow(new AggregationCancelledException("Board aggregation was cancelled", new InterruptedException()));

        mockMvc.perform(get("/report"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Board aggregation was cancelled"));
    }

    @Test
    void htmlReportUsesFormatter() throws Exception {
        WeeklyReport report = report();
        when(reportService.generateReport(null, null)).thenReturn(report);
        when(htmlFormatter.format(any())).thenReturn("<html>report</html>");

        mockMvc.perform(get("/report/html"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string("<html>report</html>"));
    }

    @Test
    void listsBoardLists() throws Exception {
        when(reportService.boardLists()).thenReturn(List.of(new TrelloList("l1", "Done")));

        mockMvc.perform(get("/report/lists"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Done"));
    }
}

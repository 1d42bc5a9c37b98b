package com.trelloreport.weekly.scheduler;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.model.WindowSpec;
import com.trelloreport.weekly.output.ReportOutputRouter;
import com.trelloreport.weekly.service.WeeklyReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ReportSchedulerTest {

    private WeeklyReportService reportService;
    private ReportOutputRouter outputRouter;
    private WeeklyReportProperties properties;
    private ReportScheduler scheduler;

    @BeforeEach
    void setUp() {
        reportService = mock(WeeklyReportService.class);
        outputRouter = mock(ReportOutputRouter.class);
        properties = new WeeklyReportProperties();
        scheduler = new ReportScheduler(reportService, outputRouter, properties);
    }

    @Test
    void disabledScheduleDoesNothing() {
        scheduler.scheduledReport();

        verifyNoInteractions(reportService, outputRouter);
    }

    @Test
    void enabledScheduleWritesCurrentWeek() {
        properties.getScheduling().setEnabled(true);
        WeeklyReport report = WeeklyReport.builder()
                .window(new WindowSpec(Instant.EPOCH, Instant.EPOCH))
                .records(List.of())
                .generatedAt(Instant.EPOCH)
                .build();
        when(reportService.generateReport(null, null)).thenReturn(report);

        scheduler.scheduledReport();

        verify(outputRouter).write(report);
    }

    @Test
    void failedRunIsLoggedNotThrown() {
        properties.getScheduling().setRunOnStartup(true);
        when(reportService.generateReport(null, null))
                .thenThrow(new TrelloTransportException("down", new RuntimeException()));

        assertThatCode(scheduler::onStartup).doesNotThrowAnyException();
        verify(outputRouter, never()).write(any());
    }
}

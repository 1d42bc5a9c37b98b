package com.trelloreport.weekly.scheduler;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.model.WeeklyReport;
import com.trelloreport.weekly.output.ReportOutputRouter;
import com.trelloreport.weekly.service.WeeklyReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Writes the current week's report to the output directory on a schedule.
 *
 * Default schedule: Mondays at 08:00 in the report timezone, disabled unless
 * weekly-report.scheduling.enabled=true. RUN_ON_STARTUP=true writes one report at boot.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportScheduler {

    private final WeeklyReportService reportService;
    private final ReportOutputRouter outputRouter;
    private final WeeklyReportProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, writing report for the current week");
            runReport();
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Report scheduler ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${weekly-report.scheduling.cron:0 0 8 * * MON}",
            zone = "${weekly-report.aggregation.timezone:America/Chicago}")
    public void scheduledReport() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled report triggered");
        runReport();
    }

    void runReport() {
        try {
            WeeklyReport report = reportService.generateReport(null, null);
            outputRouter.write(report);
            log.info("Report written: {} completed, {} in progress",
                    report.getCompletedCount(), report.getInProgressCount());
        } catch (Exception e) {
            log.error("Scheduled report failed: {}", e.getMessage(), e);
        }
    }
}

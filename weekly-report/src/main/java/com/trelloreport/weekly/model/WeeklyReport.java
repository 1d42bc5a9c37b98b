package com.trelloreport.weekly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A generated report: the window it covers and the ordered records found in it.
 */
@Value
@Builder
public class WeeklyReport {

    WindowSpec window;

    List<TaskRecord> records;

    Instant generatedAt;

    public long getCompletedCount() {
        return records.stream().filter(r -> r.getStatus() == TaskStatus.COMPLETED).count();
    }

    public long getInProgressCount() {
        return records.stream().filter(r -> r.getStatus() == TaskStatus.IN_PROGRESS).count();
    }
}

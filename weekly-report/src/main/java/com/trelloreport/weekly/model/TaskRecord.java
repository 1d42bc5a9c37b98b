package com.trelloreport.weekly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Normalised unit of report output, built from exactly one card.
 *
 * Field notes:
 *  - eventInstant is always UTC; conversion to the report timezone happens at render time
 *  - for COMPLETED it is the move into the done list, for IN_PROGRESS the latest in-window comment
 *  - comments is empty for COMPLETED records
 */
@Value
@Builder
public class TaskRecord {

    /** Card id, used for identity and logging only */
    String cardId;

    /** Card display name */
    String title;

    /** Permalink to the source card */
    String url;

    /** Label names in the order the API returned them */
    @Builder.Default
    List<String> labels = List.of();

    /** Label colours, parallel to {@link #labels} */
    @Builder.Default
    List<String> labelColors = List.of();

    /** Full name of the member credited for the event */
    String actor;

    Instant eventInstant;

    TaskStatus status;

    @Builder.Default
    List<CommentEntry> comments = List.of();
}

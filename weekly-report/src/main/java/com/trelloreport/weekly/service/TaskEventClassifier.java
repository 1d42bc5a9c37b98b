package com.trelloreport.weekly.service;

import com.trelloreport.weekly.model.CommentEntry;
import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.TaskStatus;
import com.trelloreport.weekly.model.TrelloAction;
import com.trelloreport.weekly.model.TrelloCard;
import com.trelloreport.weekly.model.WindowSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a card and its action history into at most one {@link TaskRecord}.
 *
 * Both methods are pure. Action lists are never assumed to be sorted: the relevant
 * action is always picked by comparing timestamps.
 */
@Component
@Slf4j
public class TaskEventClassifier {

    /**
     * Find the most recent move of the card into the terminal list.
     *
     * @param card             Card from the terminal list
     * @param actions          The card's {@code updateCard} actions, any order
     * @param terminalListName e.g. "Done"
     * @return a COMPLETED record, or empty if the card was never moved into that list
     */
    public Optional<TaskRecord> classifyCompletion(TrelloCard card, List<TrelloAction> actions,
                                                   String terminalListName) {
        return actions.stream()
                .filter(action -> isMoveInto(action, terminalListName))
                .max(Comparator.comparing(action -> parseInstant(action.getDate())))
                .map(move -> {
                    TaskRecord record = baseRecord(card)
                            .status(TaskStatus.COMPLETED)
                            .eventInstant(parseInstant(move.getDate()))
                            .actor(actorOf(move))
                            .build();
                    log.info("Task completed: '{}' by {} at {}",
                            record.getTitle(), record.getActor(), record.getEventInstant());
                    return record;
                });
    }

    /**
     * Collect the card's comments that fall inside the window.
     *
     * @param card    Card from the active list
     * @param actions The card's {@code commentCard} actions, any order
     * @param window  Reporting window, inclusive at both ends
     * @return an IN_PROGRESS record credited to the latest in-window comment, or empty if there is none
     */
    public Optional<TaskRecord> classifyActivity(TrelloCard card, List<TrelloAction> actions, WindowSpec window) {
        List<CommentEntry> comments = actions.stream()
                .filter(action -> TrelloAction.TYPE_COMMENT_CARD.equals(action.getType()))
                .map(this::toComment)
                .filter(comment -> window.contains(comment.getTimestamp()))
                .toList();

        if (comments.isEmpty()) {
            return Optional.empty();
        }

        CommentEntry latest = comments.stream()
                .max(Comparator.comparing(CommentEntry::getTimestamp))
                .orElseThrow();

        return Optional.of(baseRecord(card)
                .status(TaskStatus.IN_PROGRESS)
                .eventInstant(latest.getTimestamp())
                .actor(latest.getActor())
                .comments(comments)
                .build());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean isMoveInto(TrelloAction action, String listName) {
        if (!TrelloAction.TYPE_UPDATE_CARD.equals(action.getType()) || action.getData() == null) {
            return false;
        }
        TrelloAction.Payload data = action.getData();
        return data.getListBefore() != null
                && data.getListAfter() != null
                && Objects.equals(listName, data.getListAfter().getName());
    }

    private CommentEntry toComment(TrelloAction action) {
        return CommentEntry.builder()
                .text(action.getData() != null ? action.getData().getText() : null)
                .timestamp(parseInstant(action.getDate()))
                .actor(actorOf(action))
                .build();
    }

    private TaskRecord.TaskRecordBuilder baseRecord(TrelloCard card) {
        List<TrelloCard.Label> labels = card.getLabels() != null ? card.getLabels() : List.of();
        return TaskRecord.builder()
                .cardId(card.getId())
                .title(card.getName())
                .url(card.getUrl())
                .labels(labels.stream().map(label -> nameOr(label.getName(), "No Name")).toList())
                .labelColors(labels.stream().map(label -> nameOr(label.getColor(), "No Color")).toList());
    }

    /**
     * Trello dates are ISO-8601 in UTC, e.g. 2024-03-05T14:22:01.123Z.
     * A missing or malformed date fails the whole card.
     */
    private Instant parseInstant(String date) {
        if (date == null) {
            throw new IllegalArgumentException("Action has no date");
        }
        return Instant.parse(date);
    }

    private String actorOf(TrelloAction action) {
        return action.getMemberCreator() != null ? action.getMemberCreator().getFullName() : null;
    }

    private String nameOr(String value, String fallback) {
        return value == null ? fallback : value;
    }
}

package com.trelloreport.weekly.service;

import com.trelloreport.weekly.exception.AggregationCancelledException;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.TaskRecord;
import com.trelloreport.weekly.model.TrelloAction;
import com.trelloreport.weekly.model.TrelloCard;
import com.trelloreport.weekly.model.WindowSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Collects the completed and in-progress tasks of a board for one window.
 *
 * List lookups and card listings run on the calling thread and are fatal when they fail.
 * Each card is then classified on the worker pool; a failing card is logged and skipped
 * without affecting the others.
 */
@Service
@Slf4j
public class BoardActivityAggregator {

    /** COMPLETED first, then newest first. List.sort is stable, so ties keep collection order. */
    static final Comparator<TaskRecord> REPORT_ORDER = Comparator
            .comparing(TaskRecord::getStatus)
            .thenComparing(TaskRecord::getEventInstant, Comparator.reverseOrder());

    private final TrelloApiClient apiClient;
    private final TaskEventClassifier classifier;
    private final ExecutorService executor;

    public BoardActivityAggregator(TrelloApiClient apiClient,
                                   TaskEventClassifier classifier,
                                   @Qualifier("classificationExecutor") ExecutorService executor) {
        this.apiClient = apiClient;
        this.classifier = classifier;
        this.executor = executor;
    }

    /**
     * @param boardId          Board to report on
     * @param terminalListName Name of the done list, e.g. "Done"
     * @param activeListName   Name of the in-progress list, e.g. "Doing"
     * @param window           Events outside this window are dropped
     * @return records ordered by {@link #REPORT_ORDER}; unmodifiable, possibly empty
     * @throws com.trelloreport.weekly.exception.ListNotFoundException    if either list is missing
     * @throws TrelloTransportException                                   if a list or card listing fails
     * @throws AggregationCancelledException                               if the calling thread is interrupted
     */
    public List<TaskRecord> aggregate(String boardId, String terminalListName, String activeListName,
                                      WindowSpec window) {
        List<TrelloCard> terminalCards;
        List<TrelloCard> activeCards;
        try {
            String terminalListId = apiClient.listIdByName(boardId, terminalListName);
            String activeListId = apiClient.listIdByName(boardId, activeListName);

            terminalCards = apiClient.cardsInList(terminalListId);
            activeCards = apiClient.cardsInList(activeListId);
        } catch (TrelloTransportException e) {
            if (e.getCause() instanceof InterruptedException interrupted) {
                log.warn("Aggregation cancelled while listing cards of board {}", boardId);
                throw new AggregationCancelledException("Board aggregation was cancelled", interrupted);
            }
            throw e;
        }
        log.info("Classifying {} '{}' cards and {} '{}' cards",
                terminalCards.size(), terminalListName, activeCards.size(), activeListName);

        List<CardTask> tasks = new ArrayList<>(terminalCards.size() + activeCards.size());
        for (TrelloCard card : terminalCards) {
            tasks.add(new CardTask(card, () -> completionOf(card, terminalListName)));
        }
        for (TrelloCard card : activeCards) {
            tasks.add(new CardTask(card, () -> activityOf(card, window)));
        }

        List<TaskRecord> records = new ArrayList<>();
        for (Optional<TaskRecord> outcome : runAll(tasks)) {
            outcome.filter(record -> window.contains(record.getEventInstant()))
                    .ifPresent(records::add);
        }
        records.sort(REPORT_ORDER);

        log.info("Total tasks found between {} and {}: {}",
                window.startInstant(), window.endInstant(), records.size());
        return Collections.unmodifiableList(records);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Submit every task, then wait for all of them. Outcomes come back in submission order.
     * Interruption cancels whatever is still outstanding and discards finished work.
     */
    private List<Optional<TaskRecord>> runAll(List<CardTask> tasks) {
        List<Future<Optional<TaskRecord>>> futures = new ArrayList<>(tasks.size());
        try {
            for (CardTask task : tasks) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while scheduling card classification");
                }
                futures.add(executor.submit(task.work()));
            }

            List<Optional<TaskRecord>> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(awaitOutcome(tasks.get(i).card(), futures.get(i)));
            }
            return outcomes;

        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            log.warn("Aggregation cancelled, {} of {} card tasks were scheduled", futures.size(), tasks.size());
            throw new AggregationCancelledException("Board aggregation was cancelled", e);
        }
    }

    private Optional<TaskRecord> awaitOutcome(TrelloCard card, Future<Optional<TaskRecord>> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            logCardFailure(card, cause);
            return Optional.empty();
        }
    }

    private Optional<TaskRecord> completionOf(TrelloCard card, String terminalListName) {
        try {
            List<TrelloAction> moves = apiClient.actionsForCard(card.getId(), TrelloAction.TYPE_UPDATE_CARD);
            return classifier.classifyCompletion(card, moves, terminalListName);
        } catch (Exception e) {
            logCardFailure(card, e);
            return Optional.empty();
        }
    }

    private Optional<TaskRecord> activityOf(TrelloCard card, WindowSpec window) {
        try {
            List<TrelloAction> comments = apiClient.actionsForCard(card.getId(), TrelloAction.TYPE_COMMENT_CARD);
            return classifier.classifyActivity(card, comments, window);
        } catch (Exception e) {
            logCardFailure(card, e);
            return Optional.empty();
        }
    }

    private void logCardFailure(TrelloCard card, Throwable cause) {
        log.error("Error processing card '{}' ({}): {}", card.getName(), card.getId(), cause.getMessage(), cause);
    }

    private record CardTask(TrelloCard card, Callable<Optional<TaskRecord>> work) {
    }
}

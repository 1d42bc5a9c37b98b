package com.trelloreport.weekly.service;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.exception.ListNotFoundException;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.TrelloAction;
import com.trelloreport.weekly.model.TrelloCard;
import com.trelloreport.weekly.model.TrelloList;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the Trello REST API.
 *
 * Rate limiting: Trello allows 10 requests per second per token. Every call waits on the
 * shared {@link RequestRateLimiter} before it is sent, including Resilience4j retries.
 * Any RestTemplate failure is rethrown as {@link TrelloTransportException} and logged at WARN;
 * callers decide whether the failure is worth an ERROR.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrelloApiClient {

    private final RestTemplate restTemplate;
    private final RequestRateLimiter rateLimiter;
    private final WeeklyReportProperties properties;

    /**
     * Fetch every list on a board.
     *
     * @return lists in board order (may be empty, never null)
     */
    @Retry(name = "trelloApi")
    public List<TrelloList> boardLists(String boardId) {
        return callApi(url("/boards/" + boardId + "/lists").build().toUri(), TrelloList[].class);
    }

    /**
     * Resolve a list name to its id.
     *
     * @param boardId Board to search
     * @param name    Exact list name, e.g. "Done"
     * @return id of the first list with that name
     * @throws ListNotFoundException if the board has no list with that name
     */
    @Retry(name = "trelloApi")
    public String listIdByName(String boardId, String name) {
        String listId = boardLists(boardId).stream()
                .filter(list -> name.equals(list.getName()))
                .map(TrelloList::getId)
                .findFirst()
                .orElseThrow(() -> new ListNotFoundException(boardId, name));
        log.info("Found '{}' list with ID: {}", name, listId);
        return listId;
    }

    /**
     * Fetch all cards currently in a list. No date filtering happens here.
     */
    @Retry(name = "trelloApi")
    public List<TrelloCard> cardsInList(String listId) {
        return callApi(url("/lists/" + listId + "/cards").build().toUri(), TrelloCard[].class);
    }

    /**
     * Fetch a card's action history, filtered server-side by action type.
     *
     * @param cardId     Card to inspect
     * @param filterType e.g. {@link TrelloAction#TYPE_UPDATE_CARD} or {@link TrelloAction#TYPE_COMMENT_CARD}
     */
    @Retry(name = "trelloApi")
    public List<TrelloAction> actionsForCard(String cardId, String filterType) {
        URI uri = url("/cards/" + cardId + "/actions")
                .queryParam("filter", filterType)
                .build()
                .toUri();
        return callApi(uri, TrelloAction[].class);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UriComponentsBuilder url(String path) {
        WeeklyReportProperties.Api api = properties.getApi();
        return UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl() + path)
                .queryParam("key", api.getKey())
                .queryParam("token", api.getToken());
    }

    private <T> List<T> callApi(URI uri, Class<T[]> responseType) {
        String url = uri.toString();
        log.debug("Calling Trello API: {}", redact(url));
        try {
            rateLimiter.acquire();
            T[] response = restTemplate.getForObject(uri, responseType);
            if (response == null) {
                return Collections.emptyList();
            }
            log.debug("API returned {} items for URL: {}", response.length, redact(url));
            return Arrays.asList(response);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrelloTransportException("Interrupted waiting for a request slot: " + redact(url), e);

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Trello API for URL {}", redact(url));
            throw new TrelloTransportException("Trello API rate limit exceeded", e);

        } catch (RestClientException e) {
            log.warn("API call failed for URL {}: {}", redact(url), e.getMessage());
            throw new TrelloTransportException("Failed to fetch data from Trello: " + e.getMessage(), e);
        }
    }

    /** Keep credentials out of the logs. */
    private String redact(String url) {
        return url.replaceAll("(key|token)=[^&]*", "$1=***");
    }
}

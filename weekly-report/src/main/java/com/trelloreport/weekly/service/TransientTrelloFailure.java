package com.trelloreport.weekly.service;

import com.trelloreport.weekly.exception.TrelloTransportException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code trelloApi} Resilience4j instance.
 *
 * Only failures that can succeed on a second attempt are retried: 5xx responses, 429 and
 * I/O errors. Client errors such as 401/403/404 and interrupted calls fail straight away.
 */
public class TransientTrelloFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable failure) {
        if (!(failure instanceof TrelloTransportException)) {
            return false;
        }
        Throwable cause = failure.getCause();
        return cause instanceof HttpServerErrorException
                || cause instanceof HttpClientErrorException.TooManyRequests
                || cause instanceof ResourceAccessException;
    }
}

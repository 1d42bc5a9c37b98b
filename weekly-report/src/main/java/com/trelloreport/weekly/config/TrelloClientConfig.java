package com.trelloreport.weekly.config;

import com.trelloreport.weekly.service.RequestRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring for the Trello client: HTTP template, request gate, classification pool and clock.
 */
@Configuration
@Slf4j
public class TrelloClientConfig {

    @Bean
    public RestTemplate trelloRestTemplate(RestTemplateBuilder builder, WeeklyReportProperties properties) {
        WeeklyReportProperties.Api api = properties.getApi();
        log.info("Trello API key loaded: {}", hasText(api.getKey()));
        log.info("Trello token loaded: {}", hasText(api.getToken()));
        log.info("Trello board id loaded: {}", hasText(properties.getBoard().getId()));

        return builder
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout())
                .build();
    }

    @Bean
    public RequestRateLimiter trelloRequestRateLimiter(WeeklyReportProperties properties) {
        WeeklyReportProperties.Api api = properties.getApi();
        return new RequestRateLimiter(api.getCallsPerWindow(), api.getRateWindow());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService classificationExecutor(WeeklyReportProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getAggregation().getWorkerThreads(),
                new CustomizableThreadFactory("card-classifier-"));
    }

    @Bean
    public Clock reportClock(WeeklyReportProperties properties) {
        return Clock.system(ZoneId.of(properties.getAggregation().getTimezone()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

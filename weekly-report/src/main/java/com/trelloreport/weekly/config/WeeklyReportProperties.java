package com.trelloreport.weekly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "weekly-report")
@Data
public class WeeklyReportProperties {

    private Api api = new Api();
    private Board board = new Board();
    private Aggregation aggregation = new Aggregation();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        private String baseUrl = "https://api.trello.com/1";
        private String key;
        private String token;
        /** Trello allows 10 requests per second per token */
        private int callsPerWindow = 10;
        private Duration rateWindow = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Board {
        private String id;
        private String doneListName = "Done";
        private String doingListName = "Doing";
    }

    @Data
    public static class Aggregation {
        private int workerThreads = 8;
        private String timezone = "America/Chicago";
        private DayOfWeek weekStart = DayOfWeek.SUNDAY;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.HTML;
        private String outputDir = "./reports";
        private boolean includeHeader = true;

        public enum OutputMode {
            CSV, HTML, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 8 * * MON";
        private boolean runOnStartup = false;
    }
}

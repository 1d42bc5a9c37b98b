package com.trelloreport.weekly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw DTO for an entry in a card's action history.
 *
 * The payload under {@code data} depends on {@code type}: moves carry
 * {@code listBefore}/{@code listAfter}, comments carry {@code text}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrelloAction {

    public static final String TYPE_UPDATE_CARD = "updateCard";
    public static final String TYPE_COMMENT_CARD = "commentCard";

    private String id;

    private String type;

    /** ISO-8601 UTC timestamp, e.g. 2024-03-05T14:22:01.123Z */
    private String date;

    private MemberCreator memberCreator;

    private Payload data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MemberCreator {
        private String fullName;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private ListRef listBefore;
        private ListRef listAfter;
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListRef {
        private String id;
        private String name;
    }
}

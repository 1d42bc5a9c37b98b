package com.trelloreport.weekly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the Trello card JSON structure.
 * Kept separate from {@link TaskRecord} to isolate API coupling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrelloCard {

    private String id;

    private String name;

    /** Permalink to the card */
    private String url;

    private List<Label> labels = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Label {
        private String name;
        private String color;
    }
}

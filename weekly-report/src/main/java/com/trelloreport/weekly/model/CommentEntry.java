package com.trelloreport.weekly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CommentEntry {

    String text;

    Instant timestamp;

    /** Full name of the member who wrote the comment */
    String actor;
}

package com.trelloreport.weekly.model;

/**
 * Declaration order is report order: completed work is listed before work in progress.
 */
public enum TaskStatus {

    /** Card moved into the terminal ("Done") list */
    COMPLETED("Done"),

    /** Card in the active ("Doing") list with comments inside the window */
    IN_PROGRESS("Doing");

    private final String displayName;

    TaskStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

package com.wingman.core.sync;

/**
 * Steps of a sync, in the order they report progress.
 */
public enum SyncStage {
    LOCATE("Locating campaign files"),
    CAMPAIGN_SUMMARY("Reading campaign summary"),
    ACES("Reading aces"),
    EVENT_LOG("Reading campaign log"),
    COMBAT_REPORTS("Reading combat reports"),
    MISSION_DATA("Reading mission data"),
    PERSONNEL("Reading squadron rosters"),
    RESOLVE("Cross-referencing records"),
    AGGREGATE("Computing statistics"),
    ASSEMBLE("Assembling campaign model"),
    COMPLETE("Sync complete");

    private final String label;

    SyncStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

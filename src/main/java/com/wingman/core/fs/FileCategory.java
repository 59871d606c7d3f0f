package com.wingman.core.fs;

/**
 * File categories the locator looks for below a campaign root.
 */
public enum FileCategory {
    CAMPAIGN_SUMMARY("Campaign.json"),
    ACES("CampaignAces.json"),
    EVENT_LOG("CampaignLog.json"),
    COMBAT_REPORTS("CombatReports"),
    MISSION_DATA("MissionData"),
    PERSONNEL("Personnel");

    private final String entryName;

    FileCategory(String entryName) {
        this.entryName = entryName;
    }

    public String entryName() {
        return entryName;
    }
}

package com.wingman.core.json;

import com.wingman.core.model.CampaignDate;

import java.util.Optional;

/**
 * Fields read from {@code Campaign.json}.
 */
public record CampaignSummary(Optional<String> name,
                              Optional<CampaignDate> date,
                              Optional<String> referencePilotSerial,
                              Optional<String> squadronId,
                              Optional<String> product) {

    public static CampaignSummary absent() {
        return new CampaignSummary(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}

package com.wingman.core.model;

import java.util.Optional;

/**
 * One claimed victory. The category is present only when the source distinguishes target types.
 */
public record VictoryEvent(Optional<CampaignDate> date, Optional<String> category, Optional<String> description) {

    public VictoryEvent {
        date = date == null ? Optional.empty() : date;
        category = category == null ? Optional.empty() : category;
        description = description == null ? Optional.empty() : description;
    }

    public static VictoryEvent unspecified() {
        return new VictoryEvent(Optional.empty(), Optional.empty(), Optional.empty());
    }
}

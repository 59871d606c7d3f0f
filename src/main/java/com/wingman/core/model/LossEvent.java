package com.wingman.core.model;

import java.util.Optional;

public record LossEvent(Optional<CampaignDate> date, Optional<String> description) {

    public LossEvent {
        date = date == null ? Optional.empty() : date;
        description = description == null ? Optional.empty() : description;
    }

    public static LossEvent unspecified() {
        return new LossEvent(Optional.empty(), Optional.empty());
    }
}

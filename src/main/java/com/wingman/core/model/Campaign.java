package com.wingman.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Campaign identity and the tracked player, rebuilt on every sync.
 */
public record Campaign(String name,
                       Optional<CampaignDate> currentDate,
                       Optional<String> referencePilotSerial,
                       Optional<String> product) {

    public Campaign {
        Objects.requireNonNull(name, "name");
        currentDate = currentDate == null ? Optional.empty() : currentDate;
        referencePilotSerial = referencePilotSerial == null ? Optional.empty() : referencePilotSerial;
        product = product == null ? Optional.empty() : product;
    }
}

package com.wingman.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param rosterSerials serial numbers of the pilots affiliated with this squadron, in serial order
 * @param recentActivity log entries for this squadron, chronological
 * @param totals mission and victory totals; {@link SquadronTotals#NONE} until statistics are applied
 */
public record Squadron(String id,
                       Optional<String> name,
                       List<String> rosterSerials,
                       List<LogEntry> recentActivity,
                       SquadronTotals totals) {

    public Squadron {
        Objects.requireNonNull(id, "id");
        rosterSerials = List.copyOf(rosterSerials);
        recentActivity = List.copyOf(recentActivity);
        totals = totals == null ? SquadronTotals.NONE : totals;
    }

    public Squadron(String id, Optional<String> name, List<String> rosterSerials, List<LogEntry> recentActivity) {
        this(id, name, rosterSerials, recentActivity, SquadronTotals.NONE);
    }

    public Squadron withTotals(SquadronTotals updated) {
        return new Squadron(id, name, rosterSerials, recentActivity, updated);
    }
}

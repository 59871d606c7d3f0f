package com.wingman.core.model;

/**
 * @param missions  missions flown under this squadron's colors
 * @param victories victories credited to the squadron's roster
 */
public record SquadronTotals(int missions, int victories) {

    public static final SquadronTotals NONE = new SquadronTotals(0, 0);
}

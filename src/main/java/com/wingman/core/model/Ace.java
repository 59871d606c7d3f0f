package com.wingman.core.model;

/**
 * Read-only leaderboard row projected from a ranked {@link Pilot}.
 */
public record Ace(int position, String serialNumber, String name, int victories) {
}

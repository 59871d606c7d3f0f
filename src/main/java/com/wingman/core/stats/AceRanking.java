package com.wingman.core.stats;

import com.wingman.core.model.Ace;
import com.wingman.core.model.SerialNumbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders pilots by victories, most first. Equal counts fall back to the serial number, smallest
 * first, so the ranking is total. Pilots without victories are left out.
 */
public final class AceRanking {

    public static final Comparator<Candidate> ORDER = Comparator
        .comparingInt(Candidate::victories).reversed()
        .thenComparing(Candidate::serialNumber, SerialNumbers.ORDER);

    public List<Ace> rank(List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.victories() > 0) {
                sorted.add(candidate);
            }
        }
        sorted.sort(ORDER);
        List<Ace> aces = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Candidate candidate = sorted.get(i);
            aces.add(new Ace(i + 1, candidate.serialNumber(), candidate.name(), candidate.victories()));
        }
        return aces;
    }

    public record Candidate(String serialNumber, String name, int victories) {
    }
}

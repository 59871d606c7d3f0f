package com.wingman.core.stats;

import com.wingman.core.model.Ace;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AceRankingTest {

    @Test
    void ordersByVictoriesThenSerialAndSkipsPilotsWithoutVictories() {
        List<Ace> aces = new AceRanking().rank(List.of(
            new AceRanking.Candidate("300", "C", 4),
            new AceRanking.Candidate("20", "B", 4),
            new AceRanking.Candidate("1", "A", 9),
            new AceRanking.Candidate("4", "D", 0)
        ));

        assertEquals(List.of(
            new Ace(1, "1", "A", 9),
            new Ace(2, "20", "B", 4),
            new Ace(3, "300", "C", 4)
        ), aces);
    }

    @Test
    void emptyInputGivesEmptyBoard() {
        assertEquals(List.of(), new AceRanking().rank(List.of()));
    }
}

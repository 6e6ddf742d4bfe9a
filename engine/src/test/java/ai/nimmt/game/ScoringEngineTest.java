package ai.nimmt.game;

import static ai.nimmt.unit.helpers.BoardBuilder.cards;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScoringEngineTest {

    private final ScoringEngine scoring = new ScoringEngine();

    @Test
    void creditAddsBullHeadsAndKeepsTakenCards() {
        Participant human = new Participant(ParticipantId.HUMAN);

        assertEquals(6, scoring.credit(human, cards(1, 3, 5, 7, 9)));
        assertEquals(10, scoring.credit(human, cards(55, 100)));

        assertEquals(16, human.getScore());
        assertEquals(7, human.getTakenPile().size());
    }

    @Test
    void emptyTakeChangesNothing() {
        Participant ai = new Participant(ParticipantId.AI);
        assertEquals(0, scoring.credit(ai, List.of()));
        assertEquals(0, ai.getScore());
    }

    @Test
    void gameEndsWhenAScoreReachesTheLimit() {
        Participant human = new Participant(ParticipantId.HUMAN);
        Participant ai = new Participant(ParticipantId.AI);
        scoring.credit(human, cards(55, 11, 22, 33, 44, 66, 77, 88, 99));
        assertEquals(47, human.getScore());
        scoring.credit(human, cards(10, 20, 30, 40, 50, 60));
        assertEquals(65, human.getScore());
        assertFalse(scoring.isGameOver(human, ai));

        scoring.credit(human, cards(1));
        assertEquals(66, human.getScore());
        assertTrue(scoring.isGameOver(human, ai));
    }

    @Test
    void lowerScoreWins() {
        Participant human = new Participant(ParticipantId.HUMAN);
        Participant ai = new Participant(ParticipantId.AI);
        scoring.credit(human, cards(55));
        scoring.credit(ai, cards(2));

        assertEquals(GameOutcome.AI_WINS, scoring.decideOutcome(human, ai));
        assertTrue(ai.hasWon());
        assertFalse(human.hasWon());
    }

    @Test
    void equalScoresAreADrawWithNoWinner() {
        Participant human = new Participant(ParticipantId.HUMAN);
        Participant ai = new Participant(ParticipantId.AI);
        scoring.credit(human, cards(10));
        scoring.credit(ai, cards(20));

        assertEquals(GameOutcome.DRAW, scoring.decideOutcome(human, ai));
        assertFalse(human.hasWon());
        assertFalse(ai.hasWon());
    }
}

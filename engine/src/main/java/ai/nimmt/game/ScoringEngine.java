package ai.nimmt.game;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credits taken cards to participants and decides when and how a game ends.
 * <p>
 * A game ends once any participant's total reaches the score limit (66 by default). The
 * participant with the strictly lower total wins; equal totals are a draw.
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    /** Standard 6 Nimmt game-end threshold. */
    public static final int DEFAULT_SCORE_LIMIT = 66;

    private final int scoreLimit;

    public ScoringEngine() {
        this(DEFAULT_SCORE_LIMIT);
    }

    public ScoringEngine(int scoreLimit) {
        if (scoreLimit <= 0) {
            throw new IllegalArgumentException("scoreLimit must be positive");
        }
        this.scoreLimit = scoreLimit;
    }

    public int getScoreLimit() {
        return scoreLimit;
    }

    /**
     * Adds taken cards to a participant's pile and score.
     *
     * @param participant the participant who took the cards
     * @param taken the cards collected from a row; may be empty
     * @return the bull heads credited
     */
    public int credit(Participant participant, List<Card> taken) {
        if (taken.isEmpty()) {
            return 0;
        }
        int points = participant.collect(taken);
        if (log.isDebugEnabled()) {
            log.debug("{} takes {} for {} bull heads (total {})", participant.getId(), taken, points,
                    participant.getScore());
        }
        return points;
    }

    /**
     * Returns {@code true} when either participant has reached the score limit.
     */
    public boolean isGameOver(Participant human, Participant ai) {
        return human.getScore() >= scoreLimit || ai.getScore() >= scoreLimit;
    }

    /**
     * Decides the result of a finished game and flags the winner.
     *
     * @return the outcome; {@link GameOutcome#DRAW} when both totals are equal
     */
    public GameOutcome decideOutcome(Participant human, Participant ai) {
        if (human.getScore() < ai.getScore()) {
            human.markWinner();
            return GameOutcome.HUMAN_WINS;
        }
        if (ai.getScore() < human.getScore()) {
            ai.markWinner();
            return GameOutcome.AI_WINS;
        }
        return GameOutcome.DRAW;
    }
}

package ai.nimmt.gateway;

import ai.nimmt.game.Board;
import ai.nimmt.game.Card;
import ai.nimmt.game.Hand;
import java.util.ArrayList;
import java.util.List;

/**
 * DTO sent to the AI move service for one round.
 * <p>
 * Carries the public table (rows and scores), the AI's own hand and only the size of the
 * human's hand, so the service cannot read the human's cards. Cards travel as plain numbers.
 */
public class AiMoveRequest {

    /** Card numbers of each row, in row order; each list is ascending. */
    private final List<List<Integer>> board;

    /** Card numbers in the AI's hand, ascending. */
    private final List<Integer> aiHand;

    /** How many cards the human still holds. */
    private final int humanHandSize;

    private final Scores scores;

    private final AiAlgorithm algorithm;

    /** Round the request belongs to; echoed in logs to spot stale answers. */
    private final int round;

    public AiMoveRequest(
            List<List<Integer>> board,
            List<Integer> aiHand,
            int humanHandSize,
            Scores scores,
            AiAlgorithm algorithm,
            int round) {
        this.board = board;
        this.aiHand = aiHand;
        this.humanHandSize = humanHandSize;
        this.scores = scores;
        this.algorithm = algorithm;
        this.round = round;
    }

    /**
     * Builds a request from engine state.
     */
    public static AiMoveRequest of(
            Board board, Hand aiHand, int humanHandSize, int humanScore, int aiScore, AiAlgorithm algorithm,
            int round) {
        List<List<Integer>> rows = new ArrayList<>();
        for (List<Card> row : board.rows()) {
            rows.add(row.stream().map(Card::getNumber).toList());
        }
        List<Integer> hand = aiHand.cards().stream().map(Card::getNumber).toList();
        return new AiMoveRequest(rows, hand, humanHandSize, new Scores(humanScore, aiScore), algorithm, round);
    }

    public List<List<Integer>> getBoard() {
        return board;
    }

    public List<Integer> getAiHand() {
        return aiHand;
    }

    public int getHumanHandSize() {
        return humanHandSize;
    }

    public Scores getScores() {
        return scores;
    }

    public AiAlgorithm getAlgorithm() {
        return algorithm;
    }

    public int getRound() {
        return round;
    }

    /**
     * Both running totals.
     */
    public static class Scores {
        private final int human;
        private final int ai;

        public Scores(int human, int ai) {
            this.human = human;
            this.ai = ai;
        }

        public int getHuman() {
            return human;
        }

        public int getAi() {
            return ai;
        }
    }
}

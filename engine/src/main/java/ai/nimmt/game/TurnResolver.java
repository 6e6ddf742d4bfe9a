package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one round of simultaneous submissions.
 * <p>
 * <strong>Validation:</strong> every participant submits exactly one card that is currently in
 * their hand, and any row choice must be a valid row index. A failed check throws
 * {@link IllegalMoveException} before anything is touched.
 * <p>
 * <strong>Ordering:</strong> submissions are resolved one at a time in ascending card order.
 * Each card is fully placed (and any take scored) before the next card's target is computed,
 * so the higher card always sees the board left behind by the lower one.
 * <p>
 * <strong>No valid row:</strong> a card lower than every row's last card takes the row named in
 * its submission. Without a row choice the participant's fallback {@link RowSelector} is used;
 * without a fallback the round throws {@link AmbiguousActionException}.
 * <p>
 * <strong>Atomicity:</strong> resolution runs on copies of the board, hands and participants.
 * The caller receives the copies in a {@link Resolution} and commits them; an exception leaves
 * the caller's state as it was.
 */
public class TurnResolver {
    private static final Logger log = LoggerFactory.getLogger(TurnResolver.class);

    private final ScoringEngine scoring;
    private final Map<ParticipantId, RowSelector> fallbackSelectors = new EnumMap<>(ParticipantId.class);

    /**
     * @param scoring credits taken rows
     * @param fallbackSelectors row selectors for participants whose row choice may be omitted
     */
    public TurnResolver(ScoringEngine scoring, Map<ParticipantId, RowSelector> fallbackSelectors) {
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.fallbackSelectors.putAll(fallbackSelectors);
    }

    /**
     * Creates a resolver where the AI falls back to {@link RowSelector#FEWEST_BULL_HEADS} and the human must choose.
     */
    public static TurnResolver withAiFallback(ScoringEngine scoring) {
        return new TurnResolver(scoring, Map.of(ParticipantId.AI, RowSelector.FEWEST_BULL_HEADS));
    }

    /**
     * Resolves a round against copies of the given state.
     *
     * @param board the current board
     * @param hands the current hands, one per participant
     * @param participants the current score records, one per participant
     * @param submissions one submission per participant
     * @param roundNumber the round being resolved, stamped on the events
     * @return the updated copies and the events in resolution order
     * @throws IllegalMoveException if a submission is invalid
     * @throws AmbiguousActionException if a card fits no row and its owner gave no row choice
     */
    public Resolution resolve(
            Board board,
            Map<ParticipantId, Hand> hands,
            Map<ParticipantId, Participant> participants,
            List<Submission> submissions,
            int roundNumber) {

        validate(hands, submissions);

        Board workingBoard = board.copy();
        Map<ParticipantId, Hand> workingHands = new EnumMap<>(ParticipantId.class);
        hands.forEach((id, hand) -> workingHands.put(id, hand.copy()));
        Map<ParticipantId, Participant> workingParticipants = new EnumMap<>(ParticipantId.class);
        participants.forEach((id, participant) -> workingParticipants.put(id, participant.copy()));

        List<Submission> ordered = new ArrayList<>(submissions);
        ordered.sort(Comparator.comparingInt(s -> s.card().getNumber()));

        List<RoundEvent> events = new ArrayList<>();
        for (Submission submission : ordered) {
            ParticipantId owner = submission.participant();
            Card card = submission.card();
            workingHands.get(owner).remove(card);

            Placement placement = workingBoard.placementTarget(card);
            if (placement.isNoValidRow()) {
                int row = chooseRow(workingBoard, submission);
                List<Card> taken = workingBoard.take(row, card);
                int points = scoring.credit(workingParticipants.get(owner), taken);
                events.add(RoundEvent.rowTaken(roundNumber, owner, card, row, taken, points, false));
            } else {
                int row = placement.rowIndex().getAsInt();
                List<Card> taken = workingBoard.apply(row, card);
                if (taken.isEmpty()) {
                    events.add(RoundEvent.placed(roundNumber, owner, card, row));
                } else {
                    int points = scoring.credit(workingParticipants.get(owner), taken);
                    events.add(RoundEvent.rowTaken(roundNumber, owner, card, row, taken, points, true));
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Round {} resolved: {} -> {}", roundNumber, ordered, workingBoard);
        }
        return new Resolution(workingBoard, workingHands, workingParticipants, List.copyOf(events));
    }

    private void validate(Map<ParticipantId, Hand> hands, List<Submission> submissions) {
        Set<ParticipantId> seen = EnumSet.noneOf(ParticipantId.class);
        for (Submission submission : submissions) {
            ParticipantId owner = submission.participant();
            if (!seen.add(owner)) {
                throw new IllegalMoveException(owner + " submitted more than one card");
            }
            Hand hand = hands.get(owner);
            if (hand == null || !hand.contains(submission.card())) {
                throw new IllegalMoveException(owner + " does not hold card " + submission.card());
            }
            if (submission.rowChoice() != null && !Board.isValidRowIndex(submission.rowChoice())) {
                throw new IllegalMoveException("Row choice " + submission.rowChoice() + " is not a valid row");
            }
        }
        if (!seen.equals(hands.keySet())) {
            throw new IllegalMoveException("Expected one card from each of " + hands.keySet() + ", got " + seen);
        }
    }

    private int chooseRow(Board workingBoard, Submission submission) {
        if (submission.rowChoice() != null) {
            return submission.rowChoice();
        }
        RowSelector fallback = fallbackSelectors.get(submission.participant());
        if (fallback == null) {
            throw new AmbiguousActionException(submission.participant(), submission.card());
        }
        int row = fallback.chooseRow(workingBoard, submission.card());
        if (log.isDebugEnabled()) {
            log.debug("{} gave no row for {}; fallback takes row {}", submission.participant(),
                    submission.card(), row);
        }
        return row;
    }

    /**
     * State produced by a successful {@link #resolve} call.
     *
     * @param board the updated board
     * @param hands the updated hands
     * @param participants the updated score records
     * @param events what happened, in resolution order
     */
    public record Resolution(
            Board board,
            Map<ParticipantId, Hand> hands,
            Map<ParticipantId, Participant> participants,
            List<RoundEvent> events) {
    }
}

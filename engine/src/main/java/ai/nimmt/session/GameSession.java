package ai.nimmt.session;

import ai.nimmt.game.AmbiguousActionException;
import ai.nimmt.game.Board;
import ai.nimmt.game.Card;
import ai.nimmt.game.Deck;
import ai.nimmt.game.GameOutcome;
import ai.nimmt.game.Hand;
import ai.nimmt.game.IllegalMoveException;
import ai.nimmt.game.InsufficientCardsException;
import ai.nimmt.game.Participant;
import ai.nimmt.game.ParticipantId;
import ai.nimmt.game.RoundEvent;
import ai.nimmt.game.ScoringEngine;
import ai.nimmt.game.Submission;
import ai.nimmt.game.TurnResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One match between the human and the AI, and the only object allowed to change its board,
 * hands and scores.
 * <p>
 * <strong>Lifecycle:</strong>
 * <pre>
 * NOT_STARTED → DEALING → AWAITING_SUBMISSIONS → RESOLVING → ROUND_COMPLETE
 *                  ↑                ↑                              │
 *                  └── hands empty ─┴──────── next round ──────────┤
 *                                                                  └→ GAME_OVER
 * </pre>
 * <p>
 * <strong>Rounds:</strong> each participant submits one card while the session is in
 * {@link GamePhase#AWAITING_SUBMISSIONS}; the second submission triggers resolution through
 * {@link TurnResolver}. The resolver works on copies, so a rejected round leaves the session
 * exactly as it was.
 * <p>
 * <strong>Row choices:</strong> when a card fits no row and its owner gave no row to take,
 * both submissions are kept, the phase stays {@code AWAITING_SUBMISSIONS}, and the
 * {@link AmbiguousActionException} reaches the caller. {@link #chooseRow} supplies the row and
 * finishes the round.
 * <p>
 * <strong>Deals:</strong> when both hands are empty and nobody has reached the score limit, all
 * 104 cards are gathered and dealt again; scores carry over.
 * <p>
 * Public methods are synchronized so the session can be driven from a runtime thread while
 * observers read it from elsewhere.
 */
public class GameSession {
    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    /** Cards per hand in a standard two-player deal. */
    public static final int DEFAULT_HAND_SIZE = 10;

    private final int handSize;
    private final ScoringEngine scoring;
    private final TurnResolver resolver;
    private final DeckSource deckSource;

    private final Map<ParticipantId, Participant> participants = new EnumMap<>(ParticipantId.class);
    private final Map<ParticipantId, Hand> hands = new EnumMap<>(ParticipantId.class);
    private final Map<ParticipantId, Submission> pending = new EnumMap<>(ParticipantId.class);
    private final List<Card> undealt = new ArrayList<>();

    private GamePhase phase = GamePhase.NOT_STARTED;
    private Board board;
    private int roundNumber;
    private int dealNumber;
    private int roundsCompleted;
    private ParticipantId pendingRowChoice;
    private GameOutcome outcome;

    /**
     * @param handSize cards dealt to each participant per deal
     * @param scoring scoring rules and score limit
     * @param resolver round resolver; should share {@code scoring}
     * @param deckSource prepares the deck for each deal
     */
    public GameSession(int handSize, ScoringEngine scoring, TurnResolver resolver, DeckSource deckSource) {
        if (handSize <= 0) {
            throw new IllegalArgumentException("handSize must be positive");
        }
        this.handSize = handSize;
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.deckSource = Objects.requireNonNull(deckSource, "deckSource");
        for (ParticipantId id : ParticipantId.values()) {
            participants.put(id, new Participant(id));
            hands.put(id, new Hand(id, List.of()));
        }
        undealt.addAll(new Deck().asUnmodifiableList());
    }

    /**
     * Creates a session with standard rules: ten-card hands, a limit of 66 and the AI taking the
     * cheapest row when its move names none.
     */
    public static GameSession standard(DeckSource deckSource) {
        ScoringEngine scoring = new ScoringEngine();
        return new GameSession(DEFAULT_HAND_SIZE, scoring, TurnResolver.withAiFallback(scoring), deckSource);
    }

    /**
     * Deals the first hands and opens round 1.
     *
     * @return the {@code DEALT} event
     * @throws IllegalMoveException if the session has already started
     * @throws InsufficientCardsException if the deck cannot cover the deal; the session ends
     */
    public synchronized List<RoundEvent> start() {
        if (phase != GamePhase.NOT_STARTED) {
            throw reject("Session already started (phase " + phase + ")");
        }
        roundNumber = 1;
        List<RoundEvent> events = new ArrayList<>();
        events.add(deal());
        phase = GamePhase.AWAITING_SUBMISSIONS;
        return events;
    }

    /**
     * Records one participant's card for the current round and resolves the round once both
     * cards are in.
     *
     * @param submission the card, and optionally the row to take should it fit nowhere
     * @return the round's events when this submission completed the round, otherwise an empty list
     * @throws IllegalMoveException if the session is not awaiting submissions, the participant
     *         already submitted, the card is not in their hand or the row choice is invalid
     * @throws AmbiguousActionException if the round needs a row choice; see {@link #chooseRow}
     */
    public synchronized List<RoundEvent> submit(Submission submission) {
        Objects.requireNonNull(submission, "submission");
        requirePhase(GamePhase.AWAITING_SUBMISSIONS);
        ParticipantId id = submission.participant();
        if (pending.containsKey(id)) {
            throw reject(id + " already submitted a card for round " + roundNumber);
        }
        if (!hands.get(id).contains(submission.card())) {
            throw reject(id + " does not hold card " + submission.card());
        }
        if (submission.rowChoice() != null && !Board.isValidRowIndex(submission.rowChoice())) {
            throw reject("Row choice " + submission.rowChoice() + " is not a valid row");
        }
        pending.put(id, submission);
        if (log.isDebugEnabled()) {
            log.debug("Round {}: {} submitted {}", roundNumber, id, submission.card());
        }
        if (pending.size() < participants.size()) {
            return Collections.emptyList();
        }
        return resolvePending();
    }

    /**
     * Supplies the row a participant takes because their card fits no row, and finishes the
     * blocked round.
     *
     * @param participant the participant named by the pending {@link AmbiguousActionException}
     * @param rowIndex 0-based row to take
     * @return the round's events
     * @throws IllegalMoveException if no row choice is pending for the participant or the index is invalid
     */
    public synchronized List<RoundEvent> chooseRow(ParticipantId participant, int rowIndex) {
        requirePhase(GamePhase.AWAITING_SUBMISSIONS);
        if (pendingRowChoice != participant) {
            throw reject("No row choice pending for " + participant);
        }
        if (!Board.isValidRowIndex(rowIndex)) {
            throw reject("Row choice " + rowIndex + " is not a valid row");
        }
        pending.put(participant, pending.get(participant).withRowChoice(rowIndex));
        pendingRowChoice = null;
        return resolvePending();
    }

    /**
     * Ends the session before anyone reached the score limit. Has no effect once the game is over.
     *
     * @return the {@code GAME_OVER} event, or an empty list if the game had already ended
     */
    public synchronized List<RoundEvent> abandon() {
        if (phase == GamePhase.GAME_OVER) {
            return Collections.emptyList();
        }
        log.info("Session abandoned in phase {} at round {}", phase, roundNumber);
        pending.clear();
        pendingRowChoice = null;
        return List.of(finish(GameOutcome.ABANDONED));
    }

    private List<RoundEvent> resolvePending() {
        phase = GamePhase.RESOLVING;
        TurnResolver.Resolution resolution;
        try {
            resolution = resolver.resolve(board, hands, participants, new ArrayList<>(pending.values()), roundNumber);
        } catch (AmbiguousActionException e) {
            phase = GamePhase.AWAITING_SUBMISSIONS;
            pendingRowChoice = e.getParticipant();
            log.debug("Round {} waits for a row choice from {}", roundNumber, e.getParticipant());
            throw e;
        } catch (RuntimeException e) {
            phase = GamePhase.AWAITING_SUBMISSIONS;
            pending.clear();
            log.debug("Round {} rejected during resolution: {}", roundNumber, e.getMessage());
            throw e;
        }

        board = resolution.board();
        hands.putAll(resolution.hands());
        participants.putAll(resolution.participants());
        pending.clear();
        roundsCompleted++;

        List<RoundEvent> events = new ArrayList<>(resolution.events());
        phase = GamePhase.ROUND_COMPLETE;
        Participant human = participants.get(ParticipantId.HUMAN);
        Participant ai = participants.get(ParticipantId.AI);
        events.add(RoundEvent.roundComplete(roundNumber, human.getScore(), ai.getScore()));

        if (scoring.isGameOver(human, ai)) {
            events.add(finish(scoring.decideOutcome(human, ai)));
            return events;
        }

        roundNumber++;
        if (hands.values().stream().allMatch(Hand::isEmpty)) {
            events.add(deal());
        }
        phase = GamePhase.AWAITING_SUBMISSIONS;
        return events;
    }

    private RoundEvent deal() {
        phase = GamePhase.DEALING;
        List<Card> gathered = gatherCards();
        Deck deck = deckSource.prepare(gathered);
        Deck.Deal dealt;
        try {
            dealt = deck.deal(handSize, Board.ROW_COUNT);
        } catch (InsufficientCardsException e) {
            log.error("Deal {} failed: {}", dealNumber + 1, e.getMessage());
            finish(GameOutcome.ABANDONED);
            throw e;
        }

        for (Participant participant : participants.values()) {
            participant.returnTakenPile();
        }
        board = new Board(dealt.starters());
        hands.put(ParticipantId.HUMAN, new Hand(ParticipantId.HUMAN, dealt.humanHand()));
        hands.put(ParticipantId.AI, new Hand(ParticipantId.AI, dealt.aiHand()));
        undealt.clear();
        undealt.addAll(deck.asUnmodifiableList());
        dealNumber++;
        log.info("Deal {} opens at round {} with rows {}", dealNumber, roundNumber, board);
        return RoundEvent.dealt(roundNumber, dealNumber, board.rows(), handSize);
    }

    private List<Card> gatherCards() {
        List<Card> gathered = new ArrayList<>(undealt);
        if (board != null) {
            board.rows().forEach(gathered::addAll);
        }
        for (Participant participant : participants.values()) {
            gathered.addAll(participant.getTakenPile());
        }
        for (Hand hand : hands.values()) {
            gathered.addAll(hand.cards());
        }
        return gathered;
    }

    private RoundEvent finish(GameOutcome result) {
        outcome = result;
        phase = GamePhase.GAME_OVER;
        Participant human = participants.get(ParticipantId.HUMAN);
        Participant ai = participants.get(ParticipantId.AI);
        log.info("Game over at round {}: {} (human {}, ai {})", roundNumber, result, human.getScore(),
                ai.getScore());
        return RoundEvent.gameOver(roundNumber, result, human.getScore(), ai.getScore());
    }

    private IllegalMoveException reject(String message) {
        if (log.isDebugEnabled()) {
            log.debug("Rejected in round {} ({}): {}", roundNumber, phase, message);
        }
        return new IllegalMoveException(message);
    }

    private void requirePhase(GamePhase expected) {
        if (phase != expected) {
            throw reject("Session is in phase " + phase + ", expected " + expected);
        }
    }

    public synchronized GamePhase phase() {
        return phase;
    }

    public synchronized int roundNumber() {
        return roundNumber;
    }

    /**
     * Counts rounds that were fully resolved. Unlike {@link #roundNumber()} this does not include
     * a round that was opened but never finished.
     */
    public synchronized int roundsCompleted() {
        return roundsCompleted;
    }

    public synchronized int dealNumber() {
        return dealNumber;
    }

    public int handSize() {
        return handSize;
    }

    public int scoreLimit() {
        return scoring.getScoreLimit();
    }

    /**
     * Returns a copy of the board; changes to it do not affect the session.
     *
     * @throws IllegalStateException before the first deal
     */
    public synchronized Board board() {
        if (board == null) {
            throw new IllegalStateException("No cards dealt yet");
        }
        return board.copy();
    }

    public synchronized Hand hand(ParticipantId id) {
        return hands.get(id).copy();
    }

    public synchronized int score(ParticipantId id) {
        return participants.get(id).getScore();
    }

    public synchronized boolean hasWon(ParticipantId id) {
        return participants.get(id).hasWon();
    }

    public synchronized List<Card> takenPile(ParticipantId id) {
        return List.copyOf(participants.get(id).getTakenPile());
    }

    public synchronized boolean hasSubmitted(ParticipantId id) {
        return pending.containsKey(id);
    }

    public synchronized Optional<ParticipantId> pendingRowChoice() {
        return Optional.ofNullable(pendingRowChoice);
    }

    public synchronized Optional<GameOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    public synchronized int undealtCount() {
        return undealt.size();
    }

    /**
     * Counts every card the session accounts for: undealt remainder, hands, rows and taken piles.
     * Always 104 outside a resolution step.
     */
    public synchronized int cardsInPlay() {
        return gatherCards().size();
    }
}

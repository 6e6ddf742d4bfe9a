package ai.nimmt.session;

/**
 * Lifecycle of a {@link GameSession}. Exactly one phase is active at a time.
 */
public enum GamePhase {
    NOT_STARTED,
    DEALING,
    AWAITING_SUBMISSIONS,
    RESOLVING,
    ROUND_COMPLETE,
    GAME_OVER
}

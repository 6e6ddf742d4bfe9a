package ai.nimmt.game;

/**
 * Kinds of {@link RoundEvent} published to observers.
 */
public enum RoundEventType {
    /** Hands and starter rows were dealt. */
    DEALT,
    /** A card was laid on a row without a take. */
    PLACED,
    /** A participant collected a row, either forced by a sixth card or because the card fit no row. */
    ROW_TAKEN,
    /** Both cards of the round are resolved; carries the scores. */
    ROUND_COMPLETE,
    /** A participant reached the score limit or the session was abandoned. */
    GAME_OVER
}

package ai.nimmt.game;

/**
 * How a game ended.
 */
public enum GameOutcome {
    HUMAN_WINS,
    AI_WINS,
    /** Both scores equal when the limit was reached. */
    DRAW,
    /** The session was torn down before anyone reached the limit. */
    ABANDONED
}

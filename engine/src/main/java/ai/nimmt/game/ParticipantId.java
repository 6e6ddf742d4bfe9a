package ai.nimmt.game;

/**
 * The two seats at the table.
 */
public enum ParticipantId {
    /** The player at the console or UI. */
    HUMAN,
    /** The opponent whose moves come from the AI move gateway. */
    AI
}

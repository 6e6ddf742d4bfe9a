package ai.nimmt.player;

import ai.nimmt.game.Card;
import ai.nimmt.session.GameSession;

/**
 * Represents the human side of the table: supplies a card each round and a row when a card
 * fits nowhere.
 */
public interface Player {

    /**
     * Provide the next command for the game loop: a card number, optionally followed by the
     * row (1–4) to take should the card fit no row (e.g. {@code "42"}, {@code "7 2"}), or {@code "quit"}.
     *
     * @param session  current game state; read-only use.
     * @param feedback error feedback from the previous command, or an empty string.
     * @return raw command string, or null to signal the game should exit.
     */
    String nextCommand(GameSession session, String feedback);

    /**
     * Asked when the played card is lower than every row's last card.
     *
     * @param session current game state; read-only use.
     * @param card    the card that fits no row.
     * @return raw row number (1–4), or null to signal the game should exit.
     */
    String chooseRow(GameSession session, Card card);
}

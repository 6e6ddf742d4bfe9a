package ai.nimmt.session;

import ai.nimmt.game.Card;
import ai.nimmt.game.Deck;
import ai.nimmt.game.RandomSource;
import java.util.List;

/**
 * Turns the gathered cards into the deck for the next deal.
 */
@FunctionalInterface
public interface DeckSource {

    /**
     * @param cards every card of the game, gathered from board, taken piles and the previous remainder
     * @return the deck to deal from, top first
     */
    Deck prepare(List<Card> cards);

    static DeckSource shuffled(RandomSource random) {
        return cards -> {
            Deck deck = new Deck(cards);
            deck.shuffle(random);
            return deck;
        };
    }
}

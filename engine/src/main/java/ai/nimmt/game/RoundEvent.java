package ai.nimmt.game;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Something that happened during a round, in the order the engine produced it.
 * <p>
 * Observers (a UI, the console runner, tests) replay these to animate the board without
 * re-deriving placement logic. Payload keys by type:
 * <ul>
 *   <li>{@code DEALT}: {@code deal}, {@code rows} (list of card numbers per row), {@code handSize}</li>
 *   <li>{@code PLACED}: {@code participant}, {@code card}, {@code row}</li>
 *   <li>{@code ROW_TAKEN}: {@code participant}, {@code card}, {@code row}, {@code taken} (card numbers),
 *       {@code bullHeads}, {@code forced} ({@code true} for a sixth-card take)</li>
 *   <li>{@code ROUND_COMPLETE}: {@code humanScore}, {@code aiScore}</li>
 *   <li>{@code GAME_OVER}: {@code outcome}, {@code humanScore}, {@code aiScore}</li>
 * </ul>
 *
 * @param type the event kind
 * @param roundNumber the round the event belongs to
 * @param payload unmodifiable event data
 */
public record RoundEvent(RoundEventType type, int roundNumber, Map<String, Object> payload) {

    public RoundEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static RoundEvent dealt(int roundNumber, int dealNumber, List<List<Card>> rows, int handSize) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("deal", dealNumber);
        data.put("rows", rows.stream().map(RoundEvent::numbers).toList());
        data.put("handSize", handSize);
        return new RoundEvent(RoundEventType.DEALT, roundNumber, data);
    }

    public static RoundEvent placed(int roundNumber, ParticipantId participant, Card card, int row) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("participant", participant);
        data.put("card", card.getNumber());
        data.put("row", row);
        return new RoundEvent(RoundEventType.PLACED, roundNumber, data);
    }

    public static RoundEvent rowTaken(
            int roundNumber, ParticipantId participant, Card card, int row, List<Card> taken, int bullHeads,
            boolean forced) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("participant", participant);
        data.put("card", card.getNumber());
        data.put("row", row);
        data.put("taken", numbers(taken));
        data.put("bullHeads", bullHeads);
        data.put("forced", forced);
        return new RoundEvent(RoundEventType.ROW_TAKEN, roundNumber, data);
    }

    public static RoundEvent roundComplete(int roundNumber, int humanScore, int aiScore) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("humanScore", humanScore);
        data.put("aiScore", aiScore);
        return new RoundEvent(RoundEventType.ROUND_COMPLETE, roundNumber, data);
    }

    public static RoundEvent gameOver(int roundNumber, GameOutcome outcome, int humanScore, int aiScore) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("outcome", outcome);
        data.put("humanScore", humanScore);
        data.put("aiScore", aiScore);
        return new RoundEvent(RoundEventType.GAME_OVER, roundNumber, data);
    }

    /**
     * Typed payload lookup.
     *
     * @throws ClassCastException if the value has a different type
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) payload.get(key);
    }

    private static List<Integer> numbers(List<Card> cards) {
        return cards.stream().map(Card::getNumber).toList();
    }
}

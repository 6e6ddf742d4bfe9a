package ai.nimmt.gateway;

import ai.nimmt.game.Board;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps another gateway with validation, retries and a deterministic fallback move.
 * <p>
 * <strong>Validation:</strong> the chosen card must be in the AI's hand and any row choice must
 * be a valid row, otherwise the answer counts as an {@link InvalidGatewayResponseException}.
 * <p>
 * <strong>Retries:</strong>
 * <ul>
 *   <li>{@link GatewayUnavailableException}: retried with exponential backoff until
 *       {@code maxAttempts} calls have been made.</li>
 *   <li>{@link InvalidGatewayResponseException}: the answer is discarded and the call retried
 *       once, without backoff. This retry does not count against {@code maxAttempts}.</li>
 * </ul>
 * <p>
 * <strong>Fallback:</strong> once retries are exhausted the AI plays the lowest card in its hand
 * and leaves any row choice to the engine. This method therefore never throws a gateway error.
 */
public class ResilientAiMoveGateway implements AiMoveGateway {

    private static final Logger log = LoggerFactory.getLogger(ResilientAiMoveGateway.class);

    /** Calls allowed for a single request whose answers keep failing validation. */
    private static final int MAX_INVALID_RESPONSES = 2;

    private final AiMoveGateway delegate;
    private final int maxAttempts;
    private final long backoffMillis;

    /**
     * @param delegate the gateway doing the actual call
     * @param maxAttempts calls allowed per request while the service is unavailable (at least 1)
     * @param backoffMillis wait before the first retry after an unavailable service; doubled on each retry
     */
    public ResilientAiMoveGateway(AiMoveGateway delegate, int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must be >= 0");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    @Override
    public AiMoveResponse chooseMove(AiMoveRequest request) {
        int unavailable = 0;
        int invalidResponses = 0;
        while (true) {
            try {
                AiMoveResponse response = delegate.chooseMove(request);
                validate(request, response);
                return response;
            } catch (GatewayUnavailableException e) {
                unavailable++;
                log.warn("AI move service unavailable for round {} (attempt {}/{}): {}",
                        request.getRound(), unavailable, maxAttempts, e.getMessage());
                if (unavailable >= maxAttempts || !sleepBeforeRetry(unavailable)) {
                    break;
                }
            } catch (InvalidGatewayResponseException e) {
                invalidResponses++;
                log.warn("Discarding invalid AI move for round {} ({}/{}): {}",
                        request.getRound(), invalidResponses, MAX_INVALID_RESPONSES, e.getMessage());
                if (invalidResponses >= MAX_INVALID_RESPONSES) {
                    break;
                }
            }
        }
        return fallback(request);
    }

    /**
     * Plays the lowest card of the AI's hand.
     *
     * @throws IllegalStateException if the AI's hand is empty
     */
    public static AiMoveResponse fallback(AiMoveRequest request) {
        List<Integer> hand = request.getAiHand();
        if (hand.isEmpty()) {
            throw new IllegalStateException("AI hand is empty; no fallback move for round " + request.getRound());
        }
        int lowest = hand.stream().mapToInt(Integer::intValue).min().getAsInt();
        log.info("Falling back to lowest AI card {} for round {}", lowest, request.getRound());
        return AiMoveResponse.of(lowest);
    }

    /**
     * Checks that an answer names a card in the AI's hand and, if given, a valid row.
     *
     * @throws InvalidGatewayResponseException if it does not
     */
    public static void validate(AiMoveRequest request, AiMoveResponse response) {
        if (response == null || response.getChosenCardNumber() == null) {
            throw new InvalidGatewayResponseException("No card chosen");
        }
        if (!request.getAiHand().contains(response.getChosenCardNumber())) {
            throw new InvalidGatewayResponseException(
                    "Card " + response.getChosenCardNumber() + " is not in the AI hand " + request.getAiHand());
        }
        Integer row = response.getRowChoice();
        if (row != null && !Board.isValidRowIndex(row)) {
            throw new InvalidGatewayResponseException("Row choice " + row + " is not a valid row");
        }
    }

    private boolean sleepBeforeRetry(int attempt) {
        long delay = backoffMillis << (attempt - 1);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off; using fallback move");
            return false;
        }
    }
}

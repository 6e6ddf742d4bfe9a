package ai.nimmt.gateway;

/**
 * Source of the AI's card for a round.
 * <p>
 * The gateway only ever returns a move. Board and score state stay with the session.
 */
public interface AiMoveGateway {

    /**
     * Asks for the AI's card for the round described by the request.
     *
     * @param request the public table state and the AI's hand
     * @return the chosen card and, optionally, the row to take should it fit nowhere
     * @throws GatewayUnavailableException on network failure or timeout
     * @throws InvalidGatewayResponseException when the answer cannot be used
     */
    AiMoveResponse chooseMove(AiMoveRequest request);
}

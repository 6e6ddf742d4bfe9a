package ai.nimmt.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * DTO returned by the AI move service.
 * <p>
 * Only the chosen card is read. Anything else the service sends back (older services
 * returned a whole replacement game state) is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiMoveResponse {

    /** Number of the card the AI plays. */
    private Integer chosenCardNumber;

    /** 0-based row to take if the card fits no row; optional. */
    private Integer rowChoice;

    /**
     * Default constructor for JSON deserialization.
     */
    public AiMoveResponse() {
        // Default constructor for JSON binding.
    }

    public AiMoveResponse(Integer chosenCardNumber, Integer rowChoice) {
        this.chosenCardNumber = chosenCardNumber;
        this.rowChoice = rowChoice;
    }

    public static AiMoveResponse of(int chosenCardNumber) {
        return new AiMoveResponse(chosenCardNumber, null);
    }

    public Integer getChosenCardNumber() {
        return chosenCardNumber;
    }

    public void setChosenCardNumber(Integer chosenCardNumber) {
        this.chosenCardNumber = chosenCardNumber;
    }

    public Integer getRowChoice() {
        return rowChoice;
    }

    public void setRowChoice(Integer rowChoice) {
        this.rowChoice = rowChoice;
    }

    @Override
    public String toString() {
        return "AiMoveResponse(card=" + chosenCardNumber + ", row=" + rowChoice + ")";
    }
}

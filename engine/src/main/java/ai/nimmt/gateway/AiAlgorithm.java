package ai.nimmt.gateway;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Search algorithm the AI move service is asked to use.
 */
public enum AiAlgorithm {
    EXPECTIMINIMAX("expectiminimax"),
    MCTS("mcts");

    private final String wireName;

    AiAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Parses a configuration value, accepting either the wire name or the constant name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static AiAlgorithm fromName(String name) {
        for (AiAlgorithm algorithm : values()) {
            if (algorithm.wireName.equalsIgnoreCase(name) || algorithm.name().equalsIgnoreCase(name)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown AI algorithm: " + name);
    }
}

package com.openforge.toolrelay.agent;

/**
 * The model kept requesting tools past the configured number of rounds.
 */
public class RoundLimitExceededException extends RuntimeException {

    private final int maxRounds;

    public RoundLimitExceededException(int maxRounds) {
        super("Max rounds (%d) reached without final answer.".formatted(maxRounds));
        this.maxRounds = maxRounds;
    }

    public int getMaxRounds() {
        return maxRounds;
    }
}

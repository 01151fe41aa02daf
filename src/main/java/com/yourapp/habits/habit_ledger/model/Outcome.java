package com.yourapp.habits.habit_ledger.model;

import java.util.Locale;

/**
 * The user's answer to a daily prompt.
 */
public enum Outcome {
    /**
     * The habit was done that day
     */
    COMPLETED,

    /**
     * The user answered but did not do the habit; breaks the streak
     */
    SKIPPED;

    /**
     * Converts a free-form chat answer into an outcome.
     *
     * @param answer raw answer, e.g. "completed", "yes", "skipped", "no"
     * @return the matching outcome
     * @throws IllegalArgumentException when the answer is not recognised
     */
    public static Outcome fromAnswer(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("Outcome must not be empty");
        }
        switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "completed":
            case "complete":
            case "done":
            case "yes":
                return COMPLETED;
            case "skipped":
            case "skip":
            case "no":
                return SKIPPED;
            default:
                throw new IllegalArgumentException("Unknown outcome: " + answer);
        }
    }
}

package com.yourapp.habits.habit_ledger.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void shouldMapCompletedAnswers() {
        assertEquals(Outcome.COMPLETED, Outcome.fromAnswer("completed"));
        assertEquals(Outcome.COMPLETED, Outcome.fromAnswer("Yes"));
        assertEquals(Outcome.COMPLETED, Outcome.fromAnswer(" DONE "));
    }

    @Test
    void shouldMapSkippedAnswers() {
        assertEquals(Outcome.SKIPPED, Outcome.fromAnswer("skipped"));
        assertEquals(Outcome.SKIPPED, Outcome.fromAnswer("No"));
    }

    @Test
    void shouldRejectUnknownOrEmptyAnswers() {
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromAnswer("maybe"));
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromAnswer("  "));
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromAnswer(null));
    }
}
